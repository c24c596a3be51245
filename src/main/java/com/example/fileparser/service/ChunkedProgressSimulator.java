package com.example.fileparser.service;

import com.example.fileparser.config.FileParserProperties;
import java.time.Duration;
import java.util.function.IntConsumer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class ChunkedProgressSimulator implements ProgressSimulator {

    static final int MAX_PROCESSING_PROGRESS = 99;

    private final int chunks;
    private final Duration tickInterval;
    private final int floor;

    @Autowired
    public ChunkedProgressSimulator(FileParserProperties properties) {
        this(properties.getProgressChunks(), properties.getProgressTickInterval(),
                properties.getProcessingProgressFloor());
    }

    ChunkedProgressSimulator(int chunks, Duration tickInterval, int floor) {
        this.chunks = Math.max(1, chunks);
        this.tickInterval = tickInterval;
        this.floor = floor;
    }

    @Override
    public void simulate(int totalRecords, IntConsumer progressSink) throws InterruptedException {
        int total = Math.max(1, totalRecords);
        int chunkSize = Math.max(1, total / chunks);
        int processed = 0;
        while (processed < total) {
            Thread.sleep(tickInterval.toMillis());
            processed = Math.min(total, processed + chunkSize);
            int percent = floor + (int) ((long) processed * (100 - floor) / total);
            progressSink.accept(Math.min(MAX_PROCESSING_PROGRESS, percent));
        }
    }
}
