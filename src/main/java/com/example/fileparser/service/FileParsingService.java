package com.example.fileparser.service;

import com.example.fileparser.config.FileParserProperties;
import com.example.fileparser.model.FileRecord;
import com.example.fileparser.model.FileRecordStatus;
import com.example.fileparser.model.ParseMeta;
import com.example.fileparser.store.BlobStorage;
import com.example.fileparser.store.FileRecordStore;
import com.example.fileparser.support.DecodeException;
import com.example.fileparser.support.FileProcessingException;
import com.example.fileparser.support.InvalidStateException;
import com.example.fileparser.support.NotFoundException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class FileParsingService {

    private final FileRecordStore store;
    private final BlobStorage blobStorage;
    private final TabularDecoderRegistry decoders;
    private final ProgressSimulator progressSimulator;
    private final ProgressPublisher progressPublisher;
    private final ExecutorService parsingExecutor;
    private final ExecutorService decodeExecutor;
    private final int maxRows;
    private final int progressFloor;
    private final Duration parseTimeout;

    public FileParsingService(FileRecordStore store,
            BlobStorage blobStorage,
            TabularDecoderRegistry decoders,
            ProgressSimulator progressSimulator,
            ProgressPublisher progressPublisher,
            @Qualifier("parsingExecutor") ExecutorService parsingExecutor,
            @Qualifier("decodeExecutor") ExecutorService decodeExecutor,
            FileParserProperties properties) {
        this.store = store;
        this.blobStorage = blobStorage;
        this.decoders = decoders;
        this.progressSimulator = progressSimulator;
        this.progressPublisher = progressPublisher;
        this.parsingExecutor = parsingExecutor;
        this.decodeExecutor = decodeExecutor;
        this.maxRows = Math.max(0, properties.getMaxRows());
        this.progressFloor = properties.getProcessingProgressFloor();
        this.parseTimeout = properties.getParseTimeout();
    }

    public Future<?> submit(FileRecord record) {
        return parsingExecutor.submit(() -> {
            boolean claimed;
            try {
                claimed = store.markProcessing(record.getId(), FileRecordStatus.UPLOADING, progressFloor);
            } catch (RuntimeException ex) {
                fail(record.getId(), ex);
                return;
            }
            if (!claimed) {
                log.warn("Skipping parse of file={}: no longer in uploading state", record.getId());
                return;
            }
            parse(record);
        });
    }

    // failed -> processing is conditional, so concurrent retries start one task
    public FileRecord retry(String id) {
        FileRecord record = store.findById(id).orElseThrow(() -> NotFoundException.file(id));
        if (record.getStatus() != FileRecordStatus.FAILED) {
            throw new InvalidStateException("File %s is %s; only failed files can be retried"
                    .formatted(id, record.getStatus().value()));
        }
        if (!blobStorage.exists(record.getPath())) {
            throw new InvalidStateException("Stored upload for file %s no longer exists".formatted(id));
        }
        if (!store.markProcessing(id, FileRecordStatus.FAILED, progressFloor)) {
            throw new InvalidStateException("File %s is already being processed".formatted(id));
        }
        log.info("Retrying parse for file={}", id);
        parsingExecutor.submit(() -> parse(record));
        return store.findById(id).orElseThrow(() -> NotFoundException.file(id));
    }

    void parse(FileRecord record) {
        String id = record.getId();
        Instant start = Instant.now();
        try {
            TabularDecoder decoder = decoders.select(record.getMimetype(), record.getFilename());
            log.info("Parsing file={} name={} decoder={}", id, record.getFilename(), decoder.variant().value());

            List<Map<String, Object>> rows = decode(decoder, record);
            progressSimulator.simulate(rows.size(), percent -> progressPublisher.publish(id, percent));

            List<Map<String, Object>> content = rows.size() > maxRows
                    ? new ArrayList<>(rows.subList(0, maxRows))
                    : rows;
            ParseMeta parseMeta = ParseMeta.of(content, decoder.variant());
            store.markReady(id, content, parseMeta);

            log.info("Parsed file={} decoded={} kept={} cols={} durationMs={}", id, rows.size(), parseMeta.rows(),
                    parseMeta.cols(), Duration.between(start, Instant.now()).toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fail(id, ex);
        } catch (Exception ex) {
            fail(id, ex);
        }
    }

    private List<Map<String, Object>> decode(TabularDecoder decoder, FileRecord record) throws InterruptedException {
        Future<List<Map<String, Object>>> future = decodeExecutor.submit(() -> {
            try (InputStream in = blobStorage.openForRead(record.getPath())) {
                return decoder.decode(in, record.getFilename());
            }
        });
        try {
            return future.get(parseTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new DecodeException("Decoding %s exceeded %s".formatted(record.getFilename(), parseTimeout), ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof FileProcessingException processingException) {
                throw processingException;
            }
            throw new DecodeException("Failed to decode %s".formatted(record.getFilename()), cause);
        }
    }

    private void fail(String id, Exception cause) {
        log.error("Processing failed for file={}: {}", id, cause.getMessage(), cause);
        try {
            store.markFailed(id);
        } catch (RuntimeException ex) {
            log.error("Unable to mark file={} as failed: {}", id, ex.getMessage(), ex);
        }
    }
}
