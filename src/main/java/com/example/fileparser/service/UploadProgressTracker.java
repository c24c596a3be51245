package com.example.fileparser.service;

import com.example.fileparser.config.FileParserProperties;
import com.example.fileparser.model.UploadProgressSnapshot;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class UploadProgressTracker {

    private final Cache<String, UploadProgressEntry> entries;
    private final FileParserProperties properties;

    @Autowired
    public UploadProgressTracker(FileParserProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    UploadProgressTracker(FileParserProperties properties, Ticker ticker) {
        this.properties = properties;
        FileParserProperties.Tracker tracker = properties.getTracker();
        RemovalListener<String, UploadProgressEntry> removalListener = notification -> {
            if (notification.wasEvicted()) {
                log.debug("Upload progress evicted: upload={} reason={}", notification.getKey(),
                        notification.getCause());
            }
        };
        this.entries = CacheBuilder.newBuilder()
                .maximumSize(tracker.getMaxUploads())
                .expireAfterAccess(tracker.getIdleTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .ticker(ticker)
                .removalListener(removalListener)
                .build();
        log.info("Upload progress tracker initialized: maxUploads={} idleTimeout={}", tracker.getMaxUploads(),
                tracker.getIdleTimeout());
    }

    public void register(String uploadId) {
        entries.asMap().putIfAbsent(uploadId, new UploadProgressEntry());
    }

    // replaces whatever an earlier upload under the same id left behind
    public void start(String uploadId, long total) {
        entries.put(uploadId, new UploadProgressEntry());
        setTotal(uploadId, total);
    }

    public void recordBytes(String uploadId, long delta) {
        UploadProgressEntry entry = entries.getIfPresent(uploadId);
        if (entry != null) {
            entry.addReceived(delta);
        }
    }

    public void setTotal(String uploadId, long total) {
        UploadProgressEntry entry = entries.getIfPresent(uploadId);
        if (entry != null) {
            entry.setTotal(Math.max(0, total));
        }
    }

    public void link(String uploadId, String recordId) {
        UploadProgressEntry entry = entries.getIfPresent(uploadId);
        if (entry != null) {
            entry.link(recordId);
        }
    }

    public Optional<UploadProgressSnapshot> snapshot(String uploadId) {
        return Optional.ofNullable(entries.getIfPresent(uploadId)).map(UploadProgressEntry::snapshot);
    }

    public int uploadPercent(UploadProgressSnapshot snapshot) {
        return uploadPercent(snapshot.received(), snapshot.total());
    }

    public int uploadPercent(long received, long total) {
        int ceiling = properties.getUploadProgressCeiling();
        if (total <= 0) {
            return Math.min(ceiling, properties.getUnknownSizeProgress());
        }
        long scaled = (long) Math.floor((double) received / total * ceiling);
        return (int) Math.min(ceiling, Math.max(1, scaled));
    }

    long size() {
        entries.cleanUp();
        return entries.size();
    }
}
