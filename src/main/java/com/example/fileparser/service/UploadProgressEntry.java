package com.example.fileparser.service;

import com.example.fileparser.model.UploadProgressSnapshot;
import java.util.concurrent.atomic.AtomicLong;

class UploadProgressEntry {

    private final AtomicLong received = new AtomicLong();
    private volatile long total;
    private volatile String recordId;

    void addReceived(long delta) {
        received.addAndGet(delta);
    }

    void setTotal(long total) {
        this.total = total;
    }

    void link(String recordId) {
        this.recordId = recordId;
    }

    UploadProgressSnapshot snapshot() {
        return new UploadProgressSnapshot(received.get(), total, recordId);
    }
}
