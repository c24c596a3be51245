package com.example.fileparser.service;

import com.example.fileparser.store.FileRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressPublisher {

    private final FileRecordStore store;

    public void publish(String recordId, int progress) {
        try {
            store.raiseProgress(recordId, progress);
        } catch (DataAccessException ex) {
            log.warn("Dropped progress update file={} progress={}: {}", recordId, progress, ex.getMessage());
        }
    }
}
