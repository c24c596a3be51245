package com.example.fileparser.store;

import com.example.fileparser.model.FileRecord;
import com.example.fileparser.model.FileRecordStatus;
import com.example.fileparser.model.ParseMeta;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface FileRecordStore {

    FileRecord create(FileRecord record);

    Optional<FileRecord> findById(String id);

    // only moves forward, and only while the record is uploading or processing
    void raiseProgress(String id, int progress);

    void recordSize(String id, long size);

    // false when the record is not in the expected state
    boolean markProcessing(String id, FileRecordStatus expected, int progressFloor);

    void markReady(String id, List<Map<String, Object>> content, ParseMeta parseMeta);

    void markFailed(String id);

    List<FileRecord> findAllSummaries();

    boolean deleteById(String id);
}
