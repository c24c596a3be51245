package com.example.fileparser.store;

import com.example.fileparser.model.FileRecord;
import com.example.fileparser.model.FileRecordStatus;
import com.example.fileparser.model.ParseMeta;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.types.ObjectId;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Single-process stand-in for the Mongo store with the same conditional update semantics. Keeps
 * every persisted progress value per record so tests can check ordering.
 */
public class InMemoryFileRecordStore implements FileRecordStore {

    private final Map<String, FileRecord> records = new LinkedHashMap<>();
    private final Map<String, List<Integer>> progressHistory = new LinkedHashMap<>();
    private boolean failProgressWrites;

    @Override
    public synchronized FileRecord create(FileRecord record) {
        FileRecord stored = copy(record);
        stored.setId(new ObjectId().toHexString());
        records.put(stored.getId(), stored);
        progressHistory.put(stored.getId(), new ArrayList<>(List.of(stored.getProgress())));
        return copy(stored);
    }

    @Override
    public synchronized Optional<FileRecord> findById(String id) {
        return Optional.ofNullable(records.get(id)).map(InMemoryFileRecordStore::copy);
    }

    @Override
    public synchronized void raiseProgress(String id, int progress) {
        if (failProgressWrites) {
            throw new DataAccessResourceFailureException("store unavailable");
        }
        FileRecord record = records.get(id);
        if (record == null || !EnumSet.of(FileRecordStatus.UPLOADING, FileRecordStatus.PROCESSING)
                .contains(record.getStatus())) {
            return;
        }
        setProgress(record, Math.max(record.getProgress(), progress));
    }

    @Override
    public synchronized void recordSize(String id, long size) {
        FileRecord record = records.get(id);
        if (record != null) {
            record.setSize(size);
            record.setUpdatedAt(Instant.now());
        }
    }

    @Override
    public synchronized boolean markProcessing(String id, FileRecordStatus expected, int progressFloor) {
        FileRecord record = records.get(id);
        if (record == null || record.getStatus() != expected) {
            return false;
        }
        record.setStatus(FileRecordStatus.PROCESSING);
        setProgress(record, Math.max(record.getProgress(), progressFloor));
        return true;
    }

    @Override
    public synchronized void markReady(String id, List<Map<String, Object>> content, ParseMeta parseMeta) {
        FileRecord record = records.get(id);
        if (record != null) {
            record.setParsedContent(new ArrayList<>(content));
            record.setParseMeta(parseMeta);
            record.setStatus(FileRecordStatus.READY);
            setProgress(record, 100);
        }
    }

    @Override
    public synchronized void markFailed(String id) {
        FileRecord record = records.get(id);
        if (record != null) {
            record.setStatus(FileRecordStatus.FAILED);
            setProgress(record, 0);
        }
    }

    @Override
    public synchronized List<FileRecord> findAllSummaries() {
        return records.values().stream()
                .sorted(Comparator.comparing(FileRecord::getCreatedAt).reversed())
                .map(InMemoryFileRecordStore::copy)
                .peek(record -> record.setParsedContent(new ArrayList<>()))
                .toList();
    }

    @Override
    public synchronized boolean deleteById(String id) {
        progressHistory.remove(id);
        return records.remove(id) != null;
    }

    public synchronized List<Integer> progressHistory(String id) {
        return List.copyOf(progressHistory.getOrDefault(id, List.of()));
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized void failProgressWrites(boolean fail) {
        this.failProgressWrites = fail;
    }

    private void setProgress(FileRecord record, int progress) {
        if (record.getProgress() != progress) {
            progressHistory.computeIfAbsent(record.getId(), key -> new ArrayList<>()).add(progress);
        }
        record.setProgress(progress);
        record.setUpdatedAt(Instant.now());
    }

    private static FileRecord copy(FileRecord source) {
        FileRecord copy = new FileRecord();
        copy.setId(source.getId());
        copy.setFilename(source.getFilename());
        copy.setMimetype(source.getMimetype());
        copy.setPath(source.getPath());
        copy.setSize(source.getSize());
        copy.setStatus(source.getStatus());
        copy.setProgress(source.getProgress());
        copy.setParseMeta(source.getParseMeta());
        copy.setParsedContent(new ArrayList<>(source.getParsedContent()));
        copy.setCreatedAt(source.getCreatedAt());
        copy.setUpdatedAt(source.getUpdatedAt());
        return copy;
    }
}
