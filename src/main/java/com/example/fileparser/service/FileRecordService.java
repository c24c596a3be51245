package com.example.fileparser.service;

import com.example.fileparser.model.FileRecord;
import com.example.fileparser.model.FileRecordStatus;
import com.example.fileparser.model.UploadProgressResponse;
import com.example.fileparser.model.UploadProgressSnapshot;
import com.example.fileparser.store.BlobStorage;
import com.example.fileparser.store.FileRecordStore;
import com.example.fileparser.support.NotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class FileRecordService {

    private final FileRecordStore store;
    private final BlobStorage blobStorage;
    private final UploadProgressTracker tracker;

    public FileRecord getFile(String id) {
        return store.findById(id).orElseThrow(() -> NotFoundException.file(id));
    }

    public List<FileRecord> listFiles() {
        return store.findAllSummaries();
    }

    public void deleteFile(String id) {
        FileRecord record = getFile(id);
        if (blobStorage.exists(record.getPath())) {
            try {
                blobStorage.delete(record.getPath());
            } catch (IOException ex) {
                log.warn("Blob cleanup failed for file={} path={}: {}", id, record.getPath(), ex.getMessage());
            }
        }
        if (!store.deleteById(id)) {
            throw NotFoundException.file(id);
        }
        log.info("Deleted file={} name={}", id, record.getFilename());
    }

    public UploadProgressResponse uploadProgress(String uploadId) {
        UploadProgressSnapshot snapshot = tracker.snapshot(uploadId)
                .orElseThrow(() -> NotFoundException.upload(uploadId));
        Optional<FileRecord> record = Optional.ofNullable(snapshot.recordId()).flatMap(store::findById);
        if (record.isPresent()) {
            FileRecord file = record.get();
            return new UploadProgressResponse(uploadId, snapshot.received(), snapshot.total(), file.getId(),
                    file.getStatus(), file.getProgress());
        }
        int progress = snapshot.received() == 0 ? 0 : tracker.uploadPercent(snapshot);
        return new UploadProgressResponse(uploadId, snapshot.received(), snapshot.total(), snapshot.recordId(),
                FileRecordStatus.UPLOADING, progress);
    }
}
