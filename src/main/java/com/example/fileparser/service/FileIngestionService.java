package com.example.fileparser.service;

import com.example.fileparser.model.FileRecord;
import com.example.fileparser.model.FileRecordStatus;
import com.example.fileparser.model.UploadAcceptedResponse;
import com.example.fileparser.model.UploadRequest;
import com.example.fileparser.store.BlobStorage;
import com.example.fileparser.store.FileRecordStore;
import com.example.fileparser.support.MissingFilePartException;
import com.example.fileparser.support.StreamingRequestContext;
import com.example.fileparser.support.UploadStreamException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.fileupload.FileItemIterator;
import org.apache.commons.fileupload.FileItemStream;
import org.apache.commons.fileupload.FileUpload;
import org.apache.commons.fileupload.FileUploadException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class FileIngestionService {

    private static final String UNKNOWN_FILENAME = "unknown";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final int MAX_STORED_NAME_LENGTH = 160;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final FileRecordStore store;
    private final BlobStorage blobStorage;
    private final UploadProgressTracker tracker;
    private final ProgressPublisher progressPublisher;
    private final FileParsingService parsingService;

    public String requestUploadId() {
        String uploadId = UUID.randomUUID().toString();
        tracker.register(uploadId);
        return uploadId;
    }

    public static String resolveUploadId(String fromQuery, String fromHeader) {
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery.trim();
        }
        if (fromHeader != null && !fromHeader.isBlank()) {
            return fromHeader.trim();
        }
        return UUID.randomUUID().toString();
    }

    public UploadAcceptedResponse ingest(UploadRequest request) {
        String uploadId = request.uploadId();
        long total = Math.max(0, request.contentLength());
        tracker.start(uploadId, total);

        FileRecord record = null;
        try {
            FileItemIterator items = new FileUpload().getItemIterator(new StreamingRequestContext(
                    request.contentType(), request.characterEncoding(), request.contentLength(), request.body()));
            while (items.hasNext()) {
                FileItemStream item = items.next();
                if (item.isFormField()) {
                    continue;
                }
                if (record != null) {
                    log.warn("Ignoring additional file part name={} for upload={}", item.getName(), uploadId);
                    continue;
                }
                record = createRecord(item, uploadId);
                receive(item, record, uploadId, total);
            }
            if (record == null) {
                throw new MissingFilePartException();
            }
            record.setSize(blobStorage.size(record.getPath()));
            store.recordSize(record.getId(), record.getSize());
        } catch (FileUploadException | IOException ex) {
            if (record == null) {
                throw new UploadStreamException("Failed to read multipart upload: " + ex.getMessage(), ex);
            }
            markFailed(record, ex);
            return UploadAcceptedResponse.from(record, uploadId);
        } catch (DataAccessException ex) {
            if (record == null) {
                throw ex;
            }
            markFailed(record, ex);
            return UploadAcceptedResponse.from(record, uploadId);
        }

        log.info("Received file={} name={} size={} upload={}", record.getId(), record.getFilename(),
                record.getSize(), uploadId);
        parsingService.submit(record);
        return UploadAcceptedResponse.from(record, uploadId);
    }

    private FileRecord createRecord(FileItemStream item, String uploadId) {
        String filename = resolveFilename(item.getName());
        String contentType = item.getContentType() == null ? DEFAULT_CONTENT_TYPE : item.getContentType();
        String location = blobStorage.locate(storageName(filename));

        FileRecord record = store.create(FileRecord.uploading(filename, contentType, location));
        tracker.link(uploadId, record.getId());
        log.debug("Created file={} for upload={} at {}", record.getId(), uploadId, location);
        return record;
    }

    private void receive(FileItemStream item, FileRecord record, String uploadId, long total) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long received = 0;
        try (InputStream in = item.openStream();
                OutputStream out = blobStorage.openForWrite(record.getPath())) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                received += read;
                tracker.recordBytes(uploadId, read);

                int percent = tracker.uploadPercent(received, total);
                if (percent > record.getProgress()) {
                    record.setProgress(percent);
                    progressPublisher.publish(record.getId(), percent);
                }
            }
        }
    }

    private void markFailed(FileRecord record, Exception cause) {
        log.error("Upload failed for file={}: {}", record.getId(), cause.getMessage(), cause);
        record.setStatus(FileRecordStatus.FAILED);
        record.setProgress(0);
        try {
            store.markFailed(record.getId());
        } catch (DataAccessException ex) {
            log.error("Unable to mark file={} as failed: {}", record.getId(), ex.getMessage(), ex);
        }
        try {
            blobStorage.delete(record.getPath());
        } catch (IOException ex) {
            log.warn("Failed to remove partial upload {}: {}", record.getPath(), ex.getMessage());
        }
    }

    static String storageName(String filename) {
        String sanitized = filename.replaceAll("[^A-Za-z0-9._-]", "_");
        if (sanitized.length() > MAX_STORED_NAME_LENGTH) {
            sanitized = sanitized.substring(sanitized.length() - MAX_STORED_NAME_LENGTH);
        }
        byte[] suffix = new byte[6];
        RANDOM.nextBytes(suffix);
        return System.currentTimeMillis() + "-" + HexFormat.of().formatHex(suffix) + "-" + sanitized;
    }

    private static String resolveFilename(String originalFilename) {
        if (originalFilename == null) {
            return UNKNOWN_FILENAME;
        }
        String trimmed = originalFilename.trim();
        int separator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        trimmed = trimmed.substring(separator + 1);
        return trimmed.isEmpty() ? UNKNOWN_FILENAME : trimmed;
    }
}
