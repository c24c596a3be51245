package com.example.fileparser.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.fileparser.config.FileParserProperties;
import com.example.fileparser.model.FileRecord;
import com.example.fileparser.model.FileRecordStatus;
import com.example.fileparser.model.UploadAcceptedResponse;
import com.example.fileparser.model.UploadProgressSnapshot;
import com.example.fileparser.model.UploadRequest;
import com.example.fileparser.store.InMemoryFileRecordStore;
import com.example.fileparser.store.LocalBlobStorage;
import com.example.fileparser.support.MissingFilePartException;
import com.example.fileparser.support.UploadStreamException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FileIngestionServiceTest {

    private static final String BOUNDARY = "----ingestion-test";
    private static final String CONTENT_TYPE = "multipart/form-data; boundary=" + BOUNDARY;

    @TempDir
    Path uploadDir;

    @Mock
    FileParsingService parsingService;

    private InMemoryFileRecordStore store;
    private UploadProgressTracker tracker;
    private FileIngestionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryFileRecordStore();
        tracker = new UploadProgressTracker(new FileParserProperties());
        service = new FileIngestionService(store, new LocalBlobStorage(uploadDir), tracker,
                new ProgressPublisher(store), parsingService);
    }

    @Test
    void streamsFilePartToStorageAndQueuesParsing() throws IOException {
        String csv = "a,b\n1,2\n";
        byte[] body = multipart(field("note", "hello"), file("file", "data.csv", "text/csv", csv));

        UploadAcceptedResponse response = service.ingest(request("u-1", body.length, body));

        assertThat(response.uploadId()).isEqualTo("u-1");
        assertThat(response.status()).isEqualTo(FileRecordStatus.UPLOADING);
        assertThat(response.progress()).isBetween(1, 55);

        FileRecord record = store.findById(response.fileId()).orElseThrow();
        assertThat(record.getFilename()).isEqualTo("data.csv");
        assertThat(record.getMimetype()).isEqualTo("text/csv");
        assertThat(record.getSize()).isEqualTo(csv.length());
        assertThat(record.getProgress()).isBetween(1, 55);
        assertThat(Files.readString(Path.of(record.getPath()))).isEqualTo(csv);
        assertThat(Path.of(record.getPath()).getParent()).isEqualTo(uploadDir.toAbsolutePath().normalize());

        ArgumentCaptor<FileRecord> submitted = ArgumentCaptor.forClass(FileRecord.class);
        verify(parsingService).submit(submitted.capture());
        assertThat(submitted.getValue().getId()).isEqualTo(response.fileId());
    }

    @Test
    void trackerIsLinkedToTheRecordAndCountsBytes() {
        byte[] body = multipart(file("file", "data.csv", "text/csv", "x\n1\n"));

        UploadAcceptedResponse response = service.ingest(request("u-2", body.length, body));

        UploadProgressSnapshot snapshot = tracker.snapshot("u-2").orElseThrow();
        assertThat(snapshot.recordId()).isEqualTo(response.fileId());
        assertThat(snapshot.received()).isEqualTo(4);
        assertThat(snapshot.total()).isEqualTo(body.length);
    }

    @Test
    void reusedUploadIdTracksOnlyTheLatestUpload() {
        byte[] first = multipart(file("file", "first.csv", "text/csv", "a\n1\n2\n3\n"));
        byte[] second = multipart(file("file", "second.csv", "text/csv", "b\n9\n"));
        service.ingest(request("shared", first.length, first));

        UploadAcceptedResponse response = service.ingest(request("shared", second.length, second));

        UploadProgressSnapshot snapshot = tracker.snapshot("shared").orElseThrow();
        assertThat(snapshot.recordId()).isEqualTo(response.fileId());
        assertThat(snapshot.received()).isEqualTo(4);
        assertThat(snapshot.total()).isEqualTo(second.length);
    }

    @Test
    void unknownLengthUsesPlaceholderProgress() {
        byte[] body = multipart(file("file", "data.csv", "text/csv", "x\n1\n"));

        UploadAcceptedResponse response = service.ingest(request("u-3", -1, body));

        assertThat(response.progress()).isEqualTo(10);
        assertThat(store.findById(response.fileId()).orElseThrow().getProgress()).isEqualTo(10);
    }

    @Test
    void missingFilePartIsRejectedWithoutCreatingARecord() {
        byte[] body = multipart(field("note", "no file here"));

        assertThatThrownBy(() -> service.ingest(request("u-4", body.length, body)))
            .isInstanceOf(MissingFilePartException.class);
        assertThat(store.size()).isZero();
        verify(parsingService, never()).submit(any());
    }

    @Test
    void nonMultipartBodyIsRejected() {
        byte[] body = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
        UploadRequest request = new UploadRequest("u-5", "text/csv", null, body.length,
                new ByteArrayInputStream(body));

        assertThatThrownBy(() -> service.ingest(request)).isInstanceOf(UploadStreamException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void onlyTheFirstFilePartIsKept() {
        byte[] body = multipart(
            file("file", "first.csv", "text/csv", "a\n1\n"),
            file("other", "second.csv", "text/csv", "b\n2\n"));

        UploadAcceptedResponse response = service.ingest(request("u-6", body.length, body));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.findById(response.fileId()).orElseThrow().getFilename()).isEqualTo("first.csv");
        assertThat(uploadDir.toFile().list()).hasSize(1);
    }

    @Test
    void missingFilenameAndTypeFallBackToDefaults() {
        String part = "--" + BOUNDARY + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\"\"\r\n\r\n"
            + "a\n1\n\r\n";
        byte[] body = (part + "--" + BOUNDARY + "--\r\n").getBytes(StandardCharsets.UTF_8);

        UploadAcceptedResponse response = service.ingest(request("u-7", body.length, body));

        FileRecord record = store.findById(response.fileId()).orElseThrow();
        assertThat(record.getFilename()).isEqualTo("unknown");
        assertThat(record.getMimetype()).isEqualTo("application/octet-stream");
    }

    @Test
    void truncatedBodyFailsTheRecordAndRemovesThePartialBlob() {
        byte[] complete = multipart(file("file", "cut.csv", "text/csv", "a,b\n1,2\n3,4\n"));
        byte[] truncated = Arrays.copyOf(complete, complete.length - BOUNDARY.length() - 10);

        UploadAcceptedResponse response = service.ingest(request("u-8", complete.length, truncated));

        assertThat(response.status()).isEqualTo(FileRecordStatus.FAILED);
        assertThat(response.progress()).isZero();
        FileRecord record = store.findById(response.fileId()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(FileRecordStatus.FAILED);
        assertThat(record.getProgress()).isZero();
        assertThat(Files.exists(Path.of(record.getPath()))).isFalse();
        verify(parsingService, never()).submit(any());
    }

    @Test
    void progressStoreOutageDoesNotAbortTheUpload() {
        store.failProgressWrites(true);
        byte[] body = multipart(file("file", "data.csv", "text/csv", "x\n1\n"));

        UploadAcceptedResponse response = service.ingest(request("u-9", -1, body));

        assertThat(response.status()).isEqualTo(FileRecordStatus.UPLOADING);
        assertThat(store.findById(response.fileId()).orElseThrow().getProgress()).isEqualTo(1);
        verify(parsingService).submit(any());
    }

    @Test
    void uploadIdPrefersQueryThenHeader() {
        assertThat(FileIngestionService.resolveUploadId("q", "h")).isEqualTo("q");
        assertThat(FileIngestionService.resolveUploadId(" ", "h")).isEqualTo("h");
        assertThat(FileIngestionService.resolveUploadId(null, null)).isNotBlank();
    }

    @Test
    void storageNameIsSanitizedAndUnique() {
        String first = FileIngestionService.storageName("../my report (1).csv");
        String second = FileIngestionService.storageName("../my report (1).csv");

        assertThat(first).matches("\\d+-[0-9a-f]{12}-[A-Za-z0-9._-]+").endsWith("my_report__1_.csv");
        assertThat(first).isNotEqualTo(second);
    }

    private static UploadRequest request(String uploadId, long contentLength, byte[] body) {
        InputStream in = new ByteArrayInputStream(body);
        return new UploadRequest(uploadId, CONTENT_TYPE, null, contentLength, in);
    }

    private static String field(String name, String value) {
        return "--" + BOUNDARY + "\r\n"
            + "Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n"
            + value + "\r\n";
    }

    private static String file(String name, String filename, String contentType, String content) {
        return "--" + BOUNDARY + "\r\n"
            + "Content-Disposition: form-data; name=\"" + name + "\"; filename=\"" + filename + "\"\r\n"
            + "Content-Type: " + contentType + "\r\n\r\n"
            + content + "\r\n";
    }

    private static byte[] multipart(String... parts) {
        return (String.join("", parts) + "--" + BOUNDARY + "--\r\n").getBytes(StandardCharsets.UTF_8);
    }
}
