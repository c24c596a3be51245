package com.example.fileparser.controller;

import com.example.fileparser.model.DeleteResponse;
import com.example.fileparser.model.FileProgressResponse;
import com.example.fileparser.model.FileRecord;
import com.example.fileparser.model.FileRecordStatus;
import com.example.fileparser.model.FileSummaryResponse;
import com.example.fileparser.model.NotReadyResponse;
import com.example.fileparser.model.ParsedFileResponse;
import com.example.fileparser.model.UploadAcceptedResponse;
import com.example.fileparser.model.UploadIdResponse;
import com.example.fileparser.model.UploadProgressResponse;
import com.example.fileparser.model.UploadRequest;
import com.example.fileparser.service.FileIngestionService;
import com.example.fileparser.service.FileParsingService;
import com.example.fileparser.service.FileRecordService;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@Slf4j
@RestController
@RequestMapping("/files")
@RequiredArgsConstructor
public class FileController {

    static final String UPLOAD_ID_HEADER = "x-upload-id";

    private final FileIngestionService ingestionService;
    private final FileParsingService parsingService;
    private final FileRecordService fileRecordService;

    @PostMapping("/request-id")
    public ResponseEntity<UploadIdResponse> requestUploadId() {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new UploadIdResponse(ingestionService.requestUploadId()));
    }

    @PostMapping
    public ResponseEntity<UploadAcceptedResponse> upload(HttpServletRequest request,
                                                         @RequestParam(value = "uploadId", required = false)
                                                         String uploadId,
                                                         @RequestHeader(value = UPLOAD_ID_HEADER, required = false)
                                                         String headerUploadId) throws IOException {
        UploadRequest uploadRequest = new UploadRequest(
            FileIngestionService.resolveUploadId(uploadId, headerUploadId),
            request.getContentType(),
            request.getCharacterEncoding(),
            request.getContentLengthLong(),
            request.getInputStream());
        UploadAcceptedResponse response = ingestionService.ingest(uploadRequest);
        log.info("Accepted upload={} file={} status={}", response.uploadId(), response.fileId(),
            response.status().value());

        return ResponseEntity.created(ServletUriComponentsBuilder.fromCurrentRequestUri()
                .path("/{id}")
                .buildAndExpand(response.fileId())
                .toUri())
            .body(response);
    }

    @GetMapping("/{id}/progress")
    public FileProgressResponse getProgress(@PathVariable String id) {
        return FileProgressResponse.from(fileRecordService.getFile(id));
    }

    @GetMapping("/uploads/{uploadId}/progress")
    public UploadProgressResponse getUploadProgress(@PathVariable String uploadId) {
        return fileRecordService.uploadProgress(uploadId);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getFile(@PathVariable String id) {
        FileRecord record = fileRecordService.getFile(id);
        if (record.getStatus() != FileRecordStatus.READY) {
            return ResponseEntity.ok(NotReadyResponse.IN_PROGRESS);
        }
        return ResponseEntity.ok(ParsedFileResponse.from(record));
    }

    @GetMapping
    public List<FileSummaryResponse> listFiles() {
        return fileRecordService.listFiles().stream()
            .map(FileSummaryResponse::from)
            .toList();
    }

    @DeleteMapping("/{id}")
    public DeleteResponse deleteFile(@PathVariable String id) {
        fileRecordService.deleteFile(id);
        return DeleteResponse.SUCCESS;
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<FileProgressResponse> retry(@PathVariable String id) {
        FileRecord record = parsingService.retry(id);
        return ResponseEntity.accepted().body(FileProgressResponse.from(record));
    }
}
