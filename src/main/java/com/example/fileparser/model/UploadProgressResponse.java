package com.example.fileparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadProgressResponse(
        String uploadId,
        long received,
        long total,
        @JsonProperty("file_id") String fileId,
        FileRecordStatus status,
        int progress) {
}
