package com.example.fileparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FileProgressResponse(
        @JsonProperty("file_id") String fileId,
        FileRecordStatus status,
        int progress) {

    public static FileProgressResponse from(FileRecord record) {
        return new FileProgressResponse(record.getId(), record.getStatus(), record.getProgress());
    }
}
