package com.example.fileparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadAcceptedResponse(
        @JsonProperty("file_id") String fileId,
        FileRecordStatus status,
        int progress,
        String uploadId) {

    public static UploadAcceptedResponse from(FileRecord record, String uploadId) {
        return new UploadAcceptedResponse(record.getId(), record.getStatus(), record.getProgress(), uploadId);
    }
}
