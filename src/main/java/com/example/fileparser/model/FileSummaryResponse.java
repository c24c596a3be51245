package com.example.fileparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record FileSummaryResponse(
        String id,
        String filename,
        FileRecordStatus status,
        int progress,
        Long size,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static FileSummaryResponse from(FileRecord record) {
        return new FileSummaryResponse(
                record.getId(),
                record.getFilename(),
                record.getStatus(),
                record.getProgress(),
                record.getSize(),
                record.getCreatedAt(),
                record.getUpdatedAt());
    }
}
