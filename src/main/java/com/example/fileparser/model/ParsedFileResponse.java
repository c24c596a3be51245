package com.example.fileparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record ParsedFileResponse(
        @JsonProperty("file_id") String fileId,
        String filename,
        ParseMeta parseMeta,
        List<Map<String, Object>> data) {

    public static ParsedFileResponse from(FileRecord record) {
        return new ParsedFileResponse(record.getId(), record.getFilename(), record.getParseMeta(),
                record.getParsedContent());
    }
}
