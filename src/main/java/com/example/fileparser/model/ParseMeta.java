package com.example.fileparser.model;

import java.util.List;
import java.util.Map;

public record ParseMeta(int rows, int cols, DecoderVariant parser) {

    public static ParseMeta of(List<Map<String, Object>> records, DecoderVariant parser) {
        int cols = records.isEmpty() ? 0 : records.get(0).size();
        return new ParseMeta(records.size(), cols, parser);
    }
}
