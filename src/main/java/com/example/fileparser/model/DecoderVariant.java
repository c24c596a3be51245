package com.example.fileparser.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecoderVariant {
    CSV("csv"),
    XLSX("xlsx");

    private final String value;

    DecoderVariant(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
