package com.example.fileparser.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FileRecordStatus {
    UPLOADING("uploading"),
    PROCESSING("processing"),
    READY("ready"),
    FAILED("failed");

    private final String value;

    FileRecordStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}
