package com.example.fileparser.model;

public record UploadProgressSnapshot(long received, long total, String recordId) {
}
