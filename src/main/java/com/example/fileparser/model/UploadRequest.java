package com.example.fileparser.model;

import java.io.InputStream;

public record UploadRequest(
        String uploadId,
        String contentType,
        String characterEncoding,
        long contentLength,
        InputStream body) {
}
