package com.example.fileparser.model;

public record UploadIdResponse(String uploadId) {
}
