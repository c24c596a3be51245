package com.example.fileparser.support;

public class NotFoundException extends FileProcessingException {

    private NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException file(String id) {
        return new NotFoundException("File %s not found".formatted(id));
    }

    public static NotFoundException upload(String uploadId) {
        return new NotFoundException("Upload %s not found".formatted(uploadId));
    }
}
