package com.example.fileparser.support;

public class UploadStreamException extends FileProcessingException {

    public UploadStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
