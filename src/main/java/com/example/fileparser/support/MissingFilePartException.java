package com.example.fileparser.support;

public class MissingFilePartException extends FileProcessingException {

    public MissingFilePartException() {
        super("No file field found in multipart form-data (expected field name \"file\")");
    }
}
