package com.example.fileparser.support;

public class InvalidStateException extends FileProcessingException {

    public InvalidStateException(String message) {
        super(message);
    }
}
