package com.example.fileparser.support;

public class DecodeException extends FileProcessingException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DecodeException malformedRow(long line, int expected, int actual) {
        return new DecodeException("Malformed row at line %d: expected %d fields but found %d"
                .formatted(line, expected, actual));
    }
}
