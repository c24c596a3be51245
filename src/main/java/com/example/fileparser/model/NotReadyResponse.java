package com.example.fileparser.model;

public record NotReadyResponse(String message) {

    public static final NotReadyResponse IN_PROGRESS =
            new NotReadyResponse("File upload or processing in progress. Please try again later.");
}
