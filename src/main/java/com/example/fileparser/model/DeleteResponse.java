package com.example.fileparser.model;

public record DeleteResponse(boolean success) {

    public static final DeleteResponse SUCCESS = new DeleteResponse(true);
}
