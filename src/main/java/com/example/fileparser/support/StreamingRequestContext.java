package com.example.fileparser.support;

import java.io.InputStream;
import org.apache.commons.fileupload.UploadContext;

public final class StreamingRequestContext implements UploadContext {

    private final String contentType;
    private final String characterEncoding;
    private final long contentLength;
    private final InputStream body;

    public StreamingRequestContext(String contentType, String characterEncoding, long contentLength,
            InputStream body) {
        this.contentType = contentType;
        this.characterEncoding = characterEncoding;
        this.contentLength = contentLength;
        this.body = body;
    }

    @Override
    public String getCharacterEncoding() {
        return characterEncoding;
    }

    @Override
    public String getContentType() {
        return contentType;
    }

    @Override
    @Deprecated
    public int getContentLength() {
        return (int) Math.min(Integer.MAX_VALUE, contentLength);
    }

    @Override
    public long contentLength() {
        return contentLength;
    }

    @Override
    public InputStream getInputStream() {
        return body;
    }
}
