package com.example.fileparser.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

public interface BlobStorage {

    String locate(String name);

    OutputStream openForWrite(String location) throws IOException;

    InputStream openForRead(String location) throws IOException;

    boolean exists(String location);

    long size(String location) throws IOException;

    void delete(String location) throws IOException;
}
