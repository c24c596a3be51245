package com.example.fileparser.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LocalBlobStorage implements BlobStorage {

    private final Path basePath;

    public LocalBlobStorage(Path basePath) {
        this.basePath = basePath.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.basePath);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create upload directory " + this.basePath, ex);
        }
        log.info("Storing uploaded blobs under {}", this.basePath);
    }

    @Override
    public String locate(String name) {
        Path target = basePath.resolve(name).normalize();
        if (!target.startsWith(basePath)) {
            throw new IllegalArgumentException("Blob name escapes the upload directory: " + name);
        }
        return target.toString();
    }

    @Override
    public OutputStream openForWrite(String location) throws IOException {
        return Files.newOutputStream(Path.of(location), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    @Override
    public InputStream openForRead(String location) throws IOException {
        return Files.newInputStream(Path.of(location));
    }

    @Override
    public boolean exists(String location) {
        return location != null && Files.exists(Path.of(location));
    }

    @Override
    public long size(String location) throws IOException {
        return Files.size(Path.of(location));
    }

    @Override
    public void delete(String location) throws IOException {
        Files.deleteIfExists(Path.of(location));
    }
}
