package com.example.fileparser.support;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CompressionSupport {

    private static final int BUFFER_SIZE = 64 * 1024;
    private static final Set<String> SUPPORTED = Set.of(CompressorStreamFactory.GZIP, CompressorStreamFactory.BZIP2);

    private final CompressorStreamFactory compressorFactory = new CompressorStreamFactory(true);

    public InputStream decodeIfNecessary(InputStream original, String filename) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(original, BUFFER_SIZE);
        String format = detect(buffered, filename);
        if (format == null) {
            log.debug("Streaming file={} without decompression", filename);
            return buffered;
        }

        log.debug("Detected {} stream for file={}", format, filename);
        try {
            return compressorFactory.createCompressorInputStream(format, buffered);
        } catch (CompressorException ex) {
            throw new IOException("Unable to open %s stream for %s".formatted(format, filename), ex);
        }
    }

    private static String detect(BufferedInputStream stream, String filename) {
        try {
            String detected = CompressorStreamFactory.detect(stream);
            if (SUPPORTED.contains(detected)) {
                return detected;
            }
        } catch (CompressorException ex) {
            log.trace("No compression signature for file={}: {}", filename, ex.getMessage());
        }
        return formatFromFilename(filename);
    }

    private static String formatFromFilename(String filename) {
        if (filename == null) {
            return null;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".gz")) {
            return CompressorStreamFactory.GZIP;
        }
        if (lower.endsWith(".bz2")) {
            return CompressorStreamFactory.BZIP2;
        }
        return null;
    }
}
