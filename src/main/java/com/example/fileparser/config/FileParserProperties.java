package com.example.fileparser.config;

import java.nio.file.Path;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.files")
public class FileParserProperties {

    private Path uploadDir = Path.of(System.getProperty("java.io.tmpdir"), "uploads");
    private int maxRows = 5000;
    private int uploadProgressCeiling = 55;
    private int processingProgressFloor = 60;
    private int unknownSizeProgress = 10;
    private int progressChunks = 5;
    private Duration progressTickInterval = Duration.ofMillis(300);
    private Duration parseTimeout = Duration.ofMinutes(10);
    private int decodeThreads = 4;
    private boolean strictColumns = false;
    private Tracker tracker = new Tracker();

    @Getter
    @Setter
    public static class Tracker {

        private long maxUploads = 10_000;
        private Duration idleTimeout = Duration.ofMinutes(10);
    }
}
