package com.example.fileparser.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Slf4j
@Configuration
public class ParsingExecutorConfiguration {

    // one thread per parsing task; tasks mostly sleep between progress ticks
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService parsingExecutor() {
        log.info("Creating parsing executor");
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("parsing-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService decodeExecutor(FileParserProperties properties) {
        int threads = Math.max(1, properties.getDecodeThreads());
        log.info("Creating decode executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("decode-"));
    }
}
