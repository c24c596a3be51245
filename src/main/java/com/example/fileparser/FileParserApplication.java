package com.example.fileparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FileParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileParserApplication.class, args);
    }
}
