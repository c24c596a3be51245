package com.example.fileparser.support;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.dataformat.univocity.UniVocityCsvDataFormat;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CamelCsvParserFactory extends UniVocityCsvDataFormat {

    static final int MAX_COLUMNS = 4096;
    static final int MAX_CHARS_PER_COLUMN = 1 << 20;

    public CamelCsvParserFactory() {
        setHeaderExtractionEnabled(false);
        setSkipEmptyLines(true);
        setIgnoreLeadingWhitespaces(false);
        setIgnoreTrailingWhitespaces(false);
        setLazyLoad(true);
        setAsMap(false);
        setEmptyValue("");
    }

    public CsvParser newParser() {
        CsvParserSettings settings = createParserSettings();
        configureParserSettings(settings);
        settings.setColumnReorderingEnabled(false);
        settings.setMaxColumns(MAX_COLUMNS);
        settings.setMaxCharsPerColumn(MAX_CHARS_PER_COLUMN);
        settings.setNullValue("");
        settings.setLineSeparatorDetectionEnabled(true);
        log.debug("Created CsvParser with maxColumns={} maxCharsPerColumn={}",
            settings.getMaxColumns(), settings.getMaxCharsPerColumn());
        return createParser(settings);
    }
}
