package com.example.fileparser.service;

import com.example.fileparser.config.FileParserProperties;
import com.example.fileparser.model.DecoderVariant;
import com.example.fileparser.support.CamelCsvParserFactory;
import com.example.fileparser.support.CompressionSupport;
import com.example.fileparser.support.DecodeException;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class DelimitedTextDecoder implements TabularDecoder {

    private final CamelCsvParserFactory parserFactory;
    private final CompressionSupport compressionSupport;
    private final boolean strictColumns;

    @Autowired
    public DelimitedTextDecoder(CamelCsvParserFactory parserFactory,
            CompressionSupport compressionSupport,
            FileParserProperties properties) {
        this(parserFactory, compressionSupport, properties.isStrictColumns());
    }

    DelimitedTextDecoder(CamelCsvParserFactory parserFactory, CompressionSupport compressionSupport,
            boolean strictColumns) {
        this.parserFactory = parserFactory;
        this.compressionSupport = compressionSupport;
        this.strictColumns = strictColumns;
    }

    @Override
    public DecoderVariant variant() {
        return DecoderVariant.CSV;
    }

    @Override
    public List<Map<String, Object>> decode(InputStream source, String filename) throws IOException {
        CsvParser parser = parserFactory.newParser();
        try (InputStream decoded = compressionSupport.decodeIfNecessary(source, filename);
                Reader reader = new InputStreamReader(decoded, StandardCharsets.UTF_8)) {
            parser.beginParsing(reader);
            String[] headerRow = parser.parseNext();
            if (headerRow == null) {
                log.debug("File {} has no header line", filename);
                return List.of();
            }
            List<String> headers = TabularHeaders.normalize(Arrays.asList(headerRow));

            List<Map<String, Object>> records = new ArrayList<>();
            String[] row;
            while ((row = parser.parseNext()) != null) {
                if (strictColumns && row.length != headers.size()) {
                    throw DecodeException.malformedRow(parser.getContext().currentLine(), headers.size(), row.length);
                }
                records.add(toRecord(headers, row));
            }
            return records;
        } catch (TextParsingException ex) {
            throw new DecodeException("Failed to parse delimited text in %s".formatted(filename), ex);
        } finally {
            parser.stopParsing();
        }
    }

    private static Map<String, Object> toRecord(List<String> headers, String[] row) {
        Map<String, Object> record = new LinkedHashMap<>(headers.size() * 2);
        for (int i = 0; i < headers.size(); i++) {
            record.put(headers.get(i), i < row.length ? row[i] : null);
        }
        return record;
    }
}
