package com.example.fileparser.service;

import com.example.fileparser.model.DecoderVariant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class TabularDecoderRegistry {

    private final Map<DecoderVariant, TabularDecoder> decoders = new EnumMap<>(DecoderVariant.class);

    public TabularDecoderRegistry(List<TabularDecoder> decoders) {
        decoders.forEach(decoder -> this.decoders.put(decoder.variant(), decoder));
    }

    public static DecoderVariant inferVariant(String mimetype, String filename) {
        String type = mimetype == null ? "" : mimetype.toLowerCase(Locale.ROOT);
        String extension = extension(filename);
        if (type.contains("csv") || extension.equals(".csv")) {
            return DecoderVariant.CSV;
        }
        if (type.contains("excel") || type.contains("spreadsheetml")
                || extension.equals(".xlsx") || extension.equals(".xls")) {
            return DecoderVariant.XLSX;
        }
        return DecoderVariant.CSV;
    }

    public TabularDecoder select(String mimetype, String filename) {
        return forVariant(inferVariant(mimetype, filename));
    }

    public TabularDecoder forVariant(DecoderVariant variant) {
        TabularDecoder decoder = decoders.get(variant);
        if (decoder == null) {
            throw new IllegalStateException("No decoder registered for " + variant);
        }
        return decoder;
    }

    private static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        int slash = Math.max(lower.lastIndexOf('/'), lower.lastIndexOf('\\'));
        int dot = lower.lastIndexOf('.');
        return dot > slash ? lower.substring(dot) : "";
    }
}
