package com.example.fileparser.service;

import com.example.fileparser.model.DecoderVariant;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

public interface TabularDecoder {

    DecoderVariant variant();

    List<Map<String, Object>> decode(InputStream source, String filename) throws IOException;
}
