package com.example.fileparser.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class TabularHeaders {

    private TabularHeaders() {
    }

    static List<String> normalize(List<String> raw) {
        List<String> headers = new ArrayList<>(raw.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < raw.size(); i++) {
            String name = raw.get(i) == null ? "" : raw.get(i).trim();
            if (name.isEmpty()) {
                name = "column_" + (i + 1);
            }
            String candidate = name;
            int suffix = 1;
            while (!seen.add(candidate)) {
                candidate = name + "_" + suffix++;
            }
            headers.add(candidate);
        }
        return headers;
    }
}
