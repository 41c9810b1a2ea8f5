package com.rcassist.domain.analysis.model;

import java.util.List;

/**
 * A rectangular table: every row has exactly {@code headers.size()} cells.
 */
public record TableContent(List<String> headers, List<List<String>> rows) {

    public TableContent {
        headers = List.copyOf(headers);
        rows = rows.stream().map(List::copyOf).toList();
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).size() != headers.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row %d has %d cells, expected %d", i + 1, rows.get(i).size(), headers.size()));
            }
        }
    }

    public int columnCount() {
        return headers.size();
    }
}
