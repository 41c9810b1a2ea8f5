package com.rcassist.domain.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One resolved unit of source material fed into a single analysis.
 *
 * @param sourceKind file, url or ticket
 * @param identifier path, URL or ticket key as requested
 * @param text       extracted plain text
 * @param metadata   source-specific attributes (size, title, status, ...)
 */
public record EvidenceItem(
        SourceKind sourceKind,
        String identifier,
        String text,
        Map<String, String> metadata
) {
    public EvidenceItem {
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(identifier, "identifier");
        text = text == null ? "" : text;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Short human-readable source line, e.g. {@code "URL: https://status.example.com"}.
     */
    public String sourceLabel() {
        String name = identifier;
        if (sourceKind == SourceKind.FILE) {
            int slash = Math.max(identifier.lastIndexOf('/'), identifier.lastIndexOf('\\'));
            name = identifier.substring(slash + 1);
        }
        return sourceKind.label() + ": " + name;
    }
}
