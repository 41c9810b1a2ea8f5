package com.rcassist.domain.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser output: structured JSON fields plus the heading/table scan of the same reply.
 */
public record ParsedReply(
        Map<String, Object> structuredFields,
        List<StructuredSection> sections,
        List<String> warnings
) {
    public ParsedReply {
        // JSON values may be null, so Map.copyOf is not an option
        structuredFields = structuredFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(structuredFields));
        sections = List.copyOf(sections);
        warnings = List.copyOf(warnings);
    }

    public boolean hasStructuredFields() {
        return !structuredFields.isEmpty();
    }
}
