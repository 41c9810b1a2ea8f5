package com.rcassist.domain.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Definitive output of one completed analysis run.
 */
public record AnalysisResult(
        Map<String, Object> structuredFields,
        List<StructuredSection> sections,
        String rawText,
        ProviderName providerUsed,
        List<String> warnings,
        List<String> sourcesUsed,
        List<TicketReference> createdTickets,
        String templateId
) {
    public AnalysisResult {
        structuredFields = structuredFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(structuredFields));
        sections = List.copyOf(sections);
        warnings = List.copyOf(warnings);
        sourcesUsed = List.copyOf(sourcesUsed);
        createdTickets = List.copyOf(createdTickets);
    }

    public Optional<StructuredSection> section(String key) {
        return sections.stream().filter(s -> s.key().equals(key)).findFirst();
    }
}
