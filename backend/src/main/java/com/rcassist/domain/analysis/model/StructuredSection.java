package com.rcassist.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * One named, ordered piece of the model reply.
 *
 * @param key     stable identifier derived from the heading, unique within one reply
 * @param heading heading text as written by the model (empty for the preamble)
 * @param kind    narrative, table or list
 * @param text    raw body of the block, always present
 * @param table   extracted table, only for {@link SectionKind#TABLE}
 * @param items   list entries, only for {@link SectionKind#LIST}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StructuredSection(
        String key,
        String heading,
        SectionKind kind,
        String text,
        TableContent table,
        List<String> items
) {
    public StructuredSection {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(kind, "kind");
        heading = heading == null ? "" : heading;
        text = text == null ? "" : text;
        if (kind == SectionKind.TABLE && table == null) {
            throw new IllegalArgumentException("Table section '" + key + "' needs table content");
        }
        items = items == null ? null : List.copyOf(items);
    }

    public static StructuredSection narrative(String key, String heading, String text) {
        return new StructuredSection(key, heading, SectionKind.NARRATIVE, text, null, null);
    }

    public static StructuredSection table(String key, String heading, String text, TableContent table) {
        return new StructuredSection(key, heading, SectionKind.TABLE, text, table, null);
    }

    public static StructuredSection list(String key, String heading, String text, List<String> items) {
        return new StructuredSection(key, heading, SectionKind.LIST, text, null, items);
    }
}
