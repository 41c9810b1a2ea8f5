package com.rcassist.domain.analysis.model;

import java.util.Objects;

/**
 * A request for one evidence item, resolved during collection.
 */
public record EvidenceReference(SourceKind kind, String identifier) {

    public EvidenceReference {
        Objects.requireNonNull(kind, "kind");
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Evidence identifier must not be blank");
        }
        identifier = identifier.strip();
    }

    public static EvidenceReference file(String path) {
        return new EvidenceReference(SourceKind.FILE, path);
    }

    public static EvidenceReference url(String url) {
        return new EvidenceReference(SourceKind.URL, url);
    }

    public static EvidenceReference ticket(String key) {
        return new EvidenceReference(SourceKind.TICKET, key);
    }

    @Override
    public String toString() {
        return kind.key() + " '" + identifier + "'";
    }
}
