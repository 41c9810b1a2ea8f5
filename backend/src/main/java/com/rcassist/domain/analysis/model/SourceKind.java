package com.rcassist.domain.analysis.model;

/**
 * Where a piece of evidence comes from.
 */
public enum SourceKind {
    FILE("File"),
    URL("URL"),
    TICKET("Jira Ticket");

    private final String label;

    SourceKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Lowercase name used as configuration key and in warnings.
     */
    public String key() {
        return name().toLowerCase();
    }
}
