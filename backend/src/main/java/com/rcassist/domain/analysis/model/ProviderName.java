package com.rcassist.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Name of a configured LLM provider. The set of valid names comes from configuration.
 */
public record ProviderName(String value) {

    public ProviderName {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        value = value.strip().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProviderName of(String value) {
        return new ProviderName(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
