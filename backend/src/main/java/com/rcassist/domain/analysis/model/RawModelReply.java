package com.rcassist.domain.analysis.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one provider attempt.
 *
 * @param provider  provider that was attempted
 * @param text      reply text, empty on failure
 * @param latency   wall time of the attempt including a retry
 * @param succeeded true when {@code text} holds a usable reply
 * @param error     failure classification, empty on success
 * @param detail    diagnostic message of the failure, null on success
 */
public record RawModelReply(
        ProviderName provider,
        String text,
        Duration latency,
        boolean succeeded,
        Optional<ErrorKind> error,
        String detail
) {
    public RawModelReply {
        Objects.requireNonNull(provider, "provider");
        text = text == null ? "" : text;
        latency = latency == null ? Duration.ZERO : latency;
        error = error == null ? Optional.empty() : error;
        if (succeeded == error.isPresent()) {
            throw new IllegalArgumentException("A reply either succeeds or carries an error kind");
        }
    }

    public static RawModelReply success(ProviderName provider, String text, Duration latency) {
        return new RawModelReply(provider, text, latency, true, Optional.empty(), null);
    }

    public static RawModelReply failure(ProviderName provider, ErrorKind kind, String detail, Duration latency) {
        return new RawModelReply(provider, "", latency, false, Optional.of(kind), detail);
    }
}
