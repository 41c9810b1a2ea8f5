package com.rcassist.infrastructure.ai;

import com.rcassist.domain.analysis.model.ErrorKind;

/**
 * Classified failure of one provider call.
 */
public class ProviderCallException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean transientFailure;

    public ProviderCallException(ErrorKind kind, boolean transientFailure, String message) {
        super(message);
        this.kind = kind;
        this.transientFailure = transientFailure;
    }

    public ProviderCallException(ErrorKind kind, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.transientFailure = transientFailure;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * True for connection resets, I/O errors and 5xx answers: the only failures worth one retry.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
