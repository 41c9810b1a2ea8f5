package com.rcassist.domain.analysis.exception;

import com.rcassist.domain.analysis.model.ErrorKind;

public class EvidenceUnavailableException extends RuntimeException {

    private final ErrorKind kind;

    public EvidenceUnavailableException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EvidenceUnavailableException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
