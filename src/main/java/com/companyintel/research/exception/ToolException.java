package com.companyintel.research.exception;

import com.companyintel.research.model.ErrorKind;

import java.util.Objects;

/**
 * Typed failure of one external tool invocation.
 */
public class ToolException extends Exception {

    private final ErrorKind kind;

    public ToolException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ToolException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
