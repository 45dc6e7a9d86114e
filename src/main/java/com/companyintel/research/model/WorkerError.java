package com.companyintel.research.model;

import java.util.Objects;

public record WorkerError(ErrorKind kind, String message) {

    public WorkerError {
        Objects.requireNonNull(kind, "kind");
        message = message == null || message.isBlank() ? kind.name() : message;
    }

    public static WorkerError of(ErrorKind kind, String message) {
        return new WorkerError(kind, message);
    }

    public String describe() {
        return kind.name() + ": " + message;
    }
}
