package com.companyintel.research.model;

/**
 * Failure taxonomy for task units, workers and the supervisor.
 * Fatal kinds stop a worker immediately and are never retried.
 */
public enum ErrorKind {
    TOOL_UNAVAILABLE(false),
    TOOL_TIMEOUT(false),
    TOOL_REJECTED(false),
    MALFORMED_RESPONSE(false),
    UNAUTHORIZED(true),
    MISCONFIGURED(true),
    BUDGET_EXHAUSTED(false),
    DEADLINE_EXCEEDED(false),
    WORKER_CRASHED(false);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
