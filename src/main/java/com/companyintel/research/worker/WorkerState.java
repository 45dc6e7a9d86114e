package com.companyintel.research.worker;

import com.companyintel.research.model.WorkerStatus;

public enum WorkerState {
    IDLE,
    ITERATING,
    COMPLETED,
    PARTIALLY_COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_COMPLETED || this == FAILED;
    }

    static WorkerState of(WorkerStatus status) {
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case PARTIALLY_COMPLETED -> PARTIALLY_COMPLETED;
            case FAILED -> FAILED;
        };
    }
}
