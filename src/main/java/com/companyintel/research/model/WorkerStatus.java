package com.companyintel.research.model;

public enum WorkerStatus {
    COMPLETED("completed"),
    PARTIALLY_COMPLETED("partially completed"),
    FAILED("failed");

    private final String label;

    WorkerStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
