package com.companyintel.research.model;

import java.util.Objects;

/**
 * Everything one worker needs to run: its domain, the request, the domain's research focus and its
 * iteration budget.
 */
public record WorkerSpec(ResearchDomain domain, ResearchRequest request, String focus, int iterationBudget) {

    public WorkerSpec {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(request, "request");
        if (iterationBudget <= 0) {
            throw new IllegalArgumentException("Iteration budget must be positive, got " + iterationBudget);
        }
        focus = focus == null || focus.isBlank() ? request.researchBrief() : focus;
    }
}
