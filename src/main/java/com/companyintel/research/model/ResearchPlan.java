package com.companyintel.research.model;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The planned run: the request with any derived job title, the job analysis when a description was
 * given, the run's objectives and one spec per worker in launch order.
 */
public record ResearchPlan(ResearchRequest request,
                           @Nullable JobAnalysis analysis,
                           List<String> objectives,
                           List<String> jobConsiderations,
                           List<WorkerSpec> workers) {

    public ResearchPlan {
        Objects.requireNonNull(request, "request");
        objectives = List.copyOf(objectives);
        jobConsiderations = List.copyOf(jobConsiderations);
        workers = List.copyOf(workers);
    }
}
