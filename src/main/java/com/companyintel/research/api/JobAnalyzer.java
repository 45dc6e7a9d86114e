package com.companyintel.research.api;

import com.companyintel.research.model.JobAnalysis;

import java.util.Optional;

/**
 * Extracts role context from a free-form job description.
 */
public interface JobAnalyzer {

    /**
     * @param jobDescription The description as the caller gave it.
     * @return The analysis, or empty when not even a job title could be found.
     */
    Optional<JobAnalysis> analyze(String jobDescription);
}
