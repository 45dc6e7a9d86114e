package com.companyintel.research.model;

import com.companyintel.research.exception.InvalidRequestException;
import org.springframework.lang.Nullable;

/**
 * Immutable research request: the company to research plus optional job context.
 */
public record ResearchRequest(String subject, @Nullable String jobTitle, @Nullable String jobDescription) {

    public ResearchRequest {
        if (subject == null || subject.isBlank()) {
            throw new InvalidRequestException("Research subject must not be empty.");
        }
        subject = subject.trim();
        jobTitle = normalize(jobTitle);
        jobDescription = normalize(jobDescription);
    }

    public static ResearchRequest of(String subject) {
        return new ResearchRequest(subject, null, null);
    }

    public boolean hasJobContext() {
        return jobTitle != null || jobDescription != null;
    }

    public ResearchRequest withJobTitle(@Nullable String title) {
        return new ResearchRequest(subject, title, jobDescription);
    }

    public String researchBrief() {
        String brief = "Comprehensive company research for " + subject;
        return jobTitle == null ? brief : brief + " - " + jobTitle + " position";
    }

    private static String normalize(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
