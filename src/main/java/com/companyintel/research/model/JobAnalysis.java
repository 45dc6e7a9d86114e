package com.companyintel.research.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * What a job description says about the role, used to tailor the research.
 */
public record JobAnalysis(String jobTitle,
                          @Nullable String department,
                          List<String> keyResponsibilities,
                          List<String> requiredSkills,
                          List<String> companyValuesMentioned,
                          @Nullable String seniorityLevel) {

    public JobAnalysis {
        jobTitle = jobTitle == null ? "" : jobTitle.trim();
        department = blankToNull(department);
        seniorityLevel = blankToNull(seniorityLevel);
        keyResponsibilities = keyResponsibilities == null ? List.of() : List.copyOf(keyResponsibilities);
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        companyValuesMentioned = companyValuesMentioned == null ? List.of() : List.copyOf(companyValuesMentioned);
    }

    public static JobAnalysis titleOnly(String jobTitle) {
        return new JobAnalysis(jobTitle, null, List.of(), List.of(), List.of(), null);
    }

    private static String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
