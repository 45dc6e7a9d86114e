package com.companyintel.research.model;

import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Research objectives and per-domain focus suggested by the planning model. Any focus may be missing,
 * in which case the planner keeps its default for that domain.
 */
public record PlanningAdvice(List<String> researchObjectives,
                             String pastResearchFocus,
                             String futureResearchFocus,
                             String cultureResearchFocus,
                             List<String> jobSpecificConsiderations) {

    public PlanningAdvice {
        researchObjectives = researchObjectives == null ? List.of() : List.copyOf(researchObjectives);
        jobSpecificConsiderations = jobSpecificConsiderations == null ? List.of() : List.copyOf(jobSpecificConsiderations);
    }

    public Optional<String> focusFor(ResearchDomain domain) {
        String focus = switch (domain) {
            case PAST -> pastResearchFocus;
            case FUTURE -> futureResearchFocus;
            case CULTURE -> cultureResearchFocus;
        };
        return StringUtils.hasText(focus) ? Optional.of(focus.trim()) : Optional.empty();
    }

    public boolean hasAnyFocus() {
        for (ResearchDomain domain : ResearchDomain.values()) {
            if (focusFor(domain).isPresent()) {
                return true;
            }
        }
        return false;
    }
}
