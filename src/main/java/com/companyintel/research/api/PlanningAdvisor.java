package com.companyintel.research.api;

import com.companyintel.research.model.JobAnalysis;
import com.companyintel.research.model.PlanningAdvice;
import com.companyintel.research.model.ResearchRequest;
import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Suggests objectives and a research focus per domain for one run.
 */
public interface PlanningAdvisor {

    /** Gives no advice, so every domain keeps its default focus. */
    PlanningAdvisor DEFAULT_FOCUS = (request, analysis) -> Optional.empty();

    /**
     * @return The advice, or empty when the planner should use its defaults. Never throws.
     */
    Optional<PlanningAdvice> advise(ResearchRequest request, @Nullable JobAnalysis analysis);
}
