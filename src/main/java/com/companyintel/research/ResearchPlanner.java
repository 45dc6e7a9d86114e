package com.companyintel.research;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.api.JobAnalyzer;
import com.companyintel.research.api.PlanningAdvisor;
import com.companyintel.research.model.JobAnalysis;
import com.companyintel.research.model.PlanningAdvice;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.model.ResearchPlan;
import com.companyintel.research.model.ResearchRequest;
import com.companyintel.research.model.WorkerSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.companyintel.research.ResearchConstants.DEFAULT_OBJECTIVE;
import static com.companyintel.research.ResearchConstants.DOMAIN_FOCUS;
import static com.companyintel.research.ResearchConstants.ROLE_FOCUS_SUFFIX;

/**
 * Turns a request into a {@link ResearchPlan} with one {@link WorkerSpec} per configured research domain.
 * <p>
 * A job description is analyzed first. An explicit job title always wins over a derived one. The
 * {@link PlanningAdvisor} may then replace the default focus of any domain; domains it says nothing
 * about keep the default.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchPlanner {

    private final ResearchProperties properties;
    private final JobAnalyzer jobAnalyzer;
    private final PlanningAdvisor planningAdvisor;

    public ResearchPlan plan(ResearchRequest request) {
        JobAnalysis analysis = request.jobDescription() == null
                ? null
                : jobAnalyzer.analyze(request.jobDescription()).orElse(null);
        ResearchRequest resolved = resolveTitle(request, analysis);
        Optional<PlanningAdvice> advice = planningAdvisor.advise(resolved, analysis);

        List<WorkerSpec> workers = new ArrayList<>();
        for (ResearchDomain domain : properties.getDomains()) {
            String focus = advice.flatMap(a -> a.focusFor(domain)).orElseGet(() -> focusFor(domain, resolved));
            workers.add(new WorkerSpec(domain, resolved, focus, properties.getIterationBudget(domain)));
        }
        List<String> objectives = advice.map(PlanningAdvice::researchObjectives)
                .filter(list -> !list.isEmpty())
                .orElseGet(() -> List.of(DEFAULT_OBJECTIVE.formatted(resolved.subject())));
        List<String> considerations = advice.map(PlanningAdvice::jobSpecificConsiderations).orElse(List.of());
        log.info("Planned {} workers for '{}' ({} focus).", workers.size(), resolved.subject(),
                advice.isPresent() ? "advised" : "default");
        return new ResearchPlan(resolved, analysis, objectives, considerations, workers);
    }

    private ResearchRequest resolveTitle(ResearchRequest request, @Nullable JobAnalysis analysis) {
        if (request.jobTitle() != null || analysis == null || analysis.jobTitle().isEmpty()) {
            return request;
        }
        log.info("Derived job title '{}' from the job description.", analysis.jobTitle());
        return request.withJobTitle(analysis.jobTitle());
    }

    String focusFor(ResearchDomain domain, ResearchRequest request) {
        String focus = DOMAIN_FOCUS.get(domain).formatted(request.subject());
        if (request.jobTitle() != null) {
            focus = focus + ROLE_FOCUS_SUFFIX.formatted(request.jobTitle());
        }
        return focus;
    }
}
