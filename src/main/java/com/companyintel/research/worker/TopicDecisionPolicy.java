package com.companyintel.research.worker;

import com.companyintel.research.TopicTemplates;
import com.companyintel.research.api.DecisionPolicy;
import com.companyintel.research.model.Finding;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.model.WorkerSpec;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Issues the domain focus first, then walks the domain's topic list (wrapping around), and stops once
 * enough distinct findings were collected.
 */
public class TopicDecisionPolicy implements DecisionPolicy {

    private final ResearchDomain domain;
    private final List<String> topics;
    private final int minFindings;

    public TopicDecisionPolicy(ResearchDomain domain, List<String> topics, int minFindings) {
        if (minFindings <= 0) {
            throw new IllegalArgumentException("minFindings must be positive, got " + minFindings);
        }
        this.domain = Objects.requireNonNull(domain, "domain");
        this.topics = topics == null ? List.of() : List.copyOf(topics);
        this.minFindings = minFindings;
    }

    @Override
    public ResearchDomain domain() {
        return domain;
    }

    @Override
    public Instruction nextInstruction(List<Finding> findings, WorkerSpec spec, int iteration) {
        String role = spec.request().jobTitle();
        if (iteration <= 1 || topics.isEmpty()) {
            return new Instruction(domain, spec.focus(), iteration);
        }
        String template = topics.get((iteration - 2) % topics.size());
        return new Instruction(domain, TopicTemplates.fill(template, spec.request().subject(), role), iteration);
    }

    @Override
    public boolean isSufficient(List<Finding> findings) {
        long distinct = findings.stream()
                .map(finding -> finding.content().toLowerCase(Locale.ROOT))
                .distinct()
                .count();
        return distinct >= minFindings;
    }
}
