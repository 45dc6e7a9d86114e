package com.companyintel.research.worker;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.model.WorkerSpec;
import com.companyintel.research.task.TaskUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WorkerFactory {

    private final TaskUnit taskUnit;
    private final DecisionPolicyRegistry decisionPolicies;
    private final ResearchProperties properties;

    public ResearchWorker create(WorkerSpec spec) {
        return new ResearchWorker(spec, taskUnit, decisionPolicies.find(spec.domain()).orElse(null),
                properties.getWorker().isPartialOnFailures());
    }
}
