package com.companyintel.research.worker;

import com.companyintel.research.api.DecisionPolicy;
import com.companyintel.research.model.ResearchDomain;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public class DecisionPolicyRegistry {

    private final Map<ResearchDomain, DecisionPolicy> policies = new EnumMap<>(ResearchDomain.class);

    public DecisionPolicyRegistry(Collection<? extends DecisionPolicy> policies) {
        for (DecisionPolicy policy : policies) {
            if (this.policies.put(policy.domain(), policy) != null) {
                throw new IllegalArgumentException("More than one decision policy for domain " + policy.domain());
            }
        }
    }

    public Optional<DecisionPolicy> find(ResearchDomain domain) {
        return Optional.ofNullable(policies.get(domain));
    }
}
