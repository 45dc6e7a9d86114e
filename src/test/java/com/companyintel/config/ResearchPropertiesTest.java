package com.companyintel.config;

import com.companyintel.research.ResearchConstants;
import com.companyintel.research.model.ResearchDomain;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResearchPropertiesTest {

    private final ResearchProperties properties = new ResearchProperties();

    @Test
    void defaults() {
        assertEquals(List.of(ResearchDomain.PAST, ResearchDomain.FUTURE, ResearchDomain.CULTURE), properties.getDomains());
        assertEquals(5, properties.getIterationBudget());
        assertEquals(Duration.ofSeconds(190), properties.getDeadline());
        assertEquals(Duration.ofSeconds(60), properties.getSynthesis().getRenderTimeout());
        assertFalse(properties.getPlanning().isModelAssisted());
        assertEquals(3, properties.getPolicy().getMinFindings());
        assertTrue(properties.getWorker().isPartialOnFailures());
        assertEquals(ResearchProperties.ToolProviderType.TAVILY, properties.getTool().getProvider());
        assertEquals(ResearchProperties.RendererType.MARKDOWN, properties.getSynthesis().getRenderer());
    }

    @Test
    void ignoresInvalidValues() {
        properties.setIterationBudget(0);
        properties.setDeadline(Duration.ZERO);
        properties.getTool().setConnectTimeout(Duration.ofSeconds(-1));
        properties.getSynthesis().setRenderTimeout(null);
        properties.setDomains(List.of());

        assertEquals(5, properties.getIterationBudget());
        assertEquals(Duration.ofSeconds(190), properties.getDeadline());
        assertEquals(Duration.ofSeconds(5), properties.getTool().getConnectTimeout());
        assertEquals(Duration.ofSeconds(60), properties.getSynthesis().getRenderTimeout());
        assertEquals(3, properties.getDomains().size());
    }

    @Test
    void derivedDeadlineCoversBusiestWorkerAtToolTimeout() {
        Duration worstCall = properties.getTool().worstCaseCallDuration();
        assertTrue(properties.getDeadline().compareTo(worstCall.multipliedBy(5)) > 0);

        properties.setDomainBudgets(Map.of("future", 8));
        properties.getTool().setTimeout(Duration.ofSeconds(10));

        assertEquals(Duration.ofSeconds(8 * 15).plus(ResearchProperties.DEADLINE_MARGIN), properties.getDeadline());
    }

    @Test
    void explicitDeadlineWins() {
        properties.setDeadline(Duration.ofSeconds(45));

        assertEquals(Duration.ofSeconds(45), properties.getDeadline());
    }

    @Test
    void domainBudgetOverridesFallBackToGlobal() {
        properties.setDomainBudgets(Map.of("future", 8, "past", 0));

        assertEquals(8, properties.getIterationBudget(ResearchDomain.FUTURE));
        assertEquals(5, properties.getIterationBudget(ResearchDomain.PAST));
    }

    @Test
    void topicsDefaultPerDomain() {
        properties.getPolicy().setTopics(Map.of("culture", List.of("{company} hackathons")));

        assertEquals(List.of("{company} hackathons"), properties.getPolicy().topicsFor(ResearchDomain.CULTURE));
        assertEquals(ResearchConstants.DEFAULT_TOPICS.get(ResearchDomain.PAST),
                properties.getPolicy().topicsFor(ResearchDomain.PAST));
    }
}
