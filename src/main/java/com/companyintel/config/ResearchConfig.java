package com.companyintel.config;

import com.companyintel.research.api.DecisionPolicy;
import com.companyintel.research.api.JobAnalyzer;
import com.companyintel.research.api.PlanningAdvisor;
import com.companyintel.research.api.RenderingPolicy;
import com.companyintel.research.api.ToolProvider;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.planning.ChatJobAnalyzer;
import com.companyintel.research.planning.ChatPlanningAdvisor;
import com.companyintel.research.planning.JobContextExtractor;
import com.companyintel.research.service.JsonProcessingService;
import com.companyintel.research.synthesis.ChatClientRenderingPolicy;
import com.companyintel.research.synthesis.MarkdownRenderingPolicy;
import com.companyintel.research.tool.ChatModelToolProvider;
import com.companyintel.research.tool.TavilySearchToolProvider;
import com.companyintel.research.worker.DecisionPolicyRegistry;
import com.companyintel.research.worker.TopicDecisionPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class ResearchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Unbounded so that every run gets its workers started at once; a queued worker would spend the
     * shared deadline waiting for a thread held by another run.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService researchWorkerExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("research-worker-"));
    }

    @Bean
    public DecisionPolicyRegistry decisionPolicyRegistry(ResearchProperties properties) {
        List<DecisionPolicy> policies = new ArrayList<>();
        for (ResearchDomain domain : ResearchDomain.values()) {
            policies.add(new TopicDecisionPolicy(domain, properties.getPolicy().topicsFor(domain),
                    properties.getPolicy().getMinFindings()));
        }
        return new DecisionPolicyRegistry(policies);
    }

    @Bean
    public ChatClient chatClient(ChatClient.Builder chatClientBuilder) {
        return chatClientBuilder.build();
    }

    @Bean
    public JobAnalyzer jobAnalyzer(ResearchProperties properties,
                                   ObjectProvider<ChatClient> chatClient,
                                   JsonProcessingService jsonProcessingService) {
        JobContextExtractor extractor = new JobContextExtractor();
        if (!properties.getPlanning().isModelAssisted()) {
            return extractor;
        }
        return new ChatJobAnalyzer(chatClient.getObject(), jsonProcessingService, extractor);
    }

    @Bean
    public PlanningAdvisor planningAdvisor(ResearchProperties properties,
                                           ObjectProvider<ChatClient> chatClient,
                                           JsonProcessingService jsonProcessingService) {
        log.info("Model-assisted planning: {}", properties.getPlanning().isModelAssisted());
        if (!properties.getPlanning().isModelAssisted()) {
            return PlanningAdvisor.DEFAULT_FOCUS;
        }
        return new ChatPlanningAdvisor(chatClient.getObject(), jsonProcessingService);
    }

    @Bean
    public ToolProvider toolProvider(ResearchProperties properties,
                                     RestClient.Builder restClientBuilder,
                                     ObjectProvider<ChatClient> chatClient,
                                     JsonProcessingService jsonProcessingService,
                                     Clock clock) {
        ResearchProperties.ToolConfig tool = properties.getTool();
        log.info("Research tool provider: {}", tool.getProvider());
        return switch (tool.getProvider()) {
            case TAVILY -> new TavilySearchToolProvider(
                    restClientBuilder.baseUrl(tool.getTavily().getBaseUrl()).build(), tool.getTavily());
            case CHAT -> new ChatModelToolProvider(chatClient.getObject(), jsonProcessingService, clock);
        };
    }

    @Bean
    public RenderingPolicy renderingPolicy(ResearchProperties properties,
                                           ObjectProvider<ChatClient> chatClient,
                                           JsonProcessingService jsonProcessingService,
                                           Clock clock) {
        log.info("Report renderer: {}", properties.getSynthesis().getRenderer());
        return switch (properties.getSynthesis().getRenderer()) {
            case MARKDOWN -> new MarkdownRenderingPolicy();
            case CHAT -> new ChatClientRenderingPolicy(chatClient.getObject(), jsonProcessingService, clock);
        };
    }
}
