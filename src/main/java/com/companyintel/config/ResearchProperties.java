package com.companyintel.config;

import com.companyintel.research.model.ResearchDomain;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.companyintel.research.ResearchConstants.DEFAULT_TOPICS;

@ConfigurationProperties(prefix = "research")
public class ResearchProperties {

    /**
     * Added to the busiest worker's worst case to cover thread start-up and the bookkeeping between
     * task units.
     */
    public static final Duration DEADLINE_MARGIN = Duration.ofSeconds(15);

    private List<ResearchDomain> domains = new ArrayList<>(List.of(ResearchDomain.values()));
    private int iterationBudget = 5;
    private Map<String, Integer> domainBudgets = new HashMap<>();
    private Duration deadline;
    private WorkerConfig worker = new WorkerConfig();
    private PolicyConfig policy = new PolicyConfig();
    private ToolConfig tool = new ToolConfig();
    private SynthesisConfig synthesis = new SynthesisConfig();
    private PlanningConfig planning = new PlanningConfig();
    private ValidationConfig validation = new ValidationConfig();

    public enum ToolProviderType {
        TAVILY, CHAT
    }

    public enum RendererType {
        MARKDOWN, CHAT
    }

    public List<ResearchDomain> getDomains() {
        return domains;
    }

    public void setDomains(List<ResearchDomain> domains) {
        if (domains == null || domains.isEmpty()) {
            return;
        }
        this.domains = new ArrayList<>(new LinkedHashSet<>(domains));
    }

    public int getIterationBudget() {
        return iterationBudget;
    }

    public void setIterationBudget(int iterationBudget) {
        if (iterationBudget <= 0) {
            return;
        }
        this.iterationBudget = iterationBudget;
    }

    public Map<String, Integer> getDomainBudgets() {
        return domainBudgets;
    }

    public void setDomainBudgets(Map<String, Integer> domainBudgets) {
        if (domainBudgets == null) {
            return;
        }
        this.domainBudgets = new HashMap<>(domainBudgets);
    }

    public int getIterationBudget(ResearchDomain domain) {
        Integer override = domainBudgets.get(domain.key());
        if (override == null) {
            override = domainBudgets.get(domain.name().toLowerCase(Locale.ROOT));
        }
        return override != null && override > 0 ? override : iterationBudget;
    }

    /**
     * The run deadline. When none is configured it is derived so that the busiest
     * worker can spend its whole budget on calls that each run to the tool timeout:
     * {@code max budget * (connect timeout + tool timeout) + DEADLINE_MARGIN}.
     * With the defaults that is {@code 5 * (5s + 30s) + 15s = 190s}.
     */
    public Duration getDeadline() {
        return deadline != null ? deadline : derivedDeadline();
    }

    Duration derivedDeadline() {
        int maxBudget = iterationBudget;
        for (ResearchDomain domain : domains) {
            maxBudget = Math.max(maxBudget, getIterationBudget(domain));
        }
        return tool.worstCaseCallDuration().multipliedBy(maxBudget).plus(DEADLINE_MARGIN);
    }

    public void setDeadline(Duration deadline) {
        if (deadline == null || deadline.isZero() || deadline.isNegative()) {
            return;
        }
        this.deadline = deadline;
    }

    public WorkerConfig getWorker() {
        return worker;
    }

    public void setWorker(WorkerConfig worker) {
        this.worker = worker != null ? worker : new WorkerConfig();
    }

    public PolicyConfig getPolicy() {
        return policy;
    }

    public void setPolicy(PolicyConfig policy) {
        this.policy = policy != null ? policy : new PolicyConfig();
    }

    public ToolConfig getTool() {
        return tool;
    }

    public void setTool(ToolConfig tool) {
        this.tool = tool != null ? tool : new ToolConfig();
    }

    public SynthesisConfig getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(SynthesisConfig synthesis) {
        this.synthesis = synthesis != null ? synthesis : new SynthesisConfig();
    }

    public PlanningConfig getPlanning() {
        return planning;
    }

    public void setPlanning(PlanningConfig planning) {
        this.planning = planning != null ? planning : new PlanningConfig();
    }

    public ValidationConfig getValidation() {
        return validation;
    }

    public void setValidation(ValidationConfig validation) {
        this.validation = validation != null ? validation : new ValidationConfig();
    }

    public static class WorkerConfig {
        private boolean partialOnFailures = true;

        public boolean isPartialOnFailures() {
            return partialOnFailures;
        }

        public void setPartialOnFailures(boolean partialOnFailures) {
            this.partialOnFailures = partialOnFailures;
        }
    }

    public static class PolicyConfig {
        private int minFindings = 3;
        private Map<String, List<String>> topics = new HashMap<>();

        public int getMinFindings() {
            return minFindings;
        }

        public void setMinFindings(int minFindings) {
            if (minFindings <= 0) {
                return;
            }
            this.minFindings = minFindings;
        }

        public Map<String, List<String>> getTopics() {
            return topics;
        }

        public void setTopics(Map<String, List<String>> topics) {
            if (topics == null) {
                return;
            }
            this.topics = new HashMap<>(topics);
        }

        public List<String> topicsFor(ResearchDomain domain) {
            List<String> configured = topics.get(domain.key());
            if (configured == null || configured.isEmpty()) {
                return DEFAULT_TOPICS.get(domain);
            }
            return List.copyOf(configured);
        }
    }

    public static class ToolConfig {
        private ToolProviderType provider = ToolProviderType.TAVILY;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private TavilyConfig tavily = new TavilyConfig();

        public ToolProviderType getProvider() {
            return provider;
        }

        public void setProvider(ToolProviderType provider) {
            if (provider == null) {
                return;
            }
            this.provider = provider;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return;
            }
            this.timeout = timeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
                return;
            }
            this.connectTimeout = connectTimeout;
        }

        /** Longest a single call may take: connecting plus reading up to the timeout. */
        public Duration worstCaseCallDuration() {
            return connectTimeout.plus(timeout);
        }

        public TavilyConfig getTavily() {
            return tavily;
        }

        public void setTavily(TavilyConfig tavily) {
            this.tavily = tavily != null ? tavily : new TavilyConfig();
        }
    }

    public static class TavilyConfig {
        private String apiKey;
        private String baseUrl = "https://api.tavily.com";
        private int maxResults = 3;
        private String searchDepth = "basic";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults > 0 ? maxResults : this.maxResults; }
        public String getSearchDepth() { return searchDepth; }
        public void setSearchDepth(String searchDepth) { this.searchDepth = searchDepth; }
    }

    public static class SynthesisConfig {
        private RendererType renderer = RendererType.MARKDOWN;
        private Duration renderTimeout = Duration.ofSeconds(60);

        public RendererType getRenderer() {
            return renderer;
        }

        public void setRenderer(RendererType renderer) {
            if (renderer == null) {
                return;
            }
            this.renderer = renderer;
        }

        public Duration getRenderTimeout() {
            return renderTimeout;
        }

        public void setRenderTimeout(Duration renderTimeout) {
            if (renderTimeout == null || renderTimeout.isZero() || renderTimeout.isNegative()) {
                return;
            }
            this.renderTimeout = renderTimeout;
        }
    }

    public static class PlanningConfig {
        private boolean modelAssisted;

        public boolean isModelAssisted() {
            return modelAssisted;
        }

        public void setModelAssisted(boolean modelAssisted) {
            this.modelAssisted = modelAssisted;
        }
    }

    public static class ValidationConfig {
        private int minSubjectLength = 2;
        private List<String> placeholderPatterns = new ArrayList<>(List.of("test", "example", "dummy", "123"));

        public int getMinSubjectLength() {
            return minSubjectLength;
        }

        public void setMinSubjectLength(int minSubjectLength) {
            this.minSubjectLength = Math.max(1, minSubjectLength);
        }

        public List<String> getPlaceholderPatterns() {
            return placeholderPatterns;
        }

        public void setPlaceholderPatterns(List<String> placeholderPatterns) {
            if (placeholderPatterns == null) {
                return;
            }
            this.placeholderPatterns = new ArrayList<>(placeholderPatterns);
        }
    }
}
