package com.companyintel.research.tool;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.api.ToolProvider;
import com.companyintel.research.exception.ToolException;
import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ToolResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.InterruptedIOException;
import java.net.http.HttpTimeoutException;

/**
 * Web search through the Tavily search API. One search per invocation; the generated answer is
 * preferred over raw result snippets.
 */
@Slf4j
public class TavilySearchToolProvider implements ToolProvider {

    static final String SEARCH_PATH = "/search";

    private final RestClient restClient;
    private final ResearchProperties.TavilyConfig config;

    public TavilySearchToolProvider(RestClient restClient, ResearchProperties.TavilyConfig config) {
        this.restClient = restClient;
        this.config = config;
    }

    @Override
    public String name() {
        return "tavily";
    }

    @Override
    public ToolResponse invoke(Instruction instruction) throws ToolException {
        if (!StringUtils.hasText(config.getApiKey())) {
            throw new ToolException(ErrorKind.MISCONFIGURED, "Tavily API key is not configured.");
        }
        TavilySearchRequest request = new TavilySearchRequest(instruction.query(), config.getMaxResults(),
                config.getSearchDepth(), true);
        log.debug("Tavily search for {} iteration {}: {}", instruction.domain(), instruction.iteration(),
                instruction.query());
        TavilySearchResponse response;
        try {
            response = restClient.post()
                    .uri(SEARCH_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                    .body(request)
                    .retrieve()
                    .body(TavilySearchResponse.class);
        } catch (RestClientResponseException ex) {
            throw new ToolException(classify(ex.getStatusCode().value()),
                    "Tavily responded with HTTP " + ex.getStatusCode().value(), ex);
        } catch (ResourceAccessException ex) {
            ErrorKind kind = isTimeout(ex) ? ErrorKind.TOOL_TIMEOUT : ErrorKind.TOOL_UNAVAILABLE;
            throw new ToolException(kind, "Tavily is unreachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new ToolException(ErrorKind.MALFORMED_RESPONSE, "Unreadable Tavily response: " + ex.getMessage(), ex);
        }
        return toToolResponse(response);
    }

    private ToolResponse toToolResponse(TavilySearchResponse response) throws ToolException {
        if (response == null) {
            throw new ToolException(ErrorKind.MALFORMED_RESPONSE, "Tavily returned an empty body.");
        }
        TavilySearchResponse.Result top = null;
        if (response.results() != null) {
            top = response.results().stream()
                    .filter(result -> result != null && StringUtils.hasText(result.content()))
                    .findFirst()
                    .orElse(null);
        }
        String source = top != null ? top.url() : null;
        if (StringUtils.hasText(response.answer())) {
            return new ToolResponse(response.answer(), source);
        }
        if (top == null) {
            throw new ToolException(ErrorKind.MALFORMED_RESPONSE, "Tavily returned no usable results.");
        }
        String content = StringUtils.hasText(top.title()) ? top.title() + ": " + top.content() : top.content();
        return new ToolResponse(content, source);
    }

    static ErrorKind classify(int status) {
        if (status == 401 || status == 403) {
            return ErrorKind.UNAUTHORIZED;
        }
        if (status == 429 || status == 432 || status == 433 || status >= 500) {
            return ErrorKind.TOOL_UNAVAILABLE;
        }
        return ErrorKind.TOOL_REJECTED;
    }

    private static boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof InterruptedIOException || current instanceof HttpTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
