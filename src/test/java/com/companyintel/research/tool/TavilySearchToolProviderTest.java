package com.companyintel.research.tool;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.exception.ToolException;
import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.model.ToolResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TavilySearchToolProviderTest {

    private static final String BASE_URL = "https://api.tavily.com";

    private final ResearchProperties.TavilyConfig config = new ResearchProperties.TavilyConfig();
    private final Instruction instruction = new Instruction(ResearchDomain.PAST, "Acme Corp history", 1);
    private MockRestServiceServer server;
    private TavilySearchToolProvider provider;

    @BeforeEach
    void setUp() {
        config.setApiKey("tvly-test-key");
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new TavilySearchToolProvider(builder.build(), config);
    }

    @Test
    void prefersGeneratedAnswerAndCitesTopResult() throws Exception {
        server.expect(requestTo(BASE_URL + "/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer tvly-test-key"))
                .andExpect(jsonPath("$.query").value("Acme Corp history"))
                .andExpect(jsonPath("$.max_results").value(3))
                .andExpect(jsonPath("$.search_depth").value("basic"))
                .andExpect(jsonPath("$.include_answer").value(true))
                .andRespond(withSuccess("""
                        {"query": "Acme Corp history",
                         "answer": "Acme Corp was founded in 1999 in Portland.",
                         "results": [{"title": "About Acme", "url": "https://acme.example/about",
                                      "content": "Founded 1999", "score": 0.91}],
                         "response_time": 1.2}
                        """, MediaType.APPLICATION_JSON));

        ToolResponse response = provider.invoke(instruction);

        assertEquals("Acme Corp was founded in 1999 in Portland.", response.content());
        assertEquals("https://acme.example/about", response.source());
        server.verify();
    }

    @Test
    void fallsBackToFirstResultWithContent() throws Exception {
        server.expect(requestTo(BASE_URL + "/search"))
                .andRespond(withSuccess("""
                        {"results": [{"title": "Empty", "url": "https://a.example", "content": ""},
                                     {"title": "Acme timeline", "url": "https://b.example", "content": "IPO in 2010"}]}
                        """, MediaType.APPLICATION_JSON));

        ToolResponse response = provider.invoke(instruction);

        assertEquals("Acme timeline: IPO in 2010", response.content());
        assertEquals("https://b.example", response.source());
    }

    @Test
    void noResultsIsMalformed() {
        server.expect(requestTo(BASE_URL + "/search"))
                .andRespond(withSuccess("{\"results\": []}", MediaType.APPLICATION_JSON));

        assertKind(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    void unreadableBodyIsMalformed() {
        server.expect(requestTo(BASE_URL + "/search"))
                .andRespond(withSuccess("<html>oops</html>", MediaType.APPLICATION_JSON));

        assertKind(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    void unauthorizedIsFatal() {
        server.expect(requestTo(BASE_URL + "/search")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        ToolException ex = assertKind(ErrorKind.UNAUTHORIZED);
        assertTrue(ex.getKind().isFatal());
    }

    @Test
    void rateLimitAndServerErrorsAreUnavailable() {
        server.expect(requestTo(BASE_URL + "/search")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        assertKind(ErrorKind.TOOL_UNAVAILABLE);

        server.reset();
        server.expect(requestTo(BASE_URL + "/search")).andRespond(withStatus(HttpStatus.BAD_GATEWAY));
        assertKind(ErrorKind.TOOL_UNAVAILABLE);
    }

    @Test
    void badRequestIsRejected() {
        server.expect(requestTo(BASE_URL + "/search")).andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertKind(ErrorKind.TOOL_REJECTED);
    }

    @Test
    void readTimeoutIsTimeout() {
        server.expect(requestTo(BASE_URL + "/search"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertKind(ErrorKind.TOOL_TIMEOUT);
    }

    @Test
    void missingApiKeyIsMisconfigured() {
        config.setApiKey(" ");

        assertKind(ErrorKind.MISCONFIGURED);
        server.verify();
    }

    @Test
    void classifiesPlanLimitStatuses() {
        assertEquals(ErrorKind.TOOL_UNAVAILABLE, TavilySearchToolProvider.classify(432));
        assertEquals(ErrorKind.UNAUTHORIZED, TavilySearchToolProvider.classify(403));
        assertEquals(ErrorKind.TOOL_REJECTED, TavilySearchToolProvider.classify(422));
    }

    private ToolException assertKind(ErrorKind expected) {
        ToolException ex = assertThrows(ToolException.class, () -> provider.invoke(instruction));
        assertEquals(expected, ex.getKind());
        return ex;
    }
}
