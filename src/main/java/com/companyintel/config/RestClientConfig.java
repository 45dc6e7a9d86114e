package com.companyintel.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class RestClientConfig {

    static final String HTTP_LOGGER = "com.companyintel.http.logging";

    @Bean
    public RestClientCustomizer restClientCustomizer(ResearchProperties properties) {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // Buffering lets the interceptor read the body before the caller does
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(
                    requestFactory(properties)));
        };
    }

    static SimpleClientHttpRequestFactory requestFactory(ResearchProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getTool().getConnectTimeout());
        factory.setReadTimeout(properties.getTool().getTimeout());
        return factory;
    }

    static String maskAuthorization(String value) {
        if (value == null || value.isBlank()) {
            return value;
        }
        int space = value.indexOf(' ');
        String scheme = space > 0 ? value.substring(0, space + 1) : "";
        return scheme + "****";
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger(HTTP_LOGGER);

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            if (httpLogger.isDebugEnabled()) {
                logRequest(request, body);
            }
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                logResponse(response);
            }
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            HttpHeaders headers = new HttpHeaders();
            headers.putAll(request.getHeaders());
            String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
            if (auth != null) {
                headers.set(HttpHeaders.AUTHORIZATION, maskAuthorization(auth));
            }
            httpLogger.debug("--- HTTP Request ---");
            httpLogger.debug("URI: {} {}", request.getMethod(), request.getURI());
            httpLogger.debug("Headers: {}", headers);
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            httpLogger.debug("--- HTTP Response ---");
            httpLogger.debug("Status: {}", response.getStatusCode());
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }
    }
}
