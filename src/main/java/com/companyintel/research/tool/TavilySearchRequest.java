package com.companyintel.research.tool;

import com.fasterxml.jackson.annotation.JsonProperty;

record TavilySearchRequest(
        String query,
        @JsonProperty("max_results") int maxResults,
        @JsonProperty("search_depth") String searchDepth,
        @JsonProperty("include_answer") boolean includeAnswer
) {
}
