package com.companyintel.research.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record TavilySearchResponse(String query, String answer, List<Result> results) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Result(String title, String url, String content, Double score) {
    }
}
