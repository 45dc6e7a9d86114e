package com.companyintel.research.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
record ResearchAnswer(String summary, String source) {
}
