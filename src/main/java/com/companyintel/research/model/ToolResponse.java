package com.companyintel.research.model;

import org.springframework.lang.Nullable;

public record ToolResponse(@Nullable String content, @Nullable String source) {
}
