package com.companyintel.research.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * One atomic piece of discovered information.
 *
 * @param content     the finding text, never blank
 * @param source      optional citation (usually a URL)
 * @param collectedAt when the task unit produced it
 */
public record Finding(String content, @Nullable String source, Instant collectedAt) {

    public Finding {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Finding content must not be blank.");
        }
        Objects.requireNonNull(collectedAt, "collectedAt");
        content = content.trim();
        source = source == null || source.isBlank() ? null : source.trim();
    }

    public boolean hasSource() {
        return source != null;
    }
}
