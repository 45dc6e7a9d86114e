package com.companyintel.research.planning;

import com.companyintel.research.api.JobAnalyzer;
import com.companyintel.research.model.JobAnalysis;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a job title from a free-form job description without calling a model. Also the fallback when
 * model-assisted analysis gives nothing usable.
 */
public class JobContextExtractor implements JobAnalyzer {

    private static final Pattern LABELLED_TITLE = Pattern.compile(
            "^\\s*(?:job\\s+title|title|position|role)\\s*[:\\-]\\s*(.+?)\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final int MAX_TITLE_LENGTH = 80;
    private static final int MAX_TITLE_WORDS = 8;

    @Override
    public Optional<JobAnalysis> analyze(String jobDescription) {
        return extractJobTitle(jobDescription).map(JobAnalysis::titleOnly);
    }

    public Optional<String> extractJobTitle(@Nullable String jobDescription) {
        if (!StringUtils.hasText(jobDescription)) {
            return Optional.empty();
        }
        Matcher matcher = LABELLED_TITLE.matcher(jobDescription);
        if (matcher.find()) {
            return Optional.of(clean(matcher.group(1))).filter(StringUtils::hasText);
        }
        String firstLine = jobDescription.strip().lines()
                .map(String::trim)
                .filter(StringUtils::hasText)
                .findFirst()
                .orElse("");
        if (looksLikeTitle(firstLine)) {
            return Optional.of(clean(firstLine));
        }
        return Optional.empty();
    }

    private boolean looksLikeTitle(String line) {
        if (line.isEmpty() || line.length() > MAX_TITLE_LENGTH) {
            return false;
        }
        if (line.endsWith(".") || line.endsWith("?") || line.endsWith("!")) {
            return false;
        }
        return line.split("\\s+").length <= MAX_TITLE_WORDS;
    }

    private String clean(String value) {
        return value.replaceAll("^[#*\\s]+", "").replaceAll("[*\\s]+$", "").trim();
    }
}
