package com.companyintel.research;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.companyintel.research.ResearchConstants.COMPANY_PLACEHOLDER;
import static com.companyintel.research.ResearchConstants.ROLE_PLACEHOLDER;

/**
 * Fills {@code {company}} and {@code {role}} in configured topic templates.
 * <p>
 * Substitution is a single pass over the template, so placeholder text inside a company name or job
 * title is copied literally.
 */
public final class TopicTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile(
            Pattern.quote(COMPANY_PLACEHOLDER) + "|" + Pattern.quote(ROLE_PLACEHOLDER));

    private TopicTemplates() {
    }

    public static String fill(String template, String company, @Nullable String role) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = COMPANY_PLACEHOLDER.equals(matcher.group())
                    ? company
                    : StringUtils.hasText(role) ? role : "";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString().replaceAll("\\s{2,}", " ").trim();
    }
}
