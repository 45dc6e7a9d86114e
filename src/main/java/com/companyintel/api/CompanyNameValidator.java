package com.companyintel.api;

import com.companyintel.config.ResearchProperties;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Cheap plausibility check on a company name. No external lookups.
 */
@Service
public class CompanyNameValidator {

    static final String TOO_SHORT = "Company name too short";
    static final String PLACEHOLDER = "Company name appears to be a test or placeholder";

    private final ResearchProperties properties;

    public CompanyNameValidator(ResearchProperties properties) {
        this.properties = properties;
    }

    public CompanyValidationResponse validate(String companyName) {
        String trimmed = companyName == null ? "" : companyName.trim();
        if (trimmed.length() < properties.getValidation().getMinSubjectLength()) {
            return CompanyValidationResponse.invalid(TOO_SHORT);
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String pattern : properties.getValidation().getPlaceholderPatterns()) {
            if (lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                return CompanyValidationResponse.invalid(PLACEHOLDER);
            }
        }
        return CompanyValidationResponse.valid(trimmed);
    }
}
