package com.companyintel.api;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResearchApiRequest(
        @NotBlank @Size(max = 200) String companyName,
        @Size(max = 200) String jobTitle,
        @Size(max = 10000) String jobDescription
) {

    static final int MIN_COMPANY_NAME_LENGTH = 2;

    // Counted after trimming, the way the name is used for research
    @AssertTrue(message = "company name must have at least 2 characters besides surrounding whitespace")
    public boolean isCompanyNameLongEnough() {
        return companyName == null || companyName.trim().length() >= MIN_COMPANY_NAME_LENGTH;
    }
}
