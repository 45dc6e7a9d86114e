package com.companyintel.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompanyValidationResponse(boolean valid, String reason, String companyName) {

    public static CompanyValidationResponse valid(String companyName) {
        return new CompanyValidationResponse(true, null, companyName);
    }

    public static CompanyValidationResponse invalid(String reason) {
        return new CompanyValidationResponse(false, reason, null);
    }
}
