package com.companyintel.research.exception;

/**
 * Raised when a research request cannot be accepted. No worker is launched for such a request.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
