package com.example.taxcalc.application.exception;

/**
 * Signals a request parameter that a use case cannot honour, such as a history page size outside
 * the configured range. Mapped to HTTP 400.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
