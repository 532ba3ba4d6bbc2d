package com.example.taxcalc.domain.exception;

/**
 * Raised when a filing status tag does not match one of the five recognized statuses.
 */
public class InvalidFilingStatusException extends DomainException {

	/**
	 * Creates the exception and records the rejected tag as part of the message.
	 *
	 * @param tag raw value supplied by the caller
	 */
    public InvalidFilingStatusException(String tag) {
        super("Unknown filing status: " + tag);
    }
}
