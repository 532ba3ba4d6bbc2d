package com.example.taxcalc.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals an unreadable or inconsistent rate-table file.
 */
public class RateTableLoadException extends InfrastructureException {

	/**
	 * Creates the exception with a contextual message and the root cause from Jackson or the table checks.
	 *
	 * @param message which resource failed to load
	 * @param cause   underlying parse or validation failure
	 */
    public RateTableLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
