package com.example.taxcalc.infrastructure.exception;

/**
 * Root of the failures raised by adapters: the rate-table loader and the history repository.
 * Always carries the JDBC, Jackson or I/O exception that caused it.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message which resource or table was involved
	 * @param cause   library exception being translated
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
