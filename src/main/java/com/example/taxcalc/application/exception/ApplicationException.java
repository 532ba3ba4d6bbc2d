package com.example.taxcalc.application.exception;

/**
 * Root of the errors raised by the calculation, history and reference-data use cases when a request
 * is well formed but cannot be served as asked. Tax-rule violations are domain exceptions instead.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message explanation returned to the API caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
