package com.example.taxcalc.domain.exception;

/**
 * Raised when a return describes a combination the calculator does not model,
 * such as a net negative total income or above-the-line deductions that exceed income.
 */
public class UnsupportedScenarioException extends DomainException {

	/**
	 * Creates the exception with a message describing the unsupported combination.
	 *
	 * @param message description suitable for display
	 */
    public UnsupportedScenarioException(String message) {
        super(message);
    }
}
