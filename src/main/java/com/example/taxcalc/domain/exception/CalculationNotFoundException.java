package com.example.taxcalc.domain.exception;

/**
 * Raised when a stored calculation is requested by an identifier that does not exist.
 */
public class CalculationNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing identifier as part of the message.
	 *
	 * @param id identifier that could not be resolved
	 */
    public CalculationNotFoundException(long id) {
        super("Calculation not found: " + id);
    }
}
