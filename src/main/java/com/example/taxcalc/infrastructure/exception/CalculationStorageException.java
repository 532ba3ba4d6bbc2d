package com.example.taxcalc.infrastructure.exception;

/**
 * Raised when the calculation history store cannot be read or written.
 */
public class CalculationStorageException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level JDBC or JSON exception
	 */
    public CalculationStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
