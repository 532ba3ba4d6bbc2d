package com.example.taxcalc.domain.exception;

/**
 * Base type for all domain-level exceptions in the tax model.
 * Subclasses describe why a tax return cannot enter the calculation pipeline without leaking
 * transport or persistence concerns.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule the input broke
	 */
    protected DomainException(String message) {
        super(message);
    }
}
