package com.example.taxcalc.domain.exception;

/**
 * Raised when a required part of a tax return is missing or structurally invalid,
 * for example a missing filing status or a {@code null} entry inside a list of forms.
 */
public class IncompleteInputException extends DomainException {

	/**
	 * Creates the exception with a message naming the missing piece.
	 *
	 * @param message description of the missing field or record
	 */
    public IncompleteInputException(String message) {
        super(message);
    }
}
