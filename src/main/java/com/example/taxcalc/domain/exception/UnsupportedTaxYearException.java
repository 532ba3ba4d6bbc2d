package com.example.taxcalc.domain.exception;

/**
 * Raised when no rate table has been loaded for the requested tax year.
 */
public class UnsupportedTaxYearException extends UnsupportedScenarioException {

	/**
	 * Creates the exception and names the requested year.
	 *
	 * @param taxYear year without a rate table
	 */
    public UnsupportedTaxYearException(int taxYear) {
        super("Tax year " + taxYear + " is not supported.");
    }
}
