package com.example.taxcalc.domain.exception;

/**
 * Raised when a monetary field fails its numeric or sign constraint.
 * Carries the form label, the 1-based record index and the field so callers can point at the
 * offending value, e.g. {@code "W-2 #2: wages must be non-negative"}.
 */
public class TaxValidationException extends DomainException {

    private final String form;
    private final Integer recordIndex;
    private final String field;

	/**
	 * Creates a validation failure for a field that belongs to a numbered form record.
	 *
	 * @param form        form label such as {@code W-2} or {@code 1099-DIV}
	 * @param recordIndex 1-based position of the record in its list
	 * @param field       offending field name
	 * @param problem     what is wrong with the value
	 */
    public TaxValidationException(String form, int recordIndex, String field, String problem) {
        super(form + " #" + recordIndex + ": " + problem);
        this.form = form;
        this.recordIndex = recordIndex;
        this.field = field;
    }

	/**
	 * Creates a validation failure for a top-level field of the return.
	 *
	 * @param field   offending field name
	 * @param problem what is wrong with the value
	 */
    public TaxValidationException(String field, String problem) {
        super(problem);
        this.form = null;
        this.recordIndex = null;
        this.field = field;
    }

    public String getForm() {
        return form;
    }

    public Integer getRecordIndex() {
        return recordIndex;
    }

    public String getField() {
        return field;
    }
}
