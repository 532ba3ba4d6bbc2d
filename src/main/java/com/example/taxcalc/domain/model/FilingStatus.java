package com.example.taxcalc.domain.model;

import com.example.taxcalc.domain.exception.IncompleteInputException;
import com.example.taxcalc.domain.exception.InvalidFilingStatusException;

import java.util.Locale;

/**
 * Closed set of federal filing statuses. Each value keys the per-status maps of a {@link RateTable}.
 */
public enum FilingStatus {
    SINGLE,
    MARRIED_FILING_JOINTLY,
    MARRIED_FILING_SEPARATELY,
    HEAD_OF_HOUSEHOLD,
    QUALIFYING_SURVIVING_SPOUSE;

	/**
	 * Parses a filing status tag coming from the HTTP layer.
	 * Matching ignores case, surrounding whitespace and the use of dashes or spaces instead of underscores.
	 *
	 * @param tag raw tag supplied by the caller
	 * @return the matching status
	 * @throws IncompleteInputException     when the tag is missing or blank
	 * @throws InvalidFilingStatusException when the tag does not name a known status
	 */
    public static FilingStatus fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IncompleteInputException("Filing status is required.");
        }
        String normalized = tag.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        try {
            return FilingStatus.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new InvalidFilingStatusException(tag);
        }
    }

	/**
	 * Resolves a human friendly label for reference-data listings.
	 *
	 * @return display name of the status
	 */
    public String displayName() {
        return switch (this) {
            case SINGLE -> "Single";
            case MARRIED_FILING_JOINTLY -> "Married filing jointly";
            case MARRIED_FILING_SEPARATELY -> "Married filing separately";
            case HEAD_OF_HOUSEHOLD -> "Head of household";
            case QUALIFYING_SURVIVING_SPOUSE -> "Qualifying surviving spouse";
        };
    }
}
