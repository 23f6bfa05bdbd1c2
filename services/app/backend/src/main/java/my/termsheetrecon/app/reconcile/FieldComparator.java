package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.FieldComparison;

/**
 * Compares two present values of one canonical field. Implementations never throw for
 * malformed input; they fall back to a simpler comparison instead.
 */
@FunctionalInterface
public interface FieldComparator {
	FieldComparison compare(String fieldName, Object termSheetValue, Object bookingValue);
}
