package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.FieldComparison;

/**
 * Case-insensitive comparison that accepts containment either way as a partial match, so that
 * "Genel Energy PLC" and "Genel Energy" reconcile.
 */
public class TextComparator implements FieldComparator {
	static final double PARTIAL_MATCH_SIMILARITY = 0.9d;
	static final String PARTIAL_MATCH_NOTE = "partial text match";

	@Override
	public FieldComparison compare(String fieldName, Object termSheetValue, Object bookingValue) {
		String left = FieldValues.normalized(termSheetValue);
		String right = FieldValues.normalized(bookingValue);
		if (left.equals(right)) {
			return new FieldComparison(fieldName, termSheetValue, bookingValue, true, 1.0d, null);
		}
		if (left.contains(right) || right.contains(left)) {
			return new FieldComparison(fieldName, termSheetValue, bookingValue, true, PARTIAL_MATCH_SIMILARITY,
					PARTIAL_MATCH_NOTE);
		}
		return new FieldComparison(fieldName, termSheetValue, bookingValue, false, 0.0d, "Text doesn't match");
	}
}
