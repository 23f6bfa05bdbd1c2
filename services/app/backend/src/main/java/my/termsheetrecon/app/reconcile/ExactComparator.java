package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.FieldComparison;

public class ExactComparator implements FieldComparator {
	@Override
	public FieldComparison compare(String fieldName, Object termSheetValue, Object bookingValue) {
		String left = String.valueOf(FieldValues.asText(termSheetValue)).trim();
		String right = String.valueOf(FieldValues.asText(bookingValue)).trim();
		boolean match = left.equals(right);
		return new FieldComparison(fieldName, termSheetValue, bookingValue, match, match ? 1.0d : 0.0d,
				match ? null : "Exact values don't match");
	}
}
