package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.FieldComparison;

import java.util.Locale;

/**
 * Relative difference against the booking value, or absolute difference when the booking value is
 * zero. Values that do not parse as numbers are compared as exact strings.
 */
public class NumericComparator implements FieldComparator {
	private final double tolerance;
	private final FieldComparator fallback;

	public NumericComparator(double tolerance, FieldComparator fallback) {
		this.tolerance = tolerance;
		this.fallback = fallback;
	}

	@Override
	public FieldComparison compare(String fieldName, Object termSheetValue, Object bookingValue) {
		Double termSheetNumber = FieldValues.toDouble(termSheetValue);
		Double bookingNumber = FieldValues.toDouble(bookingValue);
		if (termSheetNumber == null || bookingNumber == null) {
			return fallback.compare(fieldName, termSheetValue, bookingValue);
		}
		double absolute = Math.abs(termSheetNumber - bookingNumber);
		double difference = bookingNumber != 0.0d ? absolute / Math.abs(bookingNumber) : absolute;
		boolean match = difference <= tolerance;
		double similarity = Math.max(0.0d, 1.0d - difference);
		String note = match ? null : String.format(Locale.ROOT, "Difference: %.4f", absolute);
		return new FieldComparison(fieldName, termSheetValue, bookingValue, match, similarity, note);
	}
}
