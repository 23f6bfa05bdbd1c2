package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.FieldComparison;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

public class DateComparator implements FieldComparator {
	private static final double DECAY_HORIZON_DAYS = 365.0d;

	private final int toleranceDays;
	private final FieldComparator fallback;

	public DateComparator(int toleranceDays, FieldComparator fallback) {
		this.toleranceDays = toleranceDays;
		this.fallback = fallback;
	}

	@Override
	public FieldComparison compare(String fieldName, Object termSheetValue, Object bookingValue) {
		Optional<LocalDate> termSheetDate = DateParsing.parse(FieldValues.asText(termSheetValue));
		Optional<LocalDate> bookingDate = DateParsing.parse(FieldValues.asText(bookingValue));
		if (termSheetDate.isEmpty() || bookingDate.isEmpty()) {
			return fallback.compare(fieldName, termSheetValue, bookingValue);
		}
		long days = Math.abs(ChronoUnit.DAYS.between(termSheetDate.get(), bookingDate.get()));
		boolean match = days <= toleranceDays;
		double similarity = Math.max(0.0d, 1.0d - (days / DECAY_HORIZON_DAYS));
		String note = match
				? null
				: "Date difference: " + days + " days (" + FieldValues.asText(termSheetValue)
				+ " vs " + FieldValues.asText(bookingValue) + ")";
		return new FieldComparison(fieldName, termSheetValue, bookingValue, match, similarity, note);
	}
}
