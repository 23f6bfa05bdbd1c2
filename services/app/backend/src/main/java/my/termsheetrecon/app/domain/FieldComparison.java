package my.termsheetrecon.app.domain;

public record FieldComparison(
		String fieldName,
		Object termSheetValue,
		Object bookingValue,
		boolean match,
		double similarity,
		String note
) {
}
