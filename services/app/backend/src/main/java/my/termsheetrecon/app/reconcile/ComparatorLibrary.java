package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.FieldComparison;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the comparator for a canonical field by its {@link FieldType}. Missing values are handled
 * here, before any comparator sees them.
 */
public class ComparatorLibrary {
	static final String BOTH_ABSENT_NOTE = "both absent";
	static final String ONE_MISSING_NOTE = "one value missing";

	private final Map<FieldType, FieldComparator> comparators;

	public ComparatorLibrary(double numericTolerance, int dateToleranceDays) {
		ExactComparator exact = new ExactComparator();
		this.comparators = new EnumMap<>(FieldType.class);
		comparators.put(FieldType.EXACT, exact);
		comparators.put(FieldType.NUMERIC, new NumericComparator(numericTolerance, exact));
		comparators.put(FieldType.DATE, new DateComparator(dateToleranceDays, exact));
		comparators.put(FieldType.TEXT, new TextComparator());
	}

	public FieldComparison compare(String fieldName, Object termSheetValue, Object bookingValue) {
		if (termSheetValue == null && bookingValue == null) {
			return new FieldComparison(fieldName, null, null, true, 1.0d, BOTH_ABSENT_NOTE);
		}
		if (termSheetValue == null || bookingValue == null) {
			return new FieldComparison(fieldName, termSheetValue, bookingValue, false, 0.0d, ONE_MISSING_NOTE);
		}
		return comparators.get(FieldType.forField(fieldName)).compare(fieldName, termSheetValue, bookingValue);
	}
}
