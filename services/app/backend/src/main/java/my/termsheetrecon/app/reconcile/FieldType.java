package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.CanonicalFields;

import java.util.Set;

public enum FieldType {
	NUMERIC,
	DATE,
	EXACT,
	TEXT;

	private static final Set<String> NUMERIC_FIELDS = Set.of(
			CanonicalFields.COUPON_RATE,
			CanonicalFields.FACE_VALUE,
			CanonicalFields.ISSUE_AMOUNT
	);
	private static final Set<String> DATE_FIELDS = Set.of(
			CanonicalFields.ISSUE_DATE,
			CanonicalFields.MATURITY_DATE
	);
	private static final Set<String> EXACT_FIELDS = Set.of(
			CanonicalFields.ISIN,
			CanonicalFields.CURRENCY
	);

	public static FieldType forField(String canonicalField) {
		if (canonicalField == null) {
			return TEXT;
		}
		if (NUMERIC_FIELDS.contains(canonicalField)) {
			return NUMERIC;
		}
		if (DATE_FIELDS.contains(canonicalField)) {
			return DATE;
		}
		if (EXACT_FIELDS.contains(canonicalField)) {
			return EXACT;
		}
		return TEXT;
	}
}
