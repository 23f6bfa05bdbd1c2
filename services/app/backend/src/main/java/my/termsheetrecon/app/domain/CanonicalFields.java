package my.termsheetrecon.app.domain;

import java.util.List;

public final class CanonicalFields {
	public static final String ISIN = "isin";
	public static final String ISSUER = "issuer";
	public static final String ISSUE_AMOUNT = "issue_amount";
	public static final String FACE_VALUE = "face_value";
	public static final String NOTIONAL_AMOUNT = "notional_amount";
	public static final String COUPON_RATE = "coupon_rate";
	public static final String CURRENCY = "currency";
	public static final String ISSUE_DATE = "issue_date";
	public static final String MATURITY_DATE = "maturity_date";
	public static final String SETTLEMENT_DATE = "settlement_date";
	public static final String PAYMENT_FREQUENCY = "payment_frequency";
	public static final String DAY_COUNT_CONVENTION = "day_count_convention";
	public static final String SECURITY_TYPE = "security_type";
	public static final String SENIORITY = "seniority";
	public static final String TENOR = "tenor";

	public static final List<String> ALL = List.of(
			ISIN,
			ISSUER,
			ISSUE_AMOUNT,
			FACE_VALUE,
			NOTIONAL_AMOUNT,
			COUPON_RATE,
			CURRENCY,
			ISSUE_DATE,
			MATURITY_DATE,
			SETTLEMENT_DATE,
			PAYMENT_FREQUENCY,
			DAY_COUNT_CONVENTION,
			SECURITY_TYPE,
			SENIORITY,
			TENOR
	);

	private CanonicalFields() {
	}
}
