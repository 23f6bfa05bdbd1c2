package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.CanonicalFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable engine configuration.
 *
 * @param numericTolerance  maximum relative difference (absolute when the booking value is zero)
 *                          for numeric fields to match; default {@value #DEFAULT_NUMERIC_TOLERANCE}
 * @param dateToleranceDays maximum day difference for date fields to match; default 0
 * @param fieldSynonyms     canonical field to booking attribute names in priority order; the map's
 *                          iteration order is the order in which fields are compared
 */
public record ReconciliationSettings(
		double numericTolerance,
		int dateToleranceDays,
		Map<String, List<String>> fieldSynonyms
) {
	public static final double DEFAULT_NUMERIC_TOLERANCE = 0.001d;
	public static final int DEFAULT_DATE_TOLERANCE_DAYS = 0;

	public ReconciliationSettings {
		if (Double.isNaN(numericTolerance) || numericTolerance < 0) {
			throw new IllegalArgumentException("numericTolerance must be >= 0: " + numericTolerance);
		}
		if (dateToleranceDays < 0) {
			throw new IllegalArgumentException("dateToleranceDays must be >= 0: " + dateToleranceDays);
		}
		Map<String, List<String>> copy = new LinkedHashMap<>();
		if (fieldSynonyms != null) {
			fieldSynonyms.forEach((field, synonyms) -> {
				if (field == null || field.isBlank()) {
					throw new IllegalArgumentException("Canonical field name must not be blank");
				}
				copy.put(field, synonyms == null ? List.of() : List.copyOf(synonyms));
			});
		}
		fieldSynonyms = Collections.unmodifiableMap(copy);
	}

	public static ReconciliationSettings defaults() {
		return new ReconciliationSettings(DEFAULT_NUMERIC_TOLERANCE, DEFAULT_DATE_TOLERANCE_DAYS, defaultFieldSynonyms());
	}

	public List<String> fieldOrder() {
		return new ArrayList<>(fieldSynonyms.keySet());
	}

	public ReconciliationSettings withNumericTolerance(double tolerance) {
		return new ReconciliationSettings(tolerance, dateToleranceDays, fieldSynonyms);
	}

	public ReconciliationSettings withDateToleranceDays(int days) {
		return new ReconciliationSettings(numericTolerance, days, fieldSynonyms);
	}

	public ReconciliationSettings withFieldSynonyms(Map<String, List<String>> synonyms) {
		return new ReconciliationSettings(numericTolerance, dateToleranceDays, synonyms);
	}

	public static Map<String, List<String>> defaultFieldSynonyms() {
		Map<String, List<String>> synonyms = new LinkedHashMap<>();
		synonyms.put(CanonicalFields.ISIN, List.of("ISIN", "isin", "Isin"));
		synonyms.put(CanonicalFields.ISSUER, List.of("Issuer", "issuer", "IssuerName", "IssuingEntity"));
		synonyms.put(CanonicalFields.ISSUE_AMOUNT, List.of("IssueAmount", "IssueSize", "TotalAmount", "issue_amount"));
		synonyms.put(CanonicalFields.FACE_VALUE,
				List.of("NominalAmountPerBond", "FaceValue", "Denomination", "ParValue", "face_value"));
		synonyms.put(CanonicalFields.NOTIONAL_AMOUNT,
				List.of("Notional", "NotionalAmount", "TotalNotional", "notional_amount"));
		synonyms.put(CanonicalFields.COUPON_RATE, List.of("Coupon", "CouponRate", "InterestRate", "Rate", "coupon_rate"));
		synonyms.put(CanonicalFields.CURRENCY, List.of("Currency", "currency", "Ccy"));
		synonyms.put(CanonicalFields.ISSUE_DATE, List.of("IssueDate", "issue_date", "IssuanceDate"));
		synonyms.put(CanonicalFields.MATURITY_DATE, List.of("Maturity", "MaturityDate", "maturity_date"));
		synonyms.put(CanonicalFields.SETTLEMENT_DATE, List.of("SettlementDate", "settlement_date", "SettleDate"));
		synonyms.put(CanonicalFields.PAYMENT_FREQUENCY,
				List.of("InterestPaymentFrequency", "PaymentFrequency", "Frequency", "payment_frequency"));
		synonyms.put(CanonicalFields.DAY_COUNT_CONVENTION,
				List.of("DayCountFraction", "DayCount", "DayCountConvention", "day_count_convention"));
		synonyms.put(CanonicalFields.SECURITY_TYPE, List.of("SecurityType", "security_type"));
		synonyms.put(CanonicalFields.SENIORITY, List.of("Seniority", "seniority"));
		synonyms.put(CanonicalFields.TENOR, List.of("Tenor", "tenor"));
		return synonyms;
	}
}
