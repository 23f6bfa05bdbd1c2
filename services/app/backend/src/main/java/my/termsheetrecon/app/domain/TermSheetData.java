package my.termsheetrecon.app.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Term sheet terms as extracted from a document. Every component is optional; {@code null} means
 * the term was not found, which is different from an empty string or zero.
 */
public record TermSheetData(
		String isin,
		String issuer,
		BigDecimal issueAmount,
		BigDecimal faceValue,
		BigDecimal notionalAmount,
		BigDecimal couponRate,
		String currency,
		String issueDate,
		String maturityDate,
		String settlementDate,
		String paymentFrequency,
		String dayCountConvention,
		String securityType,
		String seniority,
		String tenor
) implements AttributeSource {

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Canonical field name to value, in {@link CanonicalFields#ALL} order. Absent terms are present
	 * as keys with a {@code null} value.
	 */
	@Override
	public Map<String, Object> attributes() {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put(CanonicalFields.ISIN, isin);
		values.put(CanonicalFields.ISSUER, issuer);
		values.put(CanonicalFields.ISSUE_AMOUNT, issueAmount);
		values.put(CanonicalFields.FACE_VALUE, faceValue);
		values.put(CanonicalFields.NOTIONAL_AMOUNT, notionalAmount);
		values.put(CanonicalFields.COUPON_RATE, couponRate);
		values.put(CanonicalFields.CURRENCY, currency);
		values.put(CanonicalFields.ISSUE_DATE, issueDate);
		values.put(CanonicalFields.MATURITY_DATE, maturityDate);
		values.put(CanonicalFields.SETTLEMENT_DATE, settlementDate);
		values.put(CanonicalFields.PAYMENT_FREQUENCY, paymentFrequency);
		values.put(CanonicalFields.DAY_COUNT_CONVENTION, dayCountConvention);
		values.put(CanonicalFields.SECURITY_TYPE, securityType);
		values.put(CanonicalFields.SENIORITY, seniority);
		values.put(CanonicalFields.TENOR, tenor);
		return Collections.unmodifiableMap(values);
	}

	public boolean isEmpty() {
		return attributes().values().stream().allMatch(value -> value == null);
	}

	public static final class Builder {
		private String isin;
		private String issuer;
		private BigDecimal issueAmount;
		private BigDecimal faceValue;
		private BigDecimal notionalAmount;
		private BigDecimal couponRate;
		private String currency;
		private String issueDate;
		private String maturityDate;
		private String settlementDate;
		private String paymentFrequency;
		private String dayCountConvention;
		private String securityType;
		private String seniority;
		private String tenor;

		private Builder() {
		}

		public Builder isin(String isin) {
			this.isin = isin;
			return this;
		}

		public Builder issuer(String issuer) {
			this.issuer = issuer;
			return this;
		}

		public Builder issueAmount(BigDecimal issueAmount) {
			this.issueAmount = issueAmount;
			return this;
		}

		public Builder faceValue(BigDecimal faceValue) {
			this.faceValue = faceValue;
			return this;
		}

		public Builder notionalAmount(BigDecimal notionalAmount) {
			this.notionalAmount = notionalAmount;
			return this;
		}

		public Builder couponRate(BigDecimal couponRate) {
			this.couponRate = couponRate;
			return this;
		}

		public Builder currency(String currency) {
			this.currency = currency;
			return this;
		}

		public Builder issueDate(String issueDate) {
			this.issueDate = issueDate;
			return this;
		}

		public Builder maturityDate(String maturityDate) {
			this.maturityDate = maturityDate;
			return this;
		}

		public Builder settlementDate(String settlementDate) {
			this.settlementDate = settlementDate;
			return this;
		}

		public Builder paymentFrequency(String paymentFrequency) {
			this.paymentFrequency = paymentFrequency;
			return this;
		}

		public Builder dayCountConvention(String dayCountConvention) {
			this.dayCountConvention = dayCountConvention;
			return this;
		}

		public Builder securityType(String securityType) {
			this.securityType = securityType;
			return this;
		}

		public Builder seniority(String seniority) {
			this.seniority = seniority;
			return this;
		}

		public Builder tenor(String tenor) {
			this.tenor = tenor;
			return this;
		}

		public TermSheetData build() {
			return new TermSheetData(isin, issuer, issueAmount, faceValue, notionalAmount, couponRate, currency,
					issueDate, maturityDate, settlementDate, paymentFrequency, dayCountConvention, securityType,
					seniority, tenor);
		}
	}
}
