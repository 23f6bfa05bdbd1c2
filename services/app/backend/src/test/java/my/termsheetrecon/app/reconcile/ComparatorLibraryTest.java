package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.FieldComparison;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ComparatorLibraryTest {
	private final ComparatorLibrary library = new ComparatorLibrary(0.001d, 0);

	@Test
	void bothAbsentMatches() {
		FieldComparison comparison = library.compare("coupon_rate", null, null);

		assertThat(comparison.match()).isTrue();
		assertThat(comparison.similarity()).isEqualTo(1.0d);
		assertThat(comparison.note()).isEqualTo("both absent");
	}

	@Test
	void oneAbsentIsMismatchForEveryType() {
		for (String field : new String[]{"coupon_rate", "maturity_date", "isin", "issuer"}) {
			FieldComparison left = library.compare(field, "x", null);
			FieldComparison right = library.compare(field, null, "x");

			assertThat(left.match()).isFalse();
			assertThat(left.similarity()).isZero();
			assertThat(left.note()).isEqualTo("one value missing");
			assertThat(right.match()).isFalse();
			assertThat(right.note()).isEqualTo("one value missing");
		}
	}

	@Test
	void numericDriftWithinTolerance() {
		FieldComparison comparison = library.compare("coupon_rate", new BigDecimal("5.001"), 5.0d);

		assertThat(comparison.match()).isTrue();
		assertThat(comparison.similarity()).isCloseTo(0.9998d, within(1e-9));
		assertThat(comparison.note()).isNull();
	}

	@Test
	void numericDriftBeyondTolerance() {
		FieldComparison comparison = library.compare("coupon_rate", new BigDecimal("5.1"), 5.0d);

		assertThat(comparison.match()).isFalse();
		assertThat(comparison.similarity()).isCloseTo(0.98d, within(1e-9));
		assertThat(comparison.note()).isEqualTo("Difference: 0.1000");
	}

	@Test
	void numericAcceptsNumericStrings() {
		assertThat(library.compare("issue_amount", "1000000", "1000000.0").match()).isTrue();
		assertThat(library.compare("face_value", 100L, " 100 ").match()).isTrue();
	}

	@Test
	void numericUsesAbsoluteDifferenceWhenBookingIsZero() {
		FieldComparison close = library.compare("face_value", 0.0005d, 0);
		FieldComparison far = library.compare("face_value", 2.0d, 0);

		assertThat(close.match()).isTrue();
		assertThat(far.match()).isFalse();
		assertThat(far.similarity()).isZero();
		assertThat(far.note()).isEqualTo("Difference: 2.0000");
	}

	@Test
	void numericZeroTermSheetAgainstNonZeroBookingIsRelativeMismatch() {
		FieldComparison comparison = library.compare("coupon_rate", BigDecimal.ZERO, 5.0d);

		assertThat(comparison.match()).isFalse();
		assertThat(comparison.similarity()).isZero();
		assertThat(comparison.note()).isEqualTo("Difference: 5.0000");
	}

	@Test
	void numericFallsBackToExactWhenUnparseable() {
		FieldComparison same = library.compare("coupon_rate", "floating", "floating");
		FieldComparison different = library.compare("coupon_rate", "floating", "5.0");

		assertThat(same.match()).isTrue();
		assertThat(same.similarity()).isEqualTo(1.0d);
		assertThat(different.match()).isFalse();
		assertThat(different.note()).isEqualTo("Exact values don't match");
	}

	@Test
	void numericSimilarityDecreasesWithDifference() {
		double near = library.compare("issue_amount", 101.0d, 100.0d).similarity();
		double far = library.compare("issue_amount", 150.0d, 100.0d).similarity();
		double beyond = library.compare("issue_amount", 350.0d, 100.0d).similarity();

		assertThat(near).isGreaterThan(far);
		assertThat(far).isGreaterThan(beyond);
		assertThat(beyond).isZero();
	}

	@Test
	void datesInDifferentLayoutsMatch() {
		FieldComparison comparison = library.compare("maturity_date", "2030-01-15", "15/01/2030");

		assertThat(comparison.match()).isTrue();
		assertThat(comparison.similarity()).isEqualTo(1.0d);
	}

	@Test
	void dateMismatchReportsDayDelta() {
		FieldComparison comparison = library.compare("issue_date", "2025-01-01", "2025-01-31");

		assertThat(comparison.match()).isFalse();
		assertThat(comparison.similarity()).isCloseTo(1.0d - 30.0d / 365.0d, within(1e-9));
		assertThat(comparison.note()).isEqualTo("Date difference: 30 days (2025-01-01 vs 2025-01-31)");
	}

	@Test
	void dateToleranceIsConfigurable() {
		ComparatorLibrary lenient = new ComparatorLibrary(0.001d, 5);

		assertThat(lenient.compare("issue_date", "2025-01-01", "2025-01-04").match()).isTrue();
		assertThat(lenient.compare("issue_date", "2025-01-01", "2025-01-07").match()).isFalse();
	}

	@Test
	void dateSimilarityFloorsAtZero() {
		FieldComparison comparison = library.compare("maturity_date", "2020-01-01", "2030-01-01");

		assertThat(comparison.similarity()).isZero();
	}

	@Test
	void unparseableDatesFallBackToExact() {
		FieldComparison same = library.compare("maturity_date", "not-a-date", "not-a-date");
		FieldComparison perpetual = library.compare("maturity_date", "Perpetual", "2030-01-01");

		assertThat(same.match()).isTrue();
		assertThat(same.note()).isNull();
		assertThat(perpetual.match()).isFalse();
		assertThat(perpetual.note()).isEqualTo("Exact values don't match");
	}

	@Test
	void exactComparisonTrimsButKeepsCase() {
		assertThat(library.compare("currency", " USD ", "USD").match()).isTrue();
		FieldComparison caseMismatch = library.compare("isin", "us123", "US123");

		assertThat(caseMismatch.match()).isFalse();
		assertThat(caseMismatch.similarity()).isZero();
	}

	@Test
	void issuerSubstringIsPartialMatch() {
		FieldComparison comparison = library.compare("issuer", "Genel Energy PLC", "Genel Energy");

		assertThat(comparison.match()).isTrue();
		assertThat(comparison.similarity()).isEqualTo(0.9d);
		assertThat(comparison.note()).isEqualTo("partial text match");
	}

	@Test
	void textIgnoresCaseAndSurroundingWhitespace() {
		FieldComparison comparison = library.compare("payment_frequency", "  Semi-Annual", "semi-annual ");

		assertThat(comparison.match()).isTrue();
		assertThat(comparison.similarity()).isEqualTo(1.0d);
		assertThat(comparison.note()).isNull();
	}

	@Test
	void unrelatedTextDoesNotMatch() {
		FieldComparison comparison = library.compare("seniority", "Senior", "Subordinated");

		assertThat(comparison.match()).isFalse();
		assertThat(comparison.similarity()).isZero();
		assertThat(comparison.note()).isEqualTo("Text doesn't match");
	}

	@Test
	void unknownFieldsUseTextComparison() {
		assertThat(FieldType.forField("notional_amount")).isEqualTo(FieldType.TEXT);
		assertThat(FieldType.forField("settlement_date")).isEqualTo(FieldType.TEXT);
		assertThat(library.compare("custom_field", "ABC", "abc").match()).isTrue();
	}
}
