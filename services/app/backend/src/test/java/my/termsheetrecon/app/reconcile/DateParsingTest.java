package my.termsheetrecon.app.reconcile;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DateParsingTest {
	@Test
	void parsesIsoDates() {
		assertThat(DateParsing.parse("2030-01-15")).contains(LocalDate.of(2030, 1, 15));
		assertThat(DateParsing.parse("2030/1/5")).contains(LocalDate.of(2030, 1, 5));
	}

	@Test
	void dayFirstWinsOverMonthFirst() {
		assertThat(DateParsing.parse("05-03-2025")).contains(LocalDate.of(2025, 3, 5));
		assertThat(DateParsing.parse("05/03/2025")).contains(LocalDate.of(2025, 3, 5));
	}

	@Test
	void monthFirstUsedWhenDayFirstIsInvalid() {
		assertThat(DateParsing.parse("12-31-2025")).contains(LocalDate.of(2025, 12, 31));
		assertThat(DateParsing.parse("02/28/2026")).contains(LocalDate.of(2026, 2, 28));
	}

	@Test
	void stripsSurroundingText() {
		assertThat(DateParsing.parse("Maturity: 2030-01-15 ")).contains(LocalDate.of(2030, 1, 15));
	}

	@Test
	void rejectsImpossibleAndUnsupportedValues() {
		assertThat(DateParsing.parse("2025-02-30")).isEmpty();
		assertThat(DateParsing.parse("15 January 2030")).isEmpty();
		assertThat(DateParsing.parse("2030.01.15")).isEmpty();
		assertThat(DateParsing.parse("Perpetual")).isEmpty();
		assertThat(DateParsing.parse(null)).isEmpty();
	}
}
