package my.termsheetrecon.app.reconcile;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public final class DateParsing {
	private static final Pattern NON_DATE_CHARS = Pattern.compile("[^0-9\\-/.]");
	private static final List<DateTimeFormatter> PATTERNS = List.of(
			strict("uuuu-M-d"),
			strict("d-M-uuuu"),
			strict("M-d-uuuu"),
			strict("uuuu/M/d"),
			strict("d/M/uuuu"),
			strict("M/d/uuuu")
	);

	private DateParsing() {
	}

	/**
	 * Strips everything except digits and the separators {@code - / .}, then tries year-first,
	 * day-first and month-first layouts with {@code -} and then {@code /}. The first layout that
	 * yields a valid calendar date wins.
	 */
	public static Optional<LocalDate> parse(String raw) {
		if (raw == null) {
			return Optional.empty();
		}
		String cleaned = NON_DATE_CHARS.matcher(raw.trim()).replaceAll("");
		if (cleaned.isEmpty()) {
			return Optional.empty();
		}
		for (DateTimeFormatter formatter : PATTERNS) {
			try {
				return Optional.of(LocalDate.parse(cleaned, formatter));
			} catch (DateTimeParseException ignored) {
				// try next layout
			}
		}
		return Optional.empty();
	}

	private static DateTimeFormatter strict(String pattern) {
		return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
	}
}
