package my.termsheetrecon.app.reconcile;

import java.math.BigDecimal;
import java.util.Locale;

final class FieldValues {
	private FieldValues() {
	}

	static String asText(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof BigDecimal decimal) {
			return decimal.toPlainString();
		}
		return String.valueOf(value);
	}

	static String normalized(Object value) {
		String text = asText(value);
		return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
	}

	/**
	 * Parses a finite double from a number or numeric text; returns {@code null} when the value is
	 * not numeric.
	 */
	static Double toDouble(Object value) {
		if (value == null) {
			return null;
		}
		double parsed;
		if (value instanceof Number number) {
			parsed = number.doubleValue();
		} else {
			String raw = asText(value).trim();
			if (raw.isEmpty()) {
				return null;
			}
			try {
				parsed = new BigDecimal(raw).doubleValue();
			} catch (NumberFormatException ex) {
				return null;
			}
		}
		return Double.isFinite(parsed) ? parsed : null;
	}
}
