package my.termsheetrecon.app.util;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

public final class CsvParsing {
	private static final Pattern DECIMAL_COMMA_NUMBER = Pattern.compile("-?(\\d{1,3}(\\.\\d{3})+|\\d+),\\d+");

	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Looks at the header line only; semicolon wins when it is present, since booking exports with
	 * decimal commas use it as the separator.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int lineEnd = sample.indexOf('\n');
		String header = lineEnd < 0 ? sample : sample.substring(0, lineEnd);
		return header.indexOf(';') >= 0 ? ';' : ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	/**
	 * Rewrites a number written with a decimal comma (and optional dot grouping) to plain decimal
	 * notation, e.g. {@code 1.234,56 -> 1234.56}. Anything else is returned unchanged.
	 */
	public static String normalizeDecimalComma(String value) {
		if (value == null || !DECIMAL_COMMA_NUMBER.matcher(value).matches()) {
			return value;
		}
		return value.replace(".", "").replace(",", ".");
	}

	public static String blankToNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}
}
