package my.termsheetrecon.app.booking;

import java.util.List;

public record BookingSummary(
		int totalRecords,
		List<String> uniqueIsins,
		List<String> uniqueIssuers,
		List<String> currencies,
		String couponRange
) {
}
