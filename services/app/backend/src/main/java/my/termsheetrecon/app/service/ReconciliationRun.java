package my.termsheetrecon.app.service;

import my.termsheetrecon.app.booking.BookingSummary;
import my.termsheetrecon.app.domain.ReconciliationResult;
import my.termsheetrecon.app.domain.TermSheetData;

import java.nio.file.Path;
import java.util.List;

public record ReconciliationRun(
		TermSheetData termSheet,
		double extractionConfidence,
		BookingSummary bookingSummary,
		List<ReconciliationResult> results,
		Path extractedTextFile,
		Path csvReport,
		Path markdownReport
) {
	public ReconciliationRun {
		results = results == null ? List.of() : List.copyOf(results);
	}

	public long perfectMatches() {
		return results.stream().filter(ReconciliationResult::overallMatch).count();
	}
}
