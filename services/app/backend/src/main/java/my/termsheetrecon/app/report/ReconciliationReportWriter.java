package my.termsheetrecon.app.report;

import my.termsheetrecon.app.domain.FieldComparison;
import my.termsheetrecon.app.domain.ReconciliationResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Renders reconciliation results as CSV and Markdown files and as a plain-text console summary.
 */
public class ReconciliationReportWriter {
	private static final Logger logger = LoggerFactory.getLogger(ReconciliationReportWriter.class);
	static final String[] CSV_HEADER = {
			"Trade_ID",
			"Overall_Match",
			"Match_Percentage",
			"Field_Name",
			"Term_Sheet_Value",
			"Booking_Value",
			"Field_Match",
			"Similarity",
			"Notes"
	};

	private final Path outputDir;

	public ReconciliationReportWriter(Path outputDir) {
		this.outputDir = outputDir;
	}

	public Path getOutputDir() {
		return outputDir;
	}

	public Path writeCsv(List<ReconciliationResult> results, String baseName) {
		Path csvPath = resolve(baseName, ".csv");
		try (Writer writer = Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8);
			 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.withHeader(CSV_HEADER))) {
			for (ReconciliationResult result : safe(results)) {
				for (FieldComparison comparison : result.comparisons()) {
					printer.printRecord(
							result.tradeId() == null ? "" : result.tradeId(),
							yesNo(result.overallMatch()),
							percent(result.matchPercentage()),
							comparison.fieldName(),
							valueOr(comparison.termSheetValue(), ""),
							valueOr(comparison.bookingValue(), ""),
							yesNo(comparison.match()),
							String.format(Locale.ROOT, "%.3f", comparison.similarity()),
							comparison.note() == null ? "" : comparison.note()
					);
				}
			}
		} catch (IOException exc) {
			logger.error("Error generating CSV report {}: {}", csvPath, exc.getMessage());
			throw new UncheckedIOException("Failed to write CSV report " + csvPath, exc);
		}
		logger.info("Generated CSV report: {}", csvPath);
		return csvPath;
	}

	public Path writeMarkdown(List<ReconciliationResult> results,
							  String termSheetFile,
							  String bookingFile,
							  String baseName) {
		Path mdPath = resolve(baseName, ".md");
		try {
			Files.writeString(mdPath, renderMarkdown(results, termSheetFile, bookingFile), StandardCharsets.UTF_8);
		} catch (IOException exc) {
			logger.error("Error generating Markdown report {}: {}", mdPath, exc.getMessage());
			throw new UncheckedIOException("Failed to write Markdown report " + mdPath, exc);
		}
		logger.info("Generated Markdown report: {}", mdPath);
		return mdPath;
	}

	public String renderMarkdown(List<ReconciliationResult> results, String termSheetFile, String bookingFile) {
		List<ReconciliationResult> rows = safe(results);
		StringBuilder md = new StringBuilder();
		md.append("# Term Sheet Reconciliation Report\n\n");
		if (termSheetFile != null && !termSheetFile.isBlank()) {
			md.append("**Term Sheet:** ").append(termSheetFile).append('\n');
		}
		if (bookingFile != null && !bookingFile.isBlank()) {
			md.append("**Booking Data:** ").append(bookingFile).append('\n');
		}
		md.append("**Total Trades:** ").append(rows.size()).append("\n\n");

		long perfect = rows.stream().filter(ReconciliationResult::overallMatch).count();
		md.append("## Summary\n\n");
		md.append("- **Perfect Matches:** ").append(perfect).append('/').append(rows.size()).append('\n');
		md.append("- **Success Rate:** ").append(successRate(perfect, rows.size())).append("\n\n");

		md.append("## Trade Results\n\n");
		for (ReconciliationResult result : rows) {
			md.append("### Trade ").append(tradeLabel(result)).append(' ')
					.append(result.overallMatch() ? "✅" : "❌").append("\n\n");
			md.append(result.summary()).append("\n\n");
			md.append("| Field | Term Sheet | Booking System | Match | Notes |\n");
			md.append("|-------|------------|----------------|-------|-------|\n");
			for (FieldComparison comparison : result.comparisons()) {
				md.append("| ").append(comparison.fieldName())
						.append(" | ").append(cell(valueOr(comparison.termSheetValue(), "N/A")))
						.append(" | ").append(cell(valueOr(comparison.bookingValue(), "N/A")))
						.append(" | ").append(comparison.match() ? "✅" : "❌")
						.append(" | ").append(cell(comparison.note() == null ? "" : comparison.note()))
						.append(" |\n");
			}
			md.append('\n');
		}
		return md.toString();
	}

	public String renderConsoleSummary(List<ReconciliationResult> results) {
		List<ReconciliationResult> rows = safe(results);
		if (rows.isEmpty()) {
			return "No reconciliation results to display";
		}
		long perfect = rows.stream().filter(ReconciliationResult::overallMatch).count();
		String rule = "=".repeat(60);
		StringBuilder out = new StringBuilder();
		out.append(rule).append('\n');
		out.append("RECONCILIATION SUMMARY\n");
		out.append(rule).append('\n');
		out.append("Total Trades: ").append(rows.size()).append('\n');
		out.append("Perfect Matches: ").append(perfect).append('\n');
		out.append("Success Rate: ").append(successRate(perfect, rows.size())).append('\n');
		out.append('\n').append("Trade Details:\n");
		for (ReconciliationResult result : rows) {
			out.append("  ").append(result.overallMatch() ? "✅" : "❌")
					.append(" Trade ").append(tradeLabel(result)).append(": ")
					.append(percent(result.matchPercentage())).append(" match\n");
			for (FieldComparison mismatch : result.mismatches()) {
				out.append("      ❌ ").append(mismatch.fieldName()).append(": ")
						.append(valueOr(mismatch.termSheetValue(), "N/A")).append(" ≠ ")
						.append(valueOr(mismatch.bookingValue(), "N/A")).append('\n');
			}
		}
		out.append(rule);
		return out.toString();
	}

	private Path resolve(String baseName, String suffix) {
		String name = baseName == null || baseName.isBlank() ? "reconciliation_report" : baseName;
		try {
			Files.createDirectories(outputDir);
		} catch (IOException exc) {
			throw new UncheckedIOException("Failed to create output directory " + outputDir, exc);
		}
		return outputDir.resolve(name + suffix);
	}

	private static List<ReconciliationResult> safe(List<ReconciliationResult> results) {
		return results == null ? List.of() : results;
	}

	private static String tradeLabel(ReconciliationResult result) {
		return result.tradeId() == null ? "N/A" : result.tradeId().toString();
	}

	private static String yesNo(boolean flag) {
		return flag ? "YES" : "NO";
	}

	private static String percent(double value) {
		return String.format(Locale.ROOT, "%.1f%%", value);
	}

	private static String successRate(long perfect, int total) {
		return percent(total == 0 ? 0.0d : perfect * 100.0d / total);
	}

	private static String valueOr(Object value, String fallback) {
		if (value == null) {
			return fallback;
		}
		if (value instanceof BigDecimal decimal) {
			return decimal.toPlainString();
		}
		String text = value.toString();
		return text.isEmpty() ? fallback : text;
	}

	private static String cell(String text) {
		return text.replace("|", "\\|").replace("\n", " ");
	}
}
