package my.termsheetrecon.app.service;

import my.termsheetrecon.app.booking.BookingDataLoader;
import my.termsheetrecon.app.booking.BookingSummary;
import my.termsheetrecon.app.domain.BookingRecord;
import my.termsheetrecon.app.domain.ReconciliationResult;
import my.termsheetrecon.app.domain.TermSheetData;
import my.termsheetrecon.app.extraction.PdfExtractionResult;
import my.termsheetrecon.app.extraction.TermSheetPdfExtractor;
import my.termsheetrecon.app.llm.LlmRequestException;
import my.termsheetrecon.app.llm.TermSheetExtractionException;
import my.termsheetrecon.app.reconcile.ReconciliationEngine;
import my.termsheetrecon.app.report.ReconciliationReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Runs the full pipeline for one term sheet PDF and one booking export: text extraction, LLM
 * structuring, booking load, reconciliation and report generation.
 */
public class ReconciliationWorkflowService {
	private static final Logger logger = LoggerFactory.getLogger(ReconciliationWorkflowService.class);

	private final TermSheetPdfExtractor pdfExtractor;
	private final TermSheetExtractionService extractionService;
	private final BookingDataLoader bookingDataLoader;
	private final ReconciliationEngine engine;
	private final ReconciliationReportWriter reportWriter;
	private final boolean saveExtractedText;

	public ReconciliationWorkflowService(TermSheetPdfExtractor pdfExtractor,
										 TermSheetExtractionService extractionService,
										 BookingDataLoader bookingDataLoader,
										 ReconciliationEngine engine,
										 ReconciliationReportWriter reportWriter,
										 boolean saveExtractedText) {
		this.pdfExtractor = pdfExtractor;
		this.extractionService = extractionService;
		this.bookingDataLoader = bookingDataLoader;
		this.engine = engine;
		this.reportWriter = reportWriter;
		this.saveExtractedText = saveExtractedText;
	}

	public ReconciliationRun run(Path termSheetPdf, Path bookingFile) {
		if (termSheetPdf == null || !Files.isRegularFile(termSheetPdf)) {
			throw new ReconciliationRunException("Term sheet file not found: " + termSheetPdf);
		}
		if (bookingFile == null || !Files.isRegularFile(bookingFile)) {
			throw new ReconciliationRunException("Booking file not found: " + bookingFile);
		}
		if (!extractionService.isAvailable()) {
			throw new ReconciliationRunException("LLM extraction is disabled; set app.llm.provider=openai");
		}

		logger.info("Step 1: extracting text from {}", termSheetPdf.getFileName());
		PdfExtractionResult pdf = pdfExtractor.extract(termSheetPdf);
		if (!pdf.success()) {
			throw new ReconciliationRunException("PDF extraction failed: " + pdf.error());
		}
		logger.info("Extracted {} characters from {} pages", pdf.textLength(), pdf.pageCount());
		String pdfStem = stem(termSheetPdf);
		Path textFile = saveExtractedText ? writeExtractedText(pdf.text(), pdfStem) : null;

		logger.info("Step 2: structuring term sheet data with LLM");
		TermSheetData termSheet;
		try {
			termSheet = extractionService.extract(pdf.text(), pdf.filename());
		} catch (TermSheetExtractionException | LlmRequestException exc) {
			throw new ReconciliationRunException("LLM extraction failed: " + exc.getMessage(), exc);
		}
		double confidence = extractionService.validateExtraction(termSheet, pdf.text());
		logger.info("Extraction confidence: {}", String.format(Locale.ROOT, "%.1f%%", confidence * 100.0d));

		logger.info("Step 3: loading booking data from {}", bookingFile.getFileName());
		List<BookingRecord> bookings;
		try {
			bookings = bookingDataLoader.load(bookingFile);
		} catch (IllegalArgumentException exc) {
			throw new ReconciliationRunException("Failed to load booking data: " + exc.getMessage(), exc);
		}
		if (bookings.isEmpty()) {
			throw new ReconciliationRunException("No booking records found in " + bookingFile.getFileName());
		}
		BookingSummary summary = bookingDataLoader.summarize(bookings);
		logger.info("Loaded {} booking records ({} unique ISINs)", summary.totalRecords(), summary.uniqueIsins().size());

		logger.info("Step 4: reconciling term sheet against booking records");
		List<ReconciliationResult> results = engine.reconcile(termSheet, bookings);
		if (results.isEmpty()) {
			throw new ReconciliationRunException("No reconciliation results produced for " + termSheetPdf.getFileName());
		}

		logger.info("Step 5: generating reports");
		String reportName = "reconciliation_" + pdfStem + "_" + stem(bookingFile);
		Path csv = reportWriter.writeCsv(results, reportName);
		Path markdown = reportWriter.writeMarkdown(results,
				termSheetPdf.getFileName().toString(),
				bookingFile.getFileName().toString(),
				reportName);
		return new ReconciliationRun(termSheet, confidence, summary, results, textFile, csv, markdown);
	}

	private Path writeExtractedText(String text, String pdfStem) {
		Path target = reportWriter.getOutputDir().resolve(pdfStem + "_extracted_text.txt");
		try {
			Files.createDirectories(reportWriter.getOutputDir());
			Files.writeString(target, text == null ? "" : text, StandardCharsets.UTF_8);
		} catch (IOException exc) {
			logger.error("Failed to save extracted text to {}: {}", target, exc.getMessage());
			throw new UncheckedIOException("Failed to save extracted text " + target, exc);
		}
		logger.info("Saved extracted text to {}", target);
		return target;
	}

	static String stem(Path file) {
		String name = file.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}
}
