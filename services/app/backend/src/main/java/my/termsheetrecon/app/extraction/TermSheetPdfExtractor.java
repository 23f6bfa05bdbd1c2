package my.termsheetrecon.app.extraction;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the text layer of a term sheet PDF page by page. Failures are reported through
 * {@link PdfExtractionResult#error()} rather than thrown.
 */
public class TermSheetPdfExtractor {
	private static final Logger logger = LoggerFactory.getLogger(TermSheetPdfExtractor.class);

	public PdfExtractionResult extract(Path pdfPath) {
		String filename = pdfPath == null || pdfPath.getFileName() == null ? "" : pdfPath.getFileName().toString();
		byte[] payload;
		try {
			payload = Files.readAllBytes(pdfPath);
		} catch (IOException | RuntimeException exc) {
			logger.error("Error reading PDF {}: {}", pdfPath, exc.getMessage());
			return PdfExtractionResult.failed(filename, "Failed to read PDF: " + exc.getMessage());
		}
		return extract(payload, filename);
	}

	public PdfExtractionResult extract(byte[] payload, String filename) {
		if (payload == null || payload.length == 0) {
			return PdfExtractionResult.failed(filename, "Empty PDF payload");
		}
		try (PDDocument doc = PDDocument.load(payload)) {
			int pages = doc.getNumberOfPages();
			logger.info("Processing {} pages from {}", pages, filename);
			PDFTextStripper stripper = new PDFTextStripper();
			StringBuilder text = new StringBuilder();
			for (int page = 1; page <= pages; page++) {
				stripper.setStartPage(page);
				stripper.setEndPage(page);
				String pageText = stripper.getText(doc);
				text.append("\n\n--- PAGE ").append(page).append(" ---\n").append(pageText == null ? "" : pageText);
			}
			return new PdfExtractionResult(true, filename, text.toString().trim(), pages, null);
		} catch (IOException exc) {
			logger.error("Error extracting PDF {}: {}", filename, exc.getMessage());
			return PdfExtractionResult.failed(filename, "Failed to read PDF: " + exc.getMessage());
		}
	}
}
