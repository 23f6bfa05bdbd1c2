package my.termsheetrecon.app.extraction;

public record PdfExtractionResult(
		boolean success,
		String filename,
		String text,
		int pageCount,
		String error
) {
	public static PdfExtractionResult failed(String filename, String error) {
		return new PdfExtractionResult(false, filename, "", 0, error);
	}

	public int textLength() {
		return text == null ? 0 : text.length();
	}
}
