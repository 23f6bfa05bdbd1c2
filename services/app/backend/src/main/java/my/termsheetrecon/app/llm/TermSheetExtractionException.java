package my.termsheetrecon.app.llm;

public class TermSheetExtractionException extends RuntimeException {
	public TermSheetExtractionException(String message) {
		super(message);
	}

	public TermSheetExtractionException(String message, Throwable cause) {
		super(message, cause);
	}
}
