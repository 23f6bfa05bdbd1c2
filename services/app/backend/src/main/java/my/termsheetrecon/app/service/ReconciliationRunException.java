package my.termsheetrecon.app.service;

public class ReconciliationRunException extends RuntimeException {
	public ReconciliationRunException(String message) {
		super(message);
	}

	public ReconciliationRunException(String message, Throwable cause) {
		super(message, cause);
	}
}
