package my.termsheetrecon.app.llm;

public interface LlmClient {
	/**
	 * Sends a term sheet extraction prompt and returns the raw model output. The suggestion is empty
	 * when the provider produced nothing usable; the rationale then says why.
	 */
	LlmSuggestion extractTermSheetFields(String prompt);

	default boolean isEnabled() {
		return true;
	}
}
