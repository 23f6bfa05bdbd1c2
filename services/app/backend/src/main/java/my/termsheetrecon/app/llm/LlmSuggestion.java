package my.termsheetrecon.app.llm;

public record LlmSuggestion(
		String suggestion,
		String rationale
) {
	public boolean isEmpty() {
		return suggestion == null || suggestion.isBlank();
	}
}
