package my.termsheetrecon.app.llm;

public class NoopLlmClient implements LlmClient {
	@Override
	public LlmSuggestion extractTermSheetFields(String prompt) {
		return new LlmSuggestion("", "LLM disabled");
	}

	@Override
	public boolean isEnabled() {
		return false;
	}
}
