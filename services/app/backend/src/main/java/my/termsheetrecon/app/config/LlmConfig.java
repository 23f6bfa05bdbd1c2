package my.termsheetrecon.app.config;

import my.termsheetrecon.app.llm.LlmClient;
import my.termsheetrecon.app.llm.NoopLlmClient;
import my.termsheetrecon.app.llm.OpenAiLlmClient;
import my.termsheetrecon.app.service.TermSheetExtractionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);
	static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
	static final String DEFAULT_MODEL = "gpt-4o";
	static final int DEFAULT_MAX_DOCUMENT_CHARS = 12000;

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openai")
	public OpenAiLlmClient openAiLlmClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = properties.llm() == null ? null : properties.llm().openai();
		String apiKey = openai == null ? null : openai.apiKey();
		if (apiKey == null || apiKey.isBlank()) {
			throw new IllegalStateException("app.llm.openai.api-key must be set when app.llm.provider=openai");
		}
		String baseUrl = openai.baseUrl();
		if (baseUrl == null || baseUrl.isBlank()) {
			baseUrl = DEFAULT_BASE_URL;
		}
		String model = openai.model();
		if (model == null || model.isBlank()) {
			model = DEFAULT_MODEL;
		}
		int connectTimeout = openai.connectTimeoutSeconds() == null ? 30 : Math.max(1, openai.connectTimeoutSeconds());
		int readTimeout = openai.readTimeoutSeconds() == null ? 120 : Math.max(1, openai.readTimeoutSeconds());
		logger.info("LLM client enabled (provider=openai, model={}).", model);
		return new OpenAiLlmClient(baseUrl, apiKey, model,
				Duration.ofSeconds(connectTimeout),
				Duration.ofSeconds(readTimeout));
	}

	@Bean
	@ConditionalOnMissingBean(LlmClient.class)
	public NoopLlmClient noopLlmClient() {
		logger.info("LLM client disabled (provider=noop).");
		return new NoopLlmClient();
	}

	@Bean
	public TermSheetExtractionService termSheetExtractionService(LlmClient llmClient,
																 ObjectMapper objectMapper,
																 AppProperties properties) {
		Integer maxChars = properties.llm() == null ? null : properties.llm().maxDocumentChars();
		return new TermSheetExtractionService(llmClient, objectMapper,
				maxChars == null || maxChars <= 0 ? DEFAULT_MAX_DOCUMENT_CHARS : maxChars);
	}
}
