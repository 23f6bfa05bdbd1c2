package my.termsheetrecon.app.llm;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class OpenAiLlmClient implements LlmClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);
	static final String SYSTEM_PROMPT = "You are a financial document analyst specializing in bond term sheets. "
			+ "Extract information accurately and return valid JSON only. "
			+ "Be flexible in recognizing field names and their synonyms.";
	static final int MAX_TOKENS = 1500;

	private final RestClient restClient;
	private final String model;

	public OpenAiLlmClient(String baseUrl, String apiKey, String model) {
		this(baseUrl, apiKey, model, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public OpenAiLlmClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.model = model;
	}

	@Override
	public LlmSuggestion extractTermSheetFields(String prompt) {
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("messages", List.of(
				Map.of("role", "system", "content", SYSTEM_PROMPT),
				Map.of("role", "user", "content", prompt == null ? "" : prompt)
		));
		request.put("temperature", 0.0d);
		request.put("max_tokens", MAX_TOKENS);
		return callChatCompletions(request);
	}

	private LlmSuggestion callChatCompletions(Map<String, Object> request) {
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/chat/completions").body(request).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new LlmRequestException(safeMessage(ex), ex.getStatusCode().value(), isRetryable(ex), ex);
		} catch (ResourceAccessException ex) {
			throw new LlmRequestException(safeMessage(ex), null, true, ex);
		}
		if (response == null || response.get("choices") == null) {
			return new LlmSuggestion("", "No response");
		}
		Object choices = response.get("choices");
		if (!(choices instanceof List<?> list) || list.isEmpty()) {
			return new LlmSuggestion("", "No choices");
		}
		Object first = list.get(0);
		if (!(first instanceof Map<?, ?> map)) {
			return new LlmSuggestion("", "Invalid response");
		}
		Object message = map.get("message");
		if (!(message instanceof Map<?, ?> msgMap)) {
			return new LlmSuggestion("", "Invalid message");
		}
		Object content = msgMap.get("content");
		return new LlmSuggestion(content == null ? "" : content.toString(), "openai(model=" + model + ")");
	}

	private boolean isRetryable(RestClientResponseException ex) {
		int status = ex.getStatusCode().value();
		return status == 408 || status == 429 || status >= 500;
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			return ex.getClass().getSimpleName();
		}
		return message.length() > 500 ? message.substring(0, 500) : message;
	}
}
