package my.termsheetrecon.app.service;

import my.termsheetrecon.app.domain.TermSheetData;
import my.termsheetrecon.app.llm.LlmClient;
import my.termsheetrecon.app.llm.LlmSuggestion;
import my.termsheetrecon.app.llm.TermSheetExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns term sheet text into {@link TermSheetData} with the help of an LLM, and scores how well
 * the extracted values are backed by the source text.
 */
public class TermSheetExtractionService {
	private static final Logger logger = LoggerFactory.getLogger(TermSheetExtractionService.class);
	static final List<String> CATEGORY_KEYS = List.of(
			"IDENTIFIERS", "FINANCIAL TERMS", "DATES", "PAYMENT TERMS", "BOND CHARACTERISTICS");

	private final LlmClient llmClient;
	private final ObjectMapper objectMapper;
	private final int maxDocumentChars;

	public TermSheetExtractionService(LlmClient llmClient, ObjectMapper objectMapper, int maxDocumentChars) {
		this.llmClient = llmClient;
		this.objectMapper = objectMapper;
		this.maxDocumentChars = maxDocumentChars;
	}

	public boolean isAvailable() {
		return llmClient.isEnabled();
	}

	public TermSheetData extract(String text, String filename) {
		String prompt = buildPrompt(text, filename);
		logger.info("Sending text to LLM for extraction: {} characters", text == null ? 0 : text.length());
		LlmSuggestion suggestion = llmClient.extractTermSheetFields(prompt);
		if (suggestion == null || suggestion.isEmpty()) {
			String reason = suggestion == null ? "no response" : suggestion.rationale();
			throw new TermSheetExtractionException("LLM returned no term sheet data: " + reason);
		}
		logger.info("LLM response received: {} characters ({})", suggestion.suggestion().length(),
				suggestion.rationale());
		logger.debug("Raw LLM response:\n{}", suggestion.suggestion());
		return parseTermSheet(suggestion.suggestion());
	}

	TermSheetData parseTermSheet(String raw) {
		String json = stripCodeFences(raw);
		JsonNode root;
		try {
			root = objectMapper.readTree(json);
		} catch (JacksonException ex) {
			throw new TermSheetExtractionException("Failed to parse LLM JSON response: " + ex.getOriginalMessage(), ex);
		}
		if (root == null || !root.isObject()) {
			throw new TermSheetExtractionException("LLM response is not a JSON object");
		}
		Map<String, JsonNode> fields = flatten(root);
		TermSheetData data = TermSheetData.builder()
				.isin(textOrNull(fields, "isin", "ISIN"))
				.issuer(textOrNull(fields, "issuer", "issuer_name", "issuerName"))
				.issueAmount(decimalOrNull(fields, "issue_amount", "issueAmount", "issue_size"))
				.faceValue(decimalOrNull(fields, "face_value", "faceValue", "nominal_value"))
				.notionalAmount(decimalOrNull(fields, "notional_amount", "notionalAmount"))
				.couponRate(decimalOrNull(fields, "coupon_rate", "couponRate", "coupon"))
				.currency(textOrNull(fields, "currency"))
				.issueDate(textOrNull(fields, "issue_date", "issueDate"))
				.maturityDate(textOrNull(fields, "maturity_date", "maturityDate"))
				.settlementDate(textOrNull(fields, "settlement_date", "settlementDate"))
				.paymentFrequency(textOrNull(fields, "payment_frequency", "paymentFrequency"))
				.dayCountConvention(textOrNull(fields, "day_count_convention", "dayCountConvention"))
				.securityType(textOrNull(fields, "security_type", "securityType"))
				.seniority(textOrNull(fields, "seniority"))
				.tenor(textOrNull(fields, "tenor"))
				.build();
		logger.info("Successfully extracted term sheet data");
		return data;
	}

	/**
	 * Share of spot checks (ISIN, issuer, coupon, currency) whose extracted value can be found in the
	 * document text.
	 */
	public double validateExtraction(TermSheetData data, String originalText) {
		if (data == null) {
			return 0.0d;
		}
		String text = originalText == null ? "" : originalText;
		String lowerText = text.toLowerCase(Locale.ROOT);
		int score = 0;
		int checks = 0;

		if (data.isin() != null && !data.isin().isEmpty() && text.contains(data.isin())) {
			score++;
		}
		checks++;

		if (data.issuer() != null && !data.issuer().isBlank()) {
			String[] words = data.issuer().trim().split("\\s+");
			for (int i = 0; i < Math.min(2, words.length); i++) {
				if (words[i].length() > 3 && lowerText.contains(words[i].toLowerCase(Locale.ROOT))) {
					score++;
					break;
				}
			}
		}
		checks++;

		BigDecimal coupon = data.couponRate();
		if (coupon != null && coupon.signum() != 0) {
			List<String> patterns = List.of(
					coupon.toPlainString() + "%",
					String.format(Locale.ROOT, "%.2f%%", coupon),
					String.format(Locale.ROOT, "%.1f%%", coupon),
					coupon.toPlainString()
			);
			if (patterns.stream().anyMatch(text::contains)) {
				score++;
			}
		}
		checks++;

		if (data.currency() != null && !data.currency().isEmpty() && text.contains(data.currency())) {
			score++;
		}
		checks++;

		return (double) score / checks;
	}

	String buildPrompt(String text, String filename) {
		String document = text == null ? "" : text;
		if (document.length() > maxDocumentChars) {
			document = document.substring(0, maxDocumentChars);
		}
		return """
				You are a financial document analyst. Extract key information from this bond/debt term sheet.

				Document: %s

				Extract the following fields and return them as a FLAT JSON object (not nested):

				- isin: ISIN code (e.g., NO0010894330, INE008A08U84)
				- issuer: Name of the issuing entity/company/bank
				- issue_amount: Total issuance size (number only)
				- face_value: Nominal/face value per bond unit (number only)
				- notional_amount: Total notional amount (if specified, otherwise null)
				- coupon_rate: Interest rate as decimal number (e.g., 9.25 for 9.25%%)
				- currency: Currency code (USD, INR, EUR, etc.)
				- issue_date: Issue date in YYYY-MM-DD format
				- maturity_date: Maturity date in YYYY-MM-DD format (null for perpetual)
				- settlement_date: Settlement date in YYYY-MM-DD format
				- payment_frequency: Interest payment frequency (e.g., "Semi-annual")
				- day_count_convention: Day count method (e.g., "30/360")
				- security_type: Security status (e.g., "Unsecured")
				- seniority: Ranking (e.g., "Senior")
				- tenor: Bond tenor/term (e.g., "5 years")

				IMPORTANT:
				1. Return a FLAT JSON object with these exact field names
				2. Do NOT nest the fields under category headers
				3. Use null for missing values
				4. Extract only numbers for amounts and rates (no currency symbols or %%)

				Document content:
				%s
				""".formatted(filename == null ? "" : filename, document);
	}

	static String stripCodeFences(String raw) {
		String trimmed = raw == null ? "" : raw.trim();
		if (!trimmed.startsWith("```")) {
			return trimmed;
		}
		int firstLineEnd = trimmed.indexOf('\n');
		String body = firstLineEnd < 0 ? trimmed.substring(3) : trimmed.substring(firstLineEnd + 1);
		if (firstLineEnd < 0 && body.startsWith("json")) {
			body = body.substring(4);
		}
		body = body.trim();
		if (body.endsWith("```")) {
			body = body.substring(0, body.length() - 3);
		}
		return body.trim();
	}

	private Map<String, JsonNode> flatten(JsonNode root) {
		Map<String, JsonNode> fields = new LinkedHashMap<>();
		boolean nested = CATEGORY_KEYS.stream().anyMatch(root::has);
		if (nested) {
			logger.info("Detected nested structure, flattening");
		}
		root.properties().forEach(entry -> {
			JsonNode value = entry.getValue();
			if (nested && value != null && value.isObject()) {
				value.properties().forEach(inner -> fields.put(inner.getKey(), inner.getValue()));
			} else {
				fields.put(entry.getKey(), value);
			}
		});
		return fields;
	}

	private String textOrNull(Map<String, JsonNode> fields, String... names) {
		for (String name : names) {
			JsonNode value = fields.get(name);
			if (value == null || value.isNull() || !value.isValueNode()) {
				continue;
			}
			String text = value.asText();
			if (text == null || text.isBlank()) {
				continue;
			}
			return text.trim();
		}
		return null;
	}

	private BigDecimal decimalOrNull(Map<String, JsonNode> fields, String... names) {
		for (String name : names) {
			JsonNode value = fields.get(name);
			if (value == null || value.isNull()) {
				continue;
			}
			if (value.isNumber()) {
				return value.decimalValue();
			}
			if (!value.isTextual()) {
				continue;
			}
			String cleaned = value.asText().replace(",", "").replace("%", "").replaceAll("\\s+", "");
			if (cleaned.isEmpty()) {
				continue;
			}
			try {
				return new BigDecimal(cleaned);
			} catch (NumberFormatException ex) {
				logger.debug("Ignoring non-numeric value for {}: {}", name, value.asText());
			}
		}
		return null;
	}
}
