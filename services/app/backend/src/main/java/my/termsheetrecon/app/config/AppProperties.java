package my.termsheetrecon.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Reconciliation reconciliation,
		Booking booking,
		Llm llm,
		Report report
) {
	public record Reconciliation(
			@PositiveOrZero Double numericTolerance,
			@PositiveOrZero Integer dateToleranceDays,
			@Valid List<FieldMapping> fields
	) {
		public record FieldMapping(
				@NotBlank String field,
				List<String> synonyms
		) {
		}
	}

	public record Booking(
			List<String> tradeIdAttributes
	) {
	}

	public record Llm(
			String provider,
			OpenAi openai,
			Integer maxDocumentChars
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Report(
			String outputDir,
			Boolean saveExtractedText
	) {
	}
}
