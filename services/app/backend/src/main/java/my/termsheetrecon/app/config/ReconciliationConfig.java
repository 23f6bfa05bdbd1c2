package my.termsheetrecon.app.config;

import my.termsheetrecon.app.booking.BookingDataLoader;
import my.termsheetrecon.app.extraction.TermSheetPdfExtractor;
import my.termsheetrecon.app.reconcile.ReconciliationEngine;
import my.termsheetrecon.app.reconcile.ReconciliationSettings;
import my.termsheetrecon.app.report.ReconciliationReportWriter;
import my.termsheetrecon.app.service.ReconciliationWorkflowService;
import my.termsheetrecon.app.service.TermSheetExtractionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
public class ReconciliationConfig {
	private static final Logger logger = LoggerFactory.getLogger(ReconciliationConfig.class);
	static final List<String> DEFAULT_TRADE_ID_ATTRIBUTES = List.of("TradeID", "TradeId", "trade_id");
	static final String DEFAULT_OUTPUT_DIR = "outputs";

	@Bean
	public ReconciliationSettings reconciliationSettings(AppProperties properties) {
		ReconciliationSettings settings = toSettings(properties.reconciliation());
		logger.info("Reconciliation settings: numericTolerance={}, dateToleranceDays={}, fields={}",
				settings.numericTolerance(), settings.dateToleranceDays(), settings.fieldOrder());
		return settings;
	}

	@Bean
	public ReconciliationEngine reconciliationEngine(ReconciliationSettings settings) {
		return new ReconciliationEngine(settings);
	}

	@Bean
	public JsonMapper objectMapper() {
		return JsonMapper.builder().build();
	}

	@Bean
	public BookingDataLoader bookingDataLoader(AppProperties properties,
											   ObjectMapper objectMapper,
											   ReconciliationEngine engine) {
		List<String> tradeIdAttributes = properties.booking() == null ? null : properties.booking().tradeIdAttributes();
		if (tradeIdAttributes == null || tradeIdAttributes.isEmpty()) {
			tradeIdAttributes = DEFAULT_TRADE_ID_ATTRIBUTES;
		}
		return new BookingDataLoader(objectMapper, tradeIdAttributes, engine.getFieldResolver());
	}

	@Bean
	public TermSheetPdfExtractor termSheetPdfExtractor() {
		return new TermSheetPdfExtractor();
	}

	@Bean
	public ReconciliationReportWriter reconciliationReportWriter(AppProperties properties) {
		String outputDir = properties.report() == null ? null : properties.report().outputDir();
		if (outputDir == null || outputDir.isBlank()) {
			outputDir = DEFAULT_OUTPUT_DIR;
		}
		return new ReconciliationReportWriter(Path.of(outputDir));
	}

	@Bean
	public ReconciliationWorkflowService reconciliationWorkflowService(TermSheetPdfExtractor pdfExtractor,
																	   TermSheetExtractionService extractionService,
																	   BookingDataLoader bookingDataLoader,
																	   ReconciliationEngine engine,
																	   ReconciliationReportWriter reportWriter,
																	   AppProperties properties) {
		Boolean saveText = properties.report() == null ? null : properties.report().saveExtractedText();
		return new ReconciliationWorkflowService(pdfExtractor, extractionService, bookingDataLoader, engine,
				reportWriter, saveText == null || saveText);
	}

	static ReconciliationSettings toSettings(AppProperties.Reconciliation reconciliation) {
		ReconciliationSettings settings = ReconciliationSettings.defaults();
		if (reconciliation == null) {
			return settings;
		}
		if (reconciliation.numericTolerance() != null) {
			settings = settings.withNumericTolerance(reconciliation.numericTolerance());
		}
		if (reconciliation.dateToleranceDays() != null) {
			settings = settings.withDateToleranceDays(reconciliation.dateToleranceDays());
		}
		List<AppProperties.Reconciliation.FieldMapping> fields = reconciliation.fields();
		if (fields != null && !fields.isEmpty()) {
			Map<String, List<String>> synonyms = new LinkedHashMap<>();
			for (AppProperties.Reconciliation.FieldMapping mapping : fields) {
				if (mapping == null || mapping.field() == null || mapping.field().isBlank()) {
					continue;
				}
				List<String> names = mapping.synonyms() == null || mapping.synonyms().isEmpty()
						? List.of(mapping.field())
						: mapping.synonyms();
				synonyms.put(mapping.field().trim(), names);
			}
			settings = settings.withFieldSynonyms(synonyms);
		}
		return settings;
	}
}
