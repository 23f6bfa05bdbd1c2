package my.termsheetrecon.app.booking;

import my.termsheetrecon.app.domain.BookingRecord;
import my.termsheetrecon.app.domain.CanonicalFields;
import my.termsheetrecon.app.reconcile.FieldResolver;
import my.termsheetrecon.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads booking system exports (CSV or JSON) into {@link BookingRecord}s. Column and property names
 * are kept verbatim so the reconciliation engine can resolve them against its synonym lists.
 */
public class BookingDataLoader {
	private static final Logger logger = LoggerFactory.getLogger(BookingDataLoader.class);

	private final ObjectMapper objectMapper;
	private final List<String> tradeIdAttributes;
	private final FieldResolver fieldResolver;

	public BookingDataLoader(ObjectMapper objectMapper, List<String> tradeIdAttributes, FieldResolver fieldResolver) {
		this.objectMapper = objectMapper;
		this.tradeIdAttributes = tradeIdAttributes == null ? List.of() : List.copyOf(tradeIdAttributes);
		this.fieldResolver = fieldResolver;
	}

	public List<BookingRecord> load(Path path) {
		if (path == null || !Files.isRegularFile(path)) {
			throw new IllegalArgumentException("File not found: " + path);
		}
		String filename = path.getFileName().toString();
		String lower = filename.toLowerCase(Locale.ROOT);
		byte[] payload;
		try {
			payload = Files.readAllBytes(path);
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read booking file " + filename + ": " + exc.getMessage(), exc);
		}
		if (lower.endsWith(".csv")) {
			return loadCsv(payload, filename);
		}
		if (lower.endsWith(".json")) {
			return loadJson(payload, filename);
		}
		int dot = lower.lastIndexOf('.');
		throw new IllegalArgumentException("Unsupported file format: " + (dot < 0 ? "" : lower.substring(dot)));
	}

	public List<BookingRecord> loadCsv(byte[] payload, String filename) {
		String content = CsvParsing.decodeUtf8(payload);
		char delimiter = CsvParsing.sniffDelimiter(content);
		List<BookingRecord> records = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CSVFormat.DEFAULT.withDelimiter(delimiter).withFirstRecordAsHeader().withAllowMissingColumnNames()
		)) {
			List<String> headers = parser.getHeaderNames();
			logger.info("Loaded CSV {} with {} columns", filename, headers.size());
			boolean decimalComma = delimiter == ';';
			for (CSVRecord row : parser) {
				if (row.size() > headers.size()) {
					logger.warn("Skipping CSV row {} in {}: expected {} columns, found {}", row.getRecordNumber(),
							filename, headers.size(), row.size());
					continue;
				}
				Map<String, Object> attributes = new LinkedHashMap<>();
				for (String header : headers) {
					if (header == null || header.isBlank()) {
						continue;
					}
					String value = row.isSet(header) ? CsvParsing.blankToNull(row.get(header)) : null;
					attributes.put(header.trim(), decimalComma ? CsvParsing.normalizeDecimalComma(value) : value);
				}
				records.add(toRecord(attributes));
			}
		} catch (IOException | IllegalArgumentException | IllegalStateException exc) {
			throw new IllegalArgumentException("Failed to read booking CSV " + filename + ": " + exc.getMessage(), exc);
		}
		logger.info("Successfully loaded {} booking records from CSV", records.size());
		return records;
	}

	public List<BookingRecord> loadJson(byte[] payload, String filename) {
		JsonNode root;
		try {
			root = objectMapper.readTree(CsvParsing.decodeUtf8(payload));
		} catch (JacksonException exc) {
			logger.error("JSON parsing error in file {}: {}", filename, exc.getOriginalMessage());
			throw new IllegalArgumentException("Invalid JSON file: " + filename + ". Error: " + exc.getOriginalMessage(), exc);
		}
		List<JsonNode> rawRecords = new ArrayList<>();
		if (root != null && root.isArray()) {
			root.forEach(rawRecords::add);
		} else if (root != null && root.isObject()) {
			JsonNode nested = root.has("trades") ? root.get("trades") : root.get("records");
			if (nested != null && nested.isArray()) {
				nested.forEach(rawRecords::add);
			} else {
				rawRecords.add(root);
			}
		} else {
			throw new IllegalArgumentException("Invalid JSON structure in " + filename);
		}

		List<BookingRecord> records = new ArrayList<>();
		for (JsonNode node : rawRecords) {
			if (node == null || !node.isObject()) {
				logger.warn("Skipping non-object booking entry in {}: {}", filename, node);
				continue;
			}
			Map<String, Object> attributes = new LinkedHashMap<>();
			node.properties().forEach(entry -> attributes.put(entry.getKey(), toValue(entry.getValue())));
			records.add(toRecord(attributes));
		}
		logger.info("Successfully loaded {} booking records from JSON", records.size());
		return records;
	}

	public BookingSummary summarize(List<BookingRecord> records) {
		if (records == null || records.isEmpty()) {
			return new BookingSummary(0, List.of(), List.of(), List.of(), "N/A");
		}
		Set<String> isins = new LinkedHashSet<>();
		Set<String> issuers = new LinkedHashSet<>();
		Set<String> currencies = new LinkedHashSet<>();
		List<Double> coupons = new ArrayList<>();
		for (BookingRecord record : records) {
			textValue(record, CanonicalFields.ISIN).ifPresent(isins::add);
			textValue(record, CanonicalFields.ISSUER).ifPresent(issuers::add);
			textValue(record, CanonicalFields.CURRENCY).ifPresent(currencies::add);
			textValue(record, CanonicalFields.COUPON_RATE).map(this::parseDouble).ifPresent(coupons::add);
		}
		String couponRange = coupons.isEmpty()
				? "N/A"
				: String.format(Locale.ROOT, "%.2f%%-%.2f%%",
				coupons.stream().mapToDouble(Double::doubleValue).min().orElse(0.0d),
				coupons.stream().mapToDouble(Double::doubleValue).max().orElse(0.0d));
		return new BookingSummary(records.size(), List.copyOf(isins), List.copyOf(issuers), List.copyOf(currencies),
				couponRange);
	}

	private BookingRecord toRecord(Map<String, Object> attributes) {
		Integer tradeId = null;
		for (String attribute : tradeIdAttributes) {
			Object value = attributes.get(attribute);
			if (value == null) {
				continue;
			}
			tradeId = parseTradeId(value);
			if (tradeId != null) {
				break;
			}
			logger.warn("Ignoring non-integer trade id {}={}", attribute, value);
		}
		return new BookingRecord(tradeId, attributes);
	}

	private Integer parseTradeId(Object value) {
		try {
			BigDecimal decimal = value instanceof BigDecimal number ? number : new BigDecimal(value.toString().trim());
			return decimal.intValueExact();
		} catch (ArithmeticException | NumberFormatException ex) {
			return null;
		}
	}

	private Object toValue(JsonNode node) {
		if (node == null || node.isNull() || node.isMissingNode()) {
			return null;
		}
		if (node.isTextual()) {
			return node.asText();
		}
		if (node.isIntegralNumber() && node.canConvertToLong()) {
			return node.longValue();
		}
		if (node.isNumber()) {
			return node.decimalValue();
		}
		if (node.isBoolean()) {
			return node.booleanValue();
		}
		return node.toString();
	}

	private Optional<String> textValue(BookingRecord record, String canonicalField) {
		return fieldResolver.resolve(canonicalField, record.attributeNames())
				.map(record::get)
				.map(value -> value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString())
				.filter(text -> !text.isBlank());
	}

	private Double parseDouble(String text) {
		try {
			return Double.parseDouble(text.trim());
		} catch (NumberFormatException ex) {
			return null;
		}
	}
}
