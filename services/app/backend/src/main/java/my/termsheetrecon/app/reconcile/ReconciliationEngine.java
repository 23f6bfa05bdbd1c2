package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.BookingRecord;
import my.termsheetrecon.app.domain.FieldComparison;
import my.termsheetrecon.app.domain.ReconciliationResult;
import my.termsheetrecon.app.domain.TermSheetData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles one term sheet against booking records, producing one result per candidate trade in
 * candidate order. Stateless apart from its immutable settings, so an instance can be shared.
 */
public class ReconciliationEngine {
	private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

	private final ReconciliationSettings settings;
	private final FieldResolver fieldResolver;
	private final RecordMatcher recordMatcher;
	private final ComparatorLibrary comparators;

	public ReconciliationEngine(ReconciliationSettings settings) {
		this.settings = settings == null ? ReconciliationSettings.defaults() : settings;
		this.fieldResolver = new FieldResolver(this.settings.fieldSynonyms());
		this.recordMatcher = new RecordMatcher(fieldResolver);
		this.comparators = new ComparatorLibrary(this.settings.numericTolerance(), this.settings.dateToleranceDays());
	}

	public ReconciliationSettings getSettings() {
		return settings;
	}

	public FieldResolver getFieldResolver() {
		return fieldResolver;
	}

	public List<ReconciliationResult> reconcile(TermSheetData termSheet, List<BookingRecord> bookingRecords) {
		if (termSheet == null) {
			logger.error("No term sheet data provided");
			return List.of();
		}
		if (bookingRecords == null || bookingRecords.isEmpty()) {
			logger.error("No booking records provided");
			return List.of();
		}
		List<BookingRecord> candidates = recordMatcher.filterCandidates(termSheet, bookingRecords);
		logger.info("Reconciling against {} relevant booking records", candidates.size());

		Map<String, Object> termSheetValues = termSheet.attributes();
		List<ReconciliationResult> results = new ArrayList<>(candidates.size());
		for (BookingRecord candidate : candidates) {
			results.add(reconcileCandidate(termSheetValues, candidate));
		}
		return results;
	}

	private ReconciliationResult reconcileCandidate(Map<String, Object> termSheetValues, BookingRecord candidate) {
		Integer tradeId = candidate == null ? null : candidate.tradeId();
		Set<String> available = availableAttributes(candidate);
		List<FieldComparison> comparisons = new ArrayList<>();
		int matches = 0;

		for (Map.Entry<String, List<String>> field : settings.fieldSynonyms().entrySet()) {
			String canonical = field.getKey();
			Object termSheetValue = termSheetValues.get(canonical);
			if (termSheetValue == null) {
				continue;
			}
			Optional<String> attribute = fieldResolver.resolve(canonical, field.getValue(), available);
			if (attribute.isEmpty()) {
				logger.debug("No matching booking field found for term sheet field {} (trade {})", canonical, tradeId);
				continue;
			}
			Object bookingValue = candidate.get(attribute.get());
			if (bookingValue == null) {
				continue;
			}
			FieldComparison comparison = comparators.compare(canonical, termSheetValue, bookingValue);
			if (comparison.match()) {
				matches++;
			}
			comparisons.add(comparison);
		}

		int total = comparisons.size();
		double matchPercentage = total > 0 ? ((double) matches / total) * 100.0d : 0.0d;
		boolean overallMatch = matchPercentage == 100.0d;
		String summary = String.format(Locale.ROOT, "Trade %s: %d/%d fields match (%.1f%%)",
				tradeId == null ? "N/A" : tradeId, matches, total, matchPercentage);
		return new ReconciliationResult(tradeId, overallMatch, matchPercentage, comparisons, summary);
	}

	private Set<String> availableAttributes(BookingRecord candidate) {
		if (candidate == null) {
			logger.warn("Skipping field comparison for a missing booking record");
			return Set.of();
		}
		return candidate.attributeNames();
	}
}
