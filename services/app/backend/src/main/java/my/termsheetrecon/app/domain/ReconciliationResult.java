package my.termsheetrecon.app.domain;

import java.util.List;

/**
 * Outcome of comparing one term sheet against one booking record. {@code overallMatch} is true
 * exactly when {@code matchPercentage} is 100.0.
 */
public record ReconciliationResult(
		Integer tradeId,
		boolean overallMatch,
		double matchPercentage,
		List<FieldComparison> comparisons,
		String summary
) {
	public ReconciliationResult {
		comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
	}

	public int comparedFields() {
		return comparisons.size();
	}

	public int matchedFields() {
		return (int) comparisons.stream().filter(FieldComparison::match).count();
	}

	public List<FieldComparison> mismatches() {
		return comparisons.stream().filter(comparison -> !comparison.match()).toList();
	}
}
