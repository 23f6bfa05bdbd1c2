package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.BookingRecord;
import my.termsheetrecon.app.domain.CanonicalFields;
import my.termsheetrecon.app.domain.TermSheetData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Narrows the booking universe to the trades booked under the term sheet's ISIN. When the term
 * sheet carries no ISIN, or no trade carries it, every booking record stays a candidate.
 */
public class RecordMatcher {
	private static final Logger logger = LoggerFactory.getLogger(RecordMatcher.class);

	private final FieldResolver fieldResolver;

	public RecordMatcher(FieldResolver fieldResolver) {
		this.fieldResolver = fieldResolver;
	}

	public List<BookingRecord> filterCandidates(TermSheetData termSheet, List<BookingRecord> bookingRecords) {
		if (bookingRecords == null || bookingRecords.isEmpty()) {
			return List.of();
		}
		String isin = termSheet == null ? null : termSheet.isin();
		if (isin == null) {
			logger.warn("No ISIN in term sheet - using all {} booking records", bookingRecords.size());
			return bookingRecords;
		}
		List<BookingRecord> relevant = new ArrayList<>();
		for (BookingRecord record : bookingRecords) {
			if (isin.equals(identifierOf(record).orElse(null))) {
				relevant.add(record);
			}
		}
		if (relevant.isEmpty()) {
			logger.warn("No booking records found for ISIN {} - using all {} booking records", isin,
					bookingRecords.size());
			return bookingRecords;
		}
		return relevant;
	}

	private Optional<String> identifierOf(BookingRecord record) {
		if (record == null) {
			return Optional.empty();
		}
		return fieldResolver.resolve(CanonicalFields.ISIN, record.attributeNames())
				.map(record::get)
				.filter(Objects::nonNull)
				.map(FieldValues::asText);
	}
}
