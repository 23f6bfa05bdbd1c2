package my.termsheetrecon.app.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A trade as exported by the booking system. Attribute names are kept exactly as they appear in
 * the source file; an attribute may be present with a {@code null} value.
 */
public record BookingRecord(
		Integer tradeId,
		Map<String, Object> attributes
) implements AttributeSource {
	public BookingRecord {
		attributes = attributes == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}

	public Set<String> attributeNames() {
		return attributes.keySet();
	}
}
