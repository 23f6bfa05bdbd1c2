package my.termsheetrecon.app.domain;

import java.util.Map;

/**
 * Name-based view over a record's attributes. Absent values are mapped to {@code null}; the
 * returned map is read-only and iterates in the record's natural attribute order.
 */
public interface AttributeSource {
	Map<String, Object> attributes();

	default Object get(String name) {
		return name == null ? null : attributes().get(name);
	}
}
