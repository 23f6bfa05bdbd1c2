package my.termsheetrecon.app.reconcile;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a canonical field to the attribute name a particular booking record uses for it. Matching is
 * exact and case-sensitive; the first synonym present wins.
 */
public class FieldResolver {
	private final Map<String, List<String>> fieldSynonyms;

	public FieldResolver(Map<String, List<String>> fieldSynonyms) {
		this.fieldSynonyms = fieldSynonyms == null ? Map.of() : Map.copyOf(fieldSynonyms);
	}

	public Optional<String> resolve(String canonicalField, Collection<String> availableAttributeNames) {
		return resolve(canonicalField, synonymsFor(canonicalField), availableAttributeNames);
	}

	public Optional<String> resolve(String canonicalField,
									List<String> synonyms,
									Collection<String> availableAttributeNames) {
		if (synonyms == null || availableAttributeNames == null || availableAttributeNames.isEmpty()) {
			return Optional.empty();
		}
		for (String synonym : synonyms) {
			if (synonym != null && availableAttributeNames.contains(synonym)) {
				return Optional.of(synonym);
			}
		}
		return Optional.empty();
	}

	public List<String> synonymsFor(String canonicalField) {
		if (canonicalField == null) {
			return List.of();
		}
		return fieldSynonyms.getOrDefault(canonicalField, List.of());
	}
}
