package my.termsheetrecon.app.reconcile;

import my.termsheetrecon.app.domain.CanonicalFields;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciliationSettingsTest {
	@Test
	void defaultsCoverEveryCanonicalFieldInOrder() {
		ReconciliationSettings settings = ReconciliationSettings.defaults();

		assertThat(settings.numericTolerance()).isEqualTo(0.001d);
		assertThat(settings.dateToleranceDays()).isZero();
		assertThat(settings.fieldOrder()).containsExactlyElementsOf(CanonicalFields.ALL);
		assertThat(settings.fieldSynonyms().get("coupon_rate"))
				.containsExactly("Coupon", "CouponRate", "InterestRate", "Rate", "coupon_rate");
	}

	@Test
	void overridesReturnNewInstances() {
		ReconciliationSettings defaults = ReconciliationSettings.defaults();
		ReconciliationSettings tuned = defaults.withNumericTolerance(0.01d).withDateToleranceDays(2);

		assertThat(tuned.numericTolerance()).isEqualTo(0.01d);
		assertThat(tuned.dateToleranceDays()).isEqualTo(2);
		assertThat(defaults.numericTolerance()).isEqualTo(0.001d);
		assertThat(tuned.fieldSynonyms()).isEqualTo(defaults.fieldSynonyms());
	}

	@Test
	void synonymMapIsCopiedAndReadOnly() {
		Map<String, List<String>> synonyms = new LinkedHashMap<>();
		synonyms.put("isin", List.of("ISIN"));
		ReconciliationSettings settings = ReconciliationSettings.defaults().withFieldSynonyms(synonyms);

		synonyms.put("currency", List.of("Ccy"));

		assertThat(settings.fieldOrder()).containsExactly("isin");
		assertThatThrownBy(() -> settings.fieldSynonyms().put("issuer", List.of("Issuer")))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void rejectsNegativeTolerances() {
		assertThatThrownBy(() -> ReconciliationSettings.defaults().withNumericTolerance(-0.1d))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("numericTolerance");
		assertThatThrownBy(() -> ReconciliationSettings.defaults().withDateToleranceDays(-1))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("dateToleranceDays");
	}
}
