package my.termsheetrecon.app.config;

import my.termsheetrecon.app.reconcile.ReconciliationSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationConfigTest {
	@Test
	void missingSectionFallsBackToDefaults() {
		assertThat(ReconciliationConfig.toSettings(null)).isEqualTo(ReconciliationSettings.defaults());
		assertThat(ReconciliationConfig.toSettings(new AppProperties.Reconciliation(null, null, null)))
				.isEqualTo(ReconciliationSettings.defaults());
	}

	@Test
	void configuredFieldsReplaceDefaultsInListOrder() {
		AppProperties.Reconciliation reconciliation = new AppProperties.Reconciliation(
				0.005d,
				1,
				List.of(
						new AppProperties.Reconciliation.FieldMapping("currency", List.of("Ccy", "Currency")),
						new AppProperties.Reconciliation.FieldMapping("isin", null),
						new AppProperties.Reconciliation.FieldMapping(" ", List.of("Ignored"))
				)
		);

		ReconciliationSettings settings = ReconciliationConfig.toSettings(reconciliation);

		assertThat(settings.numericTolerance()).isEqualTo(0.005d);
		assertThat(settings.dateToleranceDays()).isEqualTo(1);
		assertThat(settings.fieldOrder()).containsExactly("currency", "isin");
		assertThat(settings.fieldSynonyms().get("currency")).containsExactly("Ccy", "Currency");
		assertThat(settings.fieldSynonyms().get("isin")).containsExactly("isin");
	}
}
