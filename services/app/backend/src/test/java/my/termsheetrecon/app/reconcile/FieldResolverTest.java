package my.termsheetrecon.app.reconcile;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FieldResolverTest {
	private final FieldResolver resolver = new FieldResolver(ReconciliationSettings.defaultFieldSynonyms());

	@Test
	void resolvesFirstSynonymPresentInPriorityOrder() {
		Set<String> available = Set.of("Rate", "CouponRate", "TradeID");

		assertThat(resolver.resolve("coupon_rate", available)).contains("CouponRate");
	}

	@Test
	void callerControlsPrecedence() {
		Set<String> available = Set.of("Rate", "CouponRate");

		assertThat(resolver.resolve("coupon_rate", List.of("Rate", "CouponRate"), available)).contains("Rate");
		assertThat(resolver.resolve("coupon_rate", List.of("CouponRate", "Rate"), available)).contains("CouponRate");
	}

	@Test
	void matchingIsExactAndCaseSensitive() {
		Set<String> available = Set.of("couponrate", "COUPON");

		assertThat(resolver.resolve("coupon_rate", available)).isEmpty();
	}

	@Test
	void returnsEmptyForUnknownFieldOrNoAttributes() {
		assertThat(resolver.resolve("yield", Set.of("Yield"))).isEmpty();
		assertThat(resolver.resolve("isin", Set.of())).isEmpty();
		assertThat(resolver.resolve("isin", null)).isEmpty();
		assertThat(resolver.resolve(null, Set.of("ISIN"))).isEmpty();
	}

	@Test
	void resolvesFaceValueThroughDomainSpecificName() {
		Set<String> available = Set.of("NominalAmountPerBond", "ISIN");

		assertThat(resolver.resolve("face_value", available)).contains("NominalAmountPerBond");
	}

	@Test
	void usesSuppliedMappingInsteadOfDefaults() {
		FieldResolver custom = new FieldResolver(Map.of("coupon_rate", List.of("Kupon")));

		assertThat(custom.resolve("coupon_rate", Set.of("Kupon", "Coupon"))).contains("Kupon");
		assertThat(custom.resolve("isin", Set.of("ISIN"))).isEmpty();
		assertThat(custom.synonymsFor("coupon_rate")).containsExactly("Kupon");
	}
}
