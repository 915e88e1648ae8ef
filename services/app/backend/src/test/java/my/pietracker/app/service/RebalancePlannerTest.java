package my.pietracker.app.service;

import my.pietracker.app.model.TargetInvestments;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RebalancePlannerTest {
	private final RebalancePlanner planner = new RebalancePlanner();

	@Test
	void directsNewCapitalTowardsUnderweightCategories() {
		TargetInvestments plan = planner.planRebalance(
				amounts("A", "800", "B", "200"), amounts("A", "50", "B", "50"), new BigDecimal("1000"));

		assertThat(plan.newTotal()).isEqualByComparingTo("2000");
		assertThat(plan.get("A")).isEqualByComparingTo("200");
		assertThat(plan.get("B")).isEqualByComparingTo("800");
	}

	@Test
	void overweightCategoryGetsNothing() {
		TargetInvestments plan = planner.planRebalance(
				amounts("A", "1200", "B", "0"), amounts("A", "50", "B", "50"), new BigDecimal("1000"));

		assertThat(plan.get("A")).isEqualByComparingTo("0");
		assertThat(plan.get("B")).isEqualByComparingTo("1100");
	}

	@Test
	void invalidInputReturnsNull() {
		Map<String, BigDecimal> current = amounts("A", "100", "B", "100");
		Map<String, BigDecimal> targets = amounts("A", "50", "B", "50");

		assertThat(planner.planRebalance(current, targets, BigDecimal.ZERO)).isNull();
		assertThat(planner.planRebalance(current, targets, new BigDecimal("-5"))).isNull();
		assertThat(planner.planRebalance(Map.of(), targets, BigDecimal.TEN)).isNull();
		assertThat(planner.planRebalance(current, null, BigDecimal.TEN)).isNull();
		assertThat(planner.planRebalance(current, amounts("A", "50", "C", "50"), BigDecimal.TEN)).isNull();

		Map<String, BigDecimal> withNull = new HashMap<>(current);
		withNull.put("B", null);
		assertThat(planner.planRebalance(withNull, targets, BigDecimal.TEN)).isNull();
	}

	private static Map<String, BigDecimal> amounts(String k1, String v1, String k2, String v2) {
		Map<String, BigDecimal> map = new LinkedHashMap<>();
		map.put(k1, new BigDecimal(v1));
		map.put(k2, new BigDecimal(v2));
		return map;
	}
}
