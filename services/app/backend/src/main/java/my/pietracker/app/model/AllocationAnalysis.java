package my.pietracker.app.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current vs target allocation per category. All maps share the same key set, in the order
 * categories were first seen in the pie list.
 */
public record AllocationAnalysis(Map<String, BigDecimal> targetAllocation,
								 Map<String, CategoryAllocation> currentAllocation,
								 Map<String, String> allocationDifferences,
								 Map<String, BigDecimal> differencePercent,
								 boolean rebalanceRecommended,
								 BigDecimal estimatedAnnualDividend) {
	public Map<String, BigDecimal> categoryInvested() {
		Map<String, BigDecimal> invested = new LinkedHashMap<>();
		currentAllocation.forEach((category, allocation) -> invested.put(category, allocation.value()));
		return invested;
	}
}
