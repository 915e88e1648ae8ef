package my.pietracker.app.service;

import my.pietracker.app.model.TargetInvestments;
import my.pietracker.app.util.DecimalMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits new capital across categories so that each moves towards its target share of the
 * enlarged portfolio. Categories already above target receive nothing.
 */
@Component
public class RebalancePlanner {
	private static final Logger logger = LoggerFactory.getLogger(RebalancePlanner.class);

	public TargetInvestments planRebalance(Map<String, BigDecimal> currentAllocation,
										   Map<String, BigDecimal> targetPercentages,
										   BigDecimal newCapital) {
		if (currentAllocation == null || currentAllocation.isEmpty()
				|| targetPercentages == null || targetPercentages.isEmpty()) {
			logger.warn("Cannot plan rebalance: current or target allocation missing");
			return null;
		}
		if (!currentAllocation.keySet().equals(targetPercentages.keySet())) {
			logger.warn("Cannot plan rebalance: categories differ (current={}, target={})",
					currentAllocation.keySet(), targetPercentages.keySet());
			return null;
		}
		if (currentAllocation.containsValue(null) || targetPercentages.containsValue(null)) {
			logger.warn("Cannot plan rebalance: allocation contains empty values");
			return null;
		}
		if (newCapital == null || newCapital.signum() <= 0) {
			logger.warn("Cannot plan rebalance: new capital must be positive (was {})", newCapital);
			return null;
		}

		BigDecimal currentTotal = currentAllocation.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
		BigDecimal newTotal = currentTotal.add(newCapital);
		Map<String, BigDecimal> investments = new LinkedHashMap<>();
		for (Map.Entry<String, BigDecimal> entry : currentAllocation.entrySet()) {
			BigDecimal target = newTotal.multiply(targetPercentages.get(entry.getKey()))
					.divide(DecimalMath.HUNDRED, 10, RoundingMode.HALF_UP);
			BigDecimal needed = target.subtract(entry.getValue());
			investments.put(entry.getKey(), needed.max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP));
		}
		return new TargetInvestments(investments, newTotal);
	}
}
