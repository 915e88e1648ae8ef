package my.pietracker.app.model;

import java.math.BigDecimal;
import java.util.Map;

public record TargetInvestments(Map<String, BigDecimal> investments, BigDecimal newTotal) {
	public BigDecimal get(String category) {
		return investments.get(category);
	}
}
