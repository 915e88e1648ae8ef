package my.pietracker.app.dto;

import java.math.BigDecimal;
import java.util.Map;

public record RebalancePlanDto(Map<String, BigDecimal> investments, BigDecimal newTotal) {
}
