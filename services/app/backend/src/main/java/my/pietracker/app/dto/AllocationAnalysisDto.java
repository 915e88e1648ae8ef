package my.pietracker.app.dto;

import java.math.BigDecimal;
import java.util.Map;

public record AllocationAnalysisDto(Map<String, BigDecimal> targetAllocation,
									Map<String, AllocationDto> currentAllocation,
									Map<String, String> allocationDifferences,
									boolean rebalanceRecommended,
									BigDecimal estimatedAnnualDividend) {
}
