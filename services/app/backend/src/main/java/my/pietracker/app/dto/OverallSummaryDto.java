package my.pietracker.app.dto;

import java.math.BigDecimal;

public record OverallSummaryDto(BigDecimal totalInvestedOverall,
								BigDecimal totalResultOverall,
								BigDecimal returnPercentageOverall) {
}
