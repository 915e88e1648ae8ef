package my.pietracker.app.dto;

import java.math.BigDecimal;

public record PerformanceDto(BigDecimal oneDay,
							 BigDecimal oneWeek,
							 BigDecimal oneMonth,
							 BigDecimal threeMonths,
							 BigDecimal oneYear) {
}
