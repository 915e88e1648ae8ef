package my.pietracker.app.dto;

import java.math.BigDecimal;

public record PieInstrumentDto(String ticker,
							   String fullName,
							   String currencyCode,
							   String type,
							   String addedToMarket,
							   BigDecimal investedValue,
							   BigDecimal currentValue,
							   BigDecimal resultValue,
							   BigDecimal dividendYield,
							   PerformanceDto performance) {
}
