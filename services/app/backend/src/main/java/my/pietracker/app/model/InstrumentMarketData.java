package my.pietracker.app.model;

import java.math.BigDecimal;

public record InstrumentMarketData(String symbol, BigDecimal dividendYield, InstrumentPerformance performance) {
	public static InstrumentMarketData unavailable(String symbol) {
		return new InstrumentMarketData(symbol, BigDecimal.ZERO, InstrumentPerformance.unavailable());
	}
}
