package my.pietracker.app.model;

import java.math.BigDecimal;

/**
 * One holding inside one pie. Metadata fields (fullName, currencyCode, type, addedToMarket and
 * the trading-size limits) are null when the catalogue had no entry for the ticker.
 */
public record PieInstrument(String ticker,
							String fullName,
							String currencyCode,
							String type,
							String addedToMarket,
							BigDecimal maxOpenQuantity,
							BigDecimal minTradeQuantity,
							BigDecimal currentShare,
							BigDecimal expectedShare,
							boolean issues,
							BigDecimal ownedQuantity,
							BigDecimal investedValue,
							BigDecimal currentValue,
							BigDecimal resultValue,
							BigDecimal dividendYield,
							InstrumentPerformance performance) {
	public PieInstrument withMarketData(InstrumentMarketData marketData) {
		InstrumentMarketData data = marketData == null ? InstrumentMarketData.unavailable(ticker) : marketData;
		return new PieInstrument(ticker, fullName, currencyCode, type, addedToMarket, maxOpenQuantity,
				minTradeQuantity, currentShare, expectedShare, issues, ownedQuantity, investedValue, currentValue,
				resultValue, data.dividendYield(), data.performance());
	}
}
