package my.pietracker.app.marketdata;

import my.pietracker.app.model.HistoricalClose;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public interface MarketDataProvider {
	/**
	 * Dividend yield in percent, rounded to two decimals. Zero when the quote carries no yield.
	 *
	 * @throws MarketDataException when the quote cannot be fetched or read
	 */
	BigDecimal dividendYield(String symbol);

	/**
	 * Daily closes between {@code from} and {@code to} (inclusive), oldest first. Days without a
	 * close are omitted.
	 *
	 * @throws MarketDataException when the history cannot be fetched or read
	 */
	List<HistoricalClose> dailyCloses(String symbol, LocalDate from, LocalDate to);
}
