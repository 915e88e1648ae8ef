package my.pietracker.app.marketdata;

import my.pietracker.app.config.AppProperties;
import my.pietracker.app.model.HistoricalClose;
import my.pietracker.app.model.InstrumentMarketData;
import my.pietracker.app.model.InstrumentPerformance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
public class InstrumentMarketDataService {
	private static final Logger logger = LoggerFactory.getLogger(InstrumentMarketDataService.class);

	private final MarketDataProvider provider;
	private final Clock clock;
	private final int historyDays;

	@Autowired
	public InstrumentMarketDataService(MarketDataProvider provider, Clock clock, AppProperties properties) {
		this(provider, clock, properties.marketData().historyDays());
	}

	InstrumentMarketDataService(MarketDataProvider provider, Clock clock, int historyDays) {
		this.provider = provider;
		this.clock = clock;
		this.historyDays = historyDays;
	}

	/**
	 * Yield and trailing performance for one broker ticker. Any failure degrades to a zero yield
	 * and no performance; this method does not throw.
	 */
	public InstrumentMarketData fetch(String ticker) {
		String symbol = TickerNormalizer.normalize(ticker);
		if (symbol == null || symbol.isBlank()) {
			return InstrumentMarketData.unavailable(ticker);
		}
		try {
			BigDecimal yield = provider.dividendYield(symbol);
			LocalDate today = LocalDate.now(clock);
			List<HistoricalClose> closes = provider.dailyCloses(symbol, today.minusDays(historyDays), today);
			InstrumentPerformance performance = PerformanceCalculator.calculate(closes, today);
			return new InstrumentMarketData(symbol, yield == null ? BigDecimal.ZERO : yield, performance);
		} catch (MarketDataException ex) {
			logger.warn("No market data for {} ({}): {} {}", ticker, symbol, ex.getReason(), ex.getMessage());
			return InstrumentMarketData.unavailable(symbol);
		} catch (RuntimeException ex) {
			logger.warn("Unexpected market data failure for {} ({})", ticker, symbol, ex);
			return InstrumentMarketData.unavailable(symbol);
		}
	}
}
