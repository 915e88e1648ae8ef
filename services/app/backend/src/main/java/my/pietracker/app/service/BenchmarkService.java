package my.pietracker.app.service;

import my.pietracker.app.marketdata.MarketDataException;
import my.pietracker.app.marketdata.MarketDataProvider;
import my.pietracker.app.model.Benchmark;
import my.pietracker.app.model.BenchmarkIndex;
import my.pietracker.app.model.HistoricalClose;
import my.pietracker.app.util.DecimalMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One-year returns of reference indices, used to put the portfolio return in context.
 */
@Service
public class BenchmarkService {
	private static final Logger logger = LoggerFactory.getLogger(BenchmarkService.class);

	static final List<BenchmarkIndex> INDICES = List.of(
			new BenchmarkIndex("^GSPC", "S&P 500", "Large-cap US stocks index", null),
			new BenchmarkIndex("URTH", "MSCI World", "Global developed markets index", null),
			new BenchmarkIndex("^FTSE", "FTSE 100", "UK large-cap stocks index", null),
			new BenchmarkIndex("VWO", "Emerging Markets", "Emerging markets index", null),
			new BenchmarkIndex("AGG", "US Bonds", "US aggregate bond index", null)
	);

	static final List<BenchmarkIndex> DEFAULTS = List.of(
			new BenchmarkIndex("^GSPC", "S&P 500", "Large-cap US stocks index", new BigDecimal("9.5")),
			new BenchmarkIndex("URTH", "MSCI World", "Global developed markets index", new BigDecimal("7.8")),
			new BenchmarkIndex("^FTSE", "FTSE 100", "UK large-cap stocks index", new BigDecimal("5.2"))
	);

	private final MarketDataProvider marketDataProvider;
	private final Clock clock;

	public BenchmarkService(MarketDataProvider marketDataProvider, Clock clock) {
		this.marketDataProvider = marketDataProvider;
		this.clock = clock;
	}

	public List<Benchmark> getBenchmarks() {
		LocalDate today = LocalDate.now(clock);
		List<Benchmark> benchmarks = new ArrayList<>();
		for (BenchmarkIndex index : INDICES) {
			BigDecimal annualReturn = annualReturn(index, today);
			if (annualReturn != null) {
				benchmarks.add(new Benchmark(index.getName(), annualReturn, index.getDescription(), today));
			}
		}
		if (benchmarks.isEmpty()) {
			logger.warn("No benchmark data available, using static defaults");
			return DEFAULTS.stream()
					.map(index -> new Benchmark(index.getName(), index.getFallbackReturn(), index.getDescription(), today))
					.toList();
		}
		return benchmarks;
	}

	private BigDecimal annualReturn(BenchmarkIndex index, LocalDate today) {
		try {
			List<HistoricalClose> closes = marketDataProvider.dailyCloses(index.getSymbol(), today.minusYears(1), today);
			if (closes.size() < 2) {
				logger.warn("Not enough history for benchmark {}", index.getName());
				return null;
			}
			BigDecimal first = closes.get(0).close();
			BigDecimal last = closes.get(closes.size() - 1).close();
			if (first.signum() == 0) {
				return null;
			}
			return DecimalMath.percent(last.subtract(first), first).setScale(2, RoundingMode.HALF_UP);
		} catch (MarketDataException ex) {
			logger.warn("Benchmark {} unavailable: {} {}", index.getName(), ex.getReason(), ex.getMessage());
			return null;
		}
	}
}
