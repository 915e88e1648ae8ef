package my.pietracker.app.model;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Trailing price change in percent per window. A null window means no close existed on or
 * before the window boundary, or market data was unavailable.
 */
public record InstrumentPerformance(BigDecimal oneDay,
									BigDecimal oneWeek,
									BigDecimal oneMonth,
									BigDecimal threeMonths,
									BigDecimal oneYear) {
	private static final InstrumentPerformance UNAVAILABLE = new InstrumentPerformance(null, null, null, null, null);

	public static InstrumentPerformance unavailable() {
		return UNAVAILABLE;
	}

	public static InstrumentPerformance of(Map<PerformanceWindow, BigDecimal> values) {
		Map<PerformanceWindow, BigDecimal> safe = values == null ? Map.of() : new EnumMap<>(values);
		return new InstrumentPerformance(
				safe.get(PerformanceWindow.ONE_DAY),
				safe.get(PerformanceWindow.ONE_WEEK),
				safe.get(PerformanceWindow.ONE_MONTH),
				safe.get(PerformanceWindow.THREE_MONTHS),
				safe.get(PerformanceWindow.ONE_YEAR));
	}

	public BigDecimal get(PerformanceWindow window) {
		return switch (window) {
			case ONE_DAY -> oneDay;
			case ONE_WEEK -> oneWeek;
			case ONE_MONTH -> oneMonth;
			case THREE_MONTHS -> threeMonths;
			case ONE_YEAR -> oneYear;
		};
	}
}
