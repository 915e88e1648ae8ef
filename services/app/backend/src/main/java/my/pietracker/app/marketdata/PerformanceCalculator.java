package my.pietracker.app.marketdata;

import my.pietracker.app.model.HistoricalClose;
import my.pietracker.app.model.InstrumentPerformance;
import my.pietracker.app.model.PerformanceWindow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class PerformanceCalculator {
	private static final BigDecimal HUNDRED = new BigDecimal("100");

	private PerformanceCalculator() {
	}

	/**
	 * Percent change from the most recent close on or before {@code today - window} to the latest
	 * close. A window with no such point, or a zero reference, is null.
	 */
	public static InstrumentPerformance calculate(List<HistoricalClose> closes, LocalDate today) {
		if (closes == null || closes.isEmpty() || today == null) {
			return InstrumentPerformance.unavailable();
		}
		List<HistoricalClose> sorted = closes.stream()
				.filter(c -> c != null && c.date() != null && c.close() != null)
				.sorted(Comparator.comparing(HistoricalClose::date))
				.toList();
		if (sorted.isEmpty()) {
			return InstrumentPerformance.unavailable();
		}
		BigDecimal latest = sorted.get(sorted.size() - 1).close();
		Map<PerformanceWindow, BigDecimal> values = new EnumMap<>(PerformanceWindow.class);
		for (PerformanceWindow window : PerformanceWindow.values()) {
			LocalDate boundary = today.minusDays(window.days());
			BigDecimal reference = referenceClose(sorted, boundary);
			values.put(window, percentChange(reference, latest));
		}
		return InstrumentPerformance.of(values);
	}

	private static BigDecimal referenceClose(List<HistoricalClose> sorted, LocalDate boundary) {
		BigDecimal reference = null;
		for (HistoricalClose close : sorted) {
			if (close.date().isAfter(boundary)) {
				break;
			}
			reference = close.close();
		}
		return reference;
	}

	static BigDecimal percentChange(BigDecimal reference, BigDecimal latest) {
		if (reference == null || latest == null || reference.signum() == 0) {
			return null;
		}
		return latest.subtract(reference)
				.divide(reference, 8, RoundingMode.HALF_UP)
				.multiply(HUNDRED)
				.setScale(2, RoundingMode.HALF_UP);
	}
}
