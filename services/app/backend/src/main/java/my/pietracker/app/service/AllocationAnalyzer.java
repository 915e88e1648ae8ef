package my.pietracker.app.service;

import my.pietracker.app.config.AppProperties;
import my.pietracker.app.model.AllocationAnalysis;
import my.pietracker.app.model.CategoryAllocation;
import my.pietracker.app.model.OverallSummary;
import my.pietracker.app.model.PieData;
import my.pietracker.app.util.DecimalMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
public class AllocationAnalyzer {
	private static final Logger logger = LoggerFactory.getLogger(AllocationAnalyzer.class);
	static final String SUMMARY_PIE_NAME = "OverallSummary";
	private static final BigDecimal DEFAULT_THRESHOLD = new BigDecimal("5");

	private final DividendEstimator dividendEstimator;
	private final BigDecimal rebalanceThreshold;

	@Autowired
	public AllocationAnalyzer(DividendEstimator dividendEstimator, AppProperties properties) {
		this(dividendEstimator, properties.refresh().rebalanceThresholdPercent());
	}

	AllocationAnalyzer(DividendEstimator dividendEstimator, BigDecimal rebalanceThreshold) {
		this.dividendEstimator = dividendEstimator;
		this.rebalanceThreshold = rebalanceThreshold == null ? DEFAULT_THRESHOLD : rebalanceThreshold;
	}

	/**
	 * Current vs target allocation by category, or {@code null} when pies or summary are absent.
	 * Pies whose names do not follow the category convention count towards the overall totals but
	 * not towards any category.
	 */
	public AllocationAnalysis analyze(List<PieData> pies, OverallSummary overallSummary, BigDecimal monthlyBudget) {
		if (pies == null || overallSummary == null) {
			return null;
		}

		Map<String, BigDecimal> targets = new LinkedHashMap<>();
		Map<String, BigDecimal> invested = new LinkedHashMap<>();
		for (PieData pie : pies) {
			if (SUMMARY_PIE_NAME.equals(pie.name())) {
				continue;
			}
			Optional<PieNameParser.ParsedPieName> parsed = PieNameParser.parse(pie.name());
			if (parsed.isEmpty()) {
				logger.debug("Pie '{}' has no category in its name, not bucketed", pie.name());
				continue;
			}
			String category = parsed.get().category();
			BigDecimal target = parsed.get().targetPercent();
			BigDecimal previous = targets.put(category, target);
			if (previous != null && previous.compareTo(target) != 0) {
				logger.warn("Category '{}' appears in several pies with different targets ({}% and {}%), using {}%",
						category, previous, target, target);
			}
			invested.merge(category, DecimalMath.nullToZero(pie.totalInvested()), BigDecimal::add);
		}

		BigDecimal bucketTotal = invested.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
		Map<String, CategoryAllocation> current = new LinkedHashMap<>();
		Map<String, String> differences = new LinkedHashMap<>();
		Map<String, BigDecimal> differencePercent = new LinkedHashMap<>();
		boolean rebalance = false;
		for (Map.Entry<String, BigDecimal> entry : targets.entrySet()) {
			String category = entry.getKey();
			BigDecimal value = invested.get(category);
			BigDecimal percent = DecimalMath.percent(value, bucketTotal);
			current.put(category, new CategoryAllocation(value, percent));
			BigDecimal difference = entry.getValue().subtract(percent);
			differencePercent.put(category, difference);
			differences.put(category, formatDifference(difference));
			if (difference.abs().compareTo(rebalanceThreshold) > 0) {
				rebalance = true;
			}
		}

		BigDecimal dividend = dividendEstimator.estimateAnnualDividend(pies, monthlyBudget);
		return new AllocationAnalysis(targets, current, differences, differencePercent, rebalance, dividend);
	}

	static String formatDifference(BigDecimal difference) {
		return String.format(Locale.ROOT, "%.2f%%", difference.setScale(2, RoundingMode.HALF_UP));
	}
}
