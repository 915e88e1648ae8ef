package my.pietracker.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import my.pietracker.app.broker.BrokerGateway;
import my.pietracker.app.config.AppProperties;
import my.pietracker.app.model.AllocationAnalysis;
import my.pietracker.app.model.Benchmark;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import my.pietracker.app.model.InstrumentMetadata;
import my.pietracker.app.model.OverallSummary;
import my.pietracker.app.model.PerformanceMetrics;
import my.pietracker.app.model.PieData;
import my.pietracker.app.model.PortfolioAggregate;
import my.pietracker.app.model.TargetInvestments;
import my.pietracker.app.model.UserSettings;
import my.pietracker.app.util.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs one refresh cycle: cash, instrument catalogue, pies, then the derived analysis. Always
 * returns a structurally valid snapshot; a failed stage is recorded on it instead of thrown.
 */
@Service
public class PortfolioOrchestrator {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioOrchestrator.class);

	private final BrokerGateway brokerGateway;
	private final InstrumentMetadataLoader metadataLoader;
	private final PortfolioAggregator aggregator;
	private final AllocationAnalyzer allocationAnalyzer;
	private final RebalancePlanner rebalancePlanner;
	private final BenchmarkService benchmarkService;
	private final AppProperties properties;
	private final Clock clock;

	public PortfolioOrchestrator(BrokerGateway brokerGateway,
								 InstrumentMetadataLoader metadataLoader,
								 PortfolioAggregator aggregator,
								 AllocationAnalyzer allocationAnalyzer,
								 RebalancePlanner rebalancePlanner,
								 BenchmarkService benchmarkService,
								 AppProperties properties,
								 Clock clock) {
		this.brokerGateway = brokerGateway;
		this.metadataLoader = metadataLoader;
		this.aggregator = aggregator;
		this.allocationAnalyzer = allocationAnalyzer;
		this.rebalancePlanner = rebalancePlanner;
		this.benchmarkService = benchmarkService;
		this.properties = properties;
		this.clock = clock;
	}

	public PerformanceMetrics fetchPortfolioData(String userId, UserSettings settings) {
		UserSettings resolved = resolve(settings);
		LocalDateTime fetchDate = LocalDateTime.now(clock);
		PerformanceMetrics empty = PerformanceMetrics.empty(resolved.country(), fetchDate);
		logger.info("Portfolio refresh started (user={}, country={})", userId, resolved.country());
		try {
			return refresh(userId, resolved, empty);
		} catch (RuntimeException ex) {
			logger.error("Portfolio refresh failed unexpectedly (user={})", userId, ex);
			return empty.withFailure(FailureReason.INTERNAL, "Unexpected error: " + ex.getMessage());
		}
	}

	private PerformanceMetrics refresh(String userId, UserSettings settings, PerformanceMetrics empty) {
		FetchResult<BigDecimal> cash = fetchFreeCash(userId);
		if (!cash.isSuccess()) {
			logger.error("Failed to fetch cash data (user={}): {}", userId, cash.failure());
			return empty.withFailure(cash.failure(), cash.message());
		}
		PerformanceMetrics withCash = new PerformanceMetrics(null, null, null, null, cash.value(), List.of(),
				settings.country(), empty.fetchDate(), null, null);

		FetchResult<Map<String, InstrumentMetadata>> metadata = metadataLoader.loadAllMetadata(userId);
		if (!metadata.isSuccess()) {
			logger.error("Failed to fetch instrument metadata (user={}): {}", userId, metadata.failure());
			return withCash.withFailure(metadata.failure(), metadata.message());
		}

		AppProperties.Refresh refresh = properties.refresh();
		ExecutorService pieExecutor = Executors.newFixedThreadPool(Math.max(1, refresh.maxParallelPies()));
		ExecutorService instrumentExecutor = Executors.newFixedThreadPool(Math.max(1, refresh.maxParallelInstruments()));
		FetchResult<PortfolioAggregate> aggregate;
		try {
			RefreshContext context = RefreshContext.start(pieExecutor, instrumentExecutor,
					Duration.ofSeconds(refresh.deadlineSeconds()), clock);
			aggregate = aggregator.fetchAllPies(userId, metadata.value(),
					Duration.ofMillis(refresh.interPieDelayMillis()), context);
		} finally {
			pieExecutor.shutdownNow();
			instrumentExecutor.shutdownNow();
		}
		if (!aggregate.isSuccess()) {
			return withCash.withFailure(aggregate.failure(), aggregate.message());
		}

		LocalDateTime stamp = LocalDateTime.now(clock);
		List<PieData> pies = aggregate.value().pies().stream().map(pie -> pie.withFetchDate(stamp)).toList();
		OverallSummary summary = aggregate.value().overallSummary().withFetchDate(stamp);

		AllocationAnalysis analysis = allocationAnalyzer.analyze(pies, summary, settings.monthlyBudget());
		TargetInvestments plan = null;
		if (analysis != null) {
			plan = rebalancePlanner.planRebalance(analysis.categoryInvested(), analysis.targetAllocation(),
					settings.monthlyBudget());
		}
		List<Benchmark> benchmarks = properties.benchmarksEnabled() ? benchmarkService.getBenchmarks() : List.of();

		logger.info("Portfolio refresh finished (user={}, pies={}, invested={})",
				userId, pies.size(), summary.totalInvestedOverall());
		return new PerformanceMetrics(pies, summary, analysis, plan, cash.value(), benchmarks,
				settings.country(), stamp, null, null);
	}

	FetchResult<BigDecimal> fetchFreeCash(String userId) {
		FetchResult<JsonNode> response = brokerGateway.get(userId, BrokerGateway.CASH);
		if (!response.isSuccess()) {
			return response.propagate();
		}
		JsonNode root = response.value();
		if (root.isArray()) {
			BigDecimal total = BigDecimal.ZERO;
			for (JsonNode entry : root) {
				total = total.add(JsonValues.decimalOrZero(entry, "cash"));
			}
			return FetchResult.success(total);
		}
		if (root.isObject()) {
			return FetchResult.success(JsonValues.decimalOrZero(root, "free"));
		}
		return FetchResult.success(BigDecimal.ZERO);
	}

	private UserSettings resolve(UserSettings settings) {
		AppProperties.Refresh refresh = properties.refresh();
		BigDecimal budget = settings == null || settings.monthlyBudget() == null
				? refresh.defaultMonthlyBudget()
				: settings.monthlyBudget();
		String country = settings == null || settings.country() == null || settings.country().isBlank()
				? refresh.defaultCountry()
				: settings.country();
		return new UserSettings(budget, country);
	}
}
