package my.pietracker.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import my.pietracker.app.broker.BrokerGateway;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import my.pietracker.app.model.InstrumentMetadata;
import my.pietracker.app.model.OverallSummary;
import my.pietracker.app.model.PieData;
import my.pietracker.app.model.PortfolioAggregate;
import my.pietracker.app.util.DecimalMath;
import my.pietracker.app.util.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches every pie of a user in parallel and sums the included pies into an overall summary.
 * Pies that fail or whose details miss the refresh deadline are left out; the rest keep the
 * broker's order. Pies with slow market data still arrive, with degraded holdings.
 */
@Service
public class PortfolioAggregator {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioAggregator.class);

	private final BrokerGateway brokerGateway;
	private final PieDetailFetcher pieDetailFetcher;
	private final Clock clock;

	public PortfolioAggregator(BrokerGateway brokerGateway, PieDetailFetcher pieDetailFetcher, Clock clock) {
		this.brokerGateway = brokerGateway;
		this.pieDetailFetcher = pieDetailFetcher;
		this.clock = clock;
	}

	public FetchResult<PortfolioAggregate> fetchAllPies(String userId,
														Map<String, InstrumentMetadata> metadata,
														Duration interPieDelay,
														RefreshContext context) {
		FetchResult<JsonNode> response = brokerGateway.get(userId, BrokerGateway.PIES);
		if (!response.isSuccess()) {
			logger.error("Failed to fetch list of pies for user {}: {}", userId, response.failure());
			return response.propagate();
		}
		JsonNode list = response.value();
		if (!list.isArray()) {
			logger.error("Pie list for user {} is not an array", userId);
			return FetchResult.failure(FailureReason.MALFORMED_DATA, "Pie list is not an array");
		}

		List<String> pieIds = new ArrayList<>();
		for (JsonNode pie : list) {
			String pieId = JsonValues.text(pie, "id");
			if (pieId == null) {
				logger.warn("Pie without id encountered, skipping");
				continue;
			}
			pieIds.add(pieId);
		}

		List<Future<FetchResult<PieData>>> futures = new ArrayList<>(pieIds.size());
		for (int i = 0; i < pieIds.size(); i++) {
			String pieId = pieIds.get(i);
			if (i > 0 && !pause(interPieDelay)) {
				break;
			}
			try {
				futures.add(context.pieExecutor().submit(() -> pieDetailFetcher.fetchPie(userId, pieId, metadata, context)));
			} catch (RejectedExecutionException ex) {
				logger.warn("Pie {} could not be scheduled: {}", pieId, ex.getMessage());
				futures.add(null);
			}
		}

		List<PieData> pies = new ArrayList<>(futures.size());
		for (int i = 0; i < futures.size(); i++) {
			PieData pie = await(pieIds.get(i), futures.get(i), context);
			if (pie != null) {
				pies.add(pie);
			}
		}

		OverallSummary summary = summarize(pies, LocalDateTime.now(clock));
		logger.info("Fetched {}/{} pies for user {}", pies.size(), pieIds.size(), userId);
		return FetchResult.success(new PortfolioAggregate(pies, summary));
	}

	static OverallSummary summarize(List<PieData> pies, LocalDateTime fetchDate) {
		BigDecimal invested = BigDecimal.ZERO;
		BigDecimal result = BigDecimal.ZERO;
		for (PieData pie : pies) {
			invested = invested.add(DecimalMath.nullToZero(pie.totalInvested()));
			result = result.add(DecimalMath.nullToZero(pie.totalResult()));
		}
		return new OverallSummary(invested, result, DecimalMath.percent(result, invested), fetchDate);
	}

	private PieData await(String pieId, Future<FetchResult<PieData>> future, RefreshContext context) {
		if (future == null) {
			return null;
		}
		try {
			FetchResult<PieData> result = future.get(context.remaining().toMillis(), TimeUnit.MILLISECONDS);
			if (!result.isSuccess()) {
				logger.warn("Excluding pie {}: {} ({})", pieId, result.failure(), result.message());
				return null;
			}
			return result.value();
		} catch (TimeoutException ex) {
			future.cancel(true);
			logger.warn("Excluding pie {}: refresh deadline reached", pieId);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			logger.warn("Interrupted while waiting for pie {}", pieId);
		} catch (ExecutionException ex) {
			logger.error("Excluding pie {}: unexpected failure", pieId, ex.getCause());
		} catch (CancellationException ex) {
			logger.warn("Excluding pie {}: task cancelled", pieId);
		}
		return null;
	}

	private boolean pause(Duration delay) {
		if (delay == null || delay.isZero() || delay.isNegative()) {
			return true;
		}
		try {
			Thread.sleep(delay.toMillis());
			return true;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted between pie dispatches");
			return false;
		}
	}
}
