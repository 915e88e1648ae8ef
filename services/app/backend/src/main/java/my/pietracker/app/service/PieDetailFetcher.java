package my.pietracker.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import my.pietracker.app.broker.BrokerGateway;
import my.pietracker.app.marketdata.InstrumentMarketDataService;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import my.pietracker.app.model.InstrumentMarketData;
import my.pietracker.app.model.InstrumentMetadata;
import my.pietracker.app.model.PieData;
import my.pietracker.app.model.PieInstrument;
import my.pietracker.app.util.DecimalMath;
import my.pietracker.app.util.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
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

@Service
public class PieDetailFetcher {
	private static final Logger logger = LoggerFactory.getLogger(PieDetailFetcher.class);

	static final String DEFAULT_NAME = "Unnamed Pie";
	static final String DEFAULT_DIVIDEND_ACTION = "unknown";

	private final BrokerGateway brokerGateway;
	private final InstrumentMarketDataService marketDataService;
	private final Clock clock;

	public PieDetailFetcher(BrokerGateway brokerGateway, InstrumentMarketDataService marketDataService, Clock clock) {
		this.brokerGateway = brokerGateway;
		this.marketDataService = marketDataService;
		this.clock = clock;
	}

	public FetchResult<PieData> fetchPie(String userId,
										 String pieId,
										 Map<String, InstrumentMetadata> metadata,
										 RefreshContext context) {
		FetchResult<JsonNode> response = brokerGateway.get(userId, BrokerGateway.pie(pieId));
		if (!response.isSuccess()) {
			logger.warn("Could not fetch details for pie {}: {}", pieId, response.failure());
			return response.propagate();
		}
		JsonNode root = response.value();
		if (!root.isObject()) {
			logger.warn("Pie {} details are not an object", pieId);
			return FetchResult.failure(FailureReason.MALFORMED_DATA, "Pie details are not an object");
		}

		JsonNode settings = root.path("settings");
		String name = JsonValues.textOrDefault(settings, "name", DEFAULT_NAME);
		String creationDate = JsonValues.text(settings, "creationDate");
		if (creationDate == null) {
			creationDate = clock.instant().toString();
		}
		String dividendCashAction = JsonValues.textOrDefault(settings, "dividendCashAction", DEFAULT_DIVIDEND_ACTION);

		List<PieInstrument> holdings = new ArrayList<>();
		JsonNode instruments = root.path("instruments");
		if (instruments.isArray()) {
			for (JsonNode instrument : instruments) {
				holdings.add(toHolding(instrument, metadata));
			}
		}
		List<PieInstrument> enriched = enrich(pieId, holdings, context);

		BigDecimal totalInvested = BigDecimal.ZERO;
		BigDecimal totalResult = BigDecimal.ZERO;
		for (PieInstrument holding : enriched) {
			totalInvested = totalInvested.add(holding.investedValue());
			totalResult = totalResult.add(holding.resultValue());
		}
		PieData pie = new PieData(pieId, name, creationDate, dividendCashAction, enriched, totalInvested, totalResult,
				DecimalMath.percent(totalResult, totalInvested), LocalDateTime.now(clock));
		logger.debug("Fetched pie {} ({}, {} holdings)", pieId, name, enriched.size());
		return FetchResult.success(pie);
	}

	private PieInstrument toHolding(JsonNode instrument, Map<String, InstrumentMetadata> metadata) {
		String ticker = JsonValues.textOrDefault(instrument, "ticker", "");
		JsonNode result = instrument.path("result");
		BigDecimal invested = JsonValues.decimalOrZero(result, "priceAvgInvestedValue");
		BigDecimal current = JsonValues.decimalOrZero(result, "priceAvgValue");
		InstrumentMetadata meta = metadata == null || ticker.isEmpty() ? null : metadata.get(ticker);
		return new PieInstrument(
				ticker,
				meta == null ? null : meta.name(),
				meta == null ? null : meta.currencyCode(),
				meta == null ? null : meta.type(),
				meta == null ? null : meta.addedOn(),
				meta == null ? null : meta.maxOpenQuantity(),
				meta == null ? null : meta.minTradeQuantity(),
				JsonValues.decimalOrZero(instrument, "currentShare"),
				JsonValues.decimalOrZero(instrument, "expectedShare"),
				JsonValues.bool(instrument, "issues"),
				JsonValues.decimalOrZero(instrument, "ownedQuantity"),
				invested,
				current,
				current.subtract(invested),
				BigDecimal.ZERO,
				null);
	}

	private List<PieInstrument> enrich(String pieId, List<PieInstrument> holdings, RefreshContext context) {
		List<Future<InstrumentMarketData>> futures = new ArrayList<>(holdings.size());
		for (PieInstrument holding : holdings) {
			futures.add(submit(holding.ticker(), context));
		}
		List<PieInstrument> enriched = new ArrayList<>(holdings.size());
		for (int i = 0; i < holdings.size(); i++) {
			PieInstrument holding = holdings.get(i);
			enriched.add(holding.withMarketData(await(pieId, holding.ticker(), futures.get(i), context)));
		}
		return enriched;
	}

	private Future<InstrumentMarketData> submit(String ticker, RefreshContext context) {
		if (ticker == null || ticker.isEmpty()) {
			return null;
		}
		try {
			return context.instrumentExecutor().submit(() -> marketDataService.fetch(ticker));
		} catch (RejectedExecutionException ex) {
			logger.warn("Market data task for {} rejected: {}", ticker, ex.getMessage());
			return null;
		}
	}

	private InstrumentMarketData await(String pieId, String ticker, Future<InstrumentMarketData> future,
									   RefreshContext context) {
		if (future == null) {
			return InstrumentMarketData.unavailable(ticker);
		}
		try {
			return future.get(context.enrichmentRemaining().toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException ex) {
			future.cancel(true);
			logger.warn("Market data for {} in pie {} missed the enrichment deadline", ticker, pieId);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			logger.warn("Interrupted while waiting for market data of {}", ticker);
		} catch (ExecutionException ex) {
			logger.warn("Market data task for {} failed", ticker, ex.getCause());
		} catch (CancellationException ex) {
			logger.warn("Market data task for {} was cancelled", ticker);
		}
		return InstrumentMarketData.unavailable(ticker);
	}
}
