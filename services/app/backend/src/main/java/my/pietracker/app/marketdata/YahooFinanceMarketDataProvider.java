package my.pietracker.app.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import my.pietracker.app.client.ApiRequest;
import my.pietracker.app.client.ResilientApiClient;
import my.pietracker.app.config.ApiClientConfig;
import my.pietracker.app.config.AppProperties;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import my.pietracker.app.model.HistoricalClose;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Market data from the Yahoo Finance quote ({@code /v7/finance/quote}) and chart
 * ({@code /v8/finance/chart}) endpoints. Responses are cached under the provider name, shared by
 * all users.
 */
@Component
public class YahooFinanceMarketDataProvider implements MarketDataProvider {
	private static final Logger logger = LoggerFactory.getLogger(YahooFinanceMarketDataProvider.class);
	private static final String CACHE_SCOPE = "yahoo-finance";
	private static final String USER_AGENT = "Mozilla/5.0 (compatible; pietracker/1.0)";
	private static final BigDecimal HUNDRED = new BigDecimal("100");

	private final ResilientApiClient client;
	private final String baseUrl;
	private final Duration initialDelay;
	private final int maxRetries;

	public YahooFinanceMarketDataProvider(@Qualifier(ApiClientConfig.MARKET_DATA_CLIENT) ResilientApiClient client,
										  AppProperties properties) {
		this.client = client;
		this.baseUrl = properties.marketData().baseUrl();
		this.initialDelay = Duration.ofSeconds(properties.http().initialDelaySeconds());
		this.maxRetries = properties.http().maxRetries();
	}

	@Override
	public BigDecimal dividendYield(String symbol) {
		String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
				.path("/v7/finance/quote")
				.queryParam("symbols", symbol)
				.toUriString();
		JsonNode root = fetch(url, symbol);
		JsonNode results = root.path("quoteResponse").path("result");
		if (!results.isArray()) {
			throw new MarketDataException(FailureReason.MALFORMED_DATA, "Quote response has no result list for " + symbol);
		}
		if (results.isEmpty()) {
			throw new MarketDataException(FailureReason.MALFORMED_DATA, "No quote for " + symbol);
		}
		JsonNode quote = results.get(0);
		JsonNode yield = quote.get("dividendYield");
		if (yield != null && yield.isNumber()) {
			return yield.decimalValue().setScale(2, RoundingMode.HALF_UP);
		}
		JsonNode trailing = quote.get("trailingAnnualDividendYield");
		if (trailing != null && trailing.isNumber()) {
			return trailing.decimalValue().multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP);
		}
		return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
	}

	@Override
	public List<HistoricalClose> dailyCloses(String symbol, LocalDate from, LocalDate to) {
		long period1 = from.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
		long period2 = to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
		String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
				.path("/v8/finance/chart/{symbol}")
				.queryParam("period1", period1)
				.queryParam("period2", period2)
				.queryParam("interval", "1d")
				.buildAndExpand(symbol)
				.toUriString();
		JsonNode root = fetch(url, symbol);
		JsonNode results = root.path("chart").path("result");
		if (!results.isArray() || results.isEmpty()) {
			throw new MarketDataException(FailureReason.MALFORMED_DATA, "Chart response has no result for " + symbol);
		}
		JsonNode result = results.get(0);
		JsonNode timestamps = result.path("timestamp");
		JsonNode closes = result.path("indicators").path("quote").path(0).path("close");
		if (!timestamps.isArray() || !closes.isArray()) {
			// A symbol without trades in the range has no timestamp array.
			return List.of();
		}
		int size = Math.min(timestamps.size(), closes.size());
		List<HistoricalClose> history = new ArrayList<>(size);
		for (int i = 0; i < size; i++) {
			JsonNode close = closes.get(i);
			JsonNode timestamp = timestamps.get(i);
			if (close == null || !close.isNumber() || timestamp == null || !timestamp.canConvertToLong()) {
				continue;
			}
			LocalDate date = Instant.ofEpochSecond(timestamp.asLong()).atZone(ZoneOffset.UTC).toLocalDate();
			history.add(new HistoricalClose(date, close.decimalValue()));
		}
		history.sort(Comparator.comparing(HistoricalClose::date));
		return history;
	}

	private JsonNode fetch(String url, String symbol) {
		FetchResult<JsonNode> result = client.request(ApiRequest.get(url,
				Map.of(HttpHeaders.USER_AGENT, USER_AGENT), CACHE_SCOPE, initialDelay, maxRetries));
		if (!result.isSuccess()) {
			logger.debug("Market data request for {} failed: {} ({})", symbol, result.failure(), result.message());
			throw new MarketDataException(result.failure(), result.message());
		}
		return result.value();
	}
}
