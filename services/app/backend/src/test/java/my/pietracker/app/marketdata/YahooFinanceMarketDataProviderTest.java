package my.pietracker.app.marketdata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import my.pietracker.app.client.InMemoryResponseCache;
import my.pietracker.app.client.ResilientApiClient;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.HistoricalClose;
import my.pietracker.app.support.TestProperties;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YahooFinanceMarketDataProviderTest {
	@Test
	void readsDividendYieldFromQuote() throws IOException {
		HttpServer server = start("/v7/finance/quote",
				new JsonHandler(200, "{\"quoteResponse\":{\"result\":[{\"symbol\":\"VOD.L\",\"dividendYield\":5.456}]}}"));
		try {
			BigDecimal yield = provider(server).dividendYield("VOD.L");

			assertThat(yield).isEqualByComparingTo("5.46");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void fallsBackToTrailingYield() throws IOException {
		HttpServer server = start("/v7/finance/quote",
				new JsonHandler(200, "{\"quoteResponse\":{\"result\":[{\"trailingAnnualDividendYield\":0.0123}]}}"));
		try {
			assertThat(provider(server).dividendYield("AAPL")).isEqualByComparingTo("1.23");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void quoteWithoutYieldIsZero() throws IOException {
		HttpServer server = start("/v7/finance/quote",
				new JsonHandler(200, "{\"quoteResponse\":{\"result\":[{\"symbol\":\"BRK-B\"}]}}"));
		try {
			assertThat(provider(server).dividendYield("BRK-B")).isEqualByComparingTo("0");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void parsesChartClosesAndDropsNulls() throws IOException {
		String body = "{\"chart\":{\"result\":[{\"timestamp\":[1717372800,1717459200,1717545600],"
				+ "\"indicators\":{\"quote\":[{\"close\":[100.5,null,102.25]}]}}]}}";
		JsonHandler handler = new JsonHandler(200, body);
		HttpServer server = start("/v8/finance/chart", handler);
		try {
			List<HistoricalClose> closes = provider(server)
					.dailyCloses("AAPL", LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 5));

			assertThat(closes).extracting(HistoricalClose::date)
					.containsExactly(LocalDate.of(2024, 6, 3), LocalDate.of(2024, 6, 5));
			assertThat(closes.get(1).close()).isEqualByComparingTo("102.25");
			assertThat(handler.lastQuery.get()).contains("interval=1d").contains("period1=1717200000");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void failedRequestRaisesMarketDataException() throws IOException {
		HttpServer server = start("/v7/finance/quote", new JsonHandler(404, "{}"));
		try {
			YahooFinanceMarketDataProvider provider = provider(server);

			assertThatThrownBy(() -> provider.dividendYield("NOPE"))
					.isInstanceOf(MarketDataException.class)
					.extracting(ex -> ((MarketDataException) ex).getReason())
					.isEqualTo(FailureReason.NETWORK);
		} finally {
			server.stop(0);
		}
	}

	private static YahooFinanceMarketDataProvider provider(HttpServer server) {
		RateLimiter limiter = RateLimiter.of("yahoo-test", RateLimiterConfig.custom()
				.limitForPeriod(100)
				.limitRefreshPeriod(Duration.ofSeconds(1))
				.timeoutDuration(Duration.ofSeconds(1))
				.build());
		ResilientApiClient client = new ResilientApiClient("market-data", new ObjectMapper(),
				new InMemoryResponseCache(Duration.ofMinutes(5), null), limiter, 2,
				Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(1));
		String baseUrl = "http://localhost:" + server.getAddress().getPort();
		return new YahooFinanceMarketDataProvider(client, TestProperties.withBaseUrls("http://localhost:1", baseUrl));
	}

	private static HttpServer start(String path, HttpHandler handler) throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext(path, handler);
		server.start();
		return server;
	}

	private static class JsonHandler implements HttpHandler {
		private final int status;
		private final String body;
		private final AtomicReference<String> lastQuery = new AtomicReference<>();

		JsonHandler(int status, String body) {
			this.status = status;
			this.body = body;
		}

		@Override
		public void handle(HttpExchange exchange) throws IOException {
			lastQuery.set(exchange.getRequestURI().getQuery());
			byte[] payload = body.getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().add("Content-Type", "application/json");
			exchange.sendResponseHeaders(status, payload.length);
			try (OutputStream os = exchange.getResponseBody()) {
				os.write(payload);
			}
		}
	}
}
