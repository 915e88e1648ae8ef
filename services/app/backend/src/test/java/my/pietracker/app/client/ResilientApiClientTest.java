package my.pietracker.app.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ResilientApiClientTest {
	@Test
	void cachedResponseIsServedWithoutSecondCall() throws IOException {
		SequenceHandler handler = new SequenceHandler(List.of(new Reply(200, "[{\"id\":1}]")));
		HttpServer server = start(handler);
		try {
			ResilientApiClient client = client();
			ApiRequest request = request(server, "alice", 3);

			FetchResult<JsonNode> first = client.request(request);
			FetchResult<JsonNode> second = client.request(request);

			assertThat(first.isSuccess()).isTrue();
			assertThat(second.value()).isEqualTo(first.value());
			assertThat(handler.hits.get()).isEqualTo(1);
		} finally {
			server.stop(0);
		}
	}

	@Test
	void differentScopesDoNotShareCache() throws IOException {
		SequenceHandler handler = new SequenceHandler(List.of(new Reply(200, "{\"free\":1}")));
		HttpServer server = start(handler);
		try {
			ResilientApiClient client = client();

			client.request(request(server, "alice", 0));
			client.request(request(server, "bob", 0));

			assertThat(handler.hits.get()).isEqualTo(2);
		} finally {
			server.stop(0);
		}
	}

	@Test
	void retriesServerErrorsUntilSuccess() throws IOException {
		SequenceHandler handler = new SequenceHandler(List.of(
				new Reply(500, "{}"),
				new Reply(503, "{}"),
				new Reply(200, "{\"free\":12.5}")));
		HttpServer server = start(handler);
		try {
			FetchResult<JsonNode> result = client().request(request(server, "alice", 3));

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.value().get("free").decimalValue()).isEqualByComparingTo("12.5");
			assertThat(handler.hits.get()).isEqualTo(3);
		} finally {
			server.stop(0);
		}
	}

	@Test
	void stopsAfterMaxRetriesPlusOneAttempts() throws IOException {
		SequenceHandler handler = new SequenceHandler(List.of(new Reply(500, "{}")));
		HttpServer server = start(handler);
		try {
			FetchResult<JsonNode> result = client().request(request(server, "alice", 2));

			assertThat(result.isSuccess()).isFalse();
			assertThat(result.failure()).isEqualTo(FailureReason.NETWORK);
			assertThat(handler.hits.get()).isEqualTo(3);
		} finally {
			server.stop(0);
		}
	}

	@Test
	void backoffDoublesBetweenAttempts() throws IOException {
		SequenceHandler handler = new SequenceHandler(List.of(new Reply(503, "{}")));
		HttpServer server = start(handler);
		try {
			String url = "http://localhost:" + server.getAddress().getPort() + "/pies";
			ApiRequest request = ApiRequest.get(url, Map.of(), "alice", Duration.ofMillis(100), 3);

			FetchResult<JsonNode> result = client().request(request);

			assertThat(result.failure()).isEqualTo(FailureReason.NETWORK);
			List<Long> gaps = handler.gapsMillis();
			assertThat(gaps).hasSize(3);
			assertThat(gaps.get(0)).isGreaterThanOrEqualTo(100);
			assertThat(gaps.get(1)).isGreaterThanOrEqualTo(200);
			assertThat(gaps.get(2)).isGreaterThanOrEqualTo(400);
			assertThat(gaps.get(2)).isGreaterThan(gaps.get(0));
		} finally {
			server.stop(0);
		}
	}

	@Test
	void unauthorizedIsNotRetried() throws IOException {
		SequenceHandler handler = new SequenceHandler(List.of(new Reply(401, "{\"error\":\"bad key\"}")));
		HttpServer server = start(handler);
		try {
			FetchResult<JsonNode> result = client().request(request(server, "alice", 3));

			assertThat(result.failure()).isEqualTo(FailureReason.INVALID_CREDENTIAL);
			assertThat(handler.hits.get()).isEqualTo(1);
		} finally {
			server.stop(0);
		}
	}

	@Test
	void unparseableBodyIsMalformedAndNotCached() throws IOException {
		SequenceHandler handler = new SequenceHandler(List.of(new Reply(200, "<html>maintenance</html>")));
		HttpServer server = start(handler);
		try {
			ResilientApiClient client = client();
			ApiRequest request = request(server, "alice", 3);

			FetchResult<JsonNode> first = client.request(request);
			client.request(request);

			assertThat(first.failure()).isEqualTo(FailureReason.MALFORMED_DATA);
			assertThat(handler.hits.get()).isEqualTo(2);
		} finally {
			server.stop(0);
		}
	}

	@Test
	void sendsRequestHeaders() throws IOException {
		SequenceHandler handler = new SequenceHandler(List.of(new Reply(200, "{}")));
		HttpServer server = start(handler);
		try {
			client().request(request(server, "alice", 0));

			assertThat(handler.authorization.get()).isEqualTo("secret-key");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void unreachableHostIsReportedAsNetworkFailure() {
		ApiRequest request = ApiRequest.get("http://localhost:1/pies", Map.of(), "alice", Duration.ZERO, 1);

		FetchResult<JsonNode> result = client().request(request);

		assertThat(result.failure()).isEqualTo(FailureReason.NETWORK);
	}

	private static ResilientApiClient client() {
		RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
				.limitForPeriod(100)
				.limitRefreshPeriod(Duration.ofSeconds(1))
				.timeoutDuration(Duration.ofSeconds(1))
				.build());
		return new ResilientApiClient("test", new ObjectMapper(),
				new InMemoryResponseCache(Duration.ofMinutes(5), null), limiter, 2,
				Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(1));
	}

	private static ApiRequest request(HttpServer server, String scope, int maxRetries) {
		String url = "http://localhost:" + server.getAddress().getPort() + "/pies";
		return ApiRequest.get(url, Map.of("Authorization", "secret-key"), scope, Duration.ZERO, maxRetries);
	}

	private static HttpServer start(HttpHandler handler) throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/pies", handler);
		server.start();
		return server;
	}

	private record Reply(int status, String body) {
	}

	/**
	 * Replies in order; the last reply repeats once the sequence is exhausted.
	 */
	private static class SequenceHandler implements HttpHandler {
		private final Deque<Reply> replies;
		private final AtomicInteger hits = new AtomicInteger();
		private final AtomicReference<String> authorization = new AtomicReference<>();
		private final List<Long> arrivals = new CopyOnWriteArrayList<>();

		SequenceHandler(List<Reply> replies) {
			this.replies = new ArrayDeque<>(replies);
		}

		@Override
		public void handle(HttpExchange exchange) throws IOException {
			arrivals.add(System.nanoTime());
			hits.incrementAndGet();
			authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
			Reply reply;
			synchronized (replies) {
				reply = replies.size() > 1 ? replies.poll() : replies.peek();
			}
			byte[] payload = reply.body().getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().add("Content-Type", "application/json");
			exchange.sendResponseHeaders(reply.status(), payload.length);
			try (OutputStream os = exchange.getResponseBody()) {
				os.write(payload);
			}
		}

		List<Long> gapsMillis() {
			List<Long> gaps = new ArrayList<>();
			for (int i = 1; i < arrivals.size(); i++) {
				gaps.add(TimeUnit.NANOSECONDS.toMillis(arrivals.get(i) - arrivals.get(i - 1)));
			}
			return gaps;
		}
	}
}
