package my.pietracker.app.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for one external provider. Responses are cached per (scope, method, url), calls are
 * throttled by the provider's token bucket and concurrency cap, and failed attempts are retried
 * with a doubling delay. Never throws: every outcome is a {@link FetchResult}.
 */
public class ResilientApiClient {
	private static final Logger logger = LoggerFactory.getLogger(ResilientApiClient.class);
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_PERMIT_TIMEOUT = Duration.ofSeconds(30);

	private final String name;
	private final RestClient restClient;
	private final ObjectMapper objectMapper;
	private final ResponseCache cache;
	private final RateLimiter rateLimiter;
	private final Semaphore concurrency;
	private final Duration permitTimeout;

	public ResilientApiClient(String name,
							  ObjectMapper objectMapper,
							  ResponseCache cache,
							  RateLimiter rateLimiter,
							  int maxConcurrentCalls,
							  Duration connectTimeout,
							  Duration readTimeout,
							  Duration permitTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.name = name;
		this.objectMapper = objectMapper;
		this.cache = cache;
		this.rateLimiter = rateLimiter;
		this.concurrency = new Semaphore(Math.max(1, maxConcurrentCalls), true);
		this.permitTimeout = permitTimeout == null ? DEFAULT_PERMIT_TIMEOUT : permitTimeout;
	}

	public String getName() {
		return name;
	}

	public FetchResult<JsonNode> request(ApiRequest request) {
		CacheKey key = request.cacheKey();
		JsonNode cached = cache.get(key).orElse(null);
		if (cached != null) {
			logger.debug("Cache hit ({}): {} {}", name, request.method(), request.url());
			return FetchResult.success(cached);
		}

		long delayMillis = request.initialDelay().toMillis();
		int attempts = request.maxRetries() + 1;
		ApiRequestException lastError = null;
		for (int attempt = 1; attempt <= attempts; attempt++) {
			String body;
			try {
				body = execute(request);
			} catch (ApiRequestException ex) {
				if (ex.isAuthenticationFailure()) {
					logger.warn("{} rejected the credential (status {}), not retrying.", name, ex.getStatusCode());
					return FetchResult.failure(FailureReason.INVALID_CREDENTIAL, ex.getMessage());
				}
				if (!ex.isRetryable()) {
					return FetchResult.failure(FailureReason.TIMEOUT, ex.getMessage());
				}
				lastError = ex;
				logger.debug("{} attempt {}/{} failed for {} (status={}): {}",
						name, attempt, attempts, request.url(), ex.getStatusCode(), ex.getMessage());
				if (attempt == attempts) {
					break;
				}
				if (!pause(delayMillis)) {
					return FetchResult.failure(FailureReason.TIMEOUT, "Interrupted while backing off");
				}
				delayMillis = delayMillis * 2;
				continue;
			}

			if (body == null || body.isBlank()) {
				logger.warn("{} returned an empty body for {}", name, request.url());
				return FetchResult.failure(FailureReason.MALFORMED_DATA, "Empty response body");
			}
			JsonNode node;
			try {
				node = objectMapper.readTree(body);
			} catch (JsonProcessingException ex) {
				logger.warn("{} returned an unparseable body for {}: {}", name, request.url(), ex.getOriginalMessage());
				return FetchResult.failure(FailureReason.MALFORMED_DATA, "Response is not valid JSON");
			}
			cache.put(key, node);
			return FetchResult.success(node);
		}
		logger.error("{} request failed after {} attempts: {} (last status={})",
				name, attempts, request.url(), lastError == null ? null : lastError.getStatusCode());
		return FetchResult.failure(FailureReason.NETWORK, lastError == null ? "Request failed" : lastError.getMessage());
	}

	public void clearCache() {
		cache.clear();
	}

	private String execute(ApiRequest request) {
		if (!rateLimiter.acquirePermission()) {
			throw new ApiRequestException("Rate limit permit not granted", null, true, null);
		}
		boolean acquired;
		try {
			acquired = concurrency.tryAcquire(permitTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new ApiRequestException("Interrupted while waiting for a connection slot", null, false, ex);
		}
		if (!acquired) {
			throw new ApiRequestException("No connection slot available", null, true, null);
		}
		try {
			ResponseEntity<String> response = restClient.method(request.method())
					.uri(URI.create(request.url()))
					.headers(headers -> request.headers().forEach(headers::set))
					.retrieve()
					.toEntity(String.class);
			return response.getBody();
		} catch (RestClientResponseException ex) {
			int status = ex.getStatusCode().value();
			throw new ApiRequestException("HTTP " + status, status, isRetryable(status), ex);
		} catch (ResourceAccessException ex) {
			throw new ApiRequestException(safeMessage(ex), null, true, ex);
		} catch (RuntimeException ex) {
			throw new ApiRequestException(safeMessage(ex), null, true, ex);
		} finally {
			concurrency.release();
		}
	}

	private boolean pause(long millis) {
		if (millis <= 0) {
			return true;
		}
		try {
			Thread.sleep(millis);
			return true;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private boolean isRetryable(int status) {
		return status != 401 && status != 403;
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
