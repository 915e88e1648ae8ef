package my.pietracker.app.client;

import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * One outbound call. {@code cacheScope} partitions the response cache, usually the user id for
 * broker calls and the provider name for market data.
 */
public record ApiRequest(String url,
						 HttpMethod method,
						 Map<String, String> headers,
						 String cacheScope,
						 Duration initialDelay,
						 int maxRetries) {
	public ApiRequest {
		Objects.requireNonNull(url, "url");
		method = method == null ? HttpMethod.GET : method;
		headers = headers == null ? Map.of() : Map.copyOf(headers);
		cacheScope = cacheScope == null ? "" : cacheScope;
		initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
		maxRetries = Math.max(0, maxRetries);
	}

	public static ApiRequest get(String url, Map<String, String> headers, String cacheScope,
								 Duration initialDelay, int maxRetries) {
		return new ApiRequest(url, HttpMethod.GET, headers, cacheScope, initialDelay, maxRetries);
	}

	public CacheKey cacheKey() {
		return new CacheKey(cacheScope, method.name(), url);
	}
}
