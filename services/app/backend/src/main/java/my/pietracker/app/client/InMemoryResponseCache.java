package my.pietracker.app.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryResponseCache implements ResponseCache {
	private static final Logger logger = LoggerFactory.getLogger(InMemoryResponseCache.class);

	private final Map<CacheKey, Entry> entries = new ConcurrentHashMap<>();
	private final Duration ttl;
	private final Clock clock;

	public InMemoryResponseCache(Duration ttl, Clock clock) {
		if (ttl == null || ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("Cache TTL must be positive");
		}
		this.ttl = ttl;
		this.clock = clock == null ? Clock.systemUTC() : clock;
	}

	@Override
	public Optional<JsonNode> get(CacheKey key) {
		cleanupExpired();
		Entry entry = entries.get(key);
		if (entry == null) {
			return Optional.empty();
		}
		return Optional.of(entry.value());
	}

	@Override
	public void put(CacheKey key, JsonNode value) {
		if (key == null || value == null) {
			return;
		}
		entries.put(key, new Entry(value, clock.instant()));
	}

	@Override
	public Duration ttl() {
		return ttl;
	}

	@Override
	public void clear() {
		int size = entries.size();
		entries.clear();
		logger.info("Response cache cleared ({} entries).", size);
	}

	int size() {
		return entries.size();
	}

	private void cleanupExpired() {
		Instant now = clock.instant();
		entries.entrySet().removeIf(entry -> !entry.getValue().storedAt().plus(ttl).isAfter(now));
	}

	private record Entry(JsonNode value, Instant storedAt) {
	}
}
