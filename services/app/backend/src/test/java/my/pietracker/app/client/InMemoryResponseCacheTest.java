package my.pietracker.app.client;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import my.pietracker.app.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryResponseCacheTest {
	private static final CacheKey KEY = new CacheKey("alice", "GET", "https://broker/pies");

	@Test
	void returnsEntryWithinTtl() {
		MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
		InMemoryResponseCache cache = new InMemoryResponseCache(Duration.ofMinutes(5), clock);
		cache.put(KEY, JsonNodeFactory.instance.textNode("cached"));

		clock.advance(Duration.ofMinutes(4));

		assertThat(cache.get(KEY)).hasValueSatisfying(node -> assertThat(node.asText()).isEqualTo("cached"));
	}

	@Test
	void expiresEntryAfterTtl() {
		MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
		InMemoryResponseCache cache = new InMemoryResponseCache(Duration.ofMinutes(5), clock);
		cache.put(KEY, JsonNodeFactory.instance.textNode("cached"));

		clock.advance(Duration.ofMinutes(5));

		assertThat(cache.get(KEY)).isEmpty();
		assertThat(cache.size()).isZero();
	}

	@Test
	void scopesEntriesByUser() {
		InMemoryResponseCache cache = new InMemoryResponseCache(Duration.ofMinutes(5), null);
		cache.put(KEY, JsonNodeFactory.instance.textNode("alice"));

		assertThat(cache.get(new CacheKey("bob", "GET", "https://broker/pies"))).isEmpty();
	}

	@Test
	void clearRemovesEverything() {
		InMemoryResponseCache cache = new InMemoryResponseCache(Duration.ofMinutes(5), null);
		cache.put(KEY, JsonNodeFactory.instance.textNode("cached"));

		cache.clear();

		assertThat(cache.get(KEY)).isEmpty();
	}

	@Test
	void rejectsNonPositiveTtl() {
		assertThatThrownBy(() -> new InMemoryResponseCache(Duration.ZERO, null))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
