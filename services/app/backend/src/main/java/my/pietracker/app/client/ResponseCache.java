package my.pietracker.app.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

public interface ResponseCache {
	Optional<JsonNode> get(CacheKey key);

	void put(CacheKey key, JsonNode value);

	Duration ttl();

	void clear();
}
