package my.pietracker.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import my.pietracker.app.broker.BrokerGateway;
import my.pietracker.app.config.AppProperties;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import my.pietracker.app.model.InstrumentMetadata;
import my.pietracker.app.util.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads the broker's instrument catalogue, keyed by ticker. A successfully built catalogue is
 * reused per user until it is older than the metadata TTL, then reloaded wholesale.
 */
@Service
public class InstrumentMetadataLoader {
	private static final Logger logger = LoggerFactory.getLogger(InstrumentMetadataLoader.class);

	private final BrokerGateway brokerGateway;
	private final Clock clock;
	private final Duration ttl;
	private final Map<String, Catalogue> catalogues = new ConcurrentHashMap<>();

	@Autowired
	public InstrumentMetadataLoader(BrokerGateway brokerGateway, Clock clock, AppProperties properties) {
		this(brokerGateway, clock, Duration.ofMinutes(properties.cache().metadataTtlMinutes()));
	}

	InstrumentMetadataLoader(BrokerGateway brokerGateway, Clock clock, Duration ttl) {
		this.brokerGateway = brokerGateway;
		this.clock = clock;
		this.ttl = ttl;
	}

	public FetchResult<Map<String, InstrumentMetadata>> loadAllMetadata(String userId) {
		Instant now = clock.instant();
		Catalogue cached = catalogues.get(userId);
		if (cached != null && cached.loadedAt().plus(ttl).isAfter(now)) {
			logger.debug("Using cached instrument catalogue for user {} ({} entries)", userId, cached.byTicker().size());
			return FetchResult.success(cached.byTicker());
		}

		FetchResult<JsonNode> response = brokerGateway.get(userId, BrokerGateway.INSTRUMENTS);
		if (!response.isSuccess()) {
			logger.error("Failed to fetch instrument metadata for user {}: {}", userId, response.failure());
			return response.propagate();
		}
		JsonNode root = response.value();
		if (!root.isArray()) {
			logger.error("Instrument metadata is not an array (user {})", userId);
			return FetchResult.failure(FailureReason.MALFORMED_DATA, "Instrument metadata is not an array");
		}

		Map<String, InstrumentMetadata> byTicker = new LinkedHashMap<>();
		int skipped = 0;
		for (JsonNode item : root) {
			String ticker = JsonValues.text(item, "ticker");
			if (ticker == null) {
				skipped++;
				continue;
			}
			byTicker.put(ticker, new InstrumentMetadata(
					ticker,
					JsonValues.text(item, "name"),
					JsonValues.text(item, "currencyCode"),
					JsonValues.text(item, "type"),
					JsonValues.text(item, "addedOn"),
					JsonValues.decimal(item, "maxOpenQuantity"),
					JsonValues.decimal(item, "minTradeQuantity")));
		}
		if (skipped > 0) {
			logger.warn("Skipped {} catalogue entries without ticker", skipped);
		}
		Map<String, InstrumentMetadata> catalogue = Collections.unmodifiableMap(byTicker);
		catalogues.put(userId, new Catalogue(catalogue, now));
		logger.info("Loaded instrument catalogue for user {} ({} instruments)", userId, catalogue.size());
		return FetchResult.success(catalogue);
	}

	public void evict(String userId) {
		catalogues.remove(userId);
	}

	private record Catalogue(Map<String, InstrumentMetadata> byTicker, Instant loadedAt) {
	}
}
