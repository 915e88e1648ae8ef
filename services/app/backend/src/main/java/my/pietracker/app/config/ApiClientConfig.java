package my.pietracker.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import my.pietracker.app.client.InMemoryResponseCache;
import my.pietracker.app.client.ResilientApiClient;
import my.pietracker.app.client.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ApiClientConfig {
	private static final Logger logger = LoggerFactory.getLogger(ApiClientConfig.class);

	public static final String BROKER_CLIENT = "brokerApiClient";
	public static final String MARKET_DATA_CLIENT = "marketDataApiClient";

	@Bean
	@ConditionalOnMissingBean(Clock.class)
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	@ConditionalOnMissingBean(ResponseCache.class)
	public ResponseCache responseCache(AppProperties properties, Clock clock) {
		Duration ttl = Duration.ofSeconds(properties.cache().ttlSeconds());
		logger.info("Response cache enabled (ttl={}).", ttl);
		return new InMemoryResponseCache(ttl, clock);
	}

	@Bean
	public RateLimiterRegistry rateLimiterRegistry() {
		return RateLimiterRegistry.ofDefaults();
	}

	@Bean(name = BROKER_CLIENT)
	public ResilientApiClient brokerApiClient(AppProperties properties,
											  ObjectMapper objectMapper,
											  ResponseCache responseCache,
											  RateLimiterRegistry registry) {
		AppProperties.Broker broker = properties.broker();
		RateLimiter limiter = rateLimiter(registry, "broker", broker.requestsPerSecond(), properties.http());
		logger.info("Broker client enabled (service={}, rps={}, maxConcurrent={}).",
				broker.serviceName(), broker.requestsPerSecond(), broker.maxConcurrentCalls());
		return buildClient("broker", properties, objectMapper, responseCache, limiter, broker.maxConcurrentCalls());
	}

	@Bean(name = MARKET_DATA_CLIENT)
	public ResilientApiClient marketDataApiClient(AppProperties properties,
												  ObjectMapper objectMapper,
												  ResponseCache responseCache,
												  RateLimiterRegistry registry) {
		AppProperties.MarketData marketData = properties.marketData();
		RateLimiter limiter = rateLimiter(registry, "market-data", marketData.requestsPerSecond(), properties.http());
		logger.info("Market data client enabled (baseUrl={}, rps={}, maxConcurrent={}).",
				marketData.baseUrl(), marketData.requestsPerSecond(), marketData.maxConcurrentCalls());
		return buildClient("market-data", properties, objectMapper, responseCache, limiter,
				marketData.maxConcurrentCalls());
	}

	private ResilientApiClient buildClient(String name,
										   AppProperties properties,
										   ObjectMapper objectMapper,
										   ResponseCache responseCache,
										   RateLimiter limiter,
										   int maxConcurrentCalls) {
		AppProperties.Http http = properties.http();
		return new ResilientApiClient(name, objectMapper, responseCache, limiter, maxConcurrentCalls,
				seconds(http.connectTimeoutSeconds(), 10),
				seconds(http.readTimeoutSeconds(), 10),
				seconds(http.rateLimitTimeoutSeconds(), 30));
	}

	private RateLimiter rateLimiter(RateLimiterRegistry registry, String name, int requestsPerSecond,
									AppProperties.Http http) {
		RateLimiterConfig config = RateLimiterConfig.custom()
				.limitForPeriod(Math.max(1, requestsPerSecond))
				.limitRefreshPeriod(Duration.ofSeconds(1))
				.timeoutDuration(seconds(http.rateLimitTimeoutSeconds(), 30))
				.build();
		return registry.rateLimiter(name, config);
	}

	private Duration seconds(Integer value, int fallback) {
		return Duration.ofSeconds(value == null || value <= 0 ? fallback : value);
	}
}
