package my.pietracker.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Broker broker,
		@Valid @NotNull MarketData marketData,
		@Valid @NotNull Http http,
		@Valid @NotNull Cache cache,
		@Valid @NotNull Refresh refresh,
		Benchmarks benchmarks,
		Credentials credentials
) {
	public record Broker(
			@NotBlank String baseUrl,
			@NotBlank String serviceName,
			@Positive int requestsPerSecond,
			@Positive int maxConcurrentCalls
	) {
	}

	public record MarketData(
			@NotBlank String baseUrl,
			@Positive int requestsPerSecond,
			@Positive int maxConcurrentCalls,
			@Positive int historyDays
	) {
	}

	public record Http(
			Integer connectTimeoutSeconds,
			Integer readTimeoutSeconds,
			@PositiveOrZero int maxRetries,
			@PositiveOrZero long initialDelaySeconds,
			Integer rateLimitTimeoutSeconds
	) {
	}

	public record Cache(
			@Positive long ttlSeconds,
			@Positive long metadataTtlMinutes
	) {
	}

	public record Refresh(
			@Positive int maxParallelPies,
			@Positive int maxParallelInstruments,
			@PositiveOrZero long interPieDelayMillis,
			@Positive long deadlineSeconds,
			BigDecimal defaultMonthlyBudget,
			String defaultCountry,
			BigDecimal rebalanceThresholdPercent
	) {
	}

	public record Benchmarks(
			boolean enabled
	) {
	}

	/**
	 * userId -> (service name -> API key).
	 */
	public record Credentials(
			Map<String, Map<String, String>> apiKeys
	) {
	}

	public boolean benchmarksEnabled() {
		return benchmarks == null || benchmarks.enabled();
	}
}
