package my.pietracker.app.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Worker pools and deadlines of one refresh cycle. The orchestrator owns and shuts down both pools.
 * <p>
 * Market data enrichment stops at {@code enrichmentDeadline}, which comes before {@code deadline},
 * so a pie whose holdings are still loading returns degraded holdings while the aggregator is
 * still waiting for it.
 */
public record RefreshContext(ExecutorService pieExecutor,
							 ExecutorService instrumentExecutor,
							 Instant enrichmentDeadline,
							 Instant deadline,
							 Clock clock) {
	static final Duration MAX_ENRICHMENT_GRACE = Duration.ofSeconds(10);

	/**
	 * Starts a refresh window of {@code timeout}; enrichment gets the window minus a quarter of it,
	 * the reserved part capped at {@link #MAX_ENRICHMENT_GRACE}.
	 */
	public static RefreshContext start(ExecutorService pieExecutor,
									   ExecutorService instrumentExecutor,
									   Duration timeout,
									   Clock clock) {
		Instant now = clock.instant();
		Duration window = timeout.isNegative() ? Duration.ZERO : timeout;
		Duration grace = window.dividedBy(4);
		if (grace.compareTo(MAX_ENRICHMENT_GRACE) > 0) {
			grace = MAX_ENRICHMENT_GRACE;
		}
		Instant deadline = now.plus(window);
		return new RefreshContext(pieExecutor, instrumentExecutor, deadline.minus(grace), deadline, clock);
	}

	public Duration remaining() {
		return until(deadline);
	}

	public Duration enrichmentRemaining() {
		return until(enrichmentDeadline);
	}

	private Duration until(Instant instant) {
		Duration left = Duration.between(clock.instant(), instant);
		return left.isNegative() ? Duration.ZERO : left;
	}
}
