package my.pietracker.app.service;

import my.pietracker.app.model.AllocationAnalysis;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.PerformanceMetrics;
import my.pietracker.app.model.TargetInvestments;
import my.pietracker.app.model.UserSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

@Service
public class PortfolioService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioService.class);

	private final PortfolioOrchestrator orchestrator;
	private final PortfolioSnapshotStore snapshotStore;
	private final RebalancePlanner rebalancePlanner;
	private final DividendEstimator dividendEstimator;

	public PortfolioService(PortfolioOrchestrator orchestrator,
							PortfolioSnapshotStore snapshotStore,
							RebalancePlanner rebalancePlanner,
							DividendEstimator dividendEstimator) {
		this.orchestrator = orchestrator;
		this.snapshotStore = snapshotStore;
		this.rebalancePlanner = rebalancePlanner;
		this.dividendEstimator = dividendEstimator;
	}

	/**
	 * Latest snapshot of the user, refreshed from the broker when requested or when none is stored.
	 * Snapshots with a failed stage are returned but not stored.
	 */
	public PerformanceMetrics getPortfolio(String userId, boolean refresh, UserSettings settings) {
		requireUser(userId);
		if (!refresh) {
			Optional<PerformanceMetrics> stored = snapshotStore.findLatest(userId);
			if (stored.isPresent()) {
				logger.debug("Serving stored snapshot for user {}", userId);
				return stored.get();
			}
		}
		PerformanceMetrics snapshot = orchestrator.fetchPortfolioData(userId, settings);
		if (snapshot.failure() == FailureReason.MISSING_CREDENTIAL) {
			throw new BrokerNotConfiguredException("No broker API key configured for this user");
		}
		if (snapshot.hasFailure()) {
			logger.warn("Refresh for user {} ended with {}: {}", userId, snapshot.failure(), snapshot.failureMessage());
		} else {
			snapshotStore.save(userId, snapshot);
		}
		return snapshot;
	}

	public TargetInvestments planRebalance(String userId, BigDecimal newCapital) {
		if (newCapital == null || newCapital.signum() <= 0) {
			throw new IllegalArgumentException("newCapital must be positive");
		}
		AllocationAnalysis analysis = getPortfolio(userId, false, null).allocationAnalysis();
		if (analysis == null) {
			throw new IllegalArgumentException("No allocation data available for this user");
		}
		TargetInvestments plan = rebalancePlanner.planRebalance(analysis.categoryInvested(),
				analysis.targetAllocation(), newCapital);
		if (plan == null) {
			throw new IllegalArgumentException("Current allocation cannot be rebalanced");
		}
		return plan;
	}

	public BigDecimal estimateDividend(String userId, BigDecimal monthlyBudget) {
		if (monthlyBudget != null && monthlyBudget.signum() < 0) {
			throw new IllegalArgumentException("monthlyBudget must not be negative");
		}
		PerformanceMetrics snapshot = getPortfolio(userId, false, null);
		return dividendEstimator.estimateAnnualDividend(snapshot.pies(), monthlyBudget);
	}

	private void requireUser(String userId) {
		if (userId == null || userId.isBlank()) {
			throw new IllegalArgumentException("User id is required");
		}
	}
}
