package my.pietracker.app.service;

import my.pietracker.app.model.PerformanceMetrics;

import java.util.Optional;

public interface PortfolioSnapshotStore {
	Optional<PerformanceMetrics> findLatest(String userId);

	void save(String userId, PerformanceMetrics snapshot);
}
