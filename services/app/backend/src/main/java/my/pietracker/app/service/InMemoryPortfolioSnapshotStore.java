package my.pietracker.app.service;

import my.pietracker.app.model.PerformanceMetrics;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryPortfolioSnapshotStore implements PortfolioSnapshotStore {
	private final Map<String, PerformanceMetrics> snapshots = new ConcurrentHashMap<>();

	@Override
	public Optional<PerformanceMetrics> findLatest(String userId) {
		return Optional.ofNullable(snapshots.get(userId));
	}

	@Override
	public void save(String userId, PerformanceMetrics snapshot) {
		snapshots.put(userId, snapshot);
	}
}
