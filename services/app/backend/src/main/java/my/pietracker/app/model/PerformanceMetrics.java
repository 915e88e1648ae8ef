package my.pietracker.app.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * The complete snapshot of one refresh cycle. Stages that failed leave their fields null; the
 * first stage-aborting failure is recorded in {@code failure}.
 */
public record PerformanceMetrics(List<PieData> pies,
								 OverallSummary overallSummary,
								 AllocationAnalysis allocationAnalysis,
								 TargetInvestments targetInvestments,
								 BigDecimal freeCashAvailable,
								 List<Benchmark> benchmarks,
								 String country,
								 @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime fetchDate,
								 FailureReason failure,
								 String failureMessage) {
	public static PerformanceMetrics empty(String country, LocalDateTime fetchDate) {
		return new PerformanceMetrics(null, null, null, null, BigDecimal.ZERO, List.of(), country, fetchDate, null, null);
	}

	public PerformanceMetrics withFailure(FailureReason reason, String message) {
		return new PerformanceMetrics(pies, overallSummary, allocationAnalysis, targetInvestments, freeCashAvailable,
				benchmarks, country, fetchDate, reason, message);
	}

	public boolean hasFailure() {
		return failure != null;
	}
}
