package my.pietracker.app.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record PortfolioSnapshotDto(List<PieDto> pies,
								   OverallSummaryDto overallSummary,
								   AllocationAnalysisDto allocationAnalysis,
								   Map<String, BigDecimal> rebalanceInvestmentForTarget,
								   BigDecimal freeCashAvailable,
								   List<BenchmarkDto> benchmarks,
								   String country,
								   @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime fetchDate,
								   String failure,
								   String failureMessage) {
}
