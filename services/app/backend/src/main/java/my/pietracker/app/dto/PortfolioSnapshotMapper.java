package my.pietracker.app.dto;

import my.pietracker.app.model.AllocationAnalysis;
import my.pietracker.app.model.Benchmark;
import my.pietracker.app.model.InstrumentPerformance;
import my.pietracker.app.model.OverallSummary;
import my.pietracker.app.model.PerformanceMetrics;
import my.pietracker.app.model.PieData;
import my.pietracker.app.model.PieInstrument;
import my.pietracker.app.model.TargetInvestments;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whitelisting mapper: owned quantities, broker share weights, issue flags, the dividend cash policy
 * and trading-size limits never leave the service.
 */
public final class PortfolioSnapshotMapper {
	private PortfolioSnapshotMapper() {
	}

	public static PortfolioSnapshotDto toDto(PerformanceMetrics snapshot) {
		TargetInvestments plan = snapshot.targetInvestments();
		List<BenchmarkDto> benchmarks = snapshot.benchmarks() == null
				? List.of()
				: snapshot.benchmarks().stream().map(PortfolioSnapshotMapper::toBenchmarkDto).toList();
		return new PortfolioSnapshotDto(
				snapshot.pies() == null ? null : snapshot.pies().stream().map(PortfolioSnapshotMapper::toPieDto).toList(),
				toSummaryDto(snapshot.overallSummary()),
				toAnalysisDto(snapshot.allocationAnalysis()),
				plan == null ? null : plan.investments(),
				snapshot.freeCashAvailable(),
				benchmarks,
				snapshot.country(),
				snapshot.fetchDate(),
				snapshot.failure() == null ? null : snapshot.failure().name(),
				snapshot.failureMessage());
	}

	public static RebalancePlanDto toPlanDto(TargetInvestments plan) {
		return new RebalancePlanDto(plan.investments(), plan.newTotal());
	}

	private static PieDto toPieDto(PieData pie) {
		return new PieDto(pie.id(), pie.name(), pie.creationDate(),
				pie.instruments().stream().map(PortfolioSnapshotMapper::toInstrumentDto).toList(),
				pie.totalInvested(), pie.totalResult(), pie.returnPercentage());
	}

	private static PieInstrumentDto toInstrumentDto(PieInstrument instrument) {
		InstrumentPerformance performance = instrument.performance() == null
				? InstrumentPerformance.unavailable()
				: instrument.performance();
		return new PieInstrumentDto(instrument.ticker(), instrument.fullName(), instrument.currencyCode(),
				instrument.type(), instrument.addedToMarket(), instrument.investedValue(), instrument.currentValue(),
				instrument.resultValue(), instrument.dividendYield(),
				new PerformanceDto(performance.oneDay(), performance.oneWeek(), performance.oneMonth(),
						performance.threeMonths(), performance.oneYear()));
	}

	private static OverallSummaryDto toSummaryDto(OverallSummary summary) {
		if (summary == null) {
			return null;
		}
		return new OverallSummaryDto(summary.totalInvestedOverall(), summary.totalResultOverall(),
				summary.returnPercentageOverall());
	}

	private static AllocationAnalysisDto toAnalysisDto(AllocationAnalysis analysis) {
		if (analysis == null) {
			return null;
		}
		Map<String, AllocationDto> current = new LinkedHashMap<>();
		analysis.currentAllocation().forEach((category, allocation) ->
				current.put(category, new AllocationDto(allocation.value(), allocation.percent())));
		return new AllocationAnalysisDto(analysis.targetAllocation(), current, analysis.allocationDifferences(),
				analysis.rebalanceRecommended(), analysis.estimatedAnnualDividend());
	}

	private static BenchmarkDto toBenchmarkDto(Benchmark benchmark) {
		return new BenchmarkDto(benchmark.name(), benchmark.returnPercentage(), benchmark.description(),
				benchmark.lastUpdated());
	}
}
