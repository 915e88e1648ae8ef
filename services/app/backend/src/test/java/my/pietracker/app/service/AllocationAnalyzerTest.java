package my.pietracker.app.service;

import my.pietracker.app.model.AllocationAnalysis;
import my.pietracker.app.model.PieData;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static my.pietracker.app.support.PortfolioFixtures.pie;
import static my.pietracker.app.support.PortfolioFixtures.summary;
import static org.assertj.core.api.Assertions.assertThat;

class AllocationAnalyzerTest {
	private final AllocationAnalyzer analyzer = new AllocationAnalyzer(new DividendEstimator(), new BigDecimal("5"));

	@Test
	void computesCurrentAllocationAndSignedDifferences() {
		List<PieData> pies = List.of(pie("Growth (40%)", "700"), pie("Income (60%)", "300"), pie("Misc", "500"));

		AllocationAnalysis analysis = analyzer.analyze(pies, summary(pies), BigDecimal.ZERO);

		assertThat(analysis.targetAllocation()).containsOnlyKeys("Growth", "Income");
		assertThat(analysis.currentAllocation().get("Growth").value()).isEqualByComparingTo("700");
		assertThat(analysis.currentAllocation().get("Growth").percent()).isEqualByComparingTo("70");
		assertThat(analysis.allocationDifferences()).containsEntry("Growth", "-30.00%").containsEntry("Income", "30.00%");
		assertThat(analysis.rebalanceRecommended()).isTrue();
	}

	@Test
	void formatsFractionalDifferences() {
		List<PieData> pies = List.of(pie("A (33%)", "1"), pie("B (67%)", "2"));

		AllocationAnalysis analysis = analyzer.analyze(pies, summary(pies), BigDecimal.ZERO);

		assertThat(analysis.allocationDifferences()).containsEntry("A", "-0.33%").containsEntry("B", "0.33%");
		assertThat(analysis.rebalanceRecommended()).isFalse();
	}

	@Test
	void duplicateCategorySumsInvestedAndKeepsLastTarget() {
		List<PieData> pies = List.of(pie("Growth (30%)", "100"), pie("Growth (50%)", "100"), pie("Income (50%)", "200"));

		AllocationAnalysis analysis = analyzer.analyze(pies, summary(pies), BigDecimal.ZERO);

		assertThat(analysis.targetAllocation().get("Growth")).isEqualByComparingTo("50");
		assertThat(analysis.currentAllocation().get("Growth").value()).isEqualByComparingTo("200");
		assertThat(analysis.currentAllocation().get("Growth").percent()).isEqualByComparingTo("50");
	}

	@Test
	void ignoresSummarySentinelPie() {
		List<PieData> pies = List.of(pie("OverallSummary", "1000"), pie("Growth (100%)", "100"));

		AllocationAnalysis analysis = analyzer.analyze(pies, summary(pies), BigDecimal.ZERO);

		assertThat(analysis.targetAllocation()).containsOnlyKeys("Growth");
	}

	@Test
	void zeroInvestedGivesZeroPercent() {
		List<PieData> pies = List.of(pie("Growth (100%)", "0"));

		AllocationAnalysis analysis = analyzer.analyze(pies, summary(pies), BigDecimal.ZERO);

		assertThat(analysis.currentAllocation().get("Growth").percent()).isEqualByComparingTo("0");
		assertThat(analysis.allocationDifferences()).containsEntry("Growth", "100.00%");
	}

	@Test
	void missingInputsReturnNull() {
		assertThat(analyzer.analyze(null, null, BigDecimal.ZERO)).isNull();
		assertThat(analyzer.analyze(List.of(), null, BigDecimal.ZERO)).isNull();
	}
}
