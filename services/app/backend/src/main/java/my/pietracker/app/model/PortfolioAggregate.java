package my.pietracker.app.model;

import java.util.List;

public record PortfolioAggregate(List<PieData> pies, OverallSummary overallSummary) {
	public PortfolioAggregate {
		pies = pies == null ? List.of() : List.copyOf(pies);
	}
}
