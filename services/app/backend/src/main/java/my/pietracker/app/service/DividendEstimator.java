package my.pietracker.app.service;

import my.pietracker.app.model.PieData;
import my.pietracker.app.model.PieInstrument;
import my.pietracker.app.util.DecimalMath;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Forward annual dividend estimate: the yield on current holdings plus the yield on a year of
 * monthly contributions, spread over holdings by their current weight.
 */
@Component
public class DividendEstimator {
	private static final BigDecimal MONTHS = new BigDecimal("12");

	public BigDecimal estimateAnnualDividend(List<PieData> pies, BigDecimal monthlyBudget) {
		if (pies == null || pies.isEmpty()) {
			return BigDecimal.ZERO;
		}
		BigDecimal annualBudget = DecimalMath.nullToZero(monthlyBudget).multiply(MONTHS);
		BigDecimal total = BigDecimal.ZERO;
		for (PieData pie : pies) {
			for (PieInstrument instrument : pie.instruments()) {
				total = total.add(DecimalMath.nullToZero(instrument.currentValue()));
			}
		}

		BigDecimal estimate = BigDecimal.ZERO;
		for (PieData pie : pies) {
			for (PieInstrument instrument : pie.instruments()) {
				BigDecimal current = DecimalMath.nullToZero(instrument.currentValue());
				BigDecimal yieldRate = DecimalMath.nullToZero(instrument.dividendYield())
						.divide(DecimalMath.HUNDRED, 10, RoundingMode.HALF_UP);
				estimate = estimate.add(current.multiply(yieldRate));
				if (total.signum() > 0) {
					BigDecimal contribution = annualBudget.multiply(current).divide(total, 10, RoundingMode.HALF_UP);
					estimate = estimate.add(contribution.multiply(yieldRate));
				}
			}
		}
		return estimate.setScale(2, RoundingMode.HALF_UP);
	}
}
