package my.pietracker.app.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class DecimalMath {
	public static final BigDecimal HUNDRED = new BigDecimal("100");

	private DecimalMath() {
	}

	/**
	 * {@code part / whole * 100}, or zero when {@code whole} is zero.
	 */
	public static BigDecimal percent(BigDecimal part, BigDecimal whole) {
		if (part == null || whole == null || whole.signum() == 0) {
			return BigDecimal.ZERO;
		}
		return part.divide(whole, 10, RoundingMode.HALF_UP)
				.multiply(HUNDRED)
				.setScale(4, RoundingMode.HALF_UP);
	}

	public static BigDecimal nullToZero(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}
