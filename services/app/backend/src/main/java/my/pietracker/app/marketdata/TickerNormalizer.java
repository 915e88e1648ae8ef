package my.pietracker.app.marketdata;

import java.util.Map;

/**
 * Maps broker instrument tickers (e.g. {@code AAPL_US_EQ}, {@code VODl_EQ}) to market-data symbols.
 */
public final class TickerNormalizer {
	private static final Map<String, String> OVERRIDES = Map.of(
			"BRK_B_US_EQ", "BRK-B",
			"ALVd_EQ", "ALV.DE",
			"ABNa_EQ", "ABN.AS"
	);

	private TickerNormalizer() {
	}

	public static String normalize(String ticker) {
		if (ticker == null) {
			return null;
		}
		String override = OVERRIDES.get(ticker);
		if (override != null) {
			return override;
		}
		String symbol = ticker;
		if (symbol.endsWith("_EQ")) {
			symbol = symbol.substring(0, symbol.length() - 3);
		}
		if (symbol.endsWith("l")) {
			symbol = symbol.substring(0, symbol.length() - 1) + ".L";
		}
		if (symbol.endsWith("_US")) {
			symbol = symbol.substring(0, symbol.length() - 3);
		}
		if (symbol.endsWith("1.L")) {
			symbol = symbol.substring(0, symbol.length() - 3) + ".L";
		}
		return symbol;
	}
}
