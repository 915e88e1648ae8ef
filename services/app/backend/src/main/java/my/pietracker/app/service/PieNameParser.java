package my.pietracker.app.service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the {@code "<Category> (<percent>%)"} naming convention of pies.
 */
public final class PieNameParser {
	private static final String SEPARATOR = " (";

	private PieNameParser() {
	}

	public record ParsedPieName(String category, BigDecimal targetPercent) {
	}

	public static Optional<ParsedPieName> parse(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String[] parts = name.split(Pattern.quote(SEPARATOR), -1);
		if (parts.length != 2) {
			return Optional.empty();
		}
		String category = parts[0].trim();
		String percent = parts[1].replace(")", "").replace("%", "").trim();
		if (category.isEmpty() || percent.isEmpty()) {
			return Optional.empty();
		}
		try {
			return Optional.of(new ParsedPieName(category, new BigDecimal(percent)));
		} catch (NumberFormatException ex) {
			return Optional.empty();
		}
	}
}
