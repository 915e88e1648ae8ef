package my.pietracker.app.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

public final class JsonValues {
	private JsonValues() {
	}

	public static String text(JsonNode node, String field) {
		if (node == null) {
			return null;
		}
		JsonNode value = node.get(field);
		if (value == null || value.isNull() || value.isContainerNode()) {
			return null;
		}
		String text = value.asText();
		return text == null || text.isBlank() ? null : text;
	}

	public static String textOrDefault(JsonNode node, String field, String fallback) {
		String value = text(node, field);
		return value == null ? fallback : value;
	}

	/**
	 * Numeric field as a decimal. Missing, null or non-numeric values read as {@code null}.
	 */
	public static BigDecimal decimal(JsonNode node, String field) {
		if (node == null) {
			return null;
		}
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return null;
		}
		if (value.isNumber()) {
			return value.decimalValue();
		}
		if (value.isTextual()) {
			try {
				return new BigDecimal(value.asText().trim());
			} catch (NumberFormatException ex) {
				return null;
			}
		}
		return null;
	}

	public static BigDecimal decimalOrZero(JsonNode node, String field) {
		BigDecimal value = decimal(node, field);
		return value == null ? BigDecimal.ZERO : value;
	}

	public static boolean bool(JsonNode node, String field) {
		if (node == null) {
			return false;
		}
		JsonNode value = node.get(field);
		return value != null && value.asBoolean(false);
	}
}
