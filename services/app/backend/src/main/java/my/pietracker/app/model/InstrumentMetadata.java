package my.pietracker.app.model;

import java.math.BigDecimal;

public record InstrumentMetadata(String ticker,
								 String name,
								 String currencyCode,
								 String type,
								 String addedOn,
								 BigDecimal maxOpenQuantity,
								 BigDecimal minTradeQuantity) {
}
