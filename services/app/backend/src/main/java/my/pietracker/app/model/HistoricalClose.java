package my.pietracker.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record HistoricalClose(LocalDate date, BigDecimal close) {
}
