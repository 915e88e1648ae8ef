package my.pietracker.app.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Benchmark(String name, BigDecimal returnPercentage, String description, LocalDate lastUpdated) {
}
