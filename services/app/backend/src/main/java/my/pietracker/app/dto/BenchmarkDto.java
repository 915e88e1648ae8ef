package my.pietracker.app.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BenchmarkDto(String name, BigDecimal returnPercentage, String description, LocalDate lastUpdated) {
}
