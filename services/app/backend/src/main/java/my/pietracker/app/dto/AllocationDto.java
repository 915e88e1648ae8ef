package my.pietracker.app.dto;

import java.math.BigDecimal;

public record AllocationDto(BigDecimal value, BigDecimal percent) {
}
