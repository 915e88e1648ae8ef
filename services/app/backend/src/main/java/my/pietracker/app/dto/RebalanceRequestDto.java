package my.pietracker.app.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record RebalanceRequestDto(@NotNull @Positive BigDecimal newCapital) {
}
