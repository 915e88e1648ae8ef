package my.pietracker.app.dto;

import java.math.BigDecimal;

public record DividendEstimateDto(BigDecimal monthlyBudget, BigDecimal estimatedAnnualDividend) {
}
