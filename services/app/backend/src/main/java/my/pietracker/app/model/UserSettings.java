package my.pietracker.app.model;

import java.math.BigDecimal;

public record UserSettings(BigDecimal monthlyBudget, String country) {
}
