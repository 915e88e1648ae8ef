package my.pietracker.app.model;

import java.math.BigDecimal;

public record CategoryAllocation(BigDecimal value, BigDecimal percent) {
}
