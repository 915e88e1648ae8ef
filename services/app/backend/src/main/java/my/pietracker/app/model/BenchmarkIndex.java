package my.pietracker.app.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BenchmarkIndex {
	private final String symbol;
	private final String name;
	private final String description;
	private final BigDecimal fallbackReturn;
}
