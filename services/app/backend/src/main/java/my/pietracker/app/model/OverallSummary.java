package my.pietracker.app.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record OverallSummary(BigDecimal totalInvestedOverall,
							 BigDecimal totalResultOverall,
							 BigDecimal returnPercentageOverall,
							 @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime fetchDate) {
	public OverallSummary withFetchDate(LocalDateTime date) {
		return new OverallSummary(totalInvestedOverall, totalResultOverall, returnPercentageOverall, date);
	}
}
