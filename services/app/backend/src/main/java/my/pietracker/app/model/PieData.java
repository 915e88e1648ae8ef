package my.pietracker.app.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record PieData(String id,
					  String name,
					  String creationDate,
					  String dividendCashAction,
					  List<PieInstrument> instruments,
					  BigDecimal totalInvested,
					  BigDecimal totalResult,
					  BigDecimal returnPercentage,
					  @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime fetchDate) {
	public PieData {
		instruments = instruments == null ? List.of() : List.copyOf(instruments);
	}

	public PieData withFetchDate(LocalDateTime date) {
		return new PieData(id, name, creationDate, dividendCashAction, instruments, totalInvested, totalResult,
				returnPercentage, date);
	}
}
