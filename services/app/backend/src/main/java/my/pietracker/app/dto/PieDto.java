package my.pietracker.app.dto;

import java.math.BigDecimal;
import java.util.List;

public record PieDto(String id,
					 String name,
					 String creationDate,
					 List<PieInstrumentDto> instruments,
					 BigDecimal totalInvested,
					 BigDecimal totalResult,
					 BigDecimal returnPercentage) {
}
