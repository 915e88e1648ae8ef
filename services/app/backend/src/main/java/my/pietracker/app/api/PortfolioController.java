package my.pietracker.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.pietracker.app.dto.DividendEstimateDto;
import my.pietracker.app.dto.PortfolioSnapshotDto;
import my.pietracker.app.dto.PortfolioSnapshotMapper;
import my.pietracker.app.dto.RebalancePlanDto;
import my.pietracker.app.dto.RebalanceRequestDto;
import my.pietracker.app.model.UserSettings;
import my.pietracker.app.service.PortfolioService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/portfolio")
@Tag(name = "Portfolio", description = "Pie portfolio snapshot, rebalancing and dividend estimates")
public class PortfolioController {
	static final String USER_HEADER = "X-User-Id";

	private final PortfolioService portfolioService;

	public PortfolioController(PortfolioService portfolioService) {
		this.portfolioService = portfolioService;
	}

	@GetMapping
	@Operation(summary = "Portfolio snapshot", description = "Returns the stored snapshot unless refresh=true.")
	public PortfolioSnapshotDto getPortfolio(@RequestHeader(USER_HEADER) String userId,
											 @RequestParam(defaultValue = "false") boolean refresh,
											 @RequestParam(required = false) BigDecimal monthlyBudget,
											 @RequestParam(required = false) String country) {
		if (monthlyBudget != null && monthlyBudget.signum() < 0) {
			throw new IllegalArgumentException("monthlyBudget must not be negative");
		}
		return PortfolioSnapshotMapper.toDto(
				portfolioService.getPortfolio(userId, refresh, new UserSettings(monthlyBudget, country)));
	}

	@PostMapping("/rebalance")
	@Operation(summary = "Plan how to split new capital across categories")
	public RebalancePlanDto rebalance(@RequestHeader(USER_HEADER) String userId,
									  @Valid @RequestBody RebalanceRequestDto request) {
		return PortfolioSnapshotMapper.toPlanDto(portfolioService.planRebalance(userId, request.newCapital()));
	}

	@GetMapping("/dividends")
	@Operation(summary = "Estimated annual dividend income")
	public DividendEstimateDto dividends(@RequestHeader(USER_HEADER) String userId,
										 @RequestParam(defaultValue = "0") BigDecimal monthlyBudget) {
		return new DividendEstimateDto(monthlyBudget, portfolioService.estimateDividend(userId, monthlyBudget));
	}
}
