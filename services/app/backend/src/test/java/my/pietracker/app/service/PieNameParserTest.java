package my.pietracker.app.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PieNameParserTest {
	@Test
	void parsesCategoryAndPercent() {
		assertThat(PieNameParser.parse("Growth (40%)")).hasValueSatisfying(parsed -> {
			assertThat(parsed.category()).isEqualTo("Growth");
			assertThat(parsed.targetPercent()).isEqualByComparingTo("40");
		});
	}

	@Test
	void parsesDecimalPercentAndTrimsCategory() {
		assertThat(PieNameParser.parse("  Dividend Income (12.5 %)")).hasValueSatisfying(parsed -> {
			assertThat(parsed.category()).isEqualTo("Dividend Income");
			assertThat(parsed.targetPercent()).isEqualByComparingTo("12.5");
		});
	}

	@Test
	void rejectsNamesOutsideTheConvention() {
		assertThat(PieNameParser.parse("Misc")).isEmpty();
		assertThat(PieNameParser.parse("Tech (US) (20%)")).isEmpty();
		assertThat(PieNameParser.parse("Bonds (ten%)")).isEmpty();
		assertThat(PieNameParser.parse(null)).isEmpty();
	}
}
