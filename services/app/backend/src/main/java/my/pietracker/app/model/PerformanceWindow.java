package my.pietracker.app.model;

public enum PerformanceWindow {
	ONE_DAY(1),
	ONE_WEEK(7),
	ONE_MONTH(30),
	THREE_MONTHS(90),
	ONE_YEAR(365);

	private final int days;

	PerformanceWindow(int days) {
		this.days = days;
	}

	public int days() {
		return days;
	}
}
