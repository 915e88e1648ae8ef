package my.pietracker.app.marketdata;

import my.pietracker.app.model.FailureReason;

public class MarketDataException extends RuntimeException {
	private final FailureReason reason;

	public MarketDataException(FailureReason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public FailureReason getReason() {
		return reason;
	}
}
