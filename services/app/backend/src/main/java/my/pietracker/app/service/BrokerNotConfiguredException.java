package my.pietracker.app.service;

public class BrokerNotConfiguredException extends RuntimeException {
	public BrokerNotConfiguredException(String message) {
		super(message);
	}
}
