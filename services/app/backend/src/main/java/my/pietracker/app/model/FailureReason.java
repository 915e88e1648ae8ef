package my.pietracker.app.model;

public enum FailureReason {
	NETWORK,
	MALFORMED_DATA,
	MISSING_CREDENTIAL,
	INVALID_CREDENTIAL,
	VALIDATION,
	TIMEOUT,
	INTERNAL
}
