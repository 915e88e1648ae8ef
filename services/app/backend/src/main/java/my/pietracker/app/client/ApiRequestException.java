package my.pietracker.app.client;

public class ApiRequestException extends RuntimeException {
	private final Integer statusCode;
	private final boolean retryable;

	public ApiRequestException(String message, Integer statusCode, boolean retryable, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.retryable = retryable;
	}

	public Integer getStatusCode() {
		return statusCode;
	}

	public boolean isRetryable() {
		return retryable;
	}

	public boolean isAuthenticationFailure() {
		return statusCode != null && (statusCode == 401 || statusCode == 403);
	}
}
