package my.pietracker.app.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a call to an external collaborator: either a value or a typed failure.
 * Callers use the failure reason to tell "no data this cycle" apart from "misconfigured".
 */
public record FetchResult<T>(T value, FailureReason failure, String message) {
	public FetchResult {
		if (failure == null) {
			Objects.requireNonNull(value, "value");
		}
	}

	public static <T> FetchResult<T> success(T value) {
		return new FetchResult<>(value, null, null);
	}

	public static <T> FetchResult<T> failure(FailureReason reason, String message) {
		return new FetchResult<>(null, Objects.requireNonNull(reason, "reason"), message);
	}

	public boolean isSuccess() {
		return failure == null;
	}

	public <R> FetchResult<R> map(Function<T, R> mapper) {
		if (!isSuccess()) {
			return failure(failure, message);
		}
		return success(mapper.apply(value));
	}

	public <R> FetchResult<R> propagate() {
		if (isSuccess()) {
			throw new IllegalStateException("Cannot propagate a successful result");
		}
		return failure(failure, message);
	}
}
