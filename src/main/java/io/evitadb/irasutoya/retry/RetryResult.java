package io.evitadb.irasutoya.retry;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Value returned by a successful retried operation together with the number of attempts it took.
 *
 * @param value    the operation result
 * @param attempts number of attempts, 1 when the first call succeeded
 * @param <T>      type of the operation result
 */
public record RetryResult<T>(@Nonnull T value, int attempts) {

	public RetryResult {
		Objects.requireNonNull(value, "value must not be null");
		if (attempts < 1) {
			throw new IllegalArgumentException("attempts must be at least 1");
		}
	}
}
