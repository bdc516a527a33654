package io.evitadb.irasutoya.retry;

import io.evitadb.irasutoya.error.EnrichmentException;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Thrown when an operation kept failing transiently until the retry budget was used up. Terminal for the
 * affected record in the current run; the record is picked up again by the next run.
 */
public final class RetriesExhaustedException extends Exception {

	private final int attempts;

	/**
	 * Creates a new RetriesExhaustedException.
	 *
	 * @param attempts  total number of attempts made
	 * @param lastCause the failure of the last attempt
	 */
	public RetriesExhaustedException(int attempts, @Nonnull EnrichmentException lastCause) {
		super(
			"Giving up after " + attempts + " attempt(s): " +
				Objects.requireNonNull(lastCause, "lastCause must not be null").getMessage(),
			lastCause
		);
		this.attempts = attempts;
	}

	/**
	 * Returns the total number of attempts made.
	 *
	 * @return attempt count
	 */
	public int getAttempts() {
		return this.attempts;
	}

	/**
	 * Returns the failure of the last attempt.
	 *
	 * @return last failure
	 */
	@Nonnull
	public EnrichmentException getLastCause() {
		return (EnrichmentException) getCause();
	}
}
