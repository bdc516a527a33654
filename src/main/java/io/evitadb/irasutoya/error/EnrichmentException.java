package io.evitadb.irasutoya.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class of failures raised while enriching a single record. Each failure is classified at the point
 * where it is raised: transient failures (timeouts, rate limiting, server errors) are worth retrying,
 * permanent ones (rejected credentials, invalid input, missing resources) are not.
 */
public abstract class EnrichmentException extends Exception {

	private final boolean transientFailure;

	/**
	 * Creates a new EnrichmentException.
	 *
	 * @param message          the error message
	 * @param cause            the underlying failure, may be null
	 * @param transientFailure true if a retry may succeed
	 */
	protected EnrichmentException(@Nonnull String message, @Nullable Throwable cause, boolean transientFailure) {
		super(message, cause);
		this.transientFailure = transientFailure;
	}

	/**
	 * Returns true if the failure is transient and the operation may be retried.
	 *
	 * @return true for transient failures, false for permanent ones
	 */
	public boolean isTransient() {
		return this.transientFailure;
	}
}
