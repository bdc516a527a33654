package io.evitadb.irasutoya.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Thrown when downloading a remote resource or storing it on disk fails.
 */
public final class FetchFailedException extends EnrichmentException {

	@Nonnull
	private final String url;

	/**
	 * Creates a new FetchFailedException.
	 *
	 * @param url              the URL that was being fetched
	 * @param cause            the network, HTTP or file system failure
	 * @param transientFailure true if a retry may succeed
	 */
	public FetchFailedException(@Nonnull String url, @Nullable Throwable cause, boolean transientFailure) {
		super(
			"Fetching " + Objects.requireNonNull(url, "url must not be null") + " failed" +
				(cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
			cause,
			transientFailure
		);
		this.url = url;
	}

	/**
	 * Returns the URL that was being fetched.
	 *
	 * @return the URL
	 */
	@Nonnull
	public String getUrl() {
		return this.url;
	}
}
