package io.evitadb.irasutoya.http;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.util.Objects;

/**
 * Thrown when a server answers a resource request with a non-success status code.
 */
public final class HttpStatusException extends IOException {

	private final int statusCode;

	/**
	 * Creates a new HttpStatusException.
	 *
	 * @param uri        the requested resource
	 * @param statusCode the HTTP status returned by the server
	 */
	public HttpStatusException(@Nonnull URI uri, int statusCode) {
		super("HTTP " + statusCode + " for " + Objects.requireNonNull(uri, "uri must not be null"));
		this.statusCode = statusCode;
	}

	public int getStatusCode() {
		return this.statusCode;
	}

	/**
	 * Returns true for statuses that may succeed when repeated later: request timeout (408),
	 * too early (425), rate limiting (429) and server errors (5xx). Everything else, notably the
	 * remaining 4xx statuses, is permanent.
	 *
	 * @return true if the request is worth retrying
	 */
	public boolean isTransient() {
		return this.statusCode == 408 || this.statusCode == 425 || this.statusCode == 429 || this.statusCode >= 500;
	}
}
