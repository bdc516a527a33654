package io.evitadb.irasutoya.http;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ResourceFetcher} backed by the JDK {@link HttpClient}. Follows redirects and treats every
 * status outside 2xx as a failure.
 */
public final class HttpResourceFetcher implements ResourceFetcher {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
	public static final String DEFAULT_USER_AGENT = "irasutoya-maven-plugin";

	@Nonnull
	private final HttpClient httpClient;
	@Nonnull
	private final Duration requestTimeout;
	@Nonnull
	private final String userAgent;

	/**
	 * Creates a fetcher with the given timeouts and User-Agent header.
	 *
	 * @param requestTimeout timeout of connecting and of each request
	 * @param userAgent      value of the User-Agent header, null for the default
	 */
	public HttpResourceFetcher(@Nonnull Duration requestTimeout, @Nullable String userAgent) {
		this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
		this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	public HttpResourceFetcher() {
		this(DEFAULT_TIMEOUT, null);
	}

	@Nonnull
	@Override
	public byte[] fetch(@Nonnull URI uri) throws IOException, InterruptedException {
		Objects.requireNonNull(uri, "uri must not be null");

		final HttpRequest request = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(this.requestTimeout)
			.header("User-Agent", this.userAgent)
			.GET()
			.build();

		final HttpResponse<byte[]> response = this.httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new HttpStatusException(uri, response.statusCode());
		}
		final byte[] body = response.body();
		return body == null ? new byte[0] : body;
	}
}
