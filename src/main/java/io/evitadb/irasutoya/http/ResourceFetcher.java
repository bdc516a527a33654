package io.evitadb.irasutoya.http;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;

/**
 * Retrieves the bytes of a remote resource: the source catalogue or an illustration image.
 */
@FunctionalInterface
public interface ResourceFetcher {

	/**
	 * Downloads the resource.
	 *
	 * @param uri the resource location
	 * @return the response body as-is
	 * @throws HttpStatusException  if the server answered with a non-success status
	 * @throws IOException          on network failure
	 * @throws InterruptedException if the calling thread was interrupted while waiting
	 */
	@Nonnull
	byte[] fetch(@Nonnull URI uri) throws IOException, InterruptedException;

}
