package io.evitadb.irasutoya;

import io.evitadb.irasutoya.error.EnrichmentException;
import io.evitadb.irasutoya.error.FetchFailedException;
import io.evitadb.irasutoya.http.HttpStatusException;
import io.evitadb.irasutoya.http.ResourceFetcher;
import io.evitadb.irasutoya.retry.RetriesExhaustedException;
import io.evitadb.irasutoya.retry.RetryPolicy;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Downloads the source catalogue to the input location when it is not there yet. An existing input file
 * is never replaced, so a run always works against the catalogue snapshot it started with.
 */
public final class CatalogueDownloader {

	@Nonnull
	private final ResourceFetcher resourceFetcher;
	@Nonnull
	private final RetryPolicy retryPolicy;
	@Nonnull
	private final Log log;

	/**
	 * Creates a catalogue downloader.
	 *
	 * @param resourceFetcher the HTTP collaborator
	 * @param retryPolicy     policy applied to the download
	 * @param log             Maven log for output
	 */
	public CatalogueDownloader(
		@Nonnull ResourceFetcher resourceFetcher,
		@Nonnull RetryPolicy retryPolicy,
		@Nonnull Log log
	) {
		this.resourceFetcher = Objects.requireNonNull(resourceFetcher, "resourceFetcher must not be null");
		this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Ensures the catalogue exists at the given location, downloading it when missing.
	 *
	 * @param catalogueUrl where to download the catalogue from
	 * @param inputFile    the local catalogue location
	 * @return true if the catalogue was downloaded, false if it already existed
	 * @throws EnrichmentException       on a permanent download failure
	 * @throws RetriesExhaustedException if the download kept failing transiently
	 */
	public boolean ensurePresent(@Nonnull URI catalogueUrl, @Nonnull Path inputFile)
		throws EnrichmentException, RetriesExhaustedException {
		Objects.requireNonNull(catalogueUrl, "catalogueUrl must not be null");
		Objects.requireNonNull(inputFile, "inputFile must not be null");

		if (Files.exists(inputFile)) {
			return false;
		}

		this.log.info("Downloading catalogue from " + catalogueUrl + " to " + inputFile);
		final byte[] content = this.retryPolicy.execute("catalogue", () -> download(catalogueUrl)).value();
		try {
			AtomicFiles.write(inputFile, ".part", content);
		} catch (IOException e) {
			throw new FetchFailedException(catalogueUrl.toString(), e, false);
		}
		this.log.info("Catalogue downloaded (" + content.length + " bytes)");
		return true;
	}

	@Nonnull
	private byte[] download(@Nonnull URI catalogueUrl) throws FetchFailedException {
		try {
			return this.resourceFetcher.fetch(catalogueUrl);
		} catch (HttpStatusException e) {
			throw new FetchFailedException(catalogueUrl.toString(), e, e.isTransient());
		} catch (IOException e) {
			throw new FetchFailedException(catalogueUrl.toString(), e, true);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FetchFailedException(catalogueUrl.toString(), e, false);
		}
	}
}
