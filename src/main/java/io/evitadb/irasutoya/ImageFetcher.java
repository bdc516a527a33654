package io.evitadb.irasutoya;

import io.evitadb.irasutoya.error.FetchFailedException;
import io.evitadb.irasutoya.http.HttpStatusException;
import io.evitadb.irasutoya.http.ResourceFetcher;
import io.evitadb.irasutoya.model.DirectoryPaths;
import io.evitadb.irasutoya.model.Illustration;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ImageFetcher stores the image of a record under its directory path, resolved against the directory
 * that holds the output document.
 *
 * Downloads are written to a temporary file in the target directory and renamed on success, so an
 * interrupted download never leaves a non-empty file that would later be mistaken for a complete image.
 */
public final class ImageFetcher {

	private static final String PART_SUFFIX = ".part";

	@Nonnull
	private final ResourceFetcher resourceFetcher;
	@Nonnull
	private final Path baseDirectory;

	/**
	 * Creates an image fetcher.
	 *
	 * @param resourceFetcher the HTTP collaborator retrieving image bytes
	 * @param baseDirectory   the directory that relative directory paths (`./images/...`) are resolved against
	 */
	public ImageFetcher(@Nonnull ResourceFetcher resourceFetcher, @Nonnull Path baseDirectory) {
		this.resourceFetcher = Objects.requireNonNull(resourceFetcher, "resourceFetcher must not be null");
		this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null").toAbsolutePath().normalize();
	}

	/**
	 * Returns the absolute location of the record's image.
	 *
	 * @param illustration the record
	 * @return absolute image path
	 * @throws IllegalArgumentException if the record has no usable timestamp or image URL
	 */
	@Nonnull
	public Path resolveTarget(@Nonnull Illustration illustration) {
		final String relative = DirectoryPaths.resolve(illustration);
		return this.baseDirectory.resolve(relative.substring(2)).normalize();
	}

	/**
	 * Returns true if a non-empty file already exists at the record's image location. Records whose
	 * location cannot be computed are never considered downloaded.
	 *
	 * @param illustration the record
	 * @return true if the image is present
	 */
	public boolean isDownloaded(@Nonnull Illustration illustration) {
		Objects.requireNonNull(illustration, "illustration must not be null");
		try {
			return isNonEmptyFile(resolveTarget(illustration));
		} catch (IllegalArgumentException | IllegalStateException e) {
			return false;
		}
	}

	/**
	 * Downloads the record's image unless it is already present.
	 *
	 * @param illustration the record
	 * @return true if the image was downloaded, false if it was already present
	 * @throws FetchFailedException on network failure, non-success status or file system error
	 */
	public boolean fetch(@Nonnull Illustration illustration) throws FetchFailedException {
		Objects.requireNonNull(illustration, "illustration must not be null");
		final String imageUrl = illustration.getImageUrl() == null ? "<missing image_url>" : illustration.getImageUrl();

		final Path target;
		final URI uri;
		try {
			target = resolveTarget(illustration);
			uri = URI.create(imageUrl.trim());
		} catch (IllegalArgumentException e) {
			throw new FetchFailedException(imageUrl, e, false);
		}

		try {
			if (isNonEmptyFile(target)) {
				return false;
			}
		} catch (IllegalStateException e) {
			throw new FetchFailedException(imageUrl, e.getCause(), false);
		}

		final byte[] bytes;
		try {
			bytes = this.resourceFetcher.fetch(uri);
		} catch (HttpStatusException e) {
			throw new FetchFailedException(imageUrl, e, e.isTransient());
		} catch (IOException e) {
			throw new FetchFailedException(imageUrl, e, true);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FetchFailedException(imageUrl, e, false);
		} catch (IllegalArgumentException e) {
			// unsupported scheme or malformed URI rejected by the client
			throw new FetchFailedException(imageUrl, e, false);
		}
		if (bytes.length == 0) {
			throw new FetchFailedException(imageUrl, new IOException("empty response body"), true);
		}

		try {
			AtomicFiles.write(target, PART_SUFFIX, bytes);
		} catch (IOException e) {
			throw new FetchFailedException(imageUrl, e, false);
		}
		return true;
	}

	private static boolean isNonEmptyFile(@Nonnull Path file) {
		if (!Files.isRegularFile(file)) {
			return false;
		}
		try {
			return Files.size(file) > 0;
		} catch (IOException e) {
			throw new IllegalStateException("Cannot read size of " + file, e);
		}
	}
}
