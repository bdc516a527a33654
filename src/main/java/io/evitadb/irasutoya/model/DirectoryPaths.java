package io.evitadb.irasutoya.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the local image location of a catalogue record. The result depends only on the publication
 * timestamp and the image URL, so it can be recomputed on every run and always yields the same path.
 *
 * Layout: `./images/<year>/<month>/<filename-from-image_url>`, relative to the directory holding the
 * output document.
 */
public final class DirectoryPaths {

	public static final String IMAGES_DIRECTORY = "images";

	/**
	 * Matches the date part of `2016-10-30 09:00:00`, `2016-10-30T09:00:00+09:00` or `2016-10-30`.
	 */
	private static final Pattern PUBLISHED_AT_PATTERN = Pattern.compile("^\\s*(\\d{4})-(\\d{1,2})(?:-\\d{1,2})?(?:[ T].*)?$");

	private DirectoryPaths() {
		// Utility class - prevent instantiation
	}

	/**
	 * Resolves the relative image path for the given publication timestamp and image URL.
	 *
	 * @param publishedAt publication timestamp as stored in the catalogue
	 * @param imageUrl    URL of the image
	 * @return path such as `./images/2016/10/taimatsu_olympic.png`
	 * @throws IllegalArgumentException if the timestamp or the URL cannot be interpreted
	 */
	@Nonnull
	public static String resolve(@Nullable String publishedAt, @Nullable String imageUrl) {
		final YearMonthParts yearMonth = parseYearMonth(publishedAt);
		final String filename = filenameOf(imageUrl);
		return "./" + IMAGES_DIRECTORY + "/" + yearMonth.year() + "/" + yearMonth.month() + "/" + filename;
	}

	/**
	 * Resolves the relative image path of a record.
	 *
	 * @param illustration the record
	 * @return relative image path
	 * @throws IllegalArgumentException if the record has no usable timestamp or image URL
	 */
	@Nonnull
	public static String resolve(@Nonnull Illustration illustration) {
		Objects.requireNonNull(illustration, "illustration must not be null");
		return resolve(illustration.getPublishedAt(), illustration.getImageUrl());
	}

	/**
	 * Extracts year and month from the publication timestamp, keeping the digits exactly as written.
	 */
	@Nonnull
	static YearMonthParts parseYearMonth(@Nullable String publishedAt) {
		if (publishedAt == null || publishedAt.isBlank()) {
			throw new IllegalArgumentException("published_at is missing");
		}
		final Matcher matcher = PUBLISHED_AT_PATTERN.matcher(publishedAt);
		if (!matcher.matches()) {
			throw new IllegalArgumentException("Unsupported published_at format: " + publishedAt);
		}
		final int month = Integer.parseInt(matcher.group(2));
		if (month < 1 || month > 12) {
			throw new IllegalArgumentException("Invalid month in published_at: " + publishedAt);
		}
		return new YearMonthParts(matcher.group(1), matcher.group(2));
	}

	/**
	 * Returns the last path segment of the URL, without query string or fragment. Percent-escapes are kept
	 * as written, so an encoded slash never splits the segment.
	 */
	@Nonnull
	static String filenameOf(@Nullable String imageUrl) {
		if (imageUrl == null || imageUrl.isBlank()) {
			throw new IllegalArgumentException("image_url is missing");
		}
		String path;
		try {
			path = new URI(imageUrl.trim()).getRawPath();
		} catch (URISyntaxException e) {
			path = null;
		}
		if (path == null) {
			// opaque or unparsable URL, fall back to plain string handling
			path = imageUrl.trim();
			final int cut = indexOfAny(path, '?', '#');
			if (cut >= 0) {
				path = path.substring(0, cut);
			}
		}
		final String filename = path.substring(path.lastIndexOf('/') + 1);
		if (filename.isBlank() || ".".equals(filename) || "..".equals(filename)) {
			throw new IllegalArgumentException("image_url has no file name: " + imageUrl);
		}
		return filename;
	}

	private static int indexOfAny(@Nonnull String value, char... characters) {
		int result = -1;
		for (final char c : characters) {
			final int index = value.indexOf(c);
			if (index >= 0 && (result < 0 || index < result)) {
				result = index;
			}
		}
		return result;
	}

	/**
	 * Year and month digits as they appear in the timestamp.
	 */
	record YearMonthParts(@Nonnull String year, @Nonnull String month) {
	}
}
