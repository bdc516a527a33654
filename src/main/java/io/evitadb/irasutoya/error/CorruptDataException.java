package io.evitadb.irasutoya.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Thrown when a persisted catalogue document cannot be read as a list of illustration records.
 * Aborts the run before any record is processed.
 */
public final class CorruptDataException extends java.io.IOException {

	@Nonnull
	private final Path file;

	/**
	 * Creates a new CorruptDataException.
	 *
	 * @param file   the unreadable document
	 * @param reason what is wrong with it
	 * @param cause  the parser failure, may be null
	 */
	public CorruptDataException(@Nonnull Path file, @Nonnull String reason, @Nullable Throwable cause) {
		super("Corrupt catalogue document " + Objects.requireNonNull(file, "file must not be null") + ": " + reason, cause);
		this.file = file;
	}

	/**
	 * Returns the unreadable document.
	 *
	 * @return path of the document
	 */
	@Nonnull
	public Path getFile() {
		return this.file;
	}
}
