package io.evitadb.irasutoya.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Thrown when translating one field of a record fails. The whole record is discarded: no English field
 * of the record is kept when any of them fails.
 */
public final class TranslationFailedException extends EnrichmentException {

	@Nonnull
	private final String field;

	/**
	 * Creates a new TranslationFailedException.
	 *
	 * @param field            the name of the field whose translation failed (e.g. `categories[1]`)
	 * @param cause            the failure reported by the translation backend
	 * @param transientFailure true if a retry may succeed
	 */
	public TranslationFailedException(@Nonnull String field, @Nullable Throwable cause, boolean transientFailure) {
		super(
			"Translation of field " + Objects.requireNonNull(field, "field must not be null") + " failed" +
				(cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
			cause,
			transientFailure
		);
		this.field = field;
	}

	/**
	 * Returns the name of the field whose translation failed.
	 *
	 * @return field name
	 */
	@Nonnull
	public String getField() {
		return this.field;
	}
}
