package io.evitadb.irasutoya.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Describes why one axis of one record failed in a run, with enough detail to diagnose and re-run.
 *
 * @param recordId identifier of the record (entry URL, image URL or title)
 * @param axis     the failed axis
 * @param attempts number of attempts made before giving up
 * @param message  description of the last failure
 */
public record RecordFailure(
	@Nonnull String recordId,
	@Nonnull Axis axis,
	int attempts,
	@Nonnull String message
) {

	public RecordFailure {
		Objects.requireNonNull(recordId, "recordId must not be null");
		Objects.requireNonNull(axis, "axis must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	@Override
	public String toString() {
		return recordId + " [" + axis + ", " + attempts + " attempt(s)]: " + message;
	}
}
