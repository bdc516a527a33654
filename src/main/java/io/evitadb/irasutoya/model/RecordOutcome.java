package io.evitadb.irasutoya.model;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Result of processing one {@link RecordTask} on a worker thread. The orchestrating thread applies the
 * updated record to the collection; workers never touch the collection themselves.
 *
 * @param task         the processed task
 * @param illustration the record after processing (the original one when nothing changed)
 * @param translation  final state of the translation axis
 * @param download     final state of the download axis
 * @param failures     failures of the failed axes
 */
public record RecordOutcome(
	@Nonnull RecordTask task,
	@Nonnull Illustration illustration,
	@Nonnull AxisState translation,
	@Nonnull AxisState download,
	@Nonnull List<RecordFailure> failures
) {

	public RecordOutcome {
		Objects.requireNonNull(task, "task must not be null");
		Objects.requireNonNull(illustration, "illustration must not be null");
		Objects.requireNonNull(translation, "translation must not be null");
		Objects.requireNonNull(download, "download must not be null");
		failures = List.copyOf(Objects.requireNonNull(failures, "failures must not be null"));
		if (!translation.isTerminal() || !download.isTerminal()) {
			throw new IllegalArgumentException("Outcome states must be terminal: " + translation + "/" + download);
		}
	}

	/**
	 * Returns true if the record differs from the loaded one and must be written back.
	 */
	public boolean isModified() {
		return !this.illustration.equals(this.task.illustration());
	}

	/**
	 * Returns true if any axis failed.
	 */
	public boolean hasFailures() {
		return this.translation == AxisState.FAILED || this.download == AxisState.FAILED;
	}
}
