package io.evitadb.irasutoya.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record containing the summary statistics of an enrichment run.
 *
 * @param totalCount      number of records in the collection
 * @param translatedCount number of records translated in this run
 * @param downloadedCount number of images downloaded in this run
 * @param skippedCount    number of records that needed no work (already translated and downloaded)
 * @param failedCount     number of records with at least one failed axis
 * @param checkpoints     number of times the collection was persisted
 * @param interrupted     true if the run was interrupted before every record was attempted
 * @param failures        failure details, one entry per failed axis
 */
public record RunSummary(
	int totalCount,
	int translatedCount,
	int downloadedCount,
	int skippedCount,
	int failedCount,
	int checkpoints,
	boolean interrupted,
	@Nonnull List<RecordFailure> failures
) {

	public RunSummary {
		failures = List.copyOf(Objects.requireNonNull(failures, "failures must not be null"));
	}

	/**
	 * Creates an empty summary for a collection of the given size.
	 *
	 * @param totalCount number of records in the collection
	 * @return an empty RunSummary
	 */
	@Nonnull
	public static RunSummary empty(int totalCount) {
		return new RunSummary(totalCount, 0, 0, 0, 0, 0, false, List.of());
	}

	/**
	 * Creates a new summary with an incremented skipped count.
	 */
	@Nonnull
	public RunSummary withSkipped() {
		return new RunSummary(
			this.totalCount, this.translatedCount, this.downloadedCount, this.skippedCount + 1,
			this.failedCount, this.checkpoints, this.interrupted, this.failures
		);
	}

	/**
	 * Creates a new summary that accounts for one processed record.
	 *
	 * @param outcome the outcome of the record
	 * @return updated summary
	 */
	@Nonnull
	public RunSummary withOutcome(@Nonnull RecordOutcome outcome) {
		Objects.requireNonNull(outcome, "outcome must not be null");
		final List<RecordFailure> allFailures;
		if (outcome.failures().isEmpty()) {
			allFailures = this.failures;
		} else {
			allFailures = new ArrayList<>(this.failures);
			allFailures.addAll(outcome.failures());
		}
		return new RunSummary(
			this.totalCount,
			this.translatedCount + (outcome.translation() == AxisState.DONE ? 1 : 0),
			this.downloadedCount + (outcome.download() == AxisState.DONE ? 1 : 0),
			this.skippedCount,
			this.failedCount + (outcome.hasFailures() ? 1 : 0),
			this.checkpoints,
			this.interrupted,
			allFailures
		);
	}

	/**
	 * Creates a new summary with an incremented checkpoint count.
	 */
	@Nonnull
	public RunSummary withCheckpoint() {
		return new RunSummary(
			this.totalCount, this.translatedCount, this.downloadedCount, this.skippedCount,
			this.failedCount, this.checkpoints + 1, this.interrupted, this.failures
		);
	}

	/**
	 * Creates a new summary flagged as interrupted.
	 */
	@Nonnull
	public RunSummary asInterrupted() {
		return new RunSummary(
			this.totalCount, this.translatedCount, this.downloadedCount, this.skippedCount,
			this.failedCount, this.checkpoints, true, this.failures
		);
	}

	/**
	 * Returns true if any record failed.
	 */
	public boolean hasFailures() {
		return this.failedCount > 0;
	}

	@Override
	public String toString() {
		return String.format(
			"RunSummary[total=%d, translated=%d, downloaded=%d, skipped=%d, failed=%d, checkpoints=%d%s]",
			this.totalCount, this.translatedCount, this.downloadedCount, this.skippedCount,
			this.failedCount, this.checkpoints, this.interrupted ? ", interrupted" : ""
		);
	}
}
