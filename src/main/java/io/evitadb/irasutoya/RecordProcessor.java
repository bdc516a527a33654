package io.evitadb.irasutoya;

import io.evitadb.irasutoya.error.EnrichmentException;
import io.evitadb.irasutoya.model.Axis;
import io.evitadb.irasutoya.model.AxisState;
import io.evitadb.irasutoya.model.Illustration;
import io.evitadb.irasutoya.model.RecordFailure;
import io.evitadb.irasutoya.model.RecordOutcome;
import io.evitadb.irasutoya.model.RecordTask;
import io.evitadb.irasutoya.retry.RetriesExhaustedException;
import io.evitadb.irasutoya.retry.RetryPolicy;
import io.evitadb.irasutoya.retry.RetryResult;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the selected axes of one record on a worker thread: translation first, then the image download,
 * each through the {@link RetryPolicy}. The axes are independent, a failed translation does not prevent
 * the download and vice versa.
 *
 * Never throws for per-record failures; they are returned in the {@link RecordOutcome}.
 */
public final class RecordProcessor {

	@Nullable
	private final TranslationWorker translationWorker;
	@Nullable
	private final ImageFetcher imageFetcher;
	@Nonnull
	private final RetryPolicy retryPolicy;
	@Nonnull
	private final Log log;
	private final Map<RecordTask, Axis> inFlight = new ConcurrentHashMap<>();

	/**
	 * Creates a record processor.
	 *
	 * @param translationWorker worker for the translation axis, null when the run does not translate
	 * @param imageFetcher      fetcher for the download axis, null when the run does not download
	 * @param retryPolicy       policy wrapping every remote operation
	 * @param log               Maven log for output
	 */
	public RecordProcessor(
		@Nullable TranslationWorker translationWorker,
		@Nullable ImageFetcher imageFetcher,
		@Nonnull RetryPolicy retryPolicy,
		@Nonnull Log log
	) {
		this.translationWorker = translationWorker;
		this.imageFetcher = imageFetcher;
		this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Processes the task.
	 *
	 * @param task the record and its selected axes
	 * @return outcome with final axis states and the possibly translated record
	 */
	@Nonnull
	public RecordOutcome process(@Nonnull RecordTask task) {
		Objects.requireNonNull(task, "task must not be null");

		final String id = task.recordId();
		final List<RecordFailure> failures = new ArrayList<>(2);
		Illustration current = task.illustration();

		AxisState translation = task.initialState(Axis.TRANSLATION);
		if (translation == AxisState.PENDING) {
			final TranslationWorker worker = Objects.requireNonNull(this.translationWorker, "translation is not configured");
			final Illustration source = current;
			this.inFlight.put(task, Axis.TRANSLATION);
			try {
				final RetryResult<Illustration> result = this.retryPolicy.execute(
					id + " translation", () -> worker.translate(source)
				);
				current = result.value();
				translation = AxisState.DONE;
				this.log.info("[TRANSLATE] " + id + attemptsSuffix(result.attempts()));
			} catch (RetriesExhaustedException e) {
				translation = AxisState.FAILED;
				failures.add(fail(id, Axis.TRANSLATION, e.getAttempts(), e));
			} catch (EnrichmentException | RuntimeException e) {
				translation = AxisState.FAILED;
				failures.add(fail(id, Axis.TRANSLATION, 1, e));
			} finally {
				this.inFlight.remove(task, Axis.TRANSLATION);
			}
		}

		AxisState download = task.initialState(Axis.DOWNLOAD);
		if (download == AxisState.PENDING) {
			final ImageFetcher fetcher = Objects.requireNonNull(this.imageFetcher, "download is not configured");
			final Illustration target = current;
			this.inFlight.put(task, Axis.DOWNLOAD);
			try {
				final RetryResult<Boolean> result = this.retryPolicy.execute(
					id + " download", () -> fetcher.fetch(target)
				);
				if (result.value()) {
					download = AxisState.DONE;
					this.log.info("[DOWNLOAD] " + id + " -> " + target.getDirectoryPath() + attemptsSuffix(result.attempts()));
				} else {
					download = AxisState.NOT_REQUIRED;
				}
			} catch (RetriesExhaustedException e) {
				download = AxisState.FAILED;
				failures.add(fail(id, Axis.DOWNLOAD, e.getAttempts(), e));
			} catch (EnrichmentException | RuntimeException e) {
				download = AxisState.FAILED;
				failures.add(fail(id, Axis.DOWNLOAD, 1, e));
			} finally {
				this.inFlight.remove(task, Axis.DOWNLOAD);
			}
		}

		return new RecordOutcome(task, current, translation, download, failures);
	}

	/**
	 * Returns the records currently being worked on and the axis in progress.
	 *
	 * @return snapshot of in-flight work keyed by task
	 */
	@Nonnull
	public Map<RecordTask, Axis> getInFlight() {
		return Map.copyOf(this.inFlight);
	}

	@Nonnull
	private RecordFailure fail(@Nonnull String id, @Nonnull Axis axis, int attempts, @Nonnull Exception e) {
		final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
		this.log.error("[FAILED] " + id + " (" + axis + "): " + message);
		return new RecordFailure(id, axis, attempts, message);
	}

	@Nonnull
	private static String attemptsSuffix(int attempts) {
		return attempts > 1 ? " (after " + attempts + " attempts)" : "";
	}
}
