package io.evitadb.irasutoya;

import io.evitadb.irasutoya.error.EnrichmentException;
import io.evitadb.irasutoya.http.ResourceFetcher;
import io.evitadb.irasutoya.model.Axis;
import io.evitadb.irasutoya.model.DirectoryPaths;
import io.evitadb.irasutoya.model.EnrichmentSettings;
import io.evitadb.irasutoya.model.Illustration;
import io.evitadb.irasutoya.model.RecordOutcome;
import io.evitadb.irasutoya.model.RecordTask;
import io.evitadb.irasutoya.model.RunMode;
import io.evitadb.irasutoya.model.RunSummary;
import io.evitadb.irasutoya.retry.RetriesExhaustedException;
import io.evitadb.irasutoya.retry.RetryPolicy;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orchestrates an enrichment run: reconciles the catalogue with the output document, selects the pending
 * work of every record, dispatches it to the worker pool and persists progress at checkpoints.
 *
 * Pending work is a pure function of the loaded collection and the image directory: a record is a
 * translation candidate when it is not translated, and a download candidate when its image file is missing
 * or empty. Nothing else is remembered between runs, so a restart after a crash redoes at most the records
 * completed after the last checkpoint.
 *
 * The orchestrating thread is the only one that touches the collection and writes the output document.
 */
public final class EnrichmentOrchestrator {

	@Nonnull
	private final RecordStore recordStore;
	@Nullable
	private final TextTranslator textTranslator;
	@Nonnull
	private final ResourceFetcher resourceFetcher;
	@Nonnull
	private final EnrichmentSettings settings;
	@Nonnull
	private final Log log;
	@Nonnull
	private final CatalogueReconciler reconciler = new CatalogueReconciler();

	/**
	 * Creates an orchestrator with the required collaborators.
	 *
	 * @param recordStore     store reading and writing catalogue documents
	 * @param textTranslator  translation backend, may be null for runs that do not translate
	 * @param resourceFetcher HTTP collaborator for images and the catalogue
	 * @param settings        run tuning
	 * @param log             Maven log for output
	 */
	public EnrichmentOrchestrator(
		@Nonnull RecordStore recordStore,
		@Nullable TextTranslator textTranslator,
		@Nonnull ResourceFetcher resourceFetcher,
		@Nonnull EnrichmentSettings settings,
		@Nonnull Log log
	) {
		this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
		this.textTranslator = textTranslator;
		this.resourceFetcher = Objects.requireNonNull(resourceFetcher, "resourceFetcher must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Runs the selected passes over the whole collection.
	 *
	 * Per-record failures are reported in the summary and never abort the run. Only data integrity problems
	 * propagate: an unreadable input or output document, or an output location that cannot be written.
	 *
	 * @param mode       which passes to run
	 * @param maxRetries number of retries of a transiently failing remote call
	 * @param inputPath  the source catalogue document
	 * @param outputPath the enriched document; images are stored next to it
	 * @return run summary
	 * @throws io.evitadb.irasutoya.error.CorruptDataException if a document cannot be parsed
	 * @throws IOException if the output location cannot be written
	 */
	@Nonnull
	public RunSummary run(
		@Nonnull RunMode mode,
		int maxRetries,
		@Nonnull Path inputPath,
		@Nonnull Path outputPath
	) throws IOException {
		Objects.requireNonNull(mode, "mode must not be null");
		Objects.requireNonNull(inputPath, "inputPath must not be null");
		Objects.requireNonNull(outputPath, "outputPath must not be null");
		if (mode.isTranslating() && this.textTranslator == null && !this.settings.dryRun()) {
			throw new IllegalStateException("A text translator is required for mode " + mode);
		}

		final Path input = inputPath.toAbsolutePath().normalize();
		final Path output = outputPath.toAbsolutePath().normalize();
		final Path outputDir = output.getParent();
		final RetryPolicy retryPolicy = new RetryPolicy(maxRetries, this.settings.retryBackoff(), this.log);

		if (!this.settings.dryRun()) {
			ensureWritable(outputDir);
			downloadCatalogueIfMissing(retryPolicy, input);
		}

		// Load and reconcile; corrupt documents abort here, before any processing
		final List<Illustration> persisted = this.recordStore.load(output);
		final List<Illustration> catalogue = input.equals(output) ? List.of() : this.recordStore.load(input);
		final List<Illustration> records = this.reconciler.reconcile(persisted, catalogue);
		this.log.info(
			"Loaded " + records.size() + " records (" + persisted.size() + " from " + output.getFileName() +
				", " + (records.size() - persisted.size()) + " new from " + input.getFileName() + ")"
		);

		final ImageFetcher imageFetcher = mode.isDownloading() ? new ImageFetcher(this.resourceFetcher, outputDir) : null;
		final RunState state = new RunState(RunSummary.empty(records.size()));
		final List<RecordTask> tasks = plan(mode, records, imageFetcher, state);
		state.dirty = !records.equals(persisted) || !Files.exists(output);

		if (this.settings.dryRun()) {
			return state.summary;
		}

		final TranslationWorker translationWorker = mode.isTranslating()
			? new TranslationWorker(Objects.requireNonNull(this.textTranslator), this.settings.targetLanguage(), this.settings.requestDelay())
			: null;
		final RecordProcessor processor = new RecordProcessor(translationWorker, imageFetcher, retryPolicy, this.log);
		final EnrichmentExecutor executor = new EnrichmentExecutor(this.settings.parallelism(), processor, this.log);

		this.log.info("Processing " + tasks.size() + " records with parallelism " + this.settings.parallelism() + "...");
		try {
			executor.executeAll(tasks, outcome -> apply(outcome, records, output, state));
			if (state.dirty) {
				checkpoint(records, output, state);
			}
		} catch (InterruptedException e) {
			abandon(executor);
			if (state.dirty) {
				checkpoint(records, output, state);
			}
			state.interrupted = true;
			Thread.currentThread().interrupt();
		} finally {
			executor.shutdown();
		}
		return state.interrupted ? state.summary.asInterrupted() : state.summary;
	}

	/**
	 * Selects the pending work of every record and resolves directory paths. Records beyond the limit are
	 * left for a later run.
	 */
	@Nonnull
	private List<RecordTask> plan(
		@Nonnull RunMode mode,
		@Nonnull List<Illustration> records,
		@Nullable ImageFetcher imageFetcher,
		@Nonnull RunState state
	) {
		final List<RecordTask> tasks = new ArrayList<>();
		int deferred = 0;
		for (int i = 0; i < records.size(); i++) {
			final Illustration illustration = withResolvedPath(records.get(i));
			records.set(i, illustration);

			final RecordTask task = new RecordTask(
				i, illustration,
				mode.isTranslating() && !illustration.isTranslated(),
				imageFetcher != null && !imageFetcher.isDownloaded(illustration)
			);
			if (!task.hasWork()) {
				state.summary = state.summary.withSkipped();
				if (this.settings.dryRun()) {
					reportUpToDate(illustration);
				}
				continue;
			}
			if (tasks.size() >= this.settings.limit()) {
				deferred++;
				continue;
			}

			tasks.add(task);
			if (this.settings.dryRun()) {
				reportTask(task);
			}
		}
		if (deferred > 0) {
			this.log.info("Deferred " + deferred + " records beyond the limit of " + this.settings.limit());
		}
		return tasks;
	}

	/**
	 * Applies one outcome to the collection and writes a checkpoint when enough records completed.
	 * Runs on the orchestrating thread only.
	 */
	private void apply(
		@Nonnull RecordOutcome outcome,
		@Nonnull List<Illustration> records,
		@Nonnull Path output,
		@Nonnull RunState state
	) throws IOException {
		if (outcome.isModified()) {
			records.set(outcome.task().index(), outcome.illustration());
			state.dirty = true;
		}
		state.summary = state.summary.withOutcome(outcome);
		state.sinceCheckpoint++;
		if (state.sinceCheckpoint >= this.settings.checkpointInterval() && state.dirty) {
			checkpoint(records, output, state);
		}
	}

	/**
	 * Writes the collection to the output document. An interrupt arriving during the write closes the file
	 * channel; the write is then repeated with the interrupt flag cleared and the flag is restored afterwards,
	 * so the run stops at the next wait with its progress saved.
	 */
	private void checkpoint(@Nonnull List<Illustration> records, @Nonnull Path output, @Nonnull RunState state) throws IOException {
		try {
			this.recordStore.save(records, output);
		} catch (ClosedByInterruptException e) {
			Thread.interrupted();
			state.interrupted = true;
			try {
				this.recordStore.save(records, output);
			} finally {
				Thread.currentThread().interrupt();
			}
		}
		this.log.info("[CHECKPOINT] " + records.size() + " records written to " + output.getFileName());
		state.summary = state.summary.withCheckpoint();
		state.sinceCheckpoint = 0;
		state.dirty = false;
	}

	private void abandon(@Nonnull EnrichmentExecutor executor) {
		final Map<RecordTask, Axis> inFlight = executor.getInFlight();
		this.log.warn("Run interrupted, abandoning " + inFlight.size() + " in-flight record(s)");
		inFlight.forEach((task, axis) -> this.log.warn("[ABANDONED] " + task.recordId() + " (" + axis + ")"));
		executor.shutdownNow();
	}

	private void downloadCatalogueIfMissing(@Nonnull RetryPolicy retryPolicy, @Nonnull Path input) {
		if (this.settings.catalogueUrl() == null || Files.exists(input)) {
			return;
		}
		try {
			new CatalogueDownloader(this.resourceFetcher, retryPolicy, this.log)
				.ensurePresent(this.settings.catalogueUrl(), input);
		} catch (EnrichmentException | RetriesExhaustedException e) {
			// the output document may still hold records worth processing
			this.log.error("Failed to download catalogue from " + this.settings.catalogueUrl() + ": " + e.getMessage());
		}
	}

	@Nonnull
	private Illustration withResolvedPath(@Nonnull Illustration illustration) {
		try {
			return illustration.withDirectoryPath(DirectoryPaths.resolve(illustration));
		} catch (IllegalArgumentException e) {
			this.log.debug("No image path for " + illustration.recordId() + ": " + e.getMessage());
			return illustration;
		}
	}

	private static void ensureWritable(@Nonnull Path directory) throws IOException {
		Files.createDirectories(directory);
		if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
			throw new IOException("Output directory is not writable: " + directory);
		}
	}

	/**
	 * Reports the pending work of a record for dry-run output.
	 *
	 * @param task the selected work
	 */
	public void reportTask(@Nonnull RecordTask task) {
		Objects.requireNonNull(task, "task must not be null");

		if (task.translate()) {
			this.log.info("[TRANSLATE] " + task.recordId());
		}
		if (task.download()) {
			final String path = task.illustration().getDirectoryPath();
			this.log.info("[DOWNLOAD] " + task.recordId() + " -> " + (path == null ? "<no image path>" : path));
		}
	}

	/**
	 * Reports that a record needs no work.
	 *
	 * @param illustration the record
	 */
	public void reportUpToDate(@Nonnull Illustration illustration) {
		this.log.info("[SKIP] " + illustration.recordId() + " (up to date)");
	}

	/**
	 * Mutable run bookkeeping, confined to the orchestrating thread.
	 */
	private static final class RunState {
		@Nonnull
		private RunSummary summary;
		private boolean dirty;
		private boolean interrupted;
		private int sinceCheckpoint;

		private RunState(@Nonnull RunSummary summary) {
			this.summary = summary;
		}
	}
}
