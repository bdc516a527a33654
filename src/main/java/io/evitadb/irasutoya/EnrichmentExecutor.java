package io.evitadb.irasutoya;

import io.evitadb.irasutoya.model.Axis;
import io.evitadb.irasutoya.model.AxisState;
import io.evitadb.irasutoya.model.RecordFailure;
import io.evitadb.irasutoya.model.RecordOutcome;
import io.evitadb.irasutoya.model.RecordTask;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Executes record tasks on a fixed thread pool. The pool size bounds the number of outstanding remote calls.
 *
 * Outcomes are handed to the {@link OutcomeHandler} on the calling thread, one at a time and in completion
 * order, so the handler is the single writer of the record collection and of the persisted document.
 */
public final class EnrichmentExecutor {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	/**
	 * Receives completed outcomes on the thread that called {@link #executeAll(List, OutcomeHandler)}.
	 */
	@FunctionalInterface
	public interface OutcomeHandler {

		void handle(@Nonnull RecordOutcome outcome) throws IOException;

	}

	private final ExecutorService executor;
	private final RecordProcessor processor;
	private final Log log;

	/**
	 * Creates an executor with the specified parallelism.
	 *
	 * @param parallelism number of records processed concurrently
	 * @param processor   the per-record processor
	 * @param log         Maven log for output
	 */
	public EnrichmentExecutor(int parallelism, @Nonnull RecordProcessor processor, @Nonnull Log log) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		this.processor = Objects.requireNonNull(processor, "processor must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.executor = Executors.newFixedThreadPool(parallelism);
	}

	/**
	 * Processes all tasks and passes every outcome to the handler. Individual record failures never stop
	 * the other tasks.
	 *
	 * @param tasks   tasks to process
	 * @param handler receiver of the outcomes, called on the current thread
	 * @throws IOException          if the handler fails; pending tasks are cancelled
	 * @throws InterruptedException if the current thread is interrupted; pending tasks are cancelled
	 */
	public void executeAll(@Nonnull List<RecordTask> tasks, @Nonnull OutcomeHandler handler)
		throws IOException, InterruptedException {
		Objects.requireNonNull(tasks, "tasks must not be null");
		Objects.requireNonNull(handler, "handler must not be null");

		if (tasks.isEmpty()) {
			return;
		}

		final CompletionService<RecordOutcome> completionService = new ExecutorCompletionService<>(this.executor);
		final Map<Future<RecordOutcome>, RecordTask> submitted = new HashMap<>(tasks.size() * 2);
		for (final RecordTask task : tasks) {
			submitted.put(completionService.submit(() -> this.processor.process(task)), task);
		}

		boolean finished = false;
		try {
			for (int i = 0; i < tasks.size(); i++) {
				final Future<RecordOutcome> future = completionService.take();
				handler.handle(outcomeOf(future, submitted.get(future)));
			}
			finished = true;
		} finally {
			if (!finished) {
				for (final Future<RecordOutcome> future : submitted.keySet()) {
					future.cancel(true);
				}
			}
		}
	}

	/**
	 * Returns the records currently being worked on.
	 */
	@Nonnull
	public Map<RecordTask, Axis> getInFlight() {
		return this.processor.getInFlight();
	}

	@Nonnull
	private RecordOutcome outcomeOf(@Nonnull Future<RecordOutcome> future, @Nonnull RecordTask task) throws InterruptedException {
		try {
			return future.get();
		} catch (ExecutionException e) {
			// the processor contains record failures, so this is a defect or an Error
			final Throwable cause = e.getCause() != null ? e.getCause() : e;
			this.log.error("Unexpected failure while processing " + task.recordId() + ": " + cause, cause);
			final String message = "unexpected failure: " + cause;
			final List<RecordFailure> failures = new ArrayList<>(2);
			if (task.translate()) {
				failures.add(new RecordFailure(task.recordId(), Axis.TRANSLATION, 1, message));
			}
			if (task.download()) {
				failures.add(new RecordFailure(task.recordId(), Axis.DOWNLOAD, 1, message));
			}
			return new RecordOutcome(
				task,
				task.illustration(),
				task.translate() ? AxisState.FAILED : AxisState.NOT_REQUIRED,
				task.download() ? AxisState.FAILED : AxisState.NOT_REQUIRED,
				failures
			);
		}
	}

	/**
	 * Shuts down the executor gracefully, waiting for pending tasks to complete.
	 */
	public void shutdown() {
		this.executor.shutdown();
		try {
			if (!this.executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Executor did not terminate in time, forcing shutdown");
				this.executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.executor.shutdownNow();
		}
	}

	/**
	 * Abandons in-flight work immediately.
	 */
	public void shutdownNow() {
		this.executor.shutdownNow();
	}
}
