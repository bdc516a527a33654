package io.evitadb.irasutoya;

import io.evitadb.irasutoya.model.AxisState;
import io.evitadb.irasutoya.model.Illustration;
import io.evitadb.irasutoya.model.RecordOutcome;
import io.evitadb.irasutoya.model.RecordTask;
import io.evitadb.irasutoya.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnrichmentExecutor should process records in parallel")
public class EnrichmentExecutorTest {

	private TestLog log;
	private EnrichmentExecutor executor;

	@BeforeEach
	void setUp() {
		log = new TestLog();
	}

	@AfterEach
	void tearDown() {
		if (executor != null) {
			executor.shutdown();
		}
	}

	@Test
	@DisplayName("shouldHandOverEveryOutcomeOnCallingThread")
	void shouldHandOverEveryOutcomeOnCallingThread() throws Exception {
		executor = new EnrichmentExecutor(4, processor((text, language) -> "Translated " + text), log);
		final List<RecordTask> tasks = createTasks(12);
		final Thread caller = Thread.currentThread();
		final List<RecordOutcome> outcomes = new ArrayList<>();

		executor.executeAll(tasks, outcome -> {
			assertSame(caller, Thread.currentThread());
			outcomes.add(outcome);
		});

		assertEquals(12, outcomes.size());
		final Set<Integer> indexes = new HashSet<>();
		for (final RecordOutcome outcome : outcomes) {
			assertEquals(AxisState.DONE, outcome.translation());
			indexes.add(outcome.task().index());
		}
		assertEquals(12, indexes.size());
	}

	@Test
	@DisplayName("shouldContinueOnIndividualFailure")
	void shouldContinueOnIndividualFailure() throws Exception {
		executor = new EnrichmentExecutor(2, processor((text, language) -> {
			if (text.endsWith("3")) {
				throw new IllegalArgumentException("unsupported text");
			}
			return "ok";
		}), log);
		final List<RecordOutcome> outcomes = new ArrayList<>();

		executor.executeAll(createTasks(5), outcomes::add);

		assertEquals(5, outcomes.size());
		assertEquals(1, outcomes.stream().filter(RecordOutcome::hasFailures).count());
	}

	@Test
	@DisplayName("shouldPropagateHandlerFailure")
	void shouldPropagateHandlerFailure() {
		executor = new EnrichmentExecutor(2, processor((text, language) -> "ok"), log);

		final IOException exception = assertThrows(IOException.class, () ->
			executor.executeAll(createTasks(3), outcome -> {
				throw new IOException("disk full");
			})
		);

		assertEquals("disk full", exception.getMessage());
	}

	@Test
	@DisplayName("shouldDoNothingForEmptyTaskList")
	void shouldDoNothingForEmptyTaskList() throws Exception {
		executor = new EnrichmentExecutor(1, processor((text, language) -> "ok"), log);

		executor.executeAll(List.of(), outcome -> fail("no outcome expected"));

		assertTrue(executor.getInFlight().isEmpty());
	}

	@Test
	@DisplayName("shouldRejectInvalidParallelism")
	void shouldRejectInvalidParallelism() {
		assertThrows(IllegalArgumentException.class, () ->
			new EnrichmentExecutor(0, processor((text, language) -> "ok"), log)
		);
	}

	private RecordProcessor processor(TextTranslator translator) {
		return new RecordProcessor(
			new TranslationWorker(translator, "en"), null, new RetryPolicy(0, Duration.ofMillis(1), log), log
		);
	}

	private static List<RecordTask> createTasks(int count) {
		final List<RecordTask> tasks = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			final Illustration illustration = Illustration.of(
				"title " + i, null, null, "https://www.irasutoya.com/entry-" + i + ".html", null, null, null
			);
			tasks.add(new RecordTask(i, illustration, true, false));
		}
		return tasks;
	}
}
