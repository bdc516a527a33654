package io.evitadb.irasutoya.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunSummary should count outcomes")
public class RunSummaryTest {

	private static final Illustration RECORD = Illustration.of(
		"花", null, List.of(), "https://www.irasutoya.com/hana.html", "https://example.org/hana.png", null, "2020-04-01"
	);

	@Test
	@DisplayName("shouldCountCompletedAxesSeparately")
	void shouldCountCompletedAxesSeparately() {
		final RecordTask task = new RecordTask(0, RECORD, true, true);
		final RecordOutcome outcome = new RecordOutcome(task, RECORD, AxisState.DONE, AxisState.DONE, List.of());

		final RunSummary summary = RunSummary.empty(3).withOutcome(outcome).withSkipped().withCheckpoint();

		assertEquals(3, summary.totalCount());
		assertEquals(1, summary.translatedCount());
		assertEquals(1, summary.downloadedCount());
		assertEquals(1, summary.skippedCount());
		assertEquals(0, summary.failedCount());
		assertEquals(1, summary.checkpoints());
		assertFalse(summary.hasFailures());
	}

	@Test
	@DisplayName("shouldCountRecordWithFailuresOnce")
	void shouldCountRecordWithFailuresOnce() {
		final RecordTask task = new RecordTask(0, RECORD, true, true);
		final List<RecordFailure> failures = List.of(
			new RecordFailure(task.recordId(), Axis.TRANSLATION, 4, "rate limited"),
			new RecordFailure(task.recordId(), Axis.DOWNLOAD, 1, "HTTP 404")
		);
		final RecordOutcome outcome = new RecordOutcome(task, RECORD, AxisState.FAILED, AxisState.FAILED, failures);

		final RunSummary summary = RunSummary.empty(1).withOutcome(outcome).asInterrupted();

		assertEquals(1, summary.failedCount());
		assertEquals(2, summary.failures().size());
		assertTrue(summary.interrupted());
		assertTrue(summary.toString().contains("interrupted"));
	}

	@Test
	@DisplayName("shouldRejectNonTerminalOutcome")
	void shouldRejectNonTerminalOutcome() {
		final RecordTask task = new RecordTask(0, RECORD, true, false);

		assertThrows(IllegalArgumentException.class, () ->
			new RecordOutcome(task, RECORD, AxisState.PENDING, AxisState.NOT_REQUIRED, List.of())
		);
	}

	@Test
	@DisplayName("shouldMapActionsToRunModes")
	void shouldMapActionsToRunModes() {
		assertEquals(RunMode.TRANSLATE, RunMode.fromAction("translate"));
		assertEquals(RunMode.DOWNLOAD, RunMode.fromAction("download"));
		assertEquals(RunMode.BOTH, RunMode.fromAction("enrich"));
		assertTrue(RunMode.BOTH.isTranslating() && RunMode.BOTH.isDownloading());
		assertThrows(IllegalArgumentException.class, () -> RunMode.fromAction("show-config"));
	}
}
