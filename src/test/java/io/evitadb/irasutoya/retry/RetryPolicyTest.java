package io.evitadb.irasutoya.retry;

import io.evitadb.irasutoya.TestLog;
import io.evitadb.irasutoya.error.EnrichmentException;
import io.evitadb.irasutoya.error.FetchFailedException;
import io.evitadb.irasutoya.error.TranslationFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy should retry transient failures only")
public class RetryPolicyTest {

	private TestLog log;
	private RetryPolicy policy;

	@BeforeEach
	void setUp() {
		log = new TestLog();
		policy = new RetryPolicy(3, Duration.ofMillis(1), log);
	}

	@Test
	@DisplayName("shouldSucceedOnFirstAttempt")
	void shouldSucceedOnFirstAttempt() throws Exception {
		final RetryResult<String> result = policy.execute("op", () -> "done");

		assertEquals("done", result.value());
		assertEquals(1, result.attempts());
		assertFalse(log.hasWarning("[RETRY]"));
	}

	@Test
	@DisplayName("shouldSucceedAfterTransientFailures")
	void shouldSucceedAfterTransientFailures() throws Exception {
		final AtomicInteger calls = new AtomicInteger();

		final RetryResult<String> result = policy.execute("flaky", () -> {
			if (calls.incrementAndGet() < 3) {
				throw new FetchFailedException("https://example.org/a.png", new IOException("connection reset"), true);
			}
			return "image";
		});

		assertEquals("image", result.value());
		assertEquals(3, result.attempts());
		assertEquals(3, calls.get());
		assertTrue(log.hasWarning("[RETRY] flaky"));
	}

	@Test
	@DisplayName("shouldNotRetryPermanentFailure")
	void shouldNotRetryPermanentFailure() {
		final AtomicInteger calls = new AtomicInteger();

		final EnrichmentException exception = assertThrows(EnrichmentException.class, () ->
			policy.execute("missing", () -> {
				calls.incrementAndGet();
				throw new FetchFailedException("https://example.org/gone.png", new IOException("HTTP 404"), false);
			})
		);

		assertFalse(exception.isTransient());
		assertEquals(1, calls.get());
	}

	@Test
	@DisplayName("shouldGiveUpAfterMaxRetries")
	void shouldGiveUpAfterMaxRetries() {
		final AtomicInteger calls = new AtomicInteger();

		final RetriesExhaustedException exception = assertThrows(RetriesExhaustedException.class, () ->
			policy.execute("overloaded", () -> {
				calls.incrementAndGet();
				throw new TranslationFailedException("title", new IllegalStateException("rate limited"), true);
			})
		);

		assertEquals(4, calls.get());
		assertEquals(4, exception.getAttempts());
		assertInstanceOf(TranslationFailedException.class, exception.getLastCause());
		assertTrue(exception.getMessage().contains("rate limited"));
	}

	@Test
	@DisplayName("shouldAttemptOnceWithZeroRetries")
	void shouldAttemptOnceWithZeroRetries() {
		final RetryPolicy noRetries = new RetryPolicy(0, Duration.ZERO, log);
		final AtomicInteger calls = new AtomicInteger();

		final RetriesExhaustedException exception = assertThrows(RetriesExhaustedException.class, () ->
			noRetries.execute("once", () -> {
				calls.incrementAndGet();
				throw new FetchFailedException("https://example.org/a.png", null, true);
			})
		);

		assertEquals(1, calls.get());
		assertEquals(1, exception.getAttempts());
	}

	@Test
	@DisplayName("shouldPropagateRuntimeExceptionWithoutRetry")
	void shouldPropagateRuntimeExceptionWithoutRetry() {
		final AtomicInteger calls = new AtomicInteger();

		assertThrows(IllegalStateException.class, () ->
			policy.execute("defect", () -> {
				calls.incrementAndGet();
				throw new IllegalStateException("bug");
			})
		);
		assertEquals(1, calls.get());
	}

	@Test
	@DisplayName("shouldRejectNegativeRetries")
	void shouldRejectNegativeRetries() {
		assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, log));
	}
}
