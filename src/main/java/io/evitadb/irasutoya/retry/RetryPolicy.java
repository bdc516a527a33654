package io.evitadb.irasutoya.retry;

import io.evitadb.irasutoya.error.EnrichmentException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs remote operations with bounded retries and exponential backoff, built on a Resilience4j {@link Retry}.
 *
 * Classification is carried by the failures themselves ({@link EnrichmentException#isTransient()}):
 * - transient failure: retried up to `maxRetries` more times, then reported as {@link RetriesExhaustedException}
 * - permanent failure: rethrown immediately without any retry
 *
 * A fresh {@link Retry} instance is created per call, so attempt counting never leaks between records
 * processed concurrently.
 */
public final class RetryPolicy {

	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
	private static final double BACKOFF_MULTIPLIER = 2.0;
	private static final long MAX_BACKOFF_MILLIS = Duration.ofMinutes(2).toMillis();

	private final int maxRetries;
	@Nonnull
	private final RetryConfig config;
	@Nonnull
	private final Log log;

	/**
	 * Creates a retry policy.
	 *
	 * @param maxRetries     number of additional attempts after the first one, zero disables retrying
	 * @param initialBackoff wait before the first retry, doubled for every further retry
	 * @param log            Maven log for retry messages
	 */
	public RetryPolicy(int maxRetries, @Nonnull Duration initialBackoff, @Nonnull Log log) {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must not be negative");
		}
		Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.maxRetries = maxRetries;

		// Resilience4j rejects intervals below one millisecond
		final long initialMillis = Math.max(1L, initialBackoff.toMillis());
		this.config = RetryConfig.custom()
			.maxAttempts(maxRetries + 1)
			.intervalFunction(IntervalFunction.ofExponentialBackoff(
				initialMillis, BACKOFF_MULTIPLIER, Math.max(initialMillis, MAX_BACKOFF_MILLIS)
			))
			.retryOnException(RetryPolicy::isTransient)
			.build();
	}

	/**
	 * Creates a retry policy with the default backoff.
	 *
	 * @param maxRetries number of additional attempts after the first one
	 * @param log        Maven log for retry messages
	 */
	public RetryPolicy(int maxRetries, @Nonnull Log log) {
		this(maxRetries, DEFAULT_INITIAL_BACKOFF, log);
	}

	/**
	 * Executes the operation, retrying transient failures.
	 *
	 * @param operationName name used in log messages, typically the record identifier and axis
	 * @param operation     the operation to run
	 * @param <T>           type of the operation result
	 * @return the result and the number of attempts it took
	 * @throws EnrichmentException        the first permanent failure, without any retry
	 * @throws RetriesExhaustedException  if every attempt failed transiently
	 */
	@Nonnull
	public <T> RetryResult<T> execute(
		@Nonnull String operationName,
		@Nonnull RetryableOperation<T> operation
	) throws EnrichmentException, RetriesExhaustedException {
		Objects.requireNonNull(operationName, "operationName must not be null");
		Objects.requireNonNull(operation, "operation must not be null");

		final AtomicInteger attempts = new AtomicInteger(0);
		final Retry retry = Retry.of(operationName, this.config);
		retry.getEventPublisher().onRetry(event -> this.log.warn(
			"[RETRY] " + operationName + ": attempt " + event.getNumberOfRetryAttempts() + " of " +
				(this.maxRetries + 1) + " failed, retrying in " + event.getWaitInterval().toMillis() + " ms: " +
				describe(event.getLastThrowable())
		));

		try {
			final T value = retry.executeCallable(() -> {
				attempts.incrementAndGet();
				return operation.execute();
			});
			return new RetryResult<>(value, attempts.get());
		} catch (EnrichmentException e) {
			if (e.isTransient()) {
				throw new RetriesExhaustedException(attempts.get(), e);
			}
			throw e;
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Unexpected checked exception from " + operationName, e);
		}
	}

	private static boolean isTransient(@Nonnull Throwable throwable) {
		return throwable instanceof EnrichmentException enrichmentException && enrichmentException.isTransient();
	}

	@Nonnull
	private static String describe(Throwable throwable) {
		if (throwable == null) {
			return "<unknown>";
		}
		return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
	}
}
