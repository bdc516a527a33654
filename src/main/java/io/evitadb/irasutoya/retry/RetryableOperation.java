package io.evitadb.irasutoya.retry;

import io.evitadb.irasutoya.error.EnrichmentException;

import javax.annotation.Nonnull;

/**
 * A remote operation that reports its failures already classified as transient or permanent.
 *
 * @param <T> type of the operation result
 */
@FunctionalInterface
public interface RetryableOperation<T> {

	@Nonnull
	T execute() throws EnrichmentException;

}
