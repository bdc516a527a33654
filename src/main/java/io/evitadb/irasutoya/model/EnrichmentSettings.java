package io.evitadb.irasutoya.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of an enrichment run that is not part of the core entry point arguments.
 *
 * @param targetLanguage     BCP 47 tag of the translation target language
 * @param parallelism        number of records processed concurrently
 * @param checkpointInterval number of completed records between two checkpoints
 * @param limit              maximum number of records with pending work processed in one run
 * @param retryBackoff       wait before the first retry, doubled for each further retry
 * @param requestDelay       pause after each translation request
 * @param catalogueUrl       where to download the source catalogue from when the input file is missing, may be null
 * @param dryRun             when true, only report the pending work
 */
public record EnrichmentSettings(
	@Nonnull String targetLanguage,
	int parallelism,
	int checkpointInterval,
	int limit,
	@Nonnull Duration retryBackoff,
	@Nonnull Duration requestDelay,
	@Nullable URI catalogueUrl,
	boolean dryRun
) {

	public static final String DEFAULT_TARGET_LANGUAGE = "en";
	public static final int DEFAULT_PARALLELISM = 4;
	public static final int DEFAULT_CHECKPOINT_INTERVAL = 10;

	public EnrichmentSettings {
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		Objects.requireNonNull(retryBackoff, "retryBackoff must not be null");
		Objects.requireNonNull(requestDelay, "requestDelay must not be null");
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		if (checkpointInterval < 1) {
			throw new IllegalArgumentException("checkpointInterval must be at least 1");
		}
		if (limit < 0) {
			throw new IllegalArgumentException("limit must not be negative");
		}
	}
}
