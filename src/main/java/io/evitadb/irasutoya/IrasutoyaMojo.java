package io.evitadb.irasutoya;

import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.irasutoya.http.HttpResourceFetcher;
import io.evitadb.irasutoya.http.ResourceFetcher;
import io.evitadb.irasutoya.llm.ChatModelFactory;
import io.evitadb.irasutoya.llm.LlmClient;
import io.evitadb.irasutoya.llm.LlmTextTranslator;
import io.evitadb.irasutoya.llm.PromptLoader;
import io.evitadb.irasutoya.model.EnrichmentSettings;
import io.evitadb.irasutoya.model.RecordFailure;
import io.evitadb.irasutoya.model.RunMode;
import io.evitadb.irasutoya.model.RunSummary;
import io.evitadb.irasutoya.retry.RetryPolicy;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Main Mojo of the Irasutoya plugin providing actions:
 * - show-config: prints current configuration
 * - translate: adds English fields to every catalogue record
 * - download: stores the image of every catalogue record locally
 * - enrich: both of the above in a single pass
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class IrasutoyaMojo extends AbstractMojo {

	/** Which action to perform: "show-config", "translate", "download" or "enrich". */
	@Parameter(property = "irasutoya.action", defaultValue = "enrich")
	private String action = "enrich";

	/** Source catalogue document. */
	@Parameter(property = "irasutoya.inputFile", defaultValue = "output/irasutoya.json")
	private String inputFile = "output/irasutoya.json";

	/** Enriched document; images are stored in the `images` directory next to it. */
	@Parameter(property = "irasutoya.outputFile", defaultValue = "output/irasutoya_with_en.json")
	private String outputFile = "output/irasutoya_with_en.json";

	/** Where to download the source catalogue from when the input file is missing (blank disables it). */
	@Parameter(property = "irasutoya.catalogueUrl", defaultValue = "https://roostaq.github.io/irasutoya-data/irasutoya.json")
	private String catalogueUrl = "https://roostaq.github.io/irasutoya-data/irasutoya.json";

	/** LLM provider: "openai" or "anthropic". */
	@Parameter(property = "irasutoya.llmProvider", defaultValue = "openai")
	private String llmProvider = "openai";

	/** LLM URL (no default). */
	@Parameter(property = "irasutoya.llmUrl")
	private String llmUrl;

	/** LLM token (no default). */
	@Parameter(property = "irasutoya.llmToken")
	private String llmToken;

	/** LLM model name, provider default when not set. */
	@Parameter(property = "irasutoya.llmModel")
	private String llmModel;

	/** Language of the catalogue texts. */
	@Parameter(property = "irasutoya.sourceLanguage", defaultValue = "ja")
	private String sourceLanguage = "ja";

	/** Language of the added fields. */
	@Parameter(property = "irasutoya.targetLanguage", defaultValue = "en")
	private String targetLanguage = EnrichmentSettings.DEFAULT_TARGET_LANGUAGE;

	/** Retries of a transiently failing remote call. */
	@Parameter(property = "irasutoya.maxRetries", defaultValue = "3")
	private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;

	/** Wait before the first retry in milliseconds, doubled for each further retry. */
	@Parameter(property = "irasutoya.retryBackoffMillis", defaultValue = "1000")
	private long retryBackoffMillis = 1000;

	/** Number of parallel worker threads (default 4). */
	@Parameter(property = "irasutoya.parallelism", defaultValue = "4")
	private int parallelism = EnrichmentSettings.DEFAULT_PARALLELISM;

	/** Number of completed records between two writes of the output document. */
	@Parameter(property = "irasutoya.checkpointInterval", defaultValue = "10")
	private int checkpointInterval = EnrichmentSettings.DEFAULT_CHECKPOINT_INTERVAL;

	/** Maximum number of records to be processed (default Integer.MAX_VALUE). */
	@Parameter(property = "irasutoya.limit", defaultValue = "2147483647")
	private int limit = Integer.MAX_VALUE;

	/** When true, do not contact remote services or write anything, only report. */
	@Parameter(property = "irasutoya.dryRun", defaultValue = "false")
	private boolean dryRun;

	/** Pause after each translation request in milliseconds. */
	@Parameter(property = "irasutoya.requestDelayMillis", defaultValue = "0")
	private long requestDelayMillis;

	/** Timeout of a single HTTP request in seconds. */
	@Parameter(property = "irasutoya.httpTimeoutSeconds", defaultValue = "60")
	private int httpTimeoutSeconds = 60;

	/** User-Agent header of image and catalogue requests. */
	@Parameter(property = "irasutoya.userAgent", defaultValue = HttpResourceFetcher.DEFAULT_USER_AGENT)
	private String userAgent = HttpResourceFetcher.DEFAULT_USER_AGENT;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "enrich";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "translate":
			case "download":
			case "enrich":
				enrich(getLog(), RunMode.fromAction(this.action));
				break;
			default:
				throw new MojoExecutionException(
					"Unknown action: " + this.action + ". Supported actions: show-config, translate, download, enrich"
				);
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Irasutoya Plugin Configuration:");
		log.info(" - inputFile: " + orNotSet(this.inputFile));
		log.info(" - outputFile: " + orNotSet(this.outputFile));
		log.info(" - catalogueUrl: " + orNotSet(this.catalogueUrl));
		log.info(" - llmProvider: " + this.llmProvider);
		log.info(" - llmUrl: " + orNotSet(this.llmUrl));
		if (isBlank(this.llmUrl)) {
			log.warn("LLM url is not set");
		}
		log.info(" - llmToken: " + (isBlank(this.llmToken) ? "<not set>" : mask(this.llmToken)));
		if (isBlank(this.llmToken)) {
			log.warn("LLM token is not set");
		}
		try {
			final ChatModelFactory.Provider provider = ChatModelFactory.Provider.fromConfigName(this.llmProvider);
			log.info(" - llmModel: " + provider.modelOrDefault(this.llmModel) + (isBlank(this.llmModel) ? " (provider default)" : ""));
		} catch (IllegalArgumentException | NullPointerException e) {
			log.info(" - llmModel: " + orNotSet(this.llmModel));
			log.warn("LLM provider is not supported: " + this.llmProvider);
		}
		log.info(" - sourceLanguage: " + this.sourceLanguage);
		log.info(" - targetLanguage: " + this.targetLanguage);
		log.info(" - maxRetries: " + this.maxRetries);
		log.info(" - retryBackoffMillis: " + this.retryBackoffMillis);
		log.info(" - parallelism: " + this.parallelism);
		log.info(" - checkpointInterval: " + this.checkpointInterval);
		log.info(" - limit: " + this.limit);
		log.info(" - dryRun: " + this.dryRun);
		log.info(" - requestDelayMillis: " + this.requestDelayMillis);
		log.info(" - httpTimeoutSeconds: " + this.httpTimeoutSeconds);
		log.info(" - userAgent: " + orNotSet(this.userAgent));
	}

	private void enrich(@Nonnull final Log log, @Nonnull final RunMode mode) throws MojoExecutionException {
		if (isBlank(this.outputFile)) {
			throw new MojoExecutionException("Output file must be specified for " + this.action + " action");
		}
		if (isBlank(this.inputFile)) {
			throw new MojoExecutionException("Input file must be specified for " + this.action + " action");
		}
		if (mode.isTranslating() && !this.dryRun && isBlank(this.llmUrl)) {
			throw new MojoExecutionException("LLM URL must be specified for non-dry-run " + this.action + " action");
		}

		final EnrichmentSettings settings;
		final LlmTextTranslator translator;
		final ResourceFetcher resourceFetcher;
		try {
			if (this.maxRetries < 0) {
				throw new IllegalArgumentException("maxRetries must not be negative");
			}
			settings = new EnrichmentSettings(
				this.targetLanguage,
				this.parallelism,
				this.checkpointInterval,
				this.limit,
				Duration.ofMillis(this.retryBackoffMillis),
				Duration.ofMillis(this.requestDelayMillis),
				isBlank(this.catalogueUrl) ? null : URI.create(this.catalogueUrl.trim()),
				this.dryRun
			);
			translator = mode.isTranslating() && !this.dryRun ? createTranslator() : null;
			resourceFetcher = new HttpResourceFetcher(Duration.ofSeconds(this.httpTimeoutSeconds), this.userAgent);
		} catch (IllegalArgumentException | NullPointerException e) {
			throw new MojoExecutionException("Invalid configuration: " + e.getMessage(), e);
		}

		final EnrichmentOrchestrator orchestrator = new EnrichmentOrchestrator(
			new RecordStore(), translator, resourceFetcher, settings, log
		);

		final Path input = Path.of(this.inputFile).toAbsolutePath().normalize();
		final Path output = Path.of(this.outputFile).toAbsolutePath().normalize();
		log.info("=== " + mode + ": " + input + " -> " + output + " ===");

		final RunSummary summary;
		try {
			summary = orchestrator.run(mode, this.maxRetries, input, output);
		} catch (IOException e) {
			throw new MojoExecutionException("Failed to execute " + this.action + " action: " + e.getMessage(), e);
		}

		logSummary(log, summary, translator);
	}

	@Nonnull
	private LlmTextTranslator createTranslator() {
		final ChatModel chatModel = ChatModelFactory.create(
			this.llmProvider, this.llmUrl, this.llmToken, this.llmModel
		);
		return new LlmTextTranslator(new LlmClient(chatModel), new PromptLoader(), this.sourceLanguage);
	}

	private void logSummary(@Nonnull final Log log, @Nonnull final RunSummary summary, @Nullable final LlmTextTranslator translator) {
		log.info(this.dryRun ? "--- Dry-run Summary ---" : "--- Enrichment Summary ---");
		log.info("Records: " + summary.totalCount());
		log.info("Translated: " + summary.translatedCount());
		log.info("Downloaded: " + summary.downloadedCount());
		log.info("Skipped (up-to-date): " + summary.skippedCount());
		log.info("Failed: " + summary.failedCount());
		log.info("Checkpoints: " + summary.checkpoints());
		if (translator != null) {
			log.info("Input tokens: " + translator.getInputTokenCount());
			log.info("Output tokens: " + translator.getOutputTokenCount());
		}
		if (summary.interrupted()) {
			log.warn("Run was interrupted, progress up to the last completed record has been saved");
		}
		for (final RecordFailure failure : summary.failures()) {
			log.warn("[FAILED] " + failure);
		}
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String orNotSet(@Nullable final String value) {
		return isBlank(value) ? "<not set>" : value;
	}

	@Nonnull
	private static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	// Package-private setters for tests
	void setAction(@Nullable final String action) { this.action = action; }
	void setInputFile(@Nullable final String inputFile) { this.inputFile = inputFile; }
	void setOutputFile(@Nullable final String outputFile) { this.outputFile = outputFile; }
	void setCatalogueUrl(@Nullable final String catalogueUrl) { this.catalogueUrl = catalogueUrl; }
	void setLlmProvider(@Nullable final String llmProvider) { this.llmProvider = llmProvider; }
	void setLlmUrl(@Nullable final String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable final String llmToken) { this.llmToken = llmToken; }
	void setLlmModel(@Nullable final String llmModel) { this.llmModel = llmModel; }
	void setSourceLanguage(@Nonnull final String sourceLanguage) { this.sourceLanguage = sourceLanguage; }
	void setTargetLanguage(@Nonnull final String targetLanguage) { this.targetLanguage = targetLanguage; }
	void setMaxRetries(final int maxRetries) { this.maxRetries = maxRetries; }
	void setRetryBackoffMillis(final long retryBackoffMillis) { this.retryBackoffMillis = retryBackoffMillis; }
	void setParallelism(final int parallelism) { this.parallelism = parallelism; }
	void setCheckpointInterval(final int checkpointInterval) { this.checkpointInterval = checkpointInterval; }
	void setLimit(final int limit) { this.limit = limit; }
	void setDryRun(final boolean dryRun) { this.dryRun = dryRun; }
	void setRequestDelayMillis(final long requestDelayMillis) { this.requestDelayMillis = requestDelayMillis; }
	void setHttpTimeoutSeconds(final int httpTimeoutSeconds) { this.httpTimeoutSeconds = httpTimeoutSeconds; }
	void setUserAgent(@Nullable final String userAgent) { this.userAgent = userAgent; }
}
