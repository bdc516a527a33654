package io.evitadb.irasutoya.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Creates the LangChain4j chat model that backs catalogue translation.
 *
 * The built-in LangChain4j retries are switched off: every request is retried by
 * {@link io.evitadb.irasutoya.retry.RetryPolicy}, which also counts the attempts.
 */
public final class ChatModelFactory {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);
	// short texts, deterministic answers
	private static final double TEMPERATURE = 0.0;
	private static final int MODEL_RETRIES = 0;
	private static final String NO_API_KEY = "none";

	/**
	 * Supported chat model providers.
	 */
	public enum Provider {
		OPENAI("openai", "gpt-4o-mini"),
		ANTHROPIC("anthropic", "claude-3-5-haiku-20241022");

		private final String configName;
		private final String defaultModel;

		Provider(@Nonnull String configName, @Nonnull String defaultModel) {
			this.configName = configName;
			this.defaultModel = defaultModel;
		}

		@Nonnull
		public String getConfigName() {
			return this.configName;
		}

		/**
		 * Returns the given model name, or this provider's default when it is blank.
		 */
		@Nonnull
		public String modelOrDefault(@Nullable String modelName) {
			return modelName == null || modelName.isBlank() ? this.defaultModel : modelName.trim();
		}

		/**
		 * Resolves a provider from its configuration name, ignoring case and surrounding whitespace.
		 *
		 * @throws IllegalArgumentException if no provider has that name
		 */
		@Nonnull
		public static Provider fromConfigName(@Nonnull String name) {
			Objects.requireNonNull(name, "provider must not be null");
			final String normalized = name.trim().toLowerCase(Locale.ROOT);
			for (final Provider provider : values()) {
				if (provider.configName.equals(normalized)) {
					return provider;
				}
			}
			throw new IllegalArgumentException(
				"Unknown provider: " + name + ". Supported providers: " +
					Arrays.stream(values()).map(Provider::getConfigName).collect(Collectors.joining(", "))
			);
		}
	}

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a chat model with the default request timeout.
	 *
	 * @see #create(String, String, String, String, Duration)
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nonnull String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName
	) {
		return create(provider, llmUrl, llmToken, modelName, DEFAULT_TIMEOUT);
	}

	/**
	 * Creates a chat model for the given provider and endpoint.
	 *
	 * @param provider  provider configuration name, "openai" (any compatible endpoint) or "anthropic"
	 * @param llmUrl    base URL of the endpoint, e.g. "https://api.openai.com/v1"
	 * @param llmToken  API key, may be null for local endpoints
	 * @param modelName model name, provider default when null or blank
	 * @param timeout   timeout of a single request
	 * @return configured chat model
	 * @throws IllegalArgumentException if the provider is unknown or the URL is blank
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nonnull String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName,
		@Nonnull Duration timeout
	) {
		Objects.requireNonNull(llmUrl, "llmUrl must not be null");
		Objects.requireNonNull(timeout, "timeout must not be null");
		if (llmUrl.isBlank()) {
			throw new IllegalArgumentException("llmUrl must not be blank");
		}

		final Provider resolved = Provider.fromConfigName(provider);
		final String baseUrl = stripTrailingSlashes(llmUrl);
		final String model = resolved.modelOrDefault(modelName);
		final String apiKey = llmToken == null || llmToken.isBlank() ? null : llmToken;

		switch (resolved) {
			case ANTHROPIC:
				final AnthropicChatModel.AnthropicChatModelBuilder anthropic = AnthropicChatModel.builder()
					.baseUrl(baseUrl)
					.modelName(model)
					.timeout(timeout)
					.temperature(TEMPERATURE)
					.maxRetries(MODEL_RETRIES);
				if (apiKey != null) {
					anthropic.apiKey(apiKey);
				}
				return anthropic.build();
			case OPENAI:
			default:
				// OpenAI-compatible local servers (Ollama, LM Studio) accept any key
				return OpenAiChatModel.builder()
					.baseUrl(baseUrl)
					.apiKey(apiKey != null ? apiKey : NO_API_KEY)
					.modelName(model)
					.timeout(timeout)
					.temperature(TEMPERATURE)
					.maxRetries(MODEL_RETRIES)
					.build();
		}
	}

	@Nonnull
	static String stripTrailingSlashes(@Nonnull String url) {
		return url.trim().replaceAll("/+$", "");
	}
}
