package io.evitadb.irasutoya.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.evitadb.irasutoya.TextTranslator;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TextTranslator} that asks a chat model for a literal translation of a single catalogue text.
 * Prompts come from `translate-system.txt` and `translate-user.txt`; token usage is accumulated across
 * all threads for the run report.
 */
public final class LlmTextTranslator implements TextTranslator {

	private static final String SYSTEM_TEMPLATE = "translate-system.txt";
	private static final String USER_TEMPLATE = "translate-user.txt";

	@Nonnull
	private final LlmClient llmClient;
	@Nonnull
	private final PromptLoader promptLoader;
	@Nonnull
	private final Locale sourceLocale;
	private final AtomicLong inputTokenCount = new AtomicLong(0);
	private final AtomicLong outputTokenCount = new AtomicLong(0);

	/**
	 * Creates a translator.
	 *
	 * @param llmClient      client of the chat model
	 * @param promptLoader   loader of the prompt templates
	 * @param sourceLanguage BCP 47 tag of the catalogue language, e.g. `ja`
	 */
	public LlmTextTranslator(
		@Nonnull LlmClient llmClient,
		@Nonnull PromptLoader promptLoader,
		@Nonnull String sourceLanguage
	) {
		this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
		this.sourceLocale = Locale.forLanguageTag(Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null"));
	}

	@Nonnull
	@Override
	public String translate(@Nonnull String text, @Nonnull String targetLanguage) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");

		final Locale targetLocale = Locale.forLanguageTag(targetLanguage);
		final Map<String, String> placeholders = Map.of(
			"sourceLanguage", describe(this.sourceLocale),
			"targetLanguage", describe(targetLocale),
			"text", text
		);
		final List<ChatMessage> messages = List.of(
			SystemMessage.from(this.promptLoader.loadAndInterpolate(SYSTEM_TEMPLATE, placeholders)),
			UserMessage.from(this.promptLoader.loadAndInterpolate(USER_TEMPLATE, placeholders))
		);

		final ChatResponse response = this.llmClient.chat(messages);
		final TokenUsage tokenUsage = response.tokenUsage();
		if (tokenUsage != null) {
			this.inputTokenCount.addAndGet(tokenUsage.inputTokenCount() == null ? 0 : tokenUsage.inputTokenCount());
			this.outputTokenCount.addAndGet(tokenUsage.outputTokenCount() == null ? 0 : tokenUsage.outputTokenCount());
		}

		final String translated = response.aiMessage() == null ? null : response.aiMessage().text();
		return translated == null ? "" : translated.strip();
	}

	/**
	 * Returns the number of input tokens consumed so far.
	 */
	public long getInputTokenCount() {
		return this.inputTokenCount.get();
	}

	/**
	 * Returns the number of output tokens generated so far.
	 */
	public long getOutputTokenCount() {
		return this.outputTokenCount.get();
	}

	@Nonnull
	private static String describe(@Nonnull Locale locale) {
		final String name = locale.getDisplayName(Locale.ENGLISH);
		return (name.isBlank() ? locale.toLanguageTag() : name) + " (" + locale.toLanguageTag() + ")";
	}
}
