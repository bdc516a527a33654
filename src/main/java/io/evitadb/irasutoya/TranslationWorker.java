package io.evitadb.irasutoya;

import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import io.evitadb.irasutoya.error.TranslationFailedException;
import io.evitadb.irasutoya.model.Illustration;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TranslationWorker produces the English fields of one record. It issues one translation request per
 * translatable unit: the title, the description, every category and the image alt text.
 *
 * Translation is all-or-nothing: the translated copy is returned only when every unit succeeded, any
 * failure discards the partial results and surfaces as {@link TranslationFailedException}. The worker
 * performs no I/O besides calling the translator; persisting the result is up to the caller.
 */
public final class TranslationWorker {

	@Nonnull
	private final TextTranslator translator;
	@Nonnull
	private final String targetLanguage;
	@Nonnull
	private final Duration requestDelay;

	/**
	 * Creates a translation worker.
	 *
	 * @param translator     the translation backend
	 * @param targetLanguage BCP 47 tag of the target language
	 * @param requestDelay   pause after every request to keep the request rate polite; zero disables it
	 */
	public TranslationWorker(
		@Nonnull TextTranslator translator,
		@Nonnull String targetLanguage,
		@Nonnull Duration requestDelay
	) {
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.targetLanguage = Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		this.requestDelay = Objects.requireNonNull(requestDelay, "requestDelay must not be null");
		if (targetLanguage.isBlank()) {
			throw new IllegalArgumentException("targetLanguage must not be blank");
		}
		if (requestDelay.isNegative()) {
			throw new IllegalArgumentException("requestDelay must not be negative");
		}
	}

	public TranslationWorker(@Nonnull TextTranslator translator, @Nonnull String targetLanguage) {
		this(translator, targetLanguage, Duration.ZERO);
	}

	/**
	 * Translates all translatable fields of the record.
	 *
	 * @param illustration the record to translate
	 * @return a copy of the record with all English fields set
	 * @throws TranslationFailedException identifying the first field whose translation failed
	 */
	@Nonnull
	public Illustration translate(@Nonnull Illustration illustration) throws TranslationFailedException {
		Objects.requireNonNull(illustration, "illustration must not be null");

		final String titleEn = translateField(Illustration.TITLE, illustration.getTitle());
		final String descriptionEn = translateField(Illustration.DESCRIPTION, illustration.getDescription());

		final List<String> categories = illustration.categoriesOrEmpty();
		final List<String> categoriesEn = new ArrayList<>(categories.size());
		for (int i = 0; i < categories.size(); i++) {
			categoriesEn.add(translateField(Illustration.CATEGORIES + "[" + i + "]", categories.get(i)));
		}

		final String imageAltEn = translateField(Illustration.IMAGE_ALT, illustration.getImageAlt());

		return illustration.withTranslation(titleEn, descriptionEn, categoriesEn, imageAltEn);
	}

	/**
	 * Translates a single field value. Empty values translate to an empty string without a request.
	 */
	@Nonnull
	private String translateField(@Nonnull String field, @Nullable String text) throws TranslationFailedException {
		if (text == null || text.isBlank()) {
			return "";
		}

		final String translated;
		try {
			translated = this.translator.translate(text, this.targetLanguage);
		} catch (RuntimeException e) {
			throw new TranslationFailedException(field, e, isTransient(e));
		}
		pause(field);

		if (translated == null || translated.isBlank()) {
			throw new TranslationFailedException(
				field, new IllegalStateException("translator returned an empty text for: " + text), true
			);
		}
		return translated.trim();
	}

	private void pause(@Nonnull String field) throws TranslationFailedException {
		if (this.requestDelay.isZero()) {
			return;
		}
		try {
			Thread.sleep(this.requestDelay.toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TranslationFailedException(field, e, false);
		}
	}

	/**
	 * Classifies a translator failure. Rejections (authentication, invalid request, unknown model,
	 * content filter) are permanent; rate limits, timeouts, server errors and unmapped transport
	 * failures are transient.
	 */
	static boolean isTransient(@Nonnull RuntimeException e) {
		if (e instanceof NonRetriableException) {
			return false;
		}
		if (e instanceof RetriableException) {
			return true;
		}
		return e instanceof LangChain4jException || e instanceof UncheckedIOException;
	}
}
