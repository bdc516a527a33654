package io.evitadb.irasutoya;

import javax.annotation.Nonnull;

/**
 * The external translation service: turns one text into the target language.
 *
 * Implementations report failures as unchecked exceptions. LangChain4j's
 * {@link dev.langchain4j.exception.RetriableException} and {@link dev.langchain4j.exception.NonRetriableException}
 * hierarchies are understood by {@link TranslationWorker} when it decides whether a failure is worth retrying.
 */
@FunctionalInterface
public interface TextTranslator {

	/**
	 * Translates the text.
	 *
	 * @param text           non-blank source text
	 * @param targetLanguage BCP 47 tag of the target language, e.g. `en`
	 * @return the translated text
	 */
	@Nonnull
	String translate(@Nonnull String text, @Nonnull String targetLanguage);

}
