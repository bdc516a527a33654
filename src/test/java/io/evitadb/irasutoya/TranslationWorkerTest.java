package io.evitadb.irasutoya;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.RateLimitException;
import io.evitadb.irasutoya.error.TranslationFailedException;
import io.evitadb.irasutoya.model.Illustration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationWorker should translate all text fields of a record")
public class TranslationWorkerTest {

	private static final Illustration TORCH = Illustration.of(
		"たいまつのイラスト",
		"聖火のイラストです。",
		List.of("スポーツ用品", "お祭り"),
		"https://www.irasutoya.com/2016/10/blog-post_51.html",
		"https://example.org/img/taimatsu_olympic.png",
		"たいまつ",
		"2016-10-05"
	);

	private static final Map<String, String> DICTIONARY = Map.of(
		"たいまつのイラスト", "Torch illustration",
		"聖火のイラストです。", "An illustration of the Olympic flame.",
		"スポーツ用品", "Sports equipment",
		"お祭り", "Festival",
		"たいまつ", "Torch"
	);

	@Test
	@DisplayName("shouldTranslateEveryFieldInOrder")
	void shouldTranslateEveryFieldInOrder() throws Exception {
		final List<String> requests = Collections.synchronizedList(new ArrayList<>());
		final TranslationWorker worker = new TranslationWorker((text, language) -> {
			requests.add(text + "->" + language);
			return " " + DICTIONARY.get(text) + "\n";
		}, "en");

		final Illustration translated = worker.translate(TORCH);

		assertEquals("Torch illustration", translated.getTitleEn());
		assertEquals("An illustration of the Olympic flame.", translated.getDescriptionEn());
		assertEquals(List.of("Sports equipment", "Festival"), translated.getCategoriesEn());
		assertEquals("Torch", translated.getImageAltEn());
		assertTrue(translated.isTranslated());
		assertEquals(
			List.of("たいまつのイラスト->en", "聖火のイラストです。->en", "スポーツ用品->en", "お祭り->en", "たいまつ->en"),
			requests
		);
	}

	@Test
	@DisplayName("shouldNotCallTranslatorForEmptyFields")
	void shouldNotCallTranslatorForEmptyFields() throws Exception {
		final Illustration sparse = Illustration.of("花火", "", null, "https://a/hanabi", "https://a/hanabi.png", null, "2015-08-01");
		final List<String> requests = new ArrayList<>();
		final TranslationWorker worker = new TranslationWorker((text, language) -> {
			requests.add(text);
			return "Fireworks";
		}, "en");

		final Illustration translated = worker.translate(sparse);

		assertEquals(List.of("花火"), requests);
		assertEquals("", translated.getDescriptionEn());
		assertEquals("", translated.getImageAltEn());
		assertEquals(List.of(), translated.getCategoriesEn());
		assertTrue(translated.isTranslated());
	}

	@Test
	@DisplayName("shouldFailWholeRecordWhenOneFieldFails")
	void shouldFailWholeRecordWhenOneFieldFails() {
		final TranslationWorker worker = new TranslationWorker((text, language) -> {
			if ("お祭り".equals(text)) {
				throw new RateLimitException("slow down");
			}
			return DICTIONARY.get(text);
		}, "en");

		final TranslationFailedException exception = assertThrows(TranslationFailedException.class, () -> worker.translate(TORCH));

		assertEquals("categories[1]", exception.getField());
		assertTrue(exception.isTransient());
		assertNull(TORCH.getTitleEn(), "The source record is never modified");
	}

	@Test
	@DisplayName("shouldTreatEmptyAnswerAsTransient")
	void shouldTreatEmptyAnswerAsTransient() {
		final TranslationWorker worker = new TranslationWorker((text, language) -> "  ", "en");

		final TranslationFailedException exception = assertThrows(TranslationFailedException.class, () -> worker.translate(TORCH));

		assertEquals("title", exception.getField());
		assertTrue(exception.isTransient());
	}

	@Test
	@DisplayName("shouldClassifyTranslatorExceptions")
	void shouldClassifyTranslatorExceptions() {
		assertTrue(TranslationWorker.isTransient(new RateLimitException("429")));
		assertTrue(TranslationWorker.isTransient(new LangChain4jException("network")));
		assertTrue(TranslationWorker.isTransient(new UncheckedIOException(new IOException("reset"))));
		assertFalse(TranslationWorker.isTransient(new AuthenticationException("bad key")));
		assertFalse(TranslationWorker.isTransient(new InvalidRequestException("bad request")));
		assertFalse(TranslationWorker.isTransient(new IllegalArgumentException("bug")));
	}

	@Test
	@DisplayName("shouldRejectBlankTargetLanguage")
	void shouldRejectBlankTargetLanguage() {
		assertThrows(IllegalArgumentException.class, () -> new TranslationWorker((text, language) -> text, " "));
	}
}
