package io.evitadb.irasutoya.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PromptLoader should load and interpolate prompt templates")
public class PromptLoaderTest {

	private PromptLoader loader;

	@BeforeEach
	void setUp() {
		loader = new PromptLoader();
		loader.clearCache();
	}

	@Test
	@DisplayName("shouldLoadTemplateFromClasspath")
	void shouldLoadTemplateFromClasspath() {
		final String template = loader.loadTemplate("test-system.txt");

		assertTrue(template.contains("You are a test translation assistant"));
		assertTrue(template.contains("{{targetLanguage}}"));
		assertFalse(template.endsWith("\n"), "Trailing whitespace is stripped");
	}

	@Test
	@DisplayName("shouldLoadBundledTranslationPrompts")
	void shouldLoadBundledTranslationPrompts() {
		final String system = loader.loadTemplate("translate-system.txt");
		final String user = loader.loadTemplate("translate-user.txt");

		assertTrue(system.contains("{{sourceLanguage}}"));
		assertTrue(system.contains("{{targetLanguage}}"));
		assertEquals("{{text}}", user);
	}

	@Test
	@DisplayName("shouldReplaceMultiplePlaceholders")
	void shouldReplaceMultiplePlaceholders() {
		final String result = loader.interpolate(
			"{{sourceLanguage}} -> {{targetLanguage}}",
			Map.of("sourceLanguage", "Japanese (ja)", "targetLanguage", "English (en)")
		);

		assertEquals("Japanese (ja) -> English (en)", result);
	}

	@Test
	@DisplayName("shouldPreservePlaceholderWhenNoValue")
	void shouldPreservePlaceholderWhenNoValue() {
		final String result = loader.interpolate("Translate {{text}} into {{targetLanguage}}", Map.of("text", "花火"));

		assertEquals("Translate 花火 into {{targetLanguage}}", result);
	}

	@Test
	@DisplayName("shouldHandleSpecialCharactersInValue")
	void shouldHandleSpecialCharactersInValue() {
		final String result = loader.interpolate("Price: {{text}}", Map.of("text", "$100 \\ yen"));

		assertEquals("Price: $100 \\ yen", result);
	}

	@Test
	@DisplayName("shouldCacheLoadedTemplates")
	void shouldCacheLoadedTemplates() {
		final String first = loader.loadTemplate("test-system.txt");
		final String second = loader.loadTemplate("test-system.txt");

		assertSame(first, second);
	}

	@Test
	@DisplayName("shouldThrowWhenTemplateNotFound")
	void shouldThrowWhenTemplateNotFound() {
		final Exception exception = assertThrows(IllegalArgumentException.class, () ->
			loader.loadTemplate("missing.txt")
		);

		assertTrue(exception.getMessage().contains("Prompt template not found"));
	}
}
