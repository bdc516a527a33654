package io.evitadb.irasutoya.llm;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads prompt templates from `META-INF/prompts/` on the classpath and fills in `{{name}}` placeholders.
 * Templates are cached after the first load.
 */
public final class PromptLoader {

	private static final String PROMPTS_PATH = "META-INF/prompts/";
	private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{(\\w+)}}");

	private final Map<String, String> templateCache = new ConcurrentHashMap<>();

	/**
	 * Loads a prompt template from the classpath.
	 *
	 * @param templateName the template file name (e.g., "translate-system.txt")
	 * @return the template content with trailing whitespace removed
	 * @throws IllegalArgumentException if template is not found
	 */
	@Nonnull
	public String loadTemplate(@Nonnull String templateName) {
		Objects.requireNonNull(templateName, "templateName must not be null");

		return this.templateCache.computeIfAbsent(templateName, this::loadTemplateFromClasspath);
	}

	/**
	 * Loads a template and replaces placeholders with provided values.
	 *
	 * @param templateName the template file name
	 * @param values       map of placeholder names to their values (without {{ }})
	 * @return the interpolated template
	 * @throws IllegalArgumentException if template is not found
	 */
	@Nonnull
	public String loadAndInterpolate(@Nonnull String templateName, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(values, "values must not be null");

		return interpolate(loadTemplate(templateName), values);
	}

	/**
	 * Replaces `{{name}}` placeholders with provided values. Placeholders without a value are left unchanged.
	 *
	 * @param template the template string with placeholders
	 * @param values   map of placeholder names to their values
	 * @return the interpolated string
	 */
	@Nonnull
	public String interpolate(@Nonnull String template, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(template, "template must not be null");
		Objects.requireNonNull(values, "values must not be null");

		final Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
		final StringBuilder result = new StringBuilder();

		while (matcher.find()) {
			final String value = values.get(matcher.group(1));
			if (value != null) {
				matcher.appendReplacement(result, Matcher.quoteReplacement(value));
			}
		}
		matcher.appendTail(result);

		return result.toString();
	}

	@Nonnull
	private String loadTemplateFromClasspath(@Nonnull String templateName) {
		final String resourcePath = PROMPTS_PATH + templateName;
		try (final InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
			if (inputStream == null) {
				throw new IllegalArgumentException("Prompt template not found: " + resourcePath);
			}
			return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8)
				.replace("\r\n", "\n")
				.stripTrailing();
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read prompt template: " + resourcePath, e);
		}
	}

	/**
	 * Clears the template cache. Useful for testing.
	 */
	public void clearCache() {
		this.templateCache.clear();
	}
}
