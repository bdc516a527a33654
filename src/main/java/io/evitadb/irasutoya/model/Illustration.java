package io.evitadb.irasutoya.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the illustration catalogue: the Japanese source fields as published by the catalogue,
 * the English fields added by translation and the local image path.
 *
 * Instances are immutable once deserialized. Enrichment produces new instances via the `with*` methods,
 * which keeps worker threads from mutating records owned by the orchestrator. Properties the catalogue
 * carries that are not modelled here are kept in {@link #getAdditionalProperties()} so that saving the
 * collection never drops data.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
	Illustration.TITLE, Illustration.DESCRIPTION, Illustration.CATEGORIES, Illustration.ENTRY_URL,
	Illustration.IMAGE_URL, Illustration.IMAGE_ALT, Illustration.PUBLISHED_AT,
	Illustration.TITLE_EN, Illustration.DESCRIPTION_EN, Illustration.CATEGORIES_EN, Illustration.IMAGE_ALT_EN,
	Illustration.DIRECTORY_PATH
})
public final class Illustration {

	public static final String TITLE = "title";
	public static final String DESCRIPTION = "description";
	public static final String CATEGORIES = "categories";
	public static final String ENTRY_URL = "entry_url";
	public static final String IMAGE_URL = "image_url";
	public static final String IMAGE_ALT = "image_alt";
	public static final String PUBLISHED_AT = "published_at";
	public static final String TITLE_EN = "title_en";
	public static final String DESCRIPTION_EN = "description_en";
	public static final String CATEGORIES_EN = "categories_en";
	public static final String IMAGE_ALT_EN = "image_alt_en";
	public static final String DIRECTORY_PATH = "directory_path";

	@Nullable private final String title;
	@Nullable private final String description;
	@Nullable private final List<String> categories;
	@Nullable private final String entryUrl;
	@Nullable private final String imageUrl;
	@Nullable private final String imageAlt;
	@Nullable private final String publishedAt;
	@Nullable private final String titleEn;
	@Nullable private final String descriptionEn;
	@Nullable private final List<String> categoriesEn;
	@Nullable private final String imageAltEn;
	@Nullable private final String directoryPath;
	@Nonnull private final Map<String, JsonNode> additionalProperties;

	@JsonCreator
	public Illustration(
		@JsonProperty(TITLE) @Nullable String title,
		@JsonProperty(DESCRIPTION) @Nullable String description,
		@JsonProperty(CATEGORIES) @Nullable List<String> categories,
		@JsonProperty(ENTRY_URL) @Nullable String entryUrl,
		@JsonProperty(IMAGE_URL) @Nullable String imageUrl,
		@JsonProperty(IMAGE_ALT) @Nullable String imageAlt,
		@JsonProperty(PUBLISHED_AT) @Nullable String publishedAt,
		@JsonProperty(TITLE_EN) @Nullable String titleEn,
		@JsonProperty(DESCRIPTION_EN) @Nullable String descriptionEn,
		@JsonProperty(CATEGORIES_EN) @Nullable List<String> categoriesEn,
		@JsonProperty(IMAGE_ALT_EN) @Nullable String imageAltEn,
		@JsonProperty(DIRECTORY_PATH) @Nullable String directoryPath
	) {
		this(
			title, description, categories, entryUrl, imageUrl, imageAlt, publishedAt,
			titleEn, descriptionEn, categoriesEn, imageAltEn, directoryPath, new LinkedHashMap<>()
		);
	}

	private Illustration(
		@Nullable String title,
		@Nullable String description,
		@Nullable List<String> categories,
		@Nullable String entryUrl,
		@Nullable String imageUrl,
		@Nullable String imageAlt,
		@Nullable String publishedAt,
		@Nullable String titleEn,
		@Nullable String descriptionEn,
		@Nullable List<String> categoriesEn,
		@Nullable String imageAltEn,
		@Nullable String directoryPath,
		@Nonnull Map<String, JsonNode> additionalProperties
	) {
		this.title = title;
		this.description = description;
		this.categories = categories == null ? null : List.copyOf(categories);
		this.entryUrl = entryUrl;
		this.imageUrl = imageUrl;
		this.imageAlt = imageAlt;
		this.publishedAt = publishedAt;
		this.titleEn = titleEn;
		this.descriptionEn = descriptionEn;
		this.categoriesEn = categoriesEn == null ? null : List.copyOf(categoriesEn);
		this.imageAltEn = imageAltEn;
		this.directoryPath = directoryPath;
		this.additionalProperties = additionalProperties;
	}

	/**
	 * Creates an untranslated record carrying only the source fields.
	 */
	@Nonnull
	public static Illustration of(
		@Nullable String title,
		@Nullable String description,
		@Nullable List<String> categories,
		@Nullable String entryUrl,
		@Nullable String imageUrl,
		@Nullable String imageAlt,
		@Nullable String publishedAt
	) {
		return new Illustration(
			title, description, categories, entryUrl, imageUrl, imageAlt, publishedAt,
			null, null, null, null, null
		);
	}

	@JsonAnySetter
	private void putAdditionalProperty(@Nonnull String name, @Nullable JsonNode value) {
		this.additionalProperties.put(name, value);
	}

	@JsonAnyGetter
	@Nonnull
	public Map<String, JsonNode> getAdditionalProperties() {
		return Collections.unmodifiableMap(this.additionalProperties);
	}

	@JsonProperty(TITLE) @Nullable public String getTitle() { return this.title; }
	@JsonProperty(DESCRIPTION) @Nullable public String getDescription() { return this.description; }
	@JsonProperty(CATEGORIES) @Nullable public List<String> getCategories() { return this.categories; }
	@JsonProperty(ENTRY_URL) @Nullable public String getEntryUrl() { return this.entryUrl; }
	@JsonProperty(IMAGE_URL) @Nullable public String getImageUrl() { return this.imageUrl; }
	@JsonProperty(IMAGE_ALT) @Nullable public String getImageAlt() { return this.imageAlt; }
	@JsonProperty(PUBLISHED_AT) @Nullable public String getPublishedAt() { return this.publishedAt; }
	@JsonProperty(TITLE_EN) @Nullable public String getTitleEn() { return this.titleEn; }
	@JsonProperty(DESCRIPTION_EN) @Nullable public String getDescriptionEn() { return this.descriptionEn; }
	@JsonProperty(CATEGORIES_EN) @Nullable public List<String> getCategoriesEn() { return this.categoriesEn; }
	@JsonProperty(IMAGE_ALT_EN) @Nullable public String getImageAltEn() { return this.imageAltEn; }
	@JsonProperty(DIRECTORY_PATH) @Nullable public String getDirectoryPath() { return this.directoryPath; }

	/**
	 * Returns the categories, or an empty list when the catalogue entry has none.
	 */
	@Nonnull
	public List<String> categoriesOrEmpty() {
		return this.categories == null ? List.of() : this.categories;
	}

	/**
	 * Returns the identifier used in logs and failure reports: the entry URL,
	 * falling back to the image URL and finally to the title.
	 *
	 * @return identifier, never null
	 */
	@Nonnull
	public String recordId() {
		return firstNonBlank(this.entryUrl, this.imageUrl, this.title).orElse("<unidentified>");
	}

	/**
	 * Returns true if every English field is present and complete. A field is complete when it is
	 * non-empty, or when its source field is empty as well (there is nothing to translate). The
	 * English categories must match the source categories one to one.
	 *
	 * @return true if the record needs no translation
	 */
	@JsonIgnore
	public boolean isTranslated() {
		if (!isComplete(this.title, this.titleEn)
			|| !isComplete(this.description, this.descriptionEn)
			|| !isComplete(this.imageAlt, this.imageAltEn)
			|| this.categoriesEn == null) {
			return false;
		}
		final List<String> source = categoriesOrEmpty();
		if (source.size() != this.categoriesEn.size()) {
			return false;
		}
		for (int i = 0; i < source.size(); i++) {
			if (!isComplete(source.get(i), this.categoriesEn.get(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Returns a copy of this record with all English fields replaced.
	 */
	@Nonnull
	public Illustration withTranslation(
		@Nonnull String titleEn,
		@Nonnull String descriptionEn,
		@Nonnull List<String> categoriesEn,
		@Nonnull String imageAltEn
	) {
		Objects.requireNonNull(titleEn, "titleEn must not be null");
		Objects.requireNonNull(descriptionEn, "descriptionEn must not be null");
		Objects.requireNonNull(categoriesEn, "categoriesEn must not be null");
		Objects.requireNonNull(imageAltEn, "imageAltEn must not be null");
		if (categoriesEn.size() != categoriesOrEmpty().size()) {
			throw new IllegalArgumentException(
				"categoriesEn has " + categoriesEn.size() + " entries but categories has " +
					categoriesOrEmpty().size() + " for " + recordId()
			);
		}
		return new Illustration(
			this.title, this.description, this.categories, this.entryUrl, this.imageUrl, this.imageAlt,
			this.publishedAt, titleEn, descriptionEn, categoriesEn, imageAltEn, this.directoryPath,
			new LinkedHashMap<>(this.additionalProperties)
		);
	}

	/**
	 * Returns a copy of this record with the given local image path.
	 */
	@Nonnull
	public Illustration withDirectoryPath(@Nonnull String directoryPath) {
		Objects.requireNonNull(directoryPath, "directoryPath must not be null");
		if (directoryPath.equals(this.directoryPath)) {
			return this;
		}
		return new Illustration(
			this.title, this.description, this.categories, this.entryUrl, this.imageUrl, this.imageAlt,
			this.publishedAt, this.titleEn, this.descriptionEn, this.categoriesEn, this.imageAltEn, directoryPath,
			new LinkedHashMap<>(this.additionalProperties)
		);
	}

	private static boolean isComplete(@Nullable String source, @Nullable String translated) {
		if (translated == null) {
			return false;
		}
		return !translated.isBlank() || source == null || source.isBlank();
	}

	@Nonnull
	private static Optional<String> firstNonBlank(@Nonnull String... values) {
		for (final String value : values) {
			if (value != null && !value.isBlank()) {
				return Optional.of(value);
			}
		}
		return Optional.empty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Illustration that)) {
			return false;
		}
		return Objects.equals(this.title, that.title)
			&& Objects.equals(this.description, that.description)
			&& Objects.equals(this.categories, that.categories)
			&& Objects.equals(this.entryUrl, that.entryUrl)
			&& Objects.equals(this.imageUrl, that.imageUrl)
			&& Objects.equals(this.imageAlt, that.imageAlt)
			&& Objects.equals(this.publishedAt, that.publishedAt)
			&& Objects.equals(this.titleEn, that.titleEn)
			&& Objects.equals(this.descriptionEn, that.descriptionEn)
			&& Objects.equals(this.categoriesEn, that.categoriesEn)
			&& Objects.equals(this.imageAltEn, that.imageAltEn)
			&& Objects.equals(this.directoryPath, that.directoryPath)
			&& this.additionalProperties.equals(that.additionalProperties);
	}

	@Override
	public int hashCode() {
		return Objects.hash(
			this.title, this.description, this.categories, this.entryUrl, this.imageUrl, this.imageAlt,
			this.publishedAt, this.titleEn, this.descriptionEn, this.categoriesEn, this.imageAltEn,
			this.directoryPath, this.additionalProperties
		);
	}

	@Override
	public String toString() {
		return "Illustration[" + recordId() + (isTranslated() ? ", translated" : "") + "]";
	}
}
