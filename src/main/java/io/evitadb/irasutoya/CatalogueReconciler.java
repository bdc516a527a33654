package io.evitadb.irasutoya;

import io.evitadb.irasutoya.model.Illustration;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Merges the source catalogue into the enriched collection. Records already present in the enriched
 * collection win and keep their position; catalogue records without a counterpart there are appended
 * in catalogue order. Nothing is ever removed or reordered.
 *
 * A catalogue record has a counterpart when an existing record carries the same entry URL and image URL.
 * One entry page may publish several images, so the entry URL alone does not identify a record. Records
 * with neither URL fall back to the title. The catalogue is never compared with itself: every catalogue
 * record without a counterpart is kept, repeated ones included.
 */
public final class CatalogueReconciler {

	/**
	 * Merges the catalogue into the existing collection.
	 *
	 * @param existing  records of the output document, possibly empty
	 * @param catalogue records of the source catalogue, possibly empty
	 * @return mutable merged collection
	 */
	@Nonnull
	public List<Illustration> reconcile(@Nonnull List<Illustration> existing, @Nonnull List<Illustration> catalogue) {
		Objects.requireNonNull(existing, "existing must not be null");
		Objects.requireNonNull(catalogue, "catalogue must not be null");

		final List<Illustration> merged = new ArrayList<>(existing.size() + catalogue.size());
		final Set<MatchKey> known = new HashSet<>(existing.size() * 2);
		for (final Illustration illustration : existing) {
			merged.add(illustration);
			known.add(MatchKey.of(illustration));
		}
		for (final Illustration illustration : catalogue) {
			if (!known.contains(MatchKey.of(illustration))) {
				merged.add(illustration);
			}
		}
		return merged;
	}

	/**
	 * Identity of a record for matching against the output document.
	 */
	private record MatchKey(@Nonnull String entryUrl, @Nonnull String imageUrl, @Nonnull String title) {

		@Nonnull
		static MatchKey of(@Nonnull Illustration illustration) {
			final String entryUrl = normalize(illustration.getEntryUrl());
			final String imageUrl = normalize(illustration.getImageUrl());
			if (entryUrl.isEmpty() && imageUrl.isEmpty()) {
				return new MatchKey("", "", normalize(illustration.getTitle()));
			}
			return new MatchKey(entryUrl, imageUrl, "");
		}

		@Nonnull
		private static String normalize(@Nullable String value) {
			return value == null ? "" : value.trim();
		}
	}
}
