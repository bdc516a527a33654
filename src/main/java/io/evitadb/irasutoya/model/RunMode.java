package io.evitadb.irasutoya.model;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Selects which enrichment passes a run performs.
 */
public enum RunMode {

	TRANSLATE(true, false),
	DOWNLOAD(false, true),
	BOTH(true, true);

	private final boolean translating;
	private final boolean downloading;

	RunMode(boolean translating, boolean downloading) {
		this.translating = translating;
		this.downloading = downloading;
	}

	public boolean isTranslating() {
		return this.translating;
	}

	public boolean isDownloading() {
		return this.downloading;
	}

	/**
	 * Maps a Mojo action name to the run mode: `translate`, `download` or `enrich` (both passes).
	 *
	 * @param action the action name, case-insensitive
	 * @return matching run mode
	 * @throws IllegalArgumentException if the action does not run any pass
	 */
	@Nonnull
	public static RunMode fromAction(@Nonnull String action) {
		Objects.requireNonNull(action, "action must not be null");
		return switch (action.trim().toLowerCase(Locale.ROOT)) {
			case "translate" -> TRANSLATE;
			case "download" -> DOWNLOAD;
			case "enrich", "both" -> BOTH;
			default -> throw new IllegalArgumentException("Action " + action + " does not select a run mode");
		};
	}
}
