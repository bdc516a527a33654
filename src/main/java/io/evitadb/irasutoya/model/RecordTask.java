package io.evitadb.irasutoya.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Work selected for one record: which axes still have to run, determined from the loaded collection
 * and the image directory before any remote call is made.
 *
 * @param index        position of the record in the collection
 * @param illustration the record as loaded (with its directory path resolved when possible)
 * @param translate    true if the record is not translated yet and translation is part of the run
 * @param download     true if the image is missing and downloading is part of the run
 */
public record RecordTask(
	int index,
	@Nonnull Illustration illustration,
	boolean translate,
	boolean download
) {

	public RecordTask {
		Objects.requireNonNull(illustration, "illustration must not be null");
		if (index < 0) {
			throw new IllegalArgumentException("index must not be negative");
		}
	}

	/**
	 * Returns true if at least one axis has work to do.
	 */
	public boolean hasWork() {
		return this.translate || this.download;
	}

	/**
	 * Returns the initial state of the given axis.
	 */
	@Nonnull
	public AxisState initialState(@Nonnull Axis axis) {
		final boolean selected = axis == Axis.TRANSLATION ? this.translate : this.download;
		return selected ? AxisState.PENDING : AxisState.NOT_REQUIRED;
	}

	@Nonnull
	public String recordId() {
		return this.illustration.recordId();
	}
}
