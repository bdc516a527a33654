package io.evitadb.irasutoya.model;

/**
 * Progress of one enrichment axis (translation or download) of a single record within a run.
 *
 * Records start in {@link #PENDING} (selected) or {@link #NOT_REQUIRED} (already done, or the axis is not
 * part of the run). A pending axis ends in {@link #DONE} or {@link #FAILED}; while a worker runs it, the
 * axis is listed by {@code RecordProcessor#getInFlight()}.
 */
public enum AxisState {

	NOT_REQUIRED,
	PENDING,
	DONE,
	FAILED;

	/**
	 * Returns true if the axis reached a final state in this run.
	 */
	public boolean isTerminal() {
		return this != PENDING;
	}
}
