package io.evitadb.irasutoya.model;

/**
 * The two independent enrichment passes.
 */
public enum Axis {

	TRANSLATION,
	DOWNLOAD

}
