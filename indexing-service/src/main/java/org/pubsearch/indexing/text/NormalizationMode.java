package org.pubsearch.indexing.text;

/**
 * Which side of the engine a piece of text is being normalized for.
 */
public enum NormalizationMode {
	/** Document fields; never expanded with synonyms. */
	INDEXING,
	/** User queries; synonym expansion applies when enabled. */
	QUERY
}
