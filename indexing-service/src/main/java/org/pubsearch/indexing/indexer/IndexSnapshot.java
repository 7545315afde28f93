package org.pubsearch.indexing.indexer;

import org.pubsearch.core.model.Publication;

import java.util.List;
import java.util.Map;

/**
 * Serializable copy of the complete index state.
 *
 * <p>Plain maps, lists and strings only, so the JSON shape stays stable and readable. Timestamps
 * are ISO-8601 strings or {@code null}.</p>
 */
public record IndexSnapshot(
		int formatVersion,
		Map<String, List<Entry>> postings,
		Map<Integer, Publication> documents,
		Map<Integer, Double> documentLengths,
		Map<Integer, Map<String, Double>> fieldLengths,
		Map<String, Integer> documentFrequency,
		int totalDocs,
		double avgDocLength,
		Map<String, Double> fieldWeights,
		String createdAt,
		String lastUpdated
) {
	public static final int FORMAT_VERSION = 1;

	/** A posting with its fields spelled out by name. */
	public record Entry(int docId, double weight, List<String> fields) {}
}
