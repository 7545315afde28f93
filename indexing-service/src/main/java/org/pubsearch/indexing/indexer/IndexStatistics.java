package org.pubsearch.indexing.indexer;

import java.time.Instant;
import java.util.Map;

public record IndexStatistics(
		int totalDocuments,
		int totalTerms,
		double averageDocLength,
		Instant createdAt,
		Instant lastUpdated,
		Map<String, Double> fieldWeights,
		long generation
) {}
