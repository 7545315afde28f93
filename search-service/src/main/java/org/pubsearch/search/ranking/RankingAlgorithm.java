package org.pubsearch.search.ranking;

import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.search.config.SearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public enum RankingAlgorithm {
	TFIDF("tfidf"),
	BM25("bm25"),
	HYBRID("hybrid");

	private static final Logger logger = LoggerFactory.getLogger(RankingAlgorithm.class);

	private final String key;

	RankingAlgorithm(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	/**
	 * Algorithm by name; unknown names fall back to {@link #BM25}.
	 */
	public static RankingAlgorithm fromName(String name) {
		if (name != null) {
			String normalized = name.trim().toLowerCase(Locale.ROOT);
			for (RankingAlgorithm algorithm : values()) {
				if (algorithm.key.equals(normalized)) {
					return algorithm;
				}
			}
		}
		logger.warn("Unknown ranking algorithm '{}', using {}", name, BM25.key);
		return BM25;
	}

	public Ranker createRanker(InvertedIndex index, SearchConfig.Ranking config) {
		return switch (this) {
			case TFIDF -> new TfIdfRanker(index);
			case BM25 -> new Bm25Ranker(index, config.bm25K1(), config.bm25B());
			case HYBRID -> new HybridRanker(
					new TfIdfRanker(index),
					new Bm25Ranker(index, config.bm25K1(), config.bm25B()),
					config.hybridTfidfWeight(),
					config.hybridBm25Weight());
		};
	}
}
