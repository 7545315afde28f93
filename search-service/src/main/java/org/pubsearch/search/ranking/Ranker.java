package org.pubsearch.search.ranking;

/**
 * Scores one document against one query. Implementations are stateless and thread-safe.
 */
public interface Ranker {
	/**
	 * @return a finite score, {@code >= 0}; 0 when the document matches none of the terms
	 */
	double score(int docId, ScoringContext context);
}
