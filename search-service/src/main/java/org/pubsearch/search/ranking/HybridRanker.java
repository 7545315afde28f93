package org.pubsearch.search.ranking;

/**
 * Weighted sum of a TF-IDF and a BM25 score.
 */
public class HybridRanker implements Ranker {
	public static final double DEFAULT_TFIDF_WEIGHT = 0.4;
	public static final double DEFAULT_BM25_WEIGHT = 0.6;

	private final TfIdfRanker tfidf;
	private final Bm25Ranker bm25;
	private final double tfidfWeight;
	private final double bm25Weight;

	public HybridRanker(TfIdfRanker tfidf, Bm25Ranker bm25, double tfidfWeight, double bm25Weight) {
		this.tfidf = tfidf;
		this.bm25 = bm25;
		this.tfidfWeight = tfidfWeight;
		this.bm25Weight = bm25Weight;
	}

	@Override
	public double score(int docId, ScoringContext context) {
		return tfidfWeight * tfidf.score(docId, context) + bm25Weight * bm25.score(docId, context);
	}
}
