package org.pubsearch.search.ranking;

import org.pubsearch.core.model.Field;
import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.indexer.Posting;

/**
 * Okapi BM25 over field-weighted term frequencies.
 *
 * <p>A term found in the title is boosted x2.0; otherwise a term found in the authors is boosted
 * x1.5. At most one boost applies per term.</p>
 */
public class Bm25Ranker implements Ranker {
	public static final double DEFAULT_K1 = 1.5;
	public static final double DEFAULT_B = 0.75;
	static final double TITLE_BOOST = 2.0;
	static final double AUTHORS_BOOST = 1.5;

	private final InvertedIndex index;
	private final double k1;
	private final double b;

	public Bm25Ranker(InvertedIndex index) {
		this(index, DEFAULT_K1, DEFAULT_B);
	}

	public Bm25Ranker(InvertedIndex index, double k1, double b) {
		this.index = index;
		this.k1 = k1;
		this.b = b;
	}

	@Override
	public double score(int docId, ScoringContext context) {
		double avgDocLength = index.averageDocumentLength();
		if (avgDocLength == 0) {
			return 0.0;
		}
		int totalDocs = index.totalDocuments();
		double lengthRatio = index.documentLength(docId) / avgDocLength;
		double score = 0.0;

		for (String term : context.terms()) {
			double idf = idf(totalDocs, context.documentFrequency(term));
			if (idf == 0) {
				continue;
			}
			Posting posting = context.posting(term, docId);
			if (posting == null || posting.weight() == 0) {
				continue;
			}

			double weight = posting.weight();
			double numerator = weight * (k1 + 1);
			double denominator = weight + k1 * (1 - b + b * lengthRatio);
			double termScore = idf * (numerator / denominator);

			if (posting.hasField(Field.TITLE)) {
				termScore *= TITLE_BOOST;
			} else if (posting.hasField(Field.AUTHORS)) {
				termScore *= AUTHORS_BOOST;
			}
			score += termScore;
		}
		return score;
	}

	/**
	 * BM25 idf {@code ln((N - df + 0.5) / (df + 0.5) + 1)}, or 0 when the term is unknown.
	 */
	public static double idf(int totalDocs, int documentFrequency) {
		if (documentFrequency <= 0) {
			return 0.0;
		}
		return Math.log((totalDocs - documentFrequency + 0.5) / (documentFrequency + 0.5) + 1);
	}
}
