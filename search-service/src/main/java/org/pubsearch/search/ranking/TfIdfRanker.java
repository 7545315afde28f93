package org.pubsearch.search.ranking;

import org.pubsearch.core.model.Field;
import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.indexer.Posting;

/**
 * Log-normalized TF-IDF with a title boost.
 *
 * <p>Per matched term: {@code (1 + ln(weight)) * idf * queryFrequency}, times 1.5 when the term
 * occurs in the title.</p>
 */
public class TfIdfRanker implements Ranker {
	static final double TITLE_BOOST = 1.5;

	private final InvertedIndex index;

	public TfIdfRanker(InvertedIndex index) {
		this.index = index;
	}

	@Override
	public double score(int docId, ScoringContext context) {
		int totalDocs = index.totalDocuments();
		double score = 0.0;

		for (String term : context.terms()) {
			Posting posting = context.posting(term, docId);
			if (posting == null) {
				continue;
			}
			double tf = termFrequency(posting.weight());
			double idf = InvertedIndex.idf(totalDocs, context.documentFrequency(term));
			double contribution = tf * idf * context.queryFrequency(term);

			if (posting.hasField(Field.TITLE)) {
				contribution *= TITLE_BOOST;
			}
			score += contribution;
		}
		return score;
	}

	static double termFrequency(double weight) {
		if (weight <= 0) {
			return 0.0;
		}
		// weights below 1/e would go negative
		return Math.max(0.0, 1.0 + Math.log(weight));
	}
}
