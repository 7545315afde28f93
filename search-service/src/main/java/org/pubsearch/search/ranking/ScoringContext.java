package org.pubsearch.search.ranking;

import org.pubsearch.indexing.indexer.Posting;

import java.util.List;
import java.util.Map;

/**
 * Everything a {@link Ranker} needs about one query.
 *
 * @param terms            distinct query terms in query order
 * @param termFrequencies  occurrences of each term in the query
 * @param postings         pre-fetched postings per term
 */
public record ScoringContext(
		List<String> terms,
		Map<String, Integer> termFrequencies,
		Map<String, TermPostings> postings
) {
	public Posting posting(String term, int docId) {
		TermPostings termPostings = postings.get(term);
		return termPostings == null ? null : termPostings.posting(docId);
	}

	public int documentFrequency(String term) {
		TermPostings termPostings = postings.get(term);
		return termPostings == null ? 0 : termPostings.documentFrequency();
	}

	public int queryFrequency(String term) {
		return termFrequencies.getOrDefault(term, 1);
	}
}
