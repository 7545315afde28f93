package org.pubsearch.search.service;

import org.pubsearch.core.model.Publication;
import org.pubsearch.search.model.SearchResult;

import java.util.List;

/**
 * A candidate after scoring, before it is turned into a {@link SearchResult}.
 */
public record ScoredDocument(int docId, Publication publication, double score, List<String> matchedTerms) {

	public int year() {
		return publication.numericYear();
	}

	public SearchResult toResult() {
		return SearchResult.fromPublication(docId, publication, score, matchedTerms);
	}
}
