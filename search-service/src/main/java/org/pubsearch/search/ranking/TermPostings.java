package org.pubsearch.search.ranking;

import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.indexer.Posting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A query term's postings looked up once per query, keyed by document.
 *
 * @param term              the query term as the query processor produced it
 * @param documentFrequency number of documents containing the term
 * @param byDocument        posting per document id, in posting-list order
 */
public record TermPostings(String term, int documentFrequency, Map<Integer, Posting> byDocument) {

	public static TermPostings lookup(InvertedIndex index, String term) {
		Map<Integer, Posting> byDocument = new LinkedHashMap<>();
		for (Posting posting : index.getPostings(term)) {
			byDocument.put(posting.docId(), posting);
		}
		return new TermPostings(term, index.documentFrequency(term), Collections.unmodifiableMap(byDocument));
	}

	public Posting posting(int docId) {
		return byDocument.get(docId);
	}
}
