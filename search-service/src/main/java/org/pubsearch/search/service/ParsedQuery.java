package org.pubsearch.search.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized query terms.
 *
 * @param terms           terms in query order, duplicates kept, already capped
 * @param termFrequencies occurrences per distinct term, in first-occurrence order
 */
public record ParsedQuery(List<String> terms, Map<String, Integer> termFrequencies) {

	public static ParsedQuery of(List<String> terms) {
		Map<String, Integer> frequencies = new LinkedHashMap<>();
		for (String term : terms) {
			frequencies.merge(term, 1, Integer::sum);
		}
		return new ParsedQuery(List.copyOf(terms), Collections.unmodifiableMap(frequencies));
	}

	public List<String> distinctTerms() {
		return new ArrayList<>(termFrequencies.keySet());
	}

	public boolean isEmpty() {
		return terms.isEmpty();
	}
}
