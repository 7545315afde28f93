package org.pubsearch.search.model;

import java.util.List;

/**
 * One page of ranked results.
 *
 * @param total      number of results across all pages
 * @param page       1-based page actually returned, after clamping
 * @param totalPages {@code ceil(total / perPage)}, 0 when there are no results
 */
public record SearchResponse(
		String query,
		String sortBy,
		List<SearchResult> results,
		int total,
		int page,
		int perPage,
		int totalPages
) {
	public static SearchResponse empty(String query, String sortBy, int perPage) {
		return new SearchResponse(query, sortBy, List.of(), 0, 1, perPage, 0);
	}
}
