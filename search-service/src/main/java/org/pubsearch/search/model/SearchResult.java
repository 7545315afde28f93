package org.pubsearch.search.model;

import org.pubsearch.core.model.Publication;

import java.util.List;
import java.util.Map;

public record SearchResult(
		int docId,
		String title,
		List<String> authors,
		String year,
		String abstractText,
		List<String> keywords,
		String publicationLink,
		Map<String, String> authorProfiles,
		double score,
		List<String> matchedTerms
) {
	public static SearchResult fromPublication(int docId, Publication publication, double score, List<String> matchedTerms) {
		return new SearchResult(
				docId,
				publication.title(),
				publication.authors(),
				publication.year(),
				publication.abstractText(),
				publication.keywords(),
				publication.publicationLink(),
				publication.authorProfiles(),
				round(score),
				List.copyOf(matchedTerms)
		);
	}

	/**
	 * Scores are reported with four decimals.
	 */
	static double round(double score) {
		return Math.round(score * 10_000.0) / 10_000.0;
	}
}
