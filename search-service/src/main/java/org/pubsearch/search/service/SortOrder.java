package org.pubsearch.search.service;

import java.util.Comparator;
import java.util.Locale;

/**
 * Result orderings. Year orderings treat a missing or non-numeric year as 0 and break ties by
 * score; every ordering finally breaks ties by document id so pages are stable.
 */
public enum SortOrder {
	RELEVANCE("relevance"),
	YEAR_DESC("year_desc"),
	YEAR_ASC("year_asc");

	private static final Comparator<ScoredDocument> BY_SCORE_DESC =
			Comparator.comparingDouble(ScoredDocument::score).reversed();
	private static final Comparator<ScoredDocument> BY_DOC_ID =
			Comparator.comparingInt(ScoredDocument::docId);

	private final String key;

	SortOrder(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	public Comparator<ScoredDocument> comparator() {
		return switch (this) {
			case RELEVANCE -> BY_SCORE_DESC.thenComparing(BY_DOC_ID);
			case YEAR_DESC -> Comparator.comparingInt(ScoredDocument::year).reversed()
					.thenComparing(BY_SCORE_DESC)
					.thenComparing(BY_DOC_ID);
			case YEAR_ASC -> Comparator.comparingInt(ScoredDocument::year)
					.thenComparing(BY_SCORE_DESC)
					.thenComparing(BY_DOC_ID);
		};
	}

	/**
	 * Order by name; unknown or missing names mean {@link #RELEVANCE}.
	 */
	public static SortOrder fromName(String name) {
		if (name == null) {
			return RELEVANCE;
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		for (SortOrder order : values()) {
			if (order.key.equals(normalized)) {
				return order;
			}
		}
		return RELEVANCE;
	}
}
