package org.pubsearch.indexing.text;

/**
 * Coarse word classes the lemmatizer distinguishes.
 */
public enum PartOfSpeech {
	NOUN,
	VERB,
	ADJECTIVE,
	ADVERB;

	/**
	 * Maps a Penn Treebank or Universal Dependencies tag to a word class; anything unknown is a noun.
	 */
	public static PartOfSpeech fromTag(String tag) {
		if (tag == null || tag.isEmpty()) {
			return NOUN;
		}
		String upper = tag.toUpperCase(java.util.Locale.ROOT);
		if (upper.startsWith("ADJ") || upper.startsWith("J")) {
			return ADJECTIVE;
		}
		if (upper.startsWith("ADV") || upper.startsWith("R")) {
			return ADVERB;
		}
		if (upper.startsWith("V")) {
			return VERB;
		}
		return NOUN;
	}
}
