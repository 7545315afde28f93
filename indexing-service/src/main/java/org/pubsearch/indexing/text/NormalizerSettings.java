package org.pubsearch.indexing.text;

/**
 * Switches for the optional stages of {@link TextNormalizer}.
 *
 * @param lemmatization      run part-of-speech aware lemmatization
 * @param stemIndexing       run the Porter stemmer in {@link NormalizationMode#INDEXING}
 * @param stemQueries        run the Porter stemmer in {@link NormalizationMode#QUERY}
 * @param synonymExpansion   expand query tokens with synonyms
 * @param maxSynonyms        synonyms added per query token when expansion is enabled
 */
public record NormalizerSettings(
		boolean lemmatization,
		boolean stemIndexing,
		boolean stemQueries,
		SynonymExpansion synonymExpansion,
		int maxSynonyms
) {
	public static final int DEFAULT_MAX_SYNONYMS = 2;

	public NormalizerSettings {
		if (synonymExpansion == null) {
			synonymExpansion = SynonymExpansion.DISABLED;
		}
		if (maxSynonyms < 0) {
			throw new IllegalArgumentException("maxSynonyms must not be negative: " + maxSynonyms);
		}
	}

	/**
	 * Production defaults: lemmatize everywhere, stem only while indexing, no synonyms.
	 */
	public static NormalizerSettings defaults() {
		return new NormalizerSettings(true, true, false, SynonymExpansion.DISABLED, DEFAULT_MAX_SYNONYMS);
	}

	public NormalizerSettings withSynonymExpansion(SynonymExpansion expansion, int max) {
		return new NormalizerSettings(lemmatization, stemIndexing, stemQueries, expansion, max);
	}

	public boolean stemmingFor(NormalizationMode mode) {
		return mode == NormalizationMode.INDEXING ? stemIndexing : stemQueries;
	}
}
