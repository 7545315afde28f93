package org.pubsearch.indexing.text;

import opennlp.tools.stemmer.PorterStemmer;
import opennlp.tools.tokenize.Tokenizer;
import opennlp.tools.tokenize.WhitespaceTokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free text into the ordered term sequence the index is keyed on.
 *
 * <p>Both modes share one pipeline: clean, tokenize, drop stopwords and single characters,
 * lemmatize, then stem when the mode asks for it. {@link NormalizationMode#QUERY} may finally
 * append synonyms. Lemmatization runs before stemming because the tagger and the lemma rules need
 * intact word forms.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public class TextNormalizer {
	private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+|www\\.\\S+");
	private static final Pattern EMAIL_PATTERN = Pattern.compile("\\S+@\\S+");
	private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}\\s]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final Set<String> stopWords;
	private final Tokenizer tokenizer;
	private final Lemmatizer lemmatizer;
	private final SynonymDictionary synonyms;
	private final NormalizerSettings settings;

	public TextNormalizer(Set<String> stopWords, Tokenizer tokenizer, Lemmatizer lemmatizer,
						  SynonymDictionary synonyms, NormalizerSettings settings) {
		this.stopWords = Set.copyOf(stopWords);
		this.tokenizer = tokenizer;
		this.lemmatizer = lemmatizer;
		this.synonyms = synonyms;
		this.settings = settings;
	}

	/**
	 * Normalizer with the bundled stopwords and synonyms, the suffix tagger and production settings.
	 */
	public static TextNormalizer withDefaults() {
		return new TextNormalizer(
				StopWords.load(TextNormalizerFactory.DEFAULT_STOPWORDS_RESOURCE),
				WhitespaceTokenizer.INSTANCE,
				new Lemmatizer(new SuffixPosTagger()),
				SynonymDictionary.fromResource(TextNormalizerFactory.DEFAULT_SYNONYMS_RESOURCE),
				NormalizerSettings.defaults());
	}

	/**
	 * Same resources, different synonym switch. Used to derive the query-side normalizer.
	 */
	public TextNormalizer withSynonymExpansion(SynonymExpansion expansion, int maxSynonyms) {
		return new TextNormalizer(stopWords, tokenizer, lemmatizer, synonyms,
				settings.withSynonymExpansion(expansion, maxSynonyms));
	}

	public NormalizerSettings settings() {
		return settings;
	}

	public List<String> forIndexing(String text) {
		return normalize(text, NormalizationMode.INDEXING);
	}

	public List<String> forQuery(String text) {
		return normalize(text, NormalizationMode.QUERY);
	}

	public List<String> normalize(String text, NormalizationMode mode) {
		List<String> tokens = removeStopWords(tokenize(clean(text)));
		if (tokens.isEmpty()) {
			return List.of();
		}
		if (settings.lemmatization()) {
			tokens = lemmatizer.lemmatize(tokens);
		}
		if (settings.stemmingFor(mode)) {
			tokens = stem(tokens);
		}
		if (mode == NormalizationMode.QUERY && settings.synonymExpansion() == SynonymExpansion.ENABLED) {
			tokens = expandWithSynonyms(tokens);
		}
		return List.copyOf(tokens);
	}

	/**
	 * Lowercase, drop URLs and e-mail addresses, turn punctuation into spaces, collapse whitespace.
	 * Digits are kept.
	 */
	public String clean(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String cleaned = text.toLowerCase(Locale.ROOT);
		cleaned = URL_PATTERN.matcher(cleaned).replaceAll("");
		cleaned = EMAIL_PATTERN.matcher(cleaned).replaceAll("");
		cleaned = NON_ALPHANUMERIC.matcher(cleaned).replaceAll(" ");
		return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
	}

	public List<String> tokenize(String cleaned) {
		if (cleaned == null || cleaned.isEmpty()) {
			return List.of();
		}
		List<String> tokens = new ArrayList<>();
		for (String token : tokenizer.tokenize(cleaned)) {
			if (!token.isBlank()) {
				tokens.add(token);
			}
		}
		return tokens;
	}

	private List<String> removeStopWords(List<String> tokens) {
		List<String> kept = new ArrayList<>(tokens.size());
		for (String token : tokens) {
			if (token.length() > 1 && !stopWords.contains(token)) {
				kept.add(token);
			}
		}
		return kept;
	}

	private List<String> stem(List<String> tokens) {
		// PorterStemmer keeps a working buffer, one per call
		PorterStemmer stemmer = new PorterStemmer();
		List<String> stemmed = new ArrayList<>(tokens.size());
		for (String token : tokens) {
			stemmed.add(stemmer.stem(token).toString());
		}
		return stemmed;
	}

	private List<String> expandWithSynonyms(List<String> tokens) {
		List<String> expanded = new ArrayList<>(tokens);
		for (String token : tokens) {
			expanded.addAll(synonyms.synonymsOf(token, settings.maxSynonyms()));
		}
		return expanded;
	}
}
