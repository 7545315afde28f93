package org.pubsearch.indexing.text;

import opennlp.tools.lemmatizer.DictionaryLemmatizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Part-of-speech aware lemmatizer.
 *
 * <p>Each token is tagged, the tag is mapped to a {@link PartOfSpeech} and the token is reduced to
 * its dictionary form. When an OpenNLP lemma dictionary is configured it is consulted first;
 * tokens it does not know, or every token when there is no dictionary, go through the built-in
 * morphological rules.</p>
 */
public class Lemmatizer {
	private static final String UNKNOWN_LEMMA = "O";
	private static final int MIN_STEM_LENGTH = 3;

	private static final Map<String, String> IRREGULAR_NOUNS = Map.ofEntries(
			Map.entry("children", "child"),
			Map.entry("men", "man"),
			Map.entry("women", "woman"),
			Map.entry("feet", "foot"),
			Map.entry("teeth", "tooth"),
			Map.entry("mice", "mouse"),
			Map.entry("geese", "goose"),
			Map.entry("analyses", "analysis"),
			Map.entry("theses", "thesis"),
			Map.entry("hypotheses", "hypothesis"),
			Map.entry("criteria", "criterion"),
			Map.entry("phenomena", "phenomenon"),
			Map.entry("indices", "index"),
			Map.entry("matrices", "matrix"),
			Map.entry("vertices", "vertex")
	);

	private static final Map<String, String> IRREGULAR_VERBS = Map.ofEntries(
			Map.entry("using", "use"),
			Map.entry("used", "use"),
			Map.entry("uses", "use"),
			Map.entry("ran", "run"),
			Map.entry("built", "build"),
			Map.entry("made", "make"),
			Map.entry("found", "find"),
			Map.entry("taken", "take"),
			Map.entry("given", "give"),
			Map.entry("shown", "show"),
			Map.entry("written", "write"),
			Map.entry("known", "know"),
			Map.entry("led", "lead"),
			Map.entry("held", "hold"),
			Map.entry("brought", "bring"),
			Map.entry("thought", "think")
	);

	private static final Map<String, String> IRREGULAR_ADJECTIVES = Map.of(
			"better", "good",
			"best", "good",
			"worse", "bad",
			"worst", "bad"
	);

	// stems that get their silent "e" back once "-ed" or "-ing" is removed
	private static final String[] E_RESTORING_ENDINGS = {"at", "ut", "iz", "yz", "bl", "v", "ur", "c"};

	private final PosTagger tagger;
	private final DictionaryLemmatizer dictionary;

	public Lemmatizer(PosTagger tagger) {
		this(tagger, null);
	}

	public Lemmatizer(PosTagger tagger, DictionaryLemmatizer dictionary) {
		this.tagger = tagger;
		this.dictionary = dictionary;
	}

	public List<String> lemmatize(List<String> tokens) {
		if (tokens.isEmpty()) {
			return List.of();
		}
		List<String> tags = tagger.tag(tokens);
		String[] dictionaryLemmas = lookupDictionary(tokens, tags);

		List<String> lemmas = new ArrayList<>(tokens.size());
		for (int i = 0; i < tokens.size(); i++) {
			String fromDictionary = dictionaryLemmas == null ? null : dictionaryLemmas[i];
			if (fromDictionary != null && !UNKNOWN_LEMMA.equals(fromDictionary)) {
				lemmas.add(fromDictionary);
			} else {
				lemmas.add(lemmatize(tokens.get(i), PartOfSpeech.fromTag(tags.get(i))));
			}
		}
		return lemmas;
	}

	/**
	 * Rule-based reduction of a single word with a known word class.
	 */
	public String lemmatize(String word, PartOfSpeech pos) {
		if (word.isEmpty() || Character.isDigit(word.charAt(0))) {
			return word;
		}
		return switch (pos) {
			case NOUN -> lemmatizeNoun(word);
			case VERB -> lemmatizeVerb(word);
			case ADJECTIVE -> IRREGULAR_ADJECTIVES.getOrDefault(word, word);
			case ADVERB -> word;
		};
	}

	private String[] lookupDictionary(List<String> tokens, List<String> tags) {
		if (dictionary == null) {
			return null;
		}
		return dictionary.lemmatize(tokens.toArray(new String[0]), tags.toArray(new String[0]));
	}

	private String lemmatizeNoun(String word) {
		String irregular = IRREGULAR_NOUNS.get(word);
		if (irregular != null) {
			return irregular;
		}
		if (word.length() <= 3) {
			return word;
		}
		if (word.endsWith("ies") && word.length() > 4) {
			return word.substring(0, word.length() - 3) + "y";
		}
		if (word.endsWith("sses") || word.endsWith("shes") || word.endsWith("ches")
				|| word.endsWith("xes") || word.endsWith("zes")) {
			return word.substring(0, word.length() - 2);
		}
		if (word.endsWith("ss") || word.endsWith("us") || word.endsWith("is")) {
			return word;
		}
		if (word.endsWith("s")) {
			return word.substring(0, word.length() - 1);
		}
		return word;
	}

	private String lemmatizeVerb(String word) {
		String irregular = IRREGULAR_VERBS.get(word);
		if (irregular != null) {
			return irregular;
		}
		if ((word.endsWith("ies") || word.endsWith("ied")) && word.length() > 4) {
			return word.substring(0, word.length() - 3) + "y";
		}
		if (word.endsWith("ing") && word.length() - 3 >= MIN_STEM_LENGTH) {
			return restoreStem(word.substring(0, word.length() - 3));
		}
		if (word.endsWith("ed") && word.length() - 2 >= MIN_STEM_LENGTH) {
			return restoreStem(word.substring(0, word.length() - 2));
		}
		if (word.endsWith("sses") || word.endsWith("shes") || word.endsWith("ches")
				|| word.endsWith("xes") || word.endsWith("zes")) {
			return word.substring(0, word.length() - 2);
		}
		if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
			return word.substring(0, word.length() - 1);
		}
		return word;
	}

	private String restoreStem(String stem) {
		int n = stem.length();
		char last = stem.charAt(n - 1);
		if (n >= 2 && last == stem.charAt(n - 2) && isConsonant(last) && last != 'l' && last != 's' && last != 'z') {
			return stem.substring(0, n - 1);
		}
		for (String ending : E_RESTORING_ENDINGS) {
			if (stem.endsWith(ending)) {
				return stem + "e";
			}
		}
		if (n <= 4 && isShortSyllable(stem)) {
			return stem + "e";
		}
		return stem;
	}

	// consonant-vowel-consonant at the end, final consonant not w, x or y
	private boolean isShortSyllable(String stem) {
		int n = stem.length();
		if (n < 3) {
			return false;
		}
		char c1 = stem.charAt(n - 3);
		char v = stem.charAt(n - 2);
		char c2 = stem.charAt(n - 1);
		return isConsonant(c1) && !isConsonant(v) && isConsonant(c2) && c2 != 'w' && c2 != 'x' && c2 != 'y';
	}

	private static boolean isConsonant(char c) {
		return Character.isLetter(c) && "aeiou".indexOf(c) < 0;
	}
}
