package org.pubsearch.indexing.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Context-free tagger that guesses Penn Treebank tags from word endings.
 *
 * <p>Used when no statistical POS model is available. It only has to be good enough to route a
 * token to the right lemmatization rules, and it tags a word the same way wherever it occurs, so
 * document and query terms stay comparable.</p>
 */
public class SuffixPosTagger implements PosTagger {
	private static final String[] ADJECTIVE_SUFFIXES = {"ous", "ful", "ive", "able", "ible", "ical", "less"};

	@Override
	public List<String> tag(List<String> tokens) {
		List<String> tags = new ArrayList<>(tokens.size());
		for (String token : tokens) {
			tags.add(tagWord(token));
		}
		return tags;
	}

	String tagWord(String word) {
		if (word.chars().allMatch(Character::isDigit)) {
			return "CD";
		}
		int length = word.length();
		if (length > 4 && word.endsWith("ly")) {
			return "RB";
		}
		if (length > 5 && word.endsWith("ing")) {
			return "VBG";
		}
		if (length > 4 && word.endsWith("ed")) {
			return "VBD";
		}
		if (length > 5) {
			for (String suffix : ADJECTIVE_SUFFIXES) {
				if (word.endsWith(suffix)) {
					return "JJ";
				}
			}
		}
		if (length > 3 && word.endsWith("s") && !word.endsWith("ss") && !word.endsWith("us") && !word.endsWith("is")) {
			return "NNS";
		}
		return "NN";
	}
}
