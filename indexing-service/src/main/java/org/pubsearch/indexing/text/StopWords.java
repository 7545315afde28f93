package org.pubsearch.indexing.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Stopword lists: a classpath resource with one word per line, or the built-in minimal list.
 */
public final class StopWords {
	private static final Logger logger = LoggerFactory.getLogger(StopWords.class);

	public static final Set<String> FALLBACK = Set.of(
			"a", "an", "and", "are", "as", "at", "be", "by", "for",
			"from", "has", "he", "in", "is", "it", "its", "of", "on",
			"or", "that", "the", "to", "was", "will", "with", "this",
			"but", "they", "have", "had", "what", "when", "where",
			"who", "why", "how", "all", "each", "every", "both", "few",
			"more", "most", "other", "some", "such", "no", "nor", "not",
			"only", "same", "so", "than", "too", "very", "can", "just",
			"should", "now", "i", "we", "you", "she", "them",
			"their", "there", "here", "about", "after", "before",
			"above", "below", "between", "during", "through", "into"
	);

	private StopWords() {}

	/**
	 * Load a stopword list from the classpath, falling back to {@link #FALLBACK} when the resource
	 * is missing or unreadable.
	 */
	public static Set<String> load(String resourceName) {
		if (resourceName == null || resourceName.isBlank()) {
			return FALLBACK;
		}
		try (InputStream in = StopWords.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (in == null) {
				logger.warn("Stopword resource '{}' not found, using built-in list", resourceName);
				return FALLBACK;
			}
			BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
			Set<String> words = parseLines(reader.lines().toList());
			logger.info("Loaded {} stopwords from {}", words.size(), resourceName);
			return words;
		} catch (IOException e) {
			logger.warn("Failed to read stopword resource '{}', using built-in list", resourceName, e);
			return FALLBACK;
		}
	}

	static Set<String> parseLines(List<String> lines) {
		Set<String> words = new HashSet<>();
		for (String line : lines) {
			String cleaned = line.trim().toLowerCase(Locale.ROOT);
			if (!cleaned.isEmpty() && !cleaned.startsWith("#")) {
				words.add(cleaned);
			}
		}
		return Set.copyOf(words);
	}
}
