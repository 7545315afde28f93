package org.pubsearch.indexing.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Word-to-synonyms lookup read from Solr-format synonym rules.
 *
 * <p>A line {@code a, b, c} makes every word a synonym of the others; {@code a => b, c} maps
 * {@code a} to {@code b} and {@code c} only. Multi-word entries are skipped because expansion
 * works token by token.</p>
 */
public class SynonymDictionary {
	private static final Logger logger = LoggerFactory.getLogger(SynonymDictionary.class);
	private static final String MAPPING_SEPARATOR = "=>";
	private static final SynonymDictionary EMPTY = new SynonymDictionary(Map.of());

	private final Map<String, List<String>> synonyms;

	private SynonymDictionary(Map<String, List<String>> synonyms) {
		this.synonyms = synonyms;
	}

	public static SynonymDictionary empty() {
		return EMPTY;
	}

	public static SynonymDictionary fromResource(String resourceName) {
		if (resourceName == null || resourceName.isBlank()) {
			return EMPTY;
		}
		try (InputStream in = SynonymDictionary.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (in == null) {
				logger.warn("Synonym resource '{}' not found, synonym expansion will add nothing", resourceName);
				return EMPTY;
			}
			BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
			SynonymDictionary dictionary = parse(reader.lines().toList());
			logger.info("Loaded synonyms for {} words from {}", dictionary.size(), resourceName);
			return dictionary;
		} catch (IOException e) {
			logger.warn("Failed to read synonym resource '{}'", resourceName, e);
			return EMPTY;
		}
	}

	/**
	 * @throws IllegalArgumentException if a rule has more than one {@code =>}
	 */
	public static SynonymDictionary parse(List<String> lines) {
		Map<String, Set<String>> rules = new HashMap<>();
		for (String rawLine : lines) {
			String line = stripComment(rawLine).trim();
			if (line.isEmpty()) {
				continue;
			}
			String[] mapping = line.split(MAPPING_SEPARATOR, -1);
			if (mapping.length > 2) {
				throw new IllegalArgumentException("Invalid synonym rule: " + rawLine);
			}
			List<String> sources = splitWords(mapping[0]);
			List<String> targets = mapping.length == 2 ? splitWords(mapping[1]) : sources;
			for (String source : sources) {
				for (String target : targets) {
					if (!target.equals(source)) {
						rules.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
					}
				}
			}
		}

		Map<String, List<String>> frozen = new HashMap<>();
		rules.forEach((word, words) -> frozen.put(word, List.copyOf(words)));
		return new SynonymDictionary(Map.copyOf(frozen));
	}

	/**
	 * Up to {@code max} synonyms of {@code word}, in rule order, never including the word itself.
	 */
	public List<String> synonymsOf(String word, int max) {
		if (max <= 0) {
			return List.of();
		}
		List<String> all = synonyms.getOrDefault(word, List.of());
		return all.size() <= max ? all : all.subList(0, max);
	}

	public int size() {
		return synonyms.size();
	}

	private static String stripComment(String line) {
		int hash = line.indexOf('#');
		return hash >= 0 ? line.substring(0, hash) : line;
	}

	private static List<String> splitWords(String part) {
		List<String> words = new ArrayList<>();
		for (String candidate : part.split(",")) {
			String word = candidate.trim().toLowerCase(Locale.ROOT);
			if (!word.isEmpty() && word.chars().noneMatch(Character::isWhitespace)) {
				words.add(word);
			}
		}
		return words;
	}
}
