package org.pubsearch.search.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Partial-match results per query term, valid for one index generation.
 *
 * <p>The first lookup after the index generation changes drops every entry. The cache is cleared
 * as well once it reaches its entry limit.</p>
 */
public class PartialMatchCache {
	static final int DEFAULT_MAX_ENTRIES = 10_000;

	private final Map<String, List<String>> entries = new ConcurrentHashMap<>();
	private final int maxEntries;
	private volatile long generation = -1;

	public PartialMatchCache() {
		this(DEFAULT_MAX_ENTRIES);
	}

	public PartialMatchCache(int maxEntries) {
		this.maxEntries = maxEntries;
	}

	public List<String> get(String term, long indexGeneration, Function<String, List<String>> finder) {
		if (generation != indexGeneration) {
			synchronized (this) {
				if (generation != indexGeneration) {
					entries.clear();
					generation = indexGeneration;
				}
			}
		}
		if (entries.size() >= maxEntries && !entries.containsKey(term)) {
			entries.clear();
		}
		return entries.computeIfAbsent(term, finder);
	}

	public int size() {
		return entries.size();
	}
}
