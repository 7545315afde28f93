package org.pubsearch.benchmarks;

import org.pubsearch.core.model.Publication;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic publications built from a small academic vocabulary.
 */
final class SyntheticCorpus {
	private static final String[] WORDS = {
			"deep", "learning", "neural", "network", "graph", "mining", "protein", "folding", "quantum",
			"algorithm", "optimization", "healthcare", "finance", "model", "analysis", "classification",
			"retrieval", "ranking", "index", "semantic", "embedding", "transformer", "vision", "language",
			"simulation", "energy", "security", "privacy", "distributed", "systems", "robust", "sparse",
			"matrix", "inference", "bayesian", "statistical", "clinical", "patients", "diagnosis", "images"
	};
	private static final String[] SURNAMES = {"Silva", "Chen", "Doe", "Smith", "Kumar", "Garcia", "Novak", "Ito"};

	private SyntheticCorpus() {}

	static List<Publication> generate(int size, long seed) {
		Random random = new Random(seed);
		List<Publication> publications = new ArrayList<>(size);
		for (int i = 0; i < size; i++) {
			publications.add(Publication.of(
					words(random, 4 + random.nextInt(6)),
					List.of("A. " + SURNAMES[random.nextInt(SURNAMES.length)], "B. " + SURNAMES[random.nextInt(SURNAMES.length)]),
					String.valueOf(1995 + random.nextInt(30)),
					words(random, 40 + random.nextInt(80)),
					List.of(WORDS[random.nextInt(WORDS.length)], WORDS[random.nextInt(WORDS.length)])));
		}
		return publications;
	}

	static String query(Random random, int terms) {
		return words(random, terms);
	}

	private static String words(Random random, int count) {
		StringBuilder text = new StringBuilder();
		for (int i = 0; i < count; i++) {
			if (i > 0) {
				text.append(' ');
			}
			text.append(WORDS[random.nextInt(WORDS.length)]);
		}
		return text.toString();
	}
}
