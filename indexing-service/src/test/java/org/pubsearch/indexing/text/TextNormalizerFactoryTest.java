package org.pubsearch.indexing.text;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pubsearch.indexing.config.IndexingConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextNormalizerFactoryTest {

	@TempDir
	Path tempDir;

	private static IndexingConfig.Text text(String tokenizerModel, String posModel, String lemmaDictionary) {
		return new IndexingConfig.Text(true, true, false,
				TextNormalizerFactory.DEFAULT_STOPWORDS_RESOURCE, TextNormalizerFactory.DEFAULT_SYNONYMS_RESOURCE,
				tokenizerModel, posModel, lemmaDictionary);
	}

	@Test
	public void testMissingModelsFallBackToBuiltIns() {
		String missing = tempDir.resolve("missing.bin").toString();
		TextNormalizer normalizer = TextNormalizerFactory.create(text(missing, missing, missing));

		assertEquals(List.of("deep", "learn"), normalizer.forQuery("Deep Learning"));
		assertEquals(SynonymExpansion.DISABLED, normalizer.settings().synonymExpansion());

		System.out.println("✅ Fallback normalizer test passed!");
	}

	@Test
	public void testLemmaDictionaryWinsOverRules() throws Exception {
		Path dictionary = tempDir.resolve("lemmas.dict");
		Files.writeString(dictionary, "data\tNN\tdatum\n");

		TextNormalizer normalizer = TextNormalizerFactory.create(text(null, null, dictionary.toString()));

		assertEquals(List.of("datum", "model"), normalizer.forQuery("data models"));
	}

	@Test
	public void testMissingStopwordResourceUsesBuiltInList() {
		IndexingConfig.Text text = new IndexingConfig.Text(true, false, false,
				"stopwords/missing.txt", "synonyms/missing.txt", null, null, null);
		TextNormalizer normalizer = TextNormalizerFactory.create(text);

		assertEquals(List.of("graph", "theory"), normalizer.forIndexing("the graph theory"));
	}
}
