package org.pubsearch.indexing.text;

import opennlp.tools.tokenize.WhitespaceTokenizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextNormalizerTest {

	private static final SynonymDictionary SYNONYMS = SynonymDictionary.parse(List.of(
			"health, healthcare, medical",
			"network, graph"
	));

	private static TextNormalizer normalizer() {
		return new TextNormalizer(StopWords.FALLBACK, WhitespaceTokenizer.INSTANCE,
				new Lemmatizer(new SuffixPosTagger()), SYNONYMS, NormalizerSettings.defaults());
	}

	@Test
	public void testCleanRemovesUrlsEmailsAndPunctuation() {
		String cleaned = normalizer().clean("Visit https://example.org or mail a@b.com: Deep-Learning!");

		assertEquals("visit or mail deep learning", cleaned);
		assertEquals("", normalizer().clean(null));
		assertEquals("", normalizer().clean(""));

		System.out.println("✅ Clean test passed!");
	}

	@Test
	public void testStopwordsAndSingleCharactersAreDropped() {
		List<String> terms = normalizer().forQuery("The x networks in 2023");

		assertEquals(List.of("network", "2023"), terms);
	}

	@Test
	public void testEmptyInputGivesNoTerms() {
		assertTrue(normalizer().forQuery("").isEmpty());
		assertTrue(normalizer().forQuery("   ").isEmpty());
		assertTrue(normalizer().forIndexing(null).isEmpty());
		assertTrue(normalizer().forIndexing("the and of").isEmpty());
	}

	@Test
	public void testLemmatizationRunsBeforeStemming() {
		// the stemmer alone leaves "children" unchanged
		assertEquals(List.of("child"), normalizer().forIndexing("children"));
		assertEquals(List.of("run", "model"), normalizer().forIndexing("running models"));
	}

	@Test
	public void testQueryModeDoesNotStemByDefault() {
		TextNormalizer normalizer = normalizer();

		assertEquals(List.of("study"), normalizer.forQuery("studies"));
		assertEquals(List.of("studi"), normalizer.forIndexing("studies"));

		System.out.println("✅ Query mode test passed!");
	}

	@Test
	public void testSynonymExpansionOnlyForQueries() {
		TextNormalizer expanding = normalizer().withSynonymExpansion(SynonymExpansion.ENABLED, 2);

		assertEquals(List.of("health", "healthcare", "medical"), expanding.forQuery("health"));
		assertEquals(List.of("health"), expanding.forIndexing("health"));
		assertEquals(List.of("health", "healthcare"),
				normalizer().withSynonymExpansion(SynonymExpansion.ENABLED, 1).forQuery("health"));
	}

	@Test
	public void testSynonymExpansionDisabledByDefault() {
		assertEquals(SynonymExpansion.DISABLED, normalizer().settings().synonymExpansion());
		assertEquals(List.of("health"), normalizer().forQuery("health"));
	}

	@Test
	public void testDefaultsLoadBundledResources() {
		TextNormalizer normalizer = TextNormalizer.withDefaults();

		// "themselves" is only in the bundled list, not in the built-in one
		assertTrue(normalizer.forQuery("themselves").isEmpty());
		assertEquals(List.of("deep", "learn"), normalizer.forQuery("Deep Learning"));
	}
}
