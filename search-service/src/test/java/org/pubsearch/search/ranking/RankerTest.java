package org.pubsearch.search.ranking;

import org.junit.jupiter.api.Test;
import org.pubsearch.core.model.Field;
import org.pubsearch.core.model.Publication;
import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.indexer.Posting;
import org.pubsearch.indexing.text.TextNormalizer;
import org.pubsearch.search.config.SearchConfig;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RankerTest {

	private static final TextNormalizer NORMALIZER = TextNormalizer.withDefaults();

	private static InvertedIndex index() {
		InvertedIndex index = new InvertedIndex(NORMALIZER);
		index.buildFromPublications(List.of(
				Publication.of("Graph Mining", List.of("Jane Doe"), "2021", "Graph methods for networks", List.of()),
				Publication.of("Protein Folding", List.of("Wei Chen"), "2019", "Simulation of proteins", List.of()),
				Publication.of("Quantum Walks", List.of(), "2020", "Walks on graphs", List.of()),
				Publication.of("Sparse Solvers", List.of(), "2018", "Iterative methods", List.of())
		));
		return index;
	}

	private static ScoringContext context(String term, int documentFrequency, int queryFrequency, Posting posting) {
		return new ScoringContext(List.of(term), Map.of(term, queryFrequency),
				Map.of(term, new TermPostings(term, documentFrequency, Map.of(posting.docId(), posting))));
	}

	private static Posting posting(double weight, Field... fields) {
		return new Posting(0, weight, EnumSet.of(fields[0], fields));
	}

	@Test
	public void testBm25SaturatesWithTermWeight() {
		Bm25Ranker ranker = new Bm25Ranker(index());

		double previousScore = 0.0;
		double previousGain = Double.MAX_VALUE;
		for (int weight = 1; weight <= 20; weight++) {
			double score = ranker.score(0, context("graph", 1, 1, posting(weight, Field.ABSTRACT)));
			double gain = score - previousScore;
			assertTrue(score >= previousScore, "score must not drop, weight=" + weight);
			assertTrue(gain < previousGain, "gain must shrink, weight=" + weight);
			previousScore = score;
			previousGain = gain;
		}

		System.out.println("✅ BM25 saturation test passed!");
	}

	@Test
	public void testBm25ChecksTitleBeforeAuthors() {
		Bm25Ranker ranker = new Bm25Ranker(index());
		double plain = ranker.score(0, context("graph", 1, 1, posting(2.0, Field.ABSTRACT)));

		assertEquals(plain * 2.0, ranker.score(0, context("graph", 1, 1, posting(2.0, Field.TITLE))), 1e-9);
		assertEquals(plain * 1.5, ranker.score(0, context("graph", 1, 1, posting(2.0, Field.AUTHORS))), 1e-9);
		assertEquals(plain * 2.0,
				ranker.score(0, context("graph", 1, 1, posting(2.0, Field.AUTHORS, Field.TITLE))), 1e-9);
	}

	@Test
	public void testBm25GuardsAgainstEmptyIndexAndUnknownTerms() {
		InvertedIndex empty = new InvertedIndex(NORMALIZER);
		assertEquals(0.0, new Bm25Ranker(empty).score(0, context("graph", 1, 1, posting(3.0, Field.TITLE))));

		Bm25Ranker ranker = new Bm25Ranker(index());
		assertEquals(0.0, ranker.score(0, context("graph", 0, 1, posting(3.0, Field.TITLE))));
		assertEquals(0.0, ranker.score(0, context("graph", 1, 1, posting(0.0, Field.TITLE))));
		assertEquals(0.0, ranker.score(1, context("graph", 1, 1, posting(3.0, Field.TITLE))));

		assertEquals(0.0, Bm25Ranker.idf(10, 0));
		assertTrue(Bm25Ranker.idf(10, 10) > 0);
		assertTrue(Bm25Ranker.idf(10, 1) > Bm25Ranker.idf(10, 5));
	}

	@Test
	public void testTfIdfScoring() {
		InvertedIndex index = index();
		TfIdfRanker ranker = new TfIdfRanker(index);

		double expected = (1.0 + Math.log(2.0)) * InvertedIndex.idf(4, 2);
		assertEquals(expected, ranker.score(0, context("graph", 2, 1, posting(2.0, Field.ABSTRACT))), 1e-9);
		assertEquals(expected * 1.5, ranker.score(0, context("graph", 2, 1, posting(2.0, Field.TITLE))), 1e-9);
		assertEquals(expected * 3, ranker.score(0, context("graph", 2, 3, posting(2.0, Field.ABSTRACT))), 1e-9);

		assertEquals(0.0, ranker.score(0, context("graph", 2, 1, posting(0.2, Field.ABSTRACT))));
		assertEquals(0.0, ranker.score(1, context("graph", 2, 1, posting(2.0, Field.ABSTRACT))));

		System.out.println("✅ TF-IDF scoring test passed!");
	}

	@Test
	public void testHybridIsWeightedSum() {
		InvertedIndex index = index();
		TfIdfRanker tfidf = new TfIdfRanker(index);
		Bm25Ranker bm25 = new Bm25Ranker(index);
		HybridRanker hybrid = new HybridRanker(tfidf, bm25, HybridRanker.DEFAULT_TFIDF_WEIGHT, HybridRanker.DEFAULT_BM25_WEIGHT);

		ScoringContext context = context("graph", 2, 1, posting(3.0, Field.TITLE, Field.ABSTRACT));
		double expected = 0.4 * tfidf.score(0, context) + 0.6 * bm25.score(0, context);
		assertEquals(expected, hybrid.score(0, context), 1e-9);
	}

	@Test
	public void testRealPostingsFromIndex() {
		InvertedIndex index = index();
		ScoringContext context = new ScoringContext(List.of("graph"), Map.of("graph", 1),
				Map.of("graph", TermPostings.lookup(index, "graph")));
		Bm25Ranker ranker = new Bm25Ranker(index);

		// doc 0 has "graph" in the title and abstract, doc 2 only in the abstract
		assertEquals(2, context.documentFrequency("graph"));
		assertTrue(ranker.score(0, context) > ranker.score(2, context));
		assertEquals(0.0, ranker.score(1, context));
	}

	@Test
	public void testAlgorithmSelection() {
		assertEquals(RankingAlgorithm.HYBRID, RankingAlgorithm.fromName(" Hybrid "));
		assertEquals(RankingAlgorithm.TFIDF, RankingAlgorithm.fromName("tfidf"));
		assertEquals(RankingAlgorithm.BM25, RankingAlgorithm.fromName("pagerank"));
		assertEquals(RankingAlgorithm.BM25, RankingAlgorithm.fromName(null));

		SearchConfig.Ranking ranking = SearchConfig.defaults().ranking();
		InvertedIndex index = index();
		assertInstanceOf(TfIdfRanker.class, RankingAlgorithm.TFIDF.createRanker(index, ranking));
		assertInstanceOf(Bm25Ranker.class, RankingAlgorithm.BM25.createRanker(index, ranking));
		assertInstanceOf(HybridRanker.class, RankingAlgorithm.HYBRID.createRanker(index, ranking));
	}
}
