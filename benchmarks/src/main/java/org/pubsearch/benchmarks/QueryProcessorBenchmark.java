package org.pubsearch.benchmarks;

import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.text.TextNormalizer;
import org.pubsearch.search.config.SearchConfig;
import org.pubsearch.search.ranking.RankingAlgorithm;
import org.pubsearch.search.service.QueryProcessor;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the query path per ranking algorithm
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class QueryProcessorBenchmark {

	private QueryProcessor queryProcessor;
	private String[] queries;
	private int next;

	@Param({"tfidf", "bm25", "hybrid"})
	private String algorithm;

	@Param({"1000", "5000"})
	private int corpusSize;

	@Setup(Level.Trial)
	public void setup() {
		TextNormalizer normalizer = TextNormalizer.withDefaults();
		InvertedIndex index = new InvertedIndex(normalizer);
		index.buildFromPublications(SyntheticCorpus.generate(corpusSize, 7L));

		SearchConfig config = SearchConfig.defaults();
		queryProcessor = new QueryProcessor(index,
				RankingAlgorithm.fromName(algorithm).createRanker(index, config.ranking()), normalizer, config);

		Random random = new Random(11L);
		queries = new String[64];
		for (int i = 0; i < queries.length; i++) {
			queries[i] = SyntheticCorpus.query(random, 1 + random.nextInt(4));
		}
		System.out.println("Query benchmark ready: " + algorithm + " over " + corpusSize + " publications");
	}

	private String nextQuery() {
		next = (next + 1) % queries.length;
		return queries[next];
	}

	/**
	 * Benchmark: Paginated search, first page by relevance
	 */
	@Benchmark
	public void searchFirstPage(Blackhole blackhole) {
		blackhole.consume(queryProcessor.search(nextQuery(), 1, 10, "relevance"));
	}

	/**
	 * Benchmark: Paginated search ordered by year
	 */
	@Benchmark
	public void searchByYearDescending(Blackhole blackhole) {
		blackhole.consume(queryProcessor.search(nextQuery(), 1, 10, "year_desc"));
	}

	/**
	 * Benchmark: Legacy top-N search
	 */
	@Benchmark
	public void searchTopTwenty(Blackhole blackhole) {
		blackhole.consume(queryProcessor.search(nextQuery(), 20));
	}

	/**
	 * Benchmark: Prefix suggestions over the vocabulary
	 */
	@Benchmark
	public void suggestions(Blackhole blackhole) {
		blackhole.consume(queryProcessor.getSuggestions("lea"));
	}
}
