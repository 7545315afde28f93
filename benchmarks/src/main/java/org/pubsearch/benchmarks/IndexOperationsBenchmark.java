package org.pubsearch.benchmarks;

import org.pubsearch.core.model.Publication;
import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.indexer.JsonIndexSnapshotStore;
import org.pubsearch.indexing.text.TextNormalizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Benchmarks for inverted index operations
 * Tests: build, term lookup, snapshot save, snapshot load
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexOperationsBenchmark {

	private TextNormalizer normalizer;
	private List<Publication> publications;
	private InvertedIndex index;
	private Path snapshotDir;
	private JsonIndexSnapshotStore snapshotStore;

	@Param({"100", "1000", "5000"})
	private int corpusSize;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		System.out.println("=== Index Operations Benchmark Setup (corpusSize=" + corpusSize + ") ===");

		normalizer = TextNormalizer.withDefaults();
		publications = SyntheticCorpus.generate(corpusSize, 42L);

		index = new InvertedIndex(normalizer);
		index.buildFromPublications(publications);

		snapshotDir = Files.createTempDirectory("pubsearch-bench");
		snapshotStore = new JsonIndexSnapshotStore(snapshotDir.resolve("index.json"));
		snapshotStore.save(index);

		System.out.println("Index ready: " + index.vocabularySize() + " terms");
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		try (Stream<Path> paths = Files.walk(snapshotDir)) {
			for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.deleteIfExists(path);
			}
		}
	}

	/**
	 * Benchmark: Build the whole index from publications
	 */
	@Benchmark
	public void buildIndex(Blackhole blackhole) {
		InvertedIndex fresh = new InvertedIndex(normalizer);
		fresh.buildFromPublications(publications);
		blackhole.consume(fresh.vocabularySize());
	}

	/**
	 * Benchmark: Postings lookup for a single term
	 */
	@Benchmark
	public void lookupTerm(Blackhole blackhole) {
		blackhole.consume(index.getPostings("learning"));
	}

	/**
	 * Benchmark: Single-term search scored by weight x idf
	 */
	@Benchmark
	public void searchTerm(Blackhole blackhole) {
		blackhole.consume(index.searchTerm("protein"));
	}

	/**
	 * Benchmark: Save the index snapshot
	 */
	@Benchmark
	public void saveSnapshot(Blackhole blackhole) throws IOException {
		snapshotStore.save(index);
		blackhole.consume(snapshotStore.getSizeInMB());
	}

	/**
	 * Benchmark: Load the index snapshot into an empty index
	 */
	@Benchmark
	public void loadSnapshot(Blackhole blackhole) {
		InvertedIndex restored = new InvertedIndex(normalizer);
		blackhole.consume(snapshotStore.load(restored));
	}
}
