package org.pubsearch.search.bootstrap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pubsearch.indexing.config.IndexingConfig;
import org.pubsearch.search.config.SearchConfig;
import org.pubsearch.search.model.SearchResponse;
import org.pubsearch.search.ranking.RankingAlgorithm;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SearchBootstrapTest {

	@TempDir
	Path tempDir;

	private IndexingConfig indexingConfig() {
		Properties properties = new Properties();
		properties.setProperty("publications.path", tempDir.resolve("publications.json").toString());
		properties.setProperty("index.snapshot.path", tempDir.resolve("index/index.json").toString());
		return IndexingConfig.from(properties);
	}

	@Test
	public void testStartBuildsThenReusesSnapshot() throws Exception {
		Files.writeString(tempDir.resolve("publications.json"), """
				[
				  {"title": "Deep Learning for Healthcare", "authors": ["Ana Silva"], "year": 2023,
				   "publication_link": "https://example.org/p/1"},
				  {"title": "Deep Learning for Finance", "authors": ["Wei Chen"], "year": 2021},
				  {"abstract": "We compare deep learning methods.", "year": "N/A"}
				]
				""");

		Properties searchProperties = new Properties();
		searchProperties.setProperty("search.ranking.algorithm", "tfidf");
		SearchBootstrap.SearchRuntime first = SearchBootstrap.start(indexingConfig(), SearchConfig.from(searchProperties));

		assertEquals(RankingAlgorithm.TFIDF, first.algorithm());
		assertTrue(Files.exists(tempDir.resolve("index/index.json")));
		SearchResponse response = first.queryProcessor().search("deep learning", 1, 2, "relevance");
		assertEquals(3, response.total());
		assertEquals(2, response.totalPages());
		assertEquals("https://example.org/p/1", response.results().get(0).publicationLink());

		// the second start must come from the snapshot, not the (now empty) publications file
		Files.writeString(tempDir.resolve("publications.json"), "[]");
		SearchBootstrap.SearchRuntime second = SearchBootstrap.start(indexingConfig(), SearchConfig.defaults());

		assertEquals(RankingAlgorithm.BM25, second.algorithm());
		assertEquals(3, second.index().totalDocuments());
		assertEquals(3, second.queryProcessor().search("deep learning", 1, 10, "relevance").total());

		System.out.println("✅ Bootstrap test passed!");
	}

	@Test
	public void testStartWithNothingOnDiskGivesEmptyEngine() throws Exception {
		SearchBootstrap.SearchRuntime runtime = SearchBootstrap.start(indexingConfig(), SearchConfig.defaults());

		assertEquals(0, runtime.index().totalDocuments());
		assertEquals(0, runtime.queryProcessor().search("anything", 1, 10, null).total());
	}
}
