package org.pubsearch.search.bootstrap;

import org.pubsearch.indexing.config.IndexingConfig;
import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.indexer.JsonIndexSnapshotStore;
import org.pubsearch.indexing.service.IndexingService;
import org.pubsearch.indexing.storage.PublicationReader;
import org.pubsearch.indexing.text.TextNormalizer;
import org.pubsearch.indexing.text.TextNormalizerFactory;
import org.pubsearch.search.config.SearchConfig;
import org.pubsearch.search.ranking.Ranker;
import org.pubsearch.search.ranking.RankingAlgorithm;
import org.pubsearch.search.service.QueryProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Wires the search engine together.
 *
 * <p>Builds the text normalizer and the index, loads the index snapshot (rebuilding it from the
 * publications file when there is none), and creates the configured ranker and the query processor.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the engine from {@code application.properties} and the environment.
     */
    public static SearchRuntime load() throws IOException {
        return start(IndexingConfig.load(), SearchConfig.load());
    }

    public static SearchRuntime start(IndexingConfig indexingConfig, SearchConfig searchConfig) throws IOException {
        TextNormalizer normalizer = TextNormalizerFactory.create(indexingConfig.text());
        InvertedIndex index = new InvertedIndex(normalizer, indexingConfig.fieldWeights());
        IndexingService indexingService = buildIndexingService(indexingConfig, index);

        IndexingService.IndexSource source = indexingService.loadOrRebuild();
        logger.info("Index ready from {}: {} documents, {} terms",
                source, index.totalDocuments(), index.vocabularySize());

        RankingAlgorithm algorithm = RankingAlgorithm.fromName(searchConfig.ranking().algorithm());
        Ranker ranker = algorithm.createRanker(index, searchConfig.ranking());
        QueryProcessor queryProcessor = new QueryProcessor(index, ranker, normalizer, searchConfig);
        logger.info("Search engine started with {} ranking", algorithm.key());
        return new SearchRuntime(index, indexingService, queryProcessor, algorithm);
    }

    private static IndexingService buildIndexingService(IndexingConfig cfg, InvertedIndex index) {
        return new IndexingService(
            index,
            new JsonIndexSnapshotStore(Paths.get(cfg.storage().snapshotPath())),
            new PublicationReader(Paths.get(cfg.storage().publicationsPath()))
        );
    }

    /**
     * A started engine.
     */
    public record SearchRuntime(
        InvertedIndex index,
        IndexingService indexingService,
        QueryProcessor queryProcessor,
        RankingAlgorithm algorithm
    ) {}
}
