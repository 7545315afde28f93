package org.pubsearch.indexing;

import org.pubsearch.indexing.config.IndexingConfig;
import org.pubsearch.indexing.indexer.IndexStatistics;
import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.indexer.JsonIndexSnapshotStore;
import org.pubsearch.indexing.service.IndexingService;
import org.pubsearch.indexing.storage.PublicationReader;
import org.pubsearch.indexing.text.TextNormalizerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Rebuilds the index from the publications file and writes a fresh snapshot.
 */
public class IndexingApp {
	private static final Logger logger = LoggerFactory.getLogger(IndexingApp.class);

	public static void main(String[] args) {
		for (String arg : args) {
			if (arg.equals("-h") || arg.equals("--help")) {
				printUsage();
				return;
			}
		}

		try {
			IndexingConfig config = IndexingConfig.load();
			logger.info("Configuration:");
			logger.info("  Publications: {}", config.storage().publicationsPath());
			logger.info("  Snapshot: {}", config.storage().snapshotPath());

			InvertedIndex index = new InvertedIndex(TextNormalizerFactory.create(config.text()), config.fieldWeights());
			IndexingService service = new IndexingService(
					index,
					new JsonIndexSnapshotStore(Paths.get(config.storage().snapshotPath())),
					new PublicationReader(Paths.get(config.storage().publicationsPath()))
			);

			int indexed = service.rebuildFromFile();
			IndexStatistics stats = service.statistics();
			logger.info("Indexed {} publications: {} terms, average length {}",
					indexed, stats.totalTerms(), stats.averageDocLength());
		} catch (Exception e) {
			logger.error("Failed to build the index", e);
			printUsage();
			System.exit(1);
		}
	}

	private static void printUsage() {
		System.out.println("\n=== Indexing Usage ===\n");
		System.out.println("Usage: java -jar indexing-service-1.0.0.jar\n");
		System.out.println("Reads publications.path and writes index.snapshot.path from application.properties.");
		System.out.println("Environment variables override properties; DATA_DIR sets both paths.\n");
	}
}
