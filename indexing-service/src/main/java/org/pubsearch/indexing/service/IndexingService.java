package org.pubsearch.indexing.service;

import org.pubsearch.core.model.Publication;
import org.pubsearch.indexing.indexer.IndexSnapshotStore;
import org.pubsearch.indexing.indexer.IndexStatistics;
import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.storage.PublicationReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Owns the index lifecycle: full rebuilds from the publications file and snapshot save/load.
 */
public class IndexingService {
	private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

	private final InvertedIndex index;
	private final IndexSnapshotStore snapshotStore;
	private final PublicationReader publicationReader;

	public IndexingService(InvertedIndex index, IndexSnapshotStore snapshotStore, PublicationReader publicationReader) {
		this.index = index;
		this.snapshotStore = snapshotStore;
		this.publicationReader = publicationReader;
	}

	/**
	 * Rebuild the index from the given publications. Does not touch the snapshot.
	 */
	public int buildIndex(List<Publication> publications) {
		logger.info("Starting index build for {} publications", publications.size());
		index.buildFromPublications(publications);
		IndexStatistics stats = index.statistics();
		logger.info("Index build complete: {} documents, {} terms", stats.totalDocuments(), stats.totalTerms());
		return stats.totalDocuments();
	}

	/**
	 * Read the publications file, rebuild the index and save a fresh snapshot.
	 */
	public int rebuildFromFile() throws IOException {
		logger.info("Starting full index rebuild from {}", publicationReader.path());
		List<Publication> publications = publicationReader.readPublications();
		int indexed = buildIndex(publications);
		snapshotStore.save(index);
		return indexed;
	}

	public boolean loadSnapshot() {
		return snapshotStore.load(index);
	}

	public void saveSnapshot() throws IOException {
		snapshotStore.save(index);
	}

	/**
	 * Load the snapshot, or rebuild from the publications file when there is no usable snapshot.
	 */
	public IndexSource loadOrRebuild() throws IOException {
		if (snapshotStore.load(index)) {
			return IndexSource.SNAPSHOT;
		}
		logger.warn("No usable index snapshot, rebuilding from publications");
		rebuildFromFile();
		return IndexSource.REBUILT;
	}

	public IndexStatistics statistics() {
		return index.statistics();
	}

	public InvertedIndex index() {
		return index;
	}

	public enum IndexSource {
		SNAPSHOT,
		REBUILT
	}
}
