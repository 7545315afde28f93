package org.pubsearch.indexing.indexer;

import java.io.IOException;

public interface IndexSnapshotStore {
	/**
	 * Write the complete index state as a single snapshot, replacing any previous one
	 */
	void save(InvertedIndex index) throws IOException;

	/**
	 * Replace the index state with the stored snapshot
	 * @return false if there is no snapshot or it cannot be read; the index is then left untouched
	 */
	boolean load(InvertedIndex index);

	/**
	 * Check if a snapshot exists
	 */
	boolean exists();

	/**
	 * Get size of the snapshot in MB
	 */
	double getSizeInMB();
}
