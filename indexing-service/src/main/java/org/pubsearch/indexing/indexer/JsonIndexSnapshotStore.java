package org.pubsearch.indexing.indexer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores the index as one JSON document.
 *
 * <p>Saving writes a temporary file next to the target and moves it into place, so readers of the
 * file see either the previous snapshot or the new one.</p>
 */
public class JsonIndexSnapshotStore implements IndexSnapshotStore {
	private static final Logger logger = LoggerFactory.getLogger(JsonIndexSnapshotStore.class);
	private final Path snapshotPath;
	private final Gson gson;

	public JsonIndexSnapshotStore(Path snapshotPath) {
		this.snapshotPath = snapshotPath;
		this.gson = new GsonBuilder().create();
	}

	@Override
	public synchronized void save(InvertedIndex index) throws IOException {
		IndexSnapshot snapshot = index.toSnapshot();

		Path parent = snapshotPath.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		Path tempFile = Files.createTempFile(parent, snapshotPath.getFileName().toString(), ".tmp");
		try {
			try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
				gson.toJson(snapshot, writer);
			}
			moveIntoPlace(tempFile);
		} finally {
			Files.deleteIfExists(tempFile);
		}

		logger.info("Saved index snapshot to {} ({} documents, {} terms, {} MB)",
				snapshotPath, snapshot.totalDocs(), snapshot.postings().size(), String.format("%.3f", getSizeInMB()));
	}

	@Override
	public synchronized boolean load(InvertedIndex index) {
		if (!Files.exists(snapshotPath)) {
			logger.warn("Index snapshot does not exist: {}", snapshotPath);
			return false;
		}

		try (Reader reader = Files.newBufferedReader(snapshotPath, StandardCharsets.UTF_8)) {
			IndexSnapshot snapshot = gson.fromJson(reader, IndexSnapshot.class);
			index.restore(snapshot);
			logger.info("Loaded index snapshot from {}", snapshotPath);
			return true;
		} catch (IOException | JsonParseException e) {
			logger.error("Failed to read index snapshot {}", snapshotPath, e);
			return false;
		} catch (RuntimeException e) {
			logger.error("Index snapshot {} is invalid: {}", snapshotPath, e.getMessage(), e);
			return false;
		}
	}

	@Override
	public boolean exists() {
		return Files.isRegularFile(snapshotPath);
	}

	@Override
	public double getSizeInMB() {
		try {
			if (Files.exists(snapshotPath)) {
				long bytes = Files.size(snapshotPath);
				return bytes / (1024.0 * 1024.0);
			}
		} catch (IOException e) {
			logger.warn("Failed to get snapshot file size", e);
		}
		return 0.0;
	}

	public Path path() {
		return snapshotPath;
	}

	private void moveIntoPlace(Path tempFile) throws IOException {
		try {
			Files.move(tempFile, snapshotPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, replacing in place", snapshotPath);
			Files.move(tempFile, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
