package org.pubsearch.indexing.indexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pubsearch.core.model.Field;
import org.pubsearch.core.model.Publication;
import org.pubsearch.indexing.text.TextNormalizer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JsonIndexSnapshotStoreTest {

	private static final TextNormalizer NORMALIZER = TextNormalizer.withDefaults();

	@TempDir
	Path tempDir;

	private static InvertedIndex sampleIndex() {
		InvertedIndex index = new InvertedIndex(NORMALIZER);
		index.buildFromPublications(List.of(
				new Publication("Deep Learning for Healthcare", List.of("Ana Silva"), "2023",
						"Neural models for diagnosis.", List.of("deep learning", "health"),
						"https://example.org/p/1", Map.of("Ana Silva", "https://example.org/a/1")),
				Publication.of("Graph Mining", List.of("Jane Doe"), "N/A", "Graph methods", List.of())
		));
		return index;
	}

	@Test
	public void testSaveAndLoadRestoresEverything() throws Exception {
		InvertedIndex original = sampleIndex();
		JsonIndexSnapshotStore store = new JsonIndexSnapshotStore(tempDir.resolve("nested/index.json"));

		store.save(original);
		assertTrue(store.exists());
		assertTrue(store.getSizeInMB() > 0);

		InvertedIndex restored = new InvertedIndex(NORMALIZER, Map.of(Field.TITLE, 1.0));
		assertTrue(store.load(restored));

		IndexSnapshot expected = original.toSnapshot();
		IndexSnapshot actual = restored.toSnapshot();
		assertEquals(expected.postings(), actual.postings());
		assertEquals(expected.documents(), actual.documents());
		assertEquals(expected.documentLengths(), actual.documentLengths());
		assertEquals(expected.fieldLengths(), actual.fieldLengths());
		assertEquals(expected.documentFrequency(), actual.documentFrequency());
		assertEquals(expected.fieldWeights(), actual.fieldWeights());
		assertEquals(expected.createdAt(), actual.createdAt());
		assertEquals(expected.lastUpdated(), actual.lastUpdated());
		assertEquals(2, restored.totalDocuments());
		assertEquals(original.averageDocumentLength(), restored.averageDocumentLength(), 1e-9);
		assertEquals("https://example.org/a/1",
				restored.getDocument(0).orElseThrow().authorProfiles().get("Ana Silva"));

		System.out.println("✅ Snapshot round trip test passed!");
	}

	@Test
	public void testMissingSnapshotIsNotLoaded() {
		JsonIndexSnapshotStore store = new JsonIndexSnapshotStore(tempDir.resolve("absent.json"));

		assertFalse(store.exists());
		assertFalse(store.load(new InvertedIndex(NORMALIZER)));
		assertEquals(0.0, store.getSizeInMB());
	}

	@Test
	public void testCorruptSnapshotLeavesIndexUntouched() throws Exception {
		InvertedIndex index = sampleIndex();
		long generation = index.generation();
		Path file = tempDir.resolve("index.json");

		Files.writeString(file, "{ this is not json");
		assertFalse(new JsonIndexSnapshotStore(file).load(index));

		Files.writeString(file, "{\"formatVersion\": 99}");
		assertFalse(new JsonIndexSnapshotStore(file).load(index));

		assertEquals(2, index.totalDocuments());
		assertEquals(generation, index.generation());
		assertFalse(index.getPostings("graph").isEmpty());
	}

	@Test
	public void testSaveReplacesPreviousSnapshot() throws Exception {
		Path file = tempDir.resolve("index.json");
		JsonIndexSnapshotStore store = new JsonIndexSnapshotStore(file);
		store.save(sampleIndex());

		InvertedIndex smaller = new InvertedIndex(NORMALIZER);
		smaller.buildFromPublications(List.of(Publication.of("Protein Folding", List.of(), "2019", "", List.of())));
		store.save(smaller);

		InvertedIndex restored = new InvertedIndex(NORMALIZER);
		assertTrue(store.load(restored));
		assertEquals(1, restored.totalDocuments());
		try (var files = Files.list(tempDir)) {
			assertEquals(1, files.count());
		}
	}
}
