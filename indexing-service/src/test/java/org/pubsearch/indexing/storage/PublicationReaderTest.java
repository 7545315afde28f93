package org.pubsearch.indexing.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pubsearch.core.model.Publication;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PublicationReaderTest {

	@TempDir
	Path tempDir;

	@Test
	public void testReadsAndCoercesRecords() throws Exception {
		Path file = tempDir.resolve("publications.json");
		Files.writeString(file, """
				[
				  {
				    "title": "Deep Learning for Healthcare",
				    "authors": ["Ana Silva", "Wei Chen"],
				    "year": 2023,
				    "abstract": "Neural models for diagnosis.",
				    "keywords": "deep learning",
				    "publication_link": "https://example.org/p/1",
				    "author_profiles": {"Ana Silva": "https://example.org/a/1"}
				  },
				  {"title": "Untitled draft", "authors": null},
				  "not a record"
				]
				""");

		List<Publication> publications = new PublicationReader(file).readPublications();

		assertEquals(2, publications.size());
		Publication first = publications.get(0);
		assertEquals("Deep Learning for Healthcare", first.title());
		assertEquals(List.of("Ana Silva", "Wei Chen"), first.authors());
		assertEquals("2023", first.year());
		assertEquals(List.of("deep learning"), first.keywords());
		assertEquals(Map.of("Ana Silva", "https://example.org/a/1"), first.authorProfiles());

		Publication second = publications.get(1);
		assertEquals(List.of(), second.authors());
		assertEquals("", second.year());
		assertEquals("", second.abstractText());

		System.out.println("✅ Publications reader test passed!");
	}

	@Test
	public void testMissingFileGivesNoPublications() throws Exception {
		assertTrue(new PublicationReader(tempDir.resolve("missing.json")).readPublications().isEmpty());
	}

	@Test
	public void testMalformedFileFails() throws Exception {
		Path broken = tempDir.resolve("broken.json");
		Files.writeString(broken, "[{\"title\": ");
		assertThrows(IOException.class, () -> new PublicationReader(broken).readPublications());

		Path notArray = tempDir.resolve("object.json");
		Files.writeString(notArray, "{\"title\": \"x\"}");
		assertThrows(IOException.class, () -> new PublicationReader(notArray).readPublications());
	}
}
