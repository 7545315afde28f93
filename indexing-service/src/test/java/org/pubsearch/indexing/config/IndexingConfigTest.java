package org.pubsearch.indexing.config;

import org.junit.jupiter.api.Test;
import org.pubsearch.core.model.Field;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingConfigTest {

	private static Properties required() {
		Properties properties = new Properties();
		properties.setProperty("publications.path", "data/publications.json");
		properties.setProperty("index.snapshot.path", "data/index.json");
		return properties;
	}

	@Test
	public void testDefaults() {
		IndexingConfig config = IndexingConfig.from(required());

		assertEquals("data/publications.json", config.storage().publicationsPath());
		assertEquals(IndexingConfig.DEFAULT_FIELD_WEIGHTS, config.fieldWeights());
		assertTrue(config.text().lemmatization());
		assertTrue(config.text().stemIndexing());
		assertFalse(config.text().stemQueries());
		assertNull(config.text().posModel());

		System.out.println("✅ Indexing config defaults test passed!");
	}

	@Test
	public void testOverrides() {
		Properties properties = required();
		properties.setProperty("index.field.weight.title", "5");
		properties.setProperty("text.stemming.query.enabled", "yes");
		properties.setProperty("text.opennlp.pos.model", " models/en-pos-maxent.bin ");

		IndexingConfig config = IndexingConfig.from(properties);

		assertEquals(5.0, config.fieldWeights().get(Field.TITLE));
		assertEquals(2.5, config.fieldWeights().get(Field.AUTHORS));
		assertTrue(config.text().stemQueries());
		assertEquals("models/en-pos-maxent.bin", config.text().posModel());
	}

	@Test
	public void testInvalidValuesFailFast() {
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(new Properties()));

		Properties negative = required();
		negative.setProperty("index.field.weight.abstract", "-1");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(negative));

		Properties notANumber = required();
		notANumber.setProperty("index.field.weight.year", "heavy");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(notANumber));

		Properties notABoolean = required();
		notABoolean.setProperty("text.lemmatization.enabled", "maybe");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(notABoolean));
	}

	@Test
	public void testLoadReadsClasspathProperties() {
		IndexingConfig config = IndexingConfig.load();

		assertNotNull(config.storage().snapshotPath());
		assertEquals(3.0, config.fieldWeights().get(Field.TITLE));
	}
}
