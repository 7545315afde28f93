package org.pubsearch.indexing.storage;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.pubsearch.core.model.Publication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the publications file produced by the crawler: a JSON array of records with the keys
 * {@code title, authors, year, abstract, keywords, publication_link, author_profiles}.
 *
 * <p>Every key is optional. Wrongly typed values are coerced rather than rejected: a numeric year
 * becomes text, a single author or keyword string becomes a one-element list.</p>
 */
public class PublicationReader {
	private static final Logger logger = LoggerFactory.getLogger(PublicationReader.class);
	private final Path publicationsPath;

	public PublicationReader(Path publicationsPath) {
		this.publicationsPath = publicationsPath;
	}

	/**
	 * Get all publications in file order; empty if the file does not exist
	 *
	 * @throws IOException if the file cannot be read or is not a JSON array
	 */
	public List<Publication> readPublications() throws IOException {
		if (!Files.exists(publicationsPath)) {
			logger.warn("Publications file not found: {}", publicationsPath);
			return List.of();
		}

		JsonElement root;
		try (Reader reader = Files.newBufferedReader(publicationsPath, StandardCharsets.UTF_8)) {
			root = JsonParser.parseReader(reader);
		} catch (JsonParseException e) {
			throw new IOException("Malformed publications file " + publicationsPath, e);
		}

		if (!root.isJsonArray()) {
			throw new IOException("Publications file must contain a JSON array: " + publicationsPath);
		}

		JsonArray records = root.getAsJsonArray();
		List<Publication> publications = new ArrayList<>(records.size());
		int skipped = 0;
		for (JsonElement element : records) {
			if (element.isJsonObject()) {
				publications.add(toPublication(element.getAsJsonObject()));
			} else {
				skipped++;
			}
		}
		if (skipped > 0) {
			logger.warn("Skipped {} non-object entries in {}", skipped, publicationsPath);
		}

		logger.info("Read {} publications from {}", publications.size(), publicationsPath);
		return publications;
	}

	public Path path() {
		return publicationsPath;
	}

	static Publication toPublication(JsonObject json) {
		return new Publication(
				text(json, "title"),
				textList(json, "authors"),
				text(json, "year"),
				text(json, "abstract"),
				textList(json, "keywords"),
				text(json, "publication_link"),
				textMap(json, "author_profiles"));
	}

	private static String text(JsonObject json, String key) {
		JsonElement value = json.get(key);
		if (value == null || !value.isJsonPrimitive()) {
			return "";
		}
		return value.getAsString();
	}

	private static List<String> textList(JsonObject json, String key) {
		JsonElement value = json.get(key);
		if (value == null || value.isJsonNull()) {
			return List.of();
		}
		if (value.isJsonPrimitive()) {
			String single = value.getAsString().trim();
			return single.isEmpty() ? List.of() : List.of(single);
		}
		List<String> values = new ArrayList<>();
		if (value.isJsonArray()) {
			for (JsonElement item : value.getAsJsonArray()) {
				if (item.isJsonPrimitive()) {
					values.add(item.getAsString());
				}
			}
		}
		return values;
	}

	private static Map<String, String> textMap(JsonObject json, String key) {
		JsonElement value = json.get(key);
		if (value == null || !value.isJsonObject()) {
			return Map.of();
		}
		Map<String, String> values = new LinkedHashMap<>();
		for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
			if (entry.getValue().isJsonPrimitive()) {
				values.put(entry.getKey(), entry.getValue().getAsString());
			}
		}
		return values;
	}
}
