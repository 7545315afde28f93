package org.pubsearch.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Searchable publication fields, in the order they are indexed.
 */
public enum Field {
	TITLE("title"),
	AUTHORS("authors"),
	YEAR("year"),
	ABSTRACT("abstract"),
	KEYWORDS("keywords");

	private final String key;

	Field(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	/**
	 * Text of this field in the given publication; list fields are joined with spaces.
	 */
	public String textOf(Publication publication) {
		return switch (this) {
			case TITLE -> publication.title();
			case AUTHORS -> String.join(" ", publication.authors());
			case YEAR -> publication.year();
			case ABSTRACT -> publication.abstractText();
			case KEYWORDS -> String.join(" ", publication.keywords());
		};
	}

	public static Optional<Field> fromKey(String key) {
		if (key == null) {
			return Optional.empty();
		}
		String normalized = key.trim().toLowerCase(Locale.ROOT);
		for (Field field : values()) {
			if (field.key.equals(normalized)) {
				return Optional.of(field);
			}
		}
		return Optional.empty();
	}
}
