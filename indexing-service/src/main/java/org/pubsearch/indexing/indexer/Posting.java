package org.pubsearch.indexing.indexer;

import org.pubsearch.core.model.Field;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One document's entry in a term's posting list.
 *
 * @param docId  document the term occurs in
 * @param weight sum over fields of (occurrences in field x field weight)
 * @param fields fields that contributed to {@code weight}
 */
public record Posting(int docId, double weight, Set<Field> fields) {

	public Posting {
		if (fields == null || fields.isEmpty()) {
			throw new IllegalArgumentException("A posting needs at least one field");
		}
		fields = Collections.unmodifiableSet(EnumSet.copyOf(fields));
	}

	public static Posting of(int docId, double weight, Field field) {
		return new Posting(docId, weight, EnumSet.of(field));
	}

	/**
	 * The posting after the same term was found in another field of the same document.
	 */
	public Posting merge(double additionalWeight, Field field) {
		EnumSet<Field> merged = EnumSet.copyOf(fields);
		merged.add(field);
		return new Posting(docId, weight + additionalWeight, merged);
	}

	public boolean hasField(Field field) {
		return fields.contains(field);
	}

	/**
	 * Comma-joined field names, e.g. {@code "title,abstract"}.
	 */
	public String fieldTag() {
		return fields.stream().map(Field::key).collect(Collectors.joining(","));
	}
}
