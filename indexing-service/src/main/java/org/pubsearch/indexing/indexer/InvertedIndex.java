package org.pubsearch.indexing.indexer;

import org.pubsearch.core.model.Field;
import org.pubsearch.core.model.Publication;
import org.pubsearch.indexing.config.IndexingConfig;
import org.pubsearch.indexing.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Field-weighted inverted index over publications.
 *
 * <p>Each term maps to at most one {@link Posting} per document. When a term occurs in several
 * fields of a document the field-weighted counts are summed into that single posting and the
 * contributing fields are recorded on it. Postings are kept per term in a map keyed by document
 * id, in insertion order, so merging is constant time while the list view stays ordered.</p>
 *
 * <p>Mutations take the write lock and bump {@link #generation()}; reads take the read lock. A
 * caller that needs several reads to see the same state wraps them in {@link #withReadLock}.</p>
 */
public class InvertedIndex {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);

	private final TextNormalizer normalizer;
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
	private final AtomicLong generation = new AtomicLong();

	private final NavigableMap<String, Map<Integer, Posting>> postings = new TreeMap<>();
	private final NavigableMap<Integer, Publication> documents = new TreeMap<>();
	private final Map<Integer, Double> documentLengths = new HashMap<>();
	private final Map<Integer, Map<Field, Double>> fieldLengths = new HashMap<>();
	private final Map<String, Integer> documentFrequency = new HashMap<>();
	private Map<Field, Double> fieldWeights;
	private int totalDocs;
	private double totalLength;
	private double avgDocLength;
	private Instant createdAt;
	private Instant lastUpdated;

	public InvertedIndex(TextNormalizer normalizer) {
		this(normalizer, IndexingConfig.DEFAULT_FIELD_WEIGHTS);
	}

	public InvertedIndex(TextNormalizer normalizer, Map<Field, Double> fieldWeights) {
		this.normalizer = normalizer;
		this.fieldWeights = copyWeights(fieldWeights);
	}

	/**
	 * Replace the whole index with the given publications; document ids are their list positions.
	 */
	public void buildFromPublications(List<Publication> publications) {
		lock.writeLock().lock();
		try {
			clearLocked();
			createdAt = Instant.now();
			for (int docId = 0; docId < publications.size(); docId++) {
				addDocumentLocked(docId, publications.get(docId));
			}
			lastUpdated = Instant.now();
			generation.incrementAndGet();
		} finally {
			lock.writeLock().unlock();
		}
		logger.info("Built index from {} publications ({} terms, avg length {})",
				publications.size(), vocabularySize(), String.format("%.2f", averageDocumentLength()));
	}

	/**
	 * @throws IllegalArgumentException if {@code docId} is already indexed
	 */
	public void addDocument(int docId, Publication publication) {
		lock.writeLock().lock();
		try {
			addDocumentLocked(docId, publication);
			lastUpdated = Instant.now();
			generation.incrementAndGet();
		} finally {
			lock.writeLock().unlock();
		}
	}

	private void addDocumentLocked(int docId, Publication publication) {
		if (documents.containsKey(docId)) {
			throw new IllegalArgumentException("Document " + docId + " is already indexed");
		}
		documents.put(docId, publication);

		Map<Field, Double> lengths = new EnumMap<>(Field.class);
		Set<String> documentTerms = new HashSet<>();
		double length = 0;

		for (Field field : Field.values()) {
			String text = field.textOf(publication);
			if (text.isBlank()) {
				continue;
			}
			List<String> terms = normalizer.forIndexing(text);
			if (terms.isEmpty()) {
				continue;
			}

			double weight = fieldWeights.getOrDefault(field, 1.0);
			Map<String, Integer> counts = new LinkedHashMap<>();
			for (String term : terms) {
				counts.merge(term, 1, Integer::sum);
			}

			for (Map.Entry<String, Integer> entry : counts.entrySet()) {
				double weighted = entry.getValue() * weight;
				Map<Integer, Posting> list = postings.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>());
				Posting existing = list.get(docId);
				list.put(docId, existing == null ? Posting.of(docId, weighted, field) : existing.merge(weighted, field));
			}
			documentTerms.addAll(counts.keySet());

			double fieldLength = terms.size() * weight;
			lengths.put(field, fieldLength);
			length += fieldLength;
		}

		for (String term : documentTerms) {
			documentFrequency.merge(term, 1, Integer::sum);
		}
		fieldLengths.put(docId, lengths);
		documentLengths.put(docId, length);
		totalDocs++;
		totalLength += length;
		avgDocLength = totalLength / totalDocs;
	}

	/**
	 * Index key for a raw term, i.e. the first term the indexing pipeline produces for it.
	 */
	public Optional<String> resolveTerm(String term) {
		if (term == null) {
			return Optional.empty();
		}
		List<String> normalized = normalizer.forIndexing(term);
		return normalized.isEmpty() ? Optional.empty() : Optional.of(normalized.get(0));
	}

	/**
	 * Postings for a raw term; empty when the term normalizes to nothing or is not indexed.
	 */
	public List<Posting> getPostings(String term) {
		return resolveTerm(term).map(this::postingsOfIndexedTerm).orElse(List.of());
	}

	/**
	 * Postings for a term that is already an index key; no normalization is applied.
	 */
	public List<Posting> postingsOfIndexedTerm(String indexedTerm) {
		lock.readLock().lock();
		try {
			Map<Integer, Posting> list = postings.get(indexedTerm);
			return list == null ? List.of() : List.copyOf(list.values());
		} finally {
			lock.readLock().unlock();
		}
	}

	public int documentFrequency(String term) {
		Optional<String> resolved = resolveTerm(term);
		if (resolved.isEmpty()) {
			return 0;
		}
		lock.readLock().lock();
		try {
			return documentFrequency.getOrDefault(resolved.get(), 0);
		} finally {
			lock.readLock().unlock();
		}
	}

	public double idf(String term) {
		lock.readLock().lock();
		try {
			return idf(totalDocs, documentFrequency(term));
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Smoothed inverse document frequency {@code ln((N+1)/(df+1)) + 1}, or 0 when {@code df == 0}.
	 */
	public static double idf(int totalDocs, int documentFrequency) {
		if (documentFrequency <= 0) {
			return 0.0;
		}
		return Math.log((totalDocs + 1.0) / (documentFrequency + 1.0)) + 1.0;
	}

	/**
	 * Documents containing a single term, scored by weight x idf, best first.
	 */
	public List<TermHit> searchTerm(String term) {
		lock.readLock().lock();
		try {
			List<Posting> list = getPostings(term);
			double termIdf = idf(term);
			List<TermHit> hits = new ArrayList<>(list.size());
			for (Posting posting : list) {
				Publication publication = documents.get(posting.docId());
				if (publication != null) {
					hits.add(new TermHit(posting.docId(), publication, posting.weight() * termIdf));
				}
			}
			hits.sort(Comparator.comparingDouble(TermHit::score).reversed());
			return hits;
		} finally {
			lock.readLock().unlock();
		}
	}

	public Optional<Publication> getDocument(int docId) {
		lock.readLock().lock();
		try {
			return Optional.ofNullable(documents.get(docId));
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Read-only view of the document store ordered by id. Iterate it inside {@link #withReadLock}.
	 */
	public NavigableMap<Integer, Publication> documents() {
		return Collections.unmodifiableNavigableMap(documents);
	}

	/**
	 * Read-only view of the sorted vocabulary. Iterate it inside {@link #withReadLock}.
	 */
	public NavigableSet<String> vocabulary() {
		return Collections.unmodifiableNavigableSet(postings.navigableKeySet());
	}

	public Set<String> allTerms() {
		lock.readLock().lock();
		try {
			return new TreeSet<>(postings.keySet());
		} finally {
			lock.readLock().unlock();
		}
	}

	public boolean containsTerm(String term) {
		Optional<String> resolved = resolveTerm(term);
		if (resolved.isEmpty()) {
			return false;
		}
		lock.readLock().lock();
		try {
			return postings.containsKey(resolved.get());
		} finally {
			lock.readLock().unlock();
		}
	}

	public double documentLength(int docId) {
		lock.readLock().lock();
		try {
			return documentLengths.getOrDefault(docId, 0.0);
		} finally {
			lock.readLock().unlock();
		}
	}

	public double fieldLength(int docId, Field field) {
		lock.readLock().lock();
		try {
			return fieldLengths.getOrDefault(docId, Map.of()).getOrDefault(field, 0.0);
		} finally {
			lock.readLock().unlock();
		}
	}

	public int totalDocuments() {
		lock.readLock().lock();
		try {
			return totalDocs;
		} finally {
			lock.readLock().unlock();
		}
	}

	/** Number of indexed documents. */
	public int size() {
		return totalDocuments();
	}

	public double averageDocumentLength() {
		lock.readLock().lock();
		try {
			return avgDocLength;
		} finally {
			lock.readLock().unlock();
		}
	}

	public int vocabularySize() {
		lock.readLock().lock();
		try {
			return postings.size();
		} finally {
			lock.readLock().unlock();
		}
	}

	public Map<Field, Double> fieldWeights() {
		lock.readLock().lock();
		try {
			return fieldWeights;
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Counter bumped by every mutation: build, add, clear and restore.
	 */
	public long generation() {
		return generation.get();
	}

	public TextNormalizer normalizer() {
		return normalizer;
	}

	public IndexStatistics statistics() {
		lock.readLock().lock();
		try {
			Map<String, Double> weights = new LinkedHashMap<>();
			fieldWeights.forEach((field, weight) -> weights.put(field.key(), weight));
			return new IndexStatistics(
					totalDocs,
					postings.size(),
					Math.round(avgDocLength * 100.0) / 100.0,
					createdAt,
					lastUpdated,
					Collections.unmodifiableMap(weights),
					generation.get());
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Run {@code action} while holding the read lock, so every read inside sees one index state.
	 */
	public <T> T withReadLock(Supplier<T> action) {
		lock.readLock().lock();
		try {
			return action.get();
		} finally {
			lock.readLock().unlock();
		}
	}

	public void clear() {
		lock.writeLock().lock();
		try {
			clearLocked();
			generation.incrementAndGet();
		} finally {
			lock.writeLock().unlock();
		}
		logger.info("Cleared inverted index");
	}

	private void clearLocked() {
		postings.clear();
		documents.clear();
		documentLengths.clear();
		fieldLengths.clear();
		documentFrequency.clear();
		totalDocs = 0;
		totalLength = 0;
		avgDocLength = 0;
	}

	public IndexSnapshot toSnapshot() {
		lock.readLock().lock();
		try {
			Map<String, List<IndexSnapshot.Entry>> postingEntries = new TreeMap<>();
			postings.forEach((term, list) -> {
				List<IndexSnapshot.Entry> entries = new ArrayList<>(list.size());
				for (Posting posting : list.values()) {
					entries.add(new IndexSnapshot.Entry(posting.docId(), posting.weight(),
							posting.fields().stream().map(Field::key).toList()));
				}
				postingEntries.put(term, entries);
			});

			Map<Integer, Map<String, Double>> namedFieldLengths = new TreeMap<>();
			fieldLengths.forEach((docId, lengths) -> namedFieldLengths.put(docId, byName(lengths)));

			return new IndexSnapshot(
					IndexSnapshot.FORMAT_VERSION,
					postingEntries,
					new TreeMap<>(documents),
					new TreeMap<>(documentLengths),
					namedFieldLengths,
					new TreeMap<>(documentFrequency),
					totalDocs,
					avgDocLength,
					byName(fieldWeights),
					createdAt == null ? null : createdAt.toString(),
					lastUpdated == null ? null : lastUpdated.toString());
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Replace all state with the snapshot's. The snapshot is fully decoded before the index is
	 * touched, so an invalid snapshot leaves the index unchanged.
	 *
	 * @throws IllegalArgumentException if the snapshot is incomplete or has an unknown format
	 */
	public void restore(IndexSnapshot snapshot) {
		Decoded decoded = decode(snapshot);

		lock.writeLock().lock();
		try {
			clearLocked();
			postings.putAll(decoded.postings);
			documents.putAll(snapshot.documents());
			documentLengths.putAll(snapshot.documentLengths());
			fieldLengths.putAll(decoded.fieldLengths);
			documentFrequency.putAll(snapshot.documentFrequency());
			fieldWeights = decoded.fieldWeights;
			totalDocs = snapshot.totalDocs();
			totalLength = decoded.totalLength;
			avgDocLength = snapshot.avgDocLength();
			createdAt = decoded.createdAt;
			lastUpdated = decoded.lastUpdated;
			generation.incrementAndGet();
		} finally {
			lock.writeLock().unlock();
		}
		logger.info("Restored index snapshot: {} documents, {} terms", snapshot.totalDocs(), decoded.postings.size());
	}

	private Decoded decode(IndexSnapshot snapshot) {
		if (snapshot == null) {
			throw new IllegalArgumentException("Snapshot is empty");
		}
		if (snapshot.formatVersion() != IndexSnapshot.FORMAT_VERSION) {
			throw new IllegalArgumentException("Unsupported snapshot format version: " + snapshot.formatVersion());
		}
		if (snapshot.postings() == null || snapshot.documents() == null || snapshot.documentLengths() == null
				|| snapshot.fieldLengths() == null || snapshot.documentFrequency() == null) {
			throw new IllegalArgumentException("Snapshot is missing index sections");
		}
		if (snapshot.totalDocs() != snapshot.documents().size()) {
			throw new IllegalArgumentException("Snapshot document count " + snapshot.totalDocs()
					+ " does not match its document store (" + snapshot.documents().size() + ")");
		}

		double totalLength = 0;
		for (Map.Entry<Integer, Double> entry : snapshot.documentLengths().entrySet()) {
			if (entry.getValue() == null || !snapshot.documents().containsKey(entry.getKey())) {
				throw new IllegalArgumentException("Invalid length entry for document " + entry.getKey());
			}
			totalLength += entry.getValue();
		}

		Map<String, Map<Integer, Posting>> decodedPostings = new HashMap<>();
		snapshot.postings().forEach((term, entries) -> {
			Map<Integer, Posting> list = new LinkedHashMap<>();
			for (IndexSnapshot.Entry entry : entries) {
				list.put(entry.docId(), new Posting(entry.docId(), entry.weight(), toFields(entry.fields())));
			}
			decodedPostings.put(term, list);
		});

		Map<Integer, Map<Field, Double>> decodedFieldLengths = new HashMap<>();
		snapshot.fieldLengths().forEach((docId, lengths) -> decodedFieldLengths.put(docId, byField(lengths)));

		Map<Field, Double> weights = new EnumMap<>(IndexingConfig.DEFAULT_FIELD_WEIGHTS);
		if (snapshot.fieldWeights() != null) {
			weights.putAll(byField(snapshot.fieldWeights()));
		}

		return new Decoded(decodedPostings, decodedFieldLengths, Collections.unmodifiableMap(weights), totalLength,
				parseInstant(snapshot.createdAt()), parseInstant(snapshot.lastUpdated()));
	}

	private static Set<Field> toFields(List<String> names) {
		if (names == null || names.isEmpty()) {
			throw new IllegalArgumentException("Snapshot posting without fields");
		}
		EnumSet<Field> fields = EnumSet.noneOf(Field.class);
		for (String name : names) {
			fields.add(Field.fromKey(name).orElseThrow(() -> new IllegalArgumentException("Unknown field: " + name)));
		}
		return fields;
	}

	private static Map<Field, Double> byField(Map<String, Double> named) {
		Map<Field, Double> byField = new EnumMap<>(Field.class);
		named.forEach((name, value) -> byField.put(
				Field.fromKey(name).orElseThrow(() -> new IllegalArgumentException("Unknown field: " + name)), value));
		return byField;
	}

	private static Map<String, Double> byName(Map<Field, Double> byField) {
		Map<String, Double> named = new LinkedHashMap<>();
		byField.forEach((field, value) -> named.put(field.key(), value));
		return named;
	}

	private static Instant parseInstant(String value) {
		if (value == null) {
			return null;
		}
		try {
			return Instant.parse(value);
		} catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid snapshot timestamp: " + value, e);
		}
	}

	private static Map<Field, Double> copyWeights(Map<Field, Double> weights) {
		Map<Field, Double> copy = new EnumMap<>(Field.class);
		copy.putAll(weights);
		return Collections.unmodifiableMap(copy);
	}

	private record Decoded(
			Map<String, Map<Integer, Posting>> postings,
			Map<Integer, Map<Field, Double>> fieldLengths,
			Map<Field, Double> fieldWeights,
			double totalLength,
			Instant createdAt,
			Instant lastUpdated
	) {}

	/** One document returned by {@link #searchTerm}. */
	public record TermHit(int docId, Publication publication, double score) {}
}
