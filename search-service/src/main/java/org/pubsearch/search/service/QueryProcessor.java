package org.pubsearch.search.service;

import org.pubsearch.core.model.Field;
import org.pubsearch.core.model.Publication;
import org.pubsearch.indexing.indexer.InvertedIndex;
import org.pubsearch.indexing.indexer.Posting;
import org.pubsearch.indexing.text.SynonymExpansion;
import org.pubsearch.indexing.text.TextNormalizer;
import org.pubsearch.search.config.SearchConfig;
import org.pubsearch.search.model.SearchResponse;
import org.pubsearch.search.model.SearchResult;
import org.pubsearch.search.ranking.Ranker;
import org.pubsearch.search.ranking.ScoringContext;
import org.pubsearch.search.ranking.TermPostings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a raw query string into ranked, paginated results over an {@link InvertedIndex}.
 *
 * <p>Each query runs inside the index read lock, so it sees either the index before a rebuild or
 * the one after it. Instances are safe to share between threads.</p>
 */
public class QueryProcessor {
    private static final Logger logger = LoggerFactory.getLogger(QueryProcessor.class);

    private final InvertedIndex index;
    private final Ranker ranker;
    private final TextNormalizer normalizer;
    private final SearchConfig config;
    private final PartialMatchCache partialMatches = new PartialMatchCache();

    public QueryProcessor(InvertedIndex index, Ranker ranker, TextNormalizer normalizer, SearchConfig config) {
        this.index = index;
        this.ranker = ranker;
        this.config = config;
        SearchConfig.Query query = config.query();
        this.normalizer = normalizer.withSynonymExpansion(
                query.synonymsEnabled() ? SynonymExpansion.ENABLED : SynonymExpansion.DISABLED,
                query.maxSynonymsPerTerm());
    }

    /**
     * Normalize a query and keep at most {@code search.query.max.terms} terms.
     */
    public ParsedQuery parse(String query) {
        if (query == null || query.isBlank()) {
            return ParsedQuery.of(List.of());
        }
        List<String> terms = normalizer.forQuery(query);
        int maxTerms = config.query().maxTerms();
        if (terms.size() > maxTerms) {
            logger.debug("Query has {} terms, keeping the first {}", terms.size(), maxTerms);
            terms = terms.subList(0, maxTerms);
        }
        return ParsedQuery.of(terms);
    }

    public SearchResponse search(String query, int page, int perPage, String sortBy) {
        SortOrder order = SortOrder.fromName(sortBy);
        int pageSize = perPage > 0 ? perPage : config.results().perPage();

        List<ScoredDocument> ranked = index.withReadLock(() -> {
            List<ScoredDocument> scored = scoreCandidates(parse(query));
            scored.sort(order.comparator());
            return scored;
        });

        int total = ranked.size();
        if (total == 0) {
            logger.debug("No results for query '{}'", query);
            return SearchResponse.empty(query, order.key(), pageSize);
        }
        int totalPages = total / pageSize + (total % pageSize == 0 ? 0 : 1);
        int currentPage = Math.max(1, Math.min(page, totalPages));
        int from = (currentPage - 1) * pageSize;
        int to = from + Math.min(pageSize, total - from);

        List<SearchResult> results = ranked.subList(from, to).stream()
                .map(ScoredDocument::toResult)
                .collect(Collectors.toList());
        logger.debug("Query '{}' matched {} documents, returning page {}/{}", query, total, currentPage, totalPages);
        return new SearchResponse(query, order.key(), results, total, currentPage, pageSize, totalPages);
    }

    /**
     * Best {@code limit} results by relevance without pagination. A non-positive limit means
     * {@code search.results.limit}.
     */
    public List<SearchResult> search(String query, int limit) {
        int resultLimit = limit > 0 ? limit : config.results().limit();
        Comparator<ScoredDocument> relevance = SortOrder.RELEVANCE.comparator();

        List<ScoredDocument> top = index.withReadLock(() -> {
            List<ScoredDocument> candidates = scoreCandidates(parse(query));
            // Head of the heap is the weakest result kept so far.
            PriorityQueue<ScoredDocument> heap =
                    new PriorityQueue<>(Math.min(resultLimit, candidates.size()) + 1, relevance.reversed());
            for (ScoredDocument candidate : candidates) {
                if (heap.size() < resultLimit) {
                    heap.offer(candidate);
                } else if (relevance.compare(candidate, heap.peek()) < 0) {
                    heap.poll();
                    heap.offer(candidate);
                }
            }
            List<ScoredDocument> selected = new ArrayList<>(heap);
            selected.sort(relevance);
            return selected;
        });

        return top.stream().map(ScoredDocument::toResult).collect(Collectors.toList());
    }

    private List<ScoredDocument> scoreCandidates(ParsedQuery parsed) {
        if (parsed.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> terms = parsed.distinctTerms();

        Map<String, TermPostings> postings = new LinkedHashMap<>();
        Map<Integer, Set<String>> matched = new LinkedHashMap<>();
        for (String term : terms) {
            TermPostings termPostings = TermPostings.lookup(index, term);
            postings.put(term, termPostings);
            for (Integer docId : termPostings.byDocument().keySet()) {
                matched.computeIfAbsent(docId, id -> new LinkedHashSet<>()).add(term);
            }
        }

        SearchConfig.PartialMatching partial = config.partialMatching();
        if (matched.size() < partial.maxCandidates() && terms.size() <= partial.maxQueryTerms()) {
            long generation = index.generation();
            for (String term : terms) {
                for (String indexedTerm : partialMatches.get(term, generation, this::findPartialMatches)) {
                    for (Posting posting : index.postingsOfIndexedTerm(indexedTerm)) {
                        matched.computeIfAbsent(posting.docId(), id -> new LinkedHashSet<>()).add(term);
                    }
                }
            }
        }

        ScoringContext context = new ScoringContext(terms, parsed.termFrequencies(), postings);
        List<ScoredDocument> scored = new ArrayList<>(matched.size());
        for (Map.Entry<Integer, Set<String>> entry : matched.entrySet()) {
            int docId = entry.getKey();
            Optional<Publication> publication = index.getDocument(docId);
            if (publication.isEmpty()) {
                continue;
            }
            double score = ranker.score(docId, context);
            if (terms.size() > 1) {
                double coverage = (double) entry.getValue().size() / terms.size();
                score *= 1.0 + coverage;
            }
            List<String> matchedTerms = terms.stream().filter(entry.getValue()::contains).collect(Collectors.toList());
            scored.add(new ScoredDocument(docId, publication.get(), score, matchedTerms));
        }
        return scored;
    }

    /**
     * Indexed terms equal to the query term, prefixes of it, or extensions of it; at most
     * {@code search.partial.max.matches} of them.
     */
    List<String> findPartialMatches(String term) {
        int limit = config.partialMatching().maxMatchesPerTerm();
        NavigableSet<String> vocabulary = index.vocabulary();
        Set<String> matches = new LinkedHashSet<>();

        if (vocabulary.contains(term)) {
            matches.add(term);
        }
        for (int length = term.length() - 1; length > 0 && matches.size() < limit; length--) {
            String prefix = term.substring(0, length);
            if (vocabulary.contains(prefix)) {
                matches.add(prefix);
            }
        }
        for (String extension : vocabulary.subSet(term, false, term + Character.MAX_VALUE, false)) {
            if (matches.size() >= limit) {
                break;
            }
            matches.add(extension);
        }
        return List.copyOf(matches);
    }

    /**
     * Documents whose postings for the query terms came from {@code field}, strongest weight first.
     * A document is listed once, under the first term that found it.
     */
    public List<SearchResult> searchByField(String query, Field field) {
        List<String> terms = parse(query).terms();
        if (terms.isEmpty()) {
            return List.of();
        }
        return index.withReadLock(() -> {
            Map<Integer, ScoredDocument> found = new LinkedHashMap<>();
            for (String term : terms) {
                for (Posting posting : index.getPostings(term)) {
                    if (!posting.hasField(field) || found.containsKey(posting.docId())) {
                        continue;
                    }
                    index.getDocument(posting.docId()).ifPresent(publication -> found.put(posting.docId(),
                            new ScoredDocument(posting.docId(), publication, posting.weight(), List.of(term))));
                }
            }
            return found.values().stream()
                    .sorted(Comparator.comparingDouble(ScoredDocument::score).reversed())
                    .map(ScoredDocument::toResult)
                    .collect(Collectors.toList());
        });
    }

    public List<SearchResult> searchByField(String query, String fieldName) {
        Optional<Field> field = Field.fromKey(fieldName);
        if (field.isEmpty()) {
            logger.warn("Unknown field '{}', nothing to search", fieldName);
            return List.of();
        }
        return searchByField(query, field.get());
    }

    public List<SearchResult> searchByAuthor(String authorName) {
        return searchByField(authorName, Field.AUTHORS);
    }

    /**
     * Publications whose year is exactly {@code year}, in document order. Results are unscored.
     */
    public List<SearchResult> searchByYear(String year) {
        if (year == null || year.isBlank()) {
            return List.of();
        }
        String wanted = year.trim();
        return index.withReadLock(() -> index.documents().entrySet().stream()
                .filter(entry -> entry.getValue().year().trim().equals(wanted))
                .map(entry -> SearchResult.fromPublication(entry.getKey(), entry.getValue(), 1.0, List.of()))
                .collect(Collectors.toList()));
    }

    public List<SearchResult> searchByYear(int year) {
        return searchByYear(String.valueOf(year));
    }

    public List<String> getSuggestions(String partialQuery) {
        return getSuggestions(partialQuery, config.results().suggestionsLimit());
    }

    /**
     * Indexed terms starting with or containing the input, shortest first.
     */
    public List<String> getSuggestions(String partialQuery, int limit) {
        if (partialQuery == null || partialQuery.isBlank() || limit <= 0) {
            return List.of();
        }
        String needle = partialQuery.trim().toLowerCase(Locale.ROOT);
        return index.withReadLock(() -> index.vocabulary().stream()
                .filter(term -> term.contains(needle))
                .sorted(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()))
                .limit(limit)
                .collect(Collectors.toList()));
    }

    /**
     * Wrap every case-insensitive occurrence of the terms in {@code <mark>} tags, keeping the
     * text's own casing. Longer terms win where terms overlap.
     */
    public String highlightMatches(String text, Collection<String> terms) {
        if (text == null || text.isEmpty() || terms == null || terms.isEmpty()) {
            return text;
        }
        String alternation = terms.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(term -> !term.isEmpty())
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        if (alternation.isEmpty()) {
            return text;
        }
        Pattern pattern = Pattern.compile(alternation, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return pattern.matcher(text).replaceAll(match -> "<mark>" + Matcher.quoteReplacement(match.group()) + "</mark>");
    }

    public SearchStats getStats() {
        return index.withReadLock(() -> new SearchStats(index.totalDocuments(), index.vocabularySize()));
    }

    public InvertedIndex index() {
        return index;
    }

    public record SearchStats(int totalDocuments, int vocabularySize) {}
}
