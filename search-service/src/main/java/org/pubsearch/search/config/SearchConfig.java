package org.pubsearch.search.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Typed configuration for the query side of the engine.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. Every key has a
 * default; malformed values fail fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    Ranking ranking,
    Results results,
    Query query,
    PartialMatching partialMatching
) {
    /** Ranking algorithm selection and its parameters. */
    public record Ranking(
        String algorithm,
        double bm25K1,
        double bm25B,
        double hybridTfidfWeight,
        double hybridBm25Weight
    ) {}

    /** Result set sizes. */
    public record Results(int perPage, int limit, int suggestionsLimit) {}

    /** Query parsing limits and synonym expansion. */
    public record Query(int maxTerms, boolean synonymsEnabled, int maxSynonymsPerTerm) {}

    /** When prefix matching kicks in and how far it reaches. */
    public record PartialMatching(int maxCandidates, int maxQueryTerms, int maxMatchesPerTerm) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        return from(properties);
    }

    /**
     * Configuration with every key at its default.
     */
    public static SearchConfig defaults() {
        return from(new Properties());
    }

    public static SearchConfig from(Properties p) {
        return new SearchConfig(
            readRanking(p),
            readResults(p),
            readQuery(p),
            readPartialMatching(p)
        );
    }

    private static Ranking readRanking(Properties p) {
        return new Ranking(
            optionalString(p, "search.ranking.algorithm", "bm25"),
            optionalDouble(p, "search.bm25.k1", 1.5),
            optionalDouble(p, "search.bm25.b", 0.75),
            optionalDouble(p, "search.hybrid.tfidf.weight", 0.4),
            optionalDouble(p, "search.hybrid.bm25.weight", 0.6)
        );
    }

    private static Results readResults(Properties p) {
        return new Results(
            positiveInt(p, "search.results.per.page", 10),
            positiveInt(p, "search.results.limit", 1000),
            positiveInt(p, "search.suggestions.limit", 5)
        );
    }

    private static Query readQuery(Properties p) {
        return new Query(
            positiveInt(p, "search.query.max.terms", 15),
            optionalBoolean(p, "search.synonyms.enabled", false),
            positiveInt(p, "search.synonyms.max.per.term", 2)
        );
    }

    private static PartialMatching readPartialMatching(Properties p) {
        return new PartialMatching(
            positiveInt(p, "search.partial.max.candidates", 100),
            positiveInt(p, "search.partial.max.terms", 5),
            positiveInt(p, "search.partial.max.matches", 50)
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static String optionalString(Properties properties, String key, String defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value == null ? defaultValue : value;
    }

    private static int positiveInt(Properties properties, String key, int defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalStateException("Configuration '" + key + "' must be positive: " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static double optionalDouble(Properties properties, String key, double defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static boolean optionalBoolean(Properties properties, String key, boolean defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalStateException("Invalid boolean for configuration '" + key + "': '" + value + "'");
        };
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
