package org.pubsearch.indexing.config;

import org.pubsearch.core.model.Field;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Typed configuration for the indexing side of the engine.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. Some convenience normalization
 * is applied:
 * <ul>
 *   <li>If {@code DATA_DIR} is set, {@code publications.path} and {@code index.snapshot.path} are resolved
 *   inside it.</li>
 * </ul>
 * Missing required keys fail fast with {@link IllegalStateException}; optional keys fall back to the
 * documented defaults.</p>
 */
public record IndexingConfig(
    Storage storage,
    Map<Field, Double> fieldWeights,
    Text text
) {
    /** Default field weights: title 3.0, authors 2.5, keywords 2.0, year 1.5, abstract 1.0. */
    public static final Map<Field, Double> DEFAULT_FIELD_WEIGHTS = Collections.unmodifiableMap(new EnumMap<>(Map.of(
        Field.TITLE, 3.0,
        Field.AUTHORS, 2.5,
        Field.KEYWORDS, 2.0,
        Field.YEAR, 1.5,
        Field.ABSTRACT, 1.0
    )));

    /** Input publications file and index snapshot location. */
    public record Storage(String publicationsPath, String snapshotPath) {}

    /** Text normalization switches and linguistic resource locations. */
    public record Text(
        boolean lemmatization,
        boolean stemIndexing,
        boolean stemQueries,
        String stopwordsResource,
        String synonymsResource,
        String tokenizerModel,
        String posModel,
        String lemmaDictionary
    ) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizeDataDir(properties);
        return from(properties);
    }

    public static IndexingConfig from(Properties p) {
        return new IndexingConfig(
            readStorage(p),
            readFieldWeights(p),
            readText(p)
        );
    }

    private static Storage readStorage(Properties p) {
        return new Storage(requireString(p, "publications.path"), requireString(p, "index.snapshot.path"));
    }

    private static Map<Field, Double> readFieldWeights(Properties p) {
        Map<Field, Double> weights = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            double weight = optionalDouble(p, "index.field.weight." + field.key(), DEFAULT_FIELD_WEIGHTS.get(field));
            if (weight < 0) {
                throw new IllegalStateException("Field weight must not be negative: " + field.key() + "=" + weight);
            }
            weights.put(field, weight);
        }
        return Collections.unmodifiableMap(weights);
    }

    private static Text readText(Properties p) {
        return new Text(
            optionalBoolean(p, "text.lemmatization.enabled", true),
            optionalBoolean(p, "text.stemming.index.enabled", true),
            optionalBoolean(p, "text.stemming.query.enabled", false),
            optionalString(p, "text.stopwords.resource", "stopwords/english.txt"),
            optionalString(p, "text.synonyms.resource", "synonyms/english.txt"),
            trimToNull(p.getProperty("text.opennlp.tokenizer.model")),
            trimToNull(p.getProperty("text.opennlp.pos.model")),
            trimToNull(p.getProperty("text.opennlp.lemma.dictionary"))
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = IndexingConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
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

    private static void normalizeDataDir(Properties properties) {
        String dataDir = trimToNull(properties.getProperty("DATA_DIR"));
        if (dataDir != null) {
            properties.setProperty("publications.path", Paths.get(dataDir, "publications.json").toString());
            properties.setProperty("index.snapshot.path", Paths.get(dataDir, "index.json").toString());
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static String optionalString(Properties properties, String key, String defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value == null ? defaultValue : value;
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
