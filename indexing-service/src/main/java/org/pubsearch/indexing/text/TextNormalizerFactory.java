package org.pubsearch.indexing.text;

import opennlp.tools.lemmatizer.DictionaryLemmatizer;
import opennlp.tools.postag.POSModel;
import opennlp.tools.tokenize.Tokenizer;
import opennlp.tools.tokenize.TokenizerME;
import opennlp.tools.tokenize.TokenizerModel;
import opennlp.tools.tokenize.WhitespaceTokenizer;
import org.pubsearch.indexing.config.IndexingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

/**
 * Builds a {@link TextNormalizer} from configuration.
 *
 * <p>Every linguistic resource is optional: a missing or unreadable model is logged and replaced by
 * the built-in fallback (whitespace tokenizer, suffix tagger, rule lemmatizer, minimal stopwords),
 * so a normalizer is always produced.</p>
 */
public final class TextNormalizerFactory {
	private static final Logger logger = LoggerFactory.getLogger(TextNormalizerFactory.class);

	public static final String DEFAULT_STOPWORDS_RESOURCE = "stopwords/english.txt";
	public static final String DEFAULT_SYNONYMS_RESOURCE = "synonyms/english.txt";

	private TextNormalizerFactory() {}

	public static TextNormalizer create(IndexingConfig.Text text) {
		Set<String> stopWords = StopWords.load(text.stopwordsResource());
		Tokenizer tokenizer = loadTokenizer(text.tokenizerModel());
		Lemmatizer lemmatizer = new Lemmatizer(loadTagger(text.posModel()), loadDictionary(text.lemmaDictionary()));
		SynonymDictionary synonyms = SynonymDictionary.fromResource(text.synonymsResource());
		NormalizerSettings settings = new NormalizerSettings(
				text.lemmatization(),
				text.stemIndexing(),
				text.stemQueries(),
				SynonymExpansion.DISABLED,
				NormalizerSettings.DEFAULT_MAX_SYNONYMS);

		logger.info("Text normalizer ready: tokenizer={}, lemmatization={}, stemming(index={}, query={})",
				tokenizer.getClass().getSimpleName(), settings.lemmatization(), settings.stemIndexing(), settings.stemQueries());
		return new TextNormalizer(stopWords, tokenizer, lemmatizer, synonyms, settings);
	}

	private static Tokenizer loadTokenizer(String modelPath) {
		if (modelPath == null) {
			return WhitespaceTokenizer.INSTANCE;
		}
		try (InputStream in = open(modelPath)) {
			return new TokenizerME(new TokenizerModel(in));
		} catch (IOException e) {
			logger.warn("Tokenizer model '{}' unavailable, falling back to whitespace tokenization: {}", modelPath, e.getMessage());
			return WhitespaceTokenizer.INSTANCE;
		}
	}

	private static PosTagger loadTagger(String modelPath) {
		if (modelPath == null) {
			return new SuffixPosTagger();
		}
		try (InputStream in = open(modelPath)) {
			return new OpenNlpPosTagger(new POSModel(in));
		} catch (IOException e) {
			logger.warn("POS model '{}' unavailable, falling back to suffix tagging: {}", modelPath, e.getMessage());
			return new SuffixPosTagger();
		}
	}

	private static DictionaryLemmatizer loadDictionary(String dictionaryPath) {
		if (dictionaryPath == null) {
			return null;
		}
		try (InputStream in = open(dictionaryPath)) {
			return new DictionaryLemmatizer(in);
		} catch (IOException e) {
			logger.warn("Lemma dictionary '{}' unavailable, using rule-based lemmas only: {}", dictionaryPath, e.getMessage());
			return null;
		}
	}

	private static InputStream open(String location) throws IOException {
		Path path = Paths.get(location);
		if (!Files.isRegularFile(path)) {
			throw new IOException("File not found: " + path);
		}
		return Files.newInputStream(path);
	}
}
