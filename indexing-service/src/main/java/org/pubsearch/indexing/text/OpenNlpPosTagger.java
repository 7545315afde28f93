package org.pubsearch.indexing.text;

import opennlp.tools.postag.POSModel;
import opennlp.tools.postag.POSTaggerME;

import java.util.Arrays;
import java.util.List;

/**
 * Statistical tagger backed by an OpenNLP POS model.
 */
public class OpenNlpPosTagger implements PosTagger {
	private final POSTaggerME tagger;

	public OpenNlpPosTagger(POSModel model) {
		this.tagger = new POSTaggerME(model);
	}

	@Override
	public List<String> tag(List<String> tokens) {
		if (tokens.isEmpty()) {
			return List.of();
		}
		String[] tags;
		// POSTaggerME keeps per-call state
		synchronized (tagger) {
			tags = tagger.tag(tokens.toArray(new String[0]));
		}
		return Arrays.asList(tags);
	}
}
