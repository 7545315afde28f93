package org.pubsearch.indexing.text;

import java.util.List;

public interface PosTagger {
	/**
	 * Tag each token; the returned list has the same size and order as {@code tokens}.
	 */
	List<String> tag(List<String> tokens);
}
