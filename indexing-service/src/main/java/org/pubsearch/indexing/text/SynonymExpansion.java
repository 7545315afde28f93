package org.pubsearch.indexing.text;

public enum SynonymExpansion {
	DISABLED,
	ENABLED
}
