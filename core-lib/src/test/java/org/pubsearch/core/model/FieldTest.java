package org.pubsearch.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FieldTest {

	@Test
	public void testTextOfJoinsListFields() {
		Publication publication = Publication.of("Graph Mining", List.of("Jane Doe", "Wei Chen"), "2021",
				"We mine graphs.", List.of("graphs", "mining"));

		assertEquals("Graph Mining", Field.TITLE.textOf(publication));
		assertEquals("Jane Doe Wei Chen", Field.AUTHORS.textOf(publication));
		assertEquals("2021", Field.YEAR.textOf(publication));
		assertEquals("We mine graphs.", Field.ABSTRACT.textOf(publication));
		assertEquals("graphs mining", Field.KEYWORDS.textOf(publication));
	}

	@Test
	public void testFromKey() {
		assertEquals(Optional.of(Field.AUTHORS), Field.fromKey("authors"));
		assertEquals(Optional.of(Field.ABSTRACT), Field.fromKey(" Abstract "));
		assertTrue(Field.fromKey("venue").isEmpty());
		assertTrue(Field.fromKey(null).isEmpty());
	}
}
