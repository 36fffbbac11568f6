package org.clinlp.ie.om;

/*
 * This file is part of ClinLP.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * ClinLP is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ClinLP is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ClinLP.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class EntityTest {

	private static Entity entity() {
		Document doc = new Document("geen koorts", List.of(
				new Token(0, "geen", "geen", 0, 4),
				new Token(1, "koorts", "koorts", 5, 11)));
		return new Entity(doc.span(1, 2), "symptom");
	}

	@Test
	void adding_before_initialization_fails() {
		Entity e = entity();
		assertFalse(e.hasQualifiers());
		assertTrue(e.getQualifiers().isEmpty());
		assertThrows(IllegalStateException.class,
				() -> e.addQualifier(new Qualifier("Presence", "Absent", false, 0, null)));
	}

	@Test
	void qualifiers_are_keyed_by_class_name() {
		Entity e = entity();
		e.initializeQualifiers();
		e.addQualifier(new Qualifier("Presence", "Present", true, 2, null));
		e.addQualifier(new Qualifier("Temporality", "Current", true, 2, null));
		e.addQualifier(new Qualifier("Presence", "Absent", false, 1, null));

		assertEquals(2, e.getQualifiers().size());
		assertEquals("Absent", e.getQualifier("Presence").get().getValue());
		assertEquals(Set.of("Presence.Absent", "Temporality.Current"), e.getQualifierStrings());
		assertEquals(2, e.getQualifierMaps().size());
	}

	@Test
	void initializing_again_keeps_assignments() {
		Entity e = entity();
		e.initializeQualifiers();
		e.addQualifier(new Qualifier("Presence", "Absent", false, 1, null));
		e.initializeQualifiers();
		assertTrue(e.getQualifier("Presence").isPresent());
	}

	@Test
	void entity_exposes_span_positions_and_text() {
		Entity e = entity();
		assertEquals(1, e.getStart());
		assertEquals(2, e.getEnd());
		assertEquals("koorts", e.getText());
		assertEquals("symptom[1:2] koorts", e.toString());
	}
}
