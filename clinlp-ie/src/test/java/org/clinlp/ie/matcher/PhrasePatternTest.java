package org.clinlp.ie.matcher;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.nlp.OpenNlpTokenizer;
import org.clinlp.ie.om.Document;
import org.junit.jupiter.api.Test;

class PhrasePatternTest {

	private final OpenNlpTokenizer tokenizer = new OpenNlpTokenizer();

	private List<Integer> ends(PhrasePattern p, String text) {
		Document doc = tokenizer.tokenize(text);
		return p.matchEnds(doc.getTokens(), 0, doc.size());
	}

	@Test
	void literal_phrase_matches_exact_tokens_only() {
		PhrasePattern p = new PhrasePattern(List.of("prematuur", "ademhalingspatroon"), TokenAttribute.TEXT);
		assertTrue(p.isExact());
		assertEquals(List.of(2), ends(p, "prematuur ademhalingspatroon"));
		assertEquals(Collections.emptyList(), ends(p, "prematuur"));
		assertEquals(Collections.emptyList(), ends(p, "Prematuur ademhalingspatroon"));
	}

	@Test
	void norm_attribute_ignores_case_and_accents() {
		PhrasePattern p = new PhrasePattern(List.of("ecg"), TokenAttribute.NORM);
		assertEquals(List.of(1), ends(p, "ECG"));
		PhrasePattern accent = new PhrasePattern(List.of("ruptuur", "of", "cafe"), TokenAttribute.NORM);
		assertEquals(List.of(3), ends(accent, "Ruptuur of café"));
	}

	@Test
	void fuzzy_one_edit_accepts_substitution_but_not_transposition() {
		PhrasePattern p = new PhrasePattern(List.of("diabetes"), TokenAttribute.TEXT, 1, 0, 0);
		assertEquals(List.of(1), ends(p, "diabetis"));
		assertEquals(Collections.emptyList(), ends(p, "diabetse"));
	}

	@Test
	void fuzzy_is_disabled_for_short_words() {
		PhrasePattern p = new PhrasePattern(List.of("pijn", "koorts"), TokenAttribute.TEXT, 1, 5, 0);
		// "koorts" is long enough for fuzzy, "pijn" is not
		assertEquals(List.of(2), ends(p, "pijn koorta"));
		assertEquals(Collections.emptyList(), ends(p, "pijm koorts"));
	}

	@Test
	void proximity_skips_up_to_p_tokens() {
		PhrasePattern p = new PhrasePattern(List.of("hoofd", "pijn"), TokenAttribute.TEXT, 0, 0, 2);
		assertEquals(List.of(2), ends(p, "hoofd pijn"));
		assertEquals(List.of(4), ends(p, "hoofd erg veel pijn"));
		assertEquals(Collections.emptyList(), ends(p, "hoofd erg veel heel pijn"));
	}

	@Test
	void proximity_reports_every_distinct_end() {
		PhrasePattern p = new PhrasePattern(List.of("pijn", "rug"), TokenAttribute.TEXT, 0, 0, 1);
		assertEquals(List.of(2, 3), ends(p, "pijn rug rug"));
	}

	@Test
	void proximity_finds_alignment_greedy_would_miss() {
		// binding "b" to position 1 leaves "c" out of reach
		PhrasePattern p = new PhrasePattern(List.of("a", "b", "c"), TokenAttribute.TEXT, 0, 0, 1);
		assertEquals(List.of(5), ends(p, "a b b x c"));
	}

	@Test
	void matches_never_pass_the_limit() {
		PhrasePattern p = new PhrasePattern(List.of("geen", "hoesten"), TokenAttribute.TEXT);
		Document doc = tokenizer.tokenize("geen hoesten");
		assertEquals(Collections.emptyList(), p.matchEnds(doc.getTokens(), 0, 1));
		assertEquals(Collections.emptyList(), p.matchEnds(doc.getTokens(), 1, 2));
	}

	@Test
	void max_span_is_words_plus_gaps() {
		PhrasePattern p = new PhrasePattern(List.of("a", "b", "c"), TokenAttribute.TEXT, 0, 0, 2);
		assertEquals(7, p.maxSpan());
	}

	@Test
	void empty_or_negative_configuration_is_rejected() {
		assertThrows(ConfigurationException.class, () -> new PhrasePattern(List.of(), TokenAttribute.TEXT));
		assertThrows(ConfigurationException.class,
				() -> new PhrasePattern(List.of("a"), TokenAttribute.TEXT, -1, 0, 0));
		assertThrows(ConfigurationException.class,
				() -> new PhrasePattern(List.of("a"), TokenAttribute.TEXT, 0, 0, -2));
	}
}
