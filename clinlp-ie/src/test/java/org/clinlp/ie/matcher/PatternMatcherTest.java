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

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.nlp.OpenNlpTokenizer;
import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.InputContractException;
import org.junit.jupiter.api.Test;

class PatternMatcherTest {

	private final OpenNlpTokenizer tokenizer = new OpenNlpTokenizer();

	private static String describe(List<PatternMatch<String>> matches) {
		return matches.stream().map(PatternMatch::toString).collect(Collectors.joining(" "));
	}

	@Test
	void overlapping_matches_are_all_reported_in_scan_order() {
		PatternMatcher<String> matcher = new PatternMatcher<>();
		matcher.add("long", new PhrasePattern(List.of("geen", "koorts"), TokenAttribute.NORM));
		matcher.add("short", new PhrasePattern(List.of("geen"), TokenAttribute.NORM));
		matcher.add("fever", new PhrasePattern(List.of("koorts"), TokenAttribute.TEXT, 1, 0, 0));

		Document doc = tokenizer.tokenize("Geen koorts");
		List<PatternMatch<String>> matches = matcher.findMatches(doc);

		assertEquals("short[0:1] long[0:2] fever[1:2]", describe(matches));
	}

	@Test
	void registration_order_breaks_ties() {
		PhrasePattern pattern = new PhrasePattern(List.of("pijn"), TokenAttribute.NORM);
		PatternMatcher<String> matcher = new PatternMatcher<>();
		matcher.add("b", pattern);
		matcher.add("a", pattern);

		List<PatternMatch<String>> matches = matcher.findMatches(tokenizer.tokenize("pijn"));
		assertEquals("b[0:1] a[0:1]", describe(matches));
		assertEquals(0, matches.get(0).getOrder());
		assertEquals(1, matches.get(1).getOrder());
	}

	@Test
	void indexed_and_scanned_patterns_are_combined() {
		PatternMatcher<String> matcher = new PatternMatcher<>();
		matcher.add("exact", new PhrasePattern(List.of("koorts"), TokenAttribute.NORM));
		matcher.add("structured", StructuredPattern.parse(List.of(Map.of("NORM", Map.of("REGEX", "^koo"))), "test"));

		List<PatternMatch<String>> matches = matcher.findMatches(tokenizer.tokenize("veel koorts"));
		assertEquals("exact[1:2] structured[1:2]", describe(matches));
	}

	@Test
	void span_search_keeps_document_offsets_and_stays_inside() {
		PatternMatcher<String> matcher = new PatternMatcher<>();
		matcher.add("phrase", new PhrasePattern(List.of("geen", "koorts"), TokenAttribute.NORM));
		matcher.add("word", new PhrasePattern(List.of("koorts"), TokenAttribute.NORM));

		Document doc = tokenizer.tokenize("wel koorts geen koorts");
		List<PatternMatch<String>> inside = matcher.findMatches(doc.span(1, 3));
		assertEquals("word[1:2]", describe(inside));

		List<PatternMatch<String>> all = matcher.findMatches(doc, 0, doc.size());
		assertEquals("word[1:2] phrase[2:4] word[3:4]", describe(all));
	}

	@Test
	void empty_matcher_or_empty_range_finds_nothing() {
		PatternMatcher<String> matcher = new PatternMatcher<>();
		Document doc = tokenizer.tokenize("geen koorts");
		assertTrue(matcher.isEmpty());
		assertTrue(matcher.findMatches(doc).isEmpty());

		matcher.add("word", new PhrasePattern(List.of("koorts"), TokenAttribute.NORM));
		assertEquals(1, matcher.size());
		assertTrue(matcher.findMatches(doc, 1, 1).isEmpty());
	}

	@Test
	void invalid_range_and_missing_pattern_are_rejected() {
		PatternMatcher<String> matcher = new PatternMatcher<>();
		Document doc = tokenizer.tokenize("geen koorts");
		assertThrows(InputContractException.class, () -> matcher.findMatches(doc, 0, 3));
		assertThrows(InputContractException.class, () -> matcher.findMatches(doc, 2, 1));
		assertThrows(ConfigurationException.class, () -> matcher.add("x", null));
	}
}
