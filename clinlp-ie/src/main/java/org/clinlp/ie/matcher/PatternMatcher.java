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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.InputContractException;
import org.clinlp.ie.om.Span;
import org.clinlp.ie.om.Token;

/**
 * Finds every occurrence of a set of keyed {@link TokenPattern}s in a token
 * range. Overlapping matches are all kept.
 *
 * <p>
 * Exact phrases are indexed by their first word per {@link TokenAttribute} so
 * that only candidates sharing the token's value are tried; fuzzy, proximity
 * and structured patterns are tried at every position.
 * </p>
 *
 * Build the matcher once, then share it: {@code findMatches} does not modify
 * any state.
 *
 * @param <K> identity attached to each pattern (a rule, a term, ...)
 */
public class PatternMatcher<K> {

	private static final class Entry<K> {
		final K key;
		final TokenPattern pattern;
		final int order;

		Entry(K key, TokenPattern pattern, int order) {
			this.key = key;
			this.pattern = pattern;
			this.order = order;
		}
	}

	private final List<Entry<K>> entries = new ArrayList<>();

	// attr -> first word -> exact phrases starting with it
	private final Map<TokenAttribute, Map<String, List<Entry<K>>>> firstWordIndex = new EnumMap<>(TokenAttribute.class);

	// everything that cannot be looked up by first word
	private final List<Entry<K>> scanned = new ArrayList<>();

	/**
	 * Registers a pattern under {@code key}. Registration order breaks ties in
	 * {@link PatternMatch#SCAN_ORDER}.
	 *
	 * @throws ConfigurationException when the pattern is missing
	 */
	public void add(K key, TokenPattern pattern) {
		if (pattern == null) {
			throw new ConfigurationException("Cannot register an empty pattern for '" + key + "'.");
		}
		Entry<K> e = new Entry<>(key, pattern, entries.size());
		entries.add(e);

		if (pattern instanceof PhrasePattern && ((PhrasePattern) pattern).isExact()) {
			PhrasePattern phrase = (PhrasePattern) pattern;
			firstWordIndex.computeIfAbsent(phrase.getAttr(), a -> new HashMap<>())
					.computeIfAbsent(phrase.getWords().get(0), w -> new ArrayList<>())
					.add(e);
		} else {
			scanned.add(e);
		}
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/** Matches over the whole document. */
	public List<PatternMatch<K>> findMatches(Document document) {
		return findMatches(document, 0, document.size());
	}

	/** Matches restricted to {@code span}; offsets stay document-relative. */
	public List<PatternMatch<K>> findMatches(Span span) {
		return findMatches(span.getDocument(), span.getStart(), span.getEnd());
	}

	/**
	 * All matches lying completely inside token range {@code [from, to)}, with
	 * document-relative offsets, sorted by {@link PatternMatch#SCAN_ORDER}.
	 *
	 * @throws InputContractException when the range is outside the document
	 */
	public List<PatternMatch<K>> findMatches(Document document, int from, int to) {
		Objects.requireNonNull(document, "document must not be null");
		if (from < 0 || to > document.size() || from > to) {
			throw new InputContractException(
					"Range [" + from + ", " + to + ") outside document bounds [0, " + document.size() + ")");
		}
		if (entries.isEmpty() || from == to) {
			return Collections.emptyList();
		}

		List<Token> tokens = document.getTokens();
		List<PatternMatch<K>> matches = new ArrayList<>();

		for (int pos = from; pos < to; pos++) {
			Token token = tokens.get(pos);

			for (Map.Entry<TokenAttribute, Map<String, List<Entry<K>>>> byAttr : firstWordIndex.entrySet()) {
				List<Entry<K>> candidates = byAttr.getValue().get(byAttr.getKey().valueOf(token));
				if (candidates != null) {
					collect(candidates, tokens, pos, to, matches);
				}
			}
			collect(scanned, tokens, pos, to, matches);
		}

		matches.sort(PatternMatch.SCAN_ORDER);
		return matches;
	}

	private void collect(List<Entry<K>> candidates, List<Token> tokens, int pos, int limit,
			List<PatternMatch<K>> out) {
		for (Entry<K> e : candidates) {
			for (int end : e.pattern.matchEnds(tokens, pos, limit)) {
				out.add(new PatternMatch<>(e.key, pos, end, e.order));
			}
		}
	}
}
