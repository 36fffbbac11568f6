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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.text.similarity.LevenshteinDistance;
import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.om.Token;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Multi-token phrase matched on one {@link TokenAttribute}.
 *
 * <ul>
 * <li>Literal when {@code fuzzy == 0} and {@code proximity == 0}.</li>
 * <li>Fuzzy: a phrase word of at least {@code fuzzyMinLen} characters matches
 * any token within {@code fuzzy} Levenshtein edits.</li>
 * <li>Proximity: up to {@code proximity} arbitrary tokens may be skipped
 * between consecutive phrase words.</li>
 * </ul>
 */
@Getter
public final class PhrasePattern implements TokenPattern {

	private final List<String> words;
	private final TokenAttribute attr;
	private final int fuzzy;
	private final int fuzzyMinLen;
	private final int proximity;

	// per word: fuzzy comparison enabled
	private final boolean[] fuzzyWord;

	// bounded to fuzzy edits; null for non-fuzzy phrases
	@Getter(AccessLevel.NONE)
	private final LevenshteinDistance editDistance;

	public PhrasePattern(List<String> words, TokenAttribute attr) {
		this(words, attr, 0, 0, 0);
	}

	/**
	 * @throws ConfigurationException on an empty phrase or negative settings
	 */
	public PhrasePattern(List<String> words, TokenAttribute attr, int fuzzy, int fuzzyMinLen, int proximity) {
		if (words == null || words.isEmpty()) {
			throw new ConfigurationException("A phrase pattern must contain at least one token.");
		}
		if (fuzzy < 0 || fuzzyMinLen < 0 || proximity < 0) {
			throw new ConfigurationException("Phrase pattern " + words + " has negative fuzzy/fuzzy_min_len/proximity.");
		}
		this.words = Collections.unmodifiableList(new ArrayList<>(words));
		this.attr = (attr == null) ? TokenAttribute.TEXT : attr;
		this.fuzzy = fuzzy;
		this.fuzzyMinLen = fuzzyMinLen;
		this.proximity = proximity;

		this.editDistance = (fuzzy > 0) ? new LevenshteinDistance(fuzzy) : null;
		this.fuzzyWord = new boolean[words.size()];
		for (int i = 0; i < words.size(); i++) {
			fuzzyWord[i] = fuzzy > 0 && words.get(i).length() >= fuzzyMinLen;
		}
	}

	/** No fuzzy words and no gaps; eligible for first-word indexing. */
	public boolean isExact() {
		return proximity == 0 && fuzzy == 0;
	}

	/** Upper bound of tokens a match can cover: N + P*(N-1). */
	public int maxSpan() {
		return words.size() + proximity * (words.size() - 1);
	}

	@Override
	public List<Integer> matchEnds(List<Token> tokens, int start, int limit) {
		if (start >= limit || !wordMatches(0, tokens.get(start))) {
			return Collections.emptyList();
		}
		if (words.size() == 1) {
			return List.of(start + 1);
		}
		Set<Integer> ends = new TreeSet<>();
		align(tokens, 1, start, limit, ends, new HashSet<>());
		return new ArrayList<>(ends);
	}

	/**
	 * Tries every position for {@code words[wordIdx]} within {@code proximity + 1}
	 * tokens after {@code prevPos}. Explored (word, position) pairs are skipped,
	 * so work is bounded by words * (proximity + 1) per start.
	 */
	private void align(List<Token> tokens, int wordIdx, int prevPos, int limit, Set<Integer> ends, Set<Long> seen) {
		if (wordIdx == words.size()) {
			ends.add(prevPos + 1);
			return;
		}
		int last = Math.min(limit - 1, prevPos + 1 + proximity);
		for (int pos = prevPos + 1; pos <= last; pos++) {
			long state = ((long) wordIdx << 32) | pos;
			if (!seen.add(state)) {
				continue;
			}
			if (wordMatches(wordIdx, tokens.get(pos))) {
				align(tokens, wordIdx + 1, pos, limit, ends, seen);
			}
		}
	}

	private boolean wordMatches(int wordIdx, Token token) {
		String value = attr.valueOf(token);
		String word = words.get(wordIdx);
		if (fuzzyWord[wordIdx]) {
			return editDistance.apply(value, word) >= 0;
		}
		return word.equals(value);
	}

	@Override
	public String toString() {
		return String.join(" ", words) + " (" + attr + ", fuzzy=" + fuzzy + ", proximity=" + proximity + ")";
	}
}
