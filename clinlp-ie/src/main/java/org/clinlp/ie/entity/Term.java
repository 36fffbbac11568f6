package org.clinlp.ie.entity;

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
import java.util.List;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.PhrasePattern;
import org.clinlp.ie.matcher.StructuredPattern;
import org.clinlp.ie.matcher.TokenAttribute;
import org.clinlp.ie.matcher.TokenPattern;
import org.clinlp.ie.nlp.Tokenizer;
import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.Token;

import lombok.Data;

/**
 * A single way of writing a concept: either a phrase with optional matching
 * overrides, or a structured token pattern that is matched as written.
 *
 * <p>
 * Every override left {@code null} is taken from the {@link TermDefaults} of
 * the matcher the term is added to.
 * </p>
 */
@Data
public class Term {

	// --- What to match --------------------------------------------------------

	/** Literal phrase; null for structured terms. */
	private String phrase;

	/** Structured token pattern; null for phrase terms. */
	private StructuredPattern pattern;

	// --- Overrides (null = matcher default) -----------------------------------

	/** Token attribute the phrase is compared on. */
	private TokenAttribute attr;

	/** Max arbitrary tokens between consecutive phrase words. */
	private Integer proximity;

	/** Max Levenshtein edits per phrase word. */
	private Integer fuzzy;

	/** Phrase words shorter than this are compared exactly. */
	private Integer fuzzyMinLen;

	/** Matches of a pseudo term suppress matches of the same concept. */
	private Boolean pseudo;

	// --- Constructors ---------------------------------------------------------

	public Term() {
	}

	public Term(String phrase) {
		this.phrase = phrase;
	}

	public Term(String phrase, TokenAttribute attr, Integer proximity, Integer fuzzy, Integer fuzzyMinLen,
			Boolean pseudo) {
		this.phrase = phrase;
		this.attr = attr;
		this.proximity = proximity;
		this.fuzzy = fuzzy;
		this.fuzzyMinLen = fuzzyMinLen;
		this.pseudo = pseudo;
	}

	public static Term pseudo(String phrase) {
		Term t = new Term(phrase);
		t.setPseudo(Boolean.TRUE);
		return t;
	}

	public static Term structured(StructuredPattern pattern) {
		Term t = new Term();
		t.setPattern(pattern);
		return t;
	}

	// --- Resolution -----------------------------------------------------------

	public boolean isStructured() {
		return pattern != null;
	}

	/**
	 * Effective pseudo flag. Structured terms are always positive.
	 */
	public boolean isPseudo(TermDefaults defaults) {
		if (isStructured()) {
			return false;
		}
		return (pseudo != null) ? pseudo : defaults.isPseudo();
	}

	/**
	 * Builds the pattern for this term. The phrase is split with the same
	 * tokenizer that produces documents, and the chosen attribute of each phrase
	 * token becomes a pattern word.
	 *
	 * @throws ConfigurationException when the term has neither or both a phrase
	 *                                and a pattern, an empty phrase, or negative
	 *                                overrides
	 */
	public TokenPattern compile(TermDefaults defaults, Tokenizer tokenizer) {
		validate();
		if (isStructured()) {
			return pattern;
		}
		TokenAttribute a = (attr != null) ? attr : defaults.getAttr();
		int p = (proximity != null) ? proximity : defaults.getProximity();
		int f = (fuzzy != null) ? fuzzy : defaults.getFuzzy();
		int fml = (fuzzyMinLen != null) ? fuzzyMinLen : defaults.getFuzzyMinLen();

		Document phraseDoc = tokenizer.tokenize(phrase);
		List<String> words = new ArrayList<>(phraseDoc.size());
		for (Token t : phraseDoc.getTokens()) {
			words.add(a.valueOf(t));
		}
		if (words.isEmpty()) {
			throw new ConfigurationException("Term '" + phrase + "' contains no tokens.");
		}
		return new PhrasePattern(words, a, f, fml, p);
	}

	/**
	 * @throws ConfigurationException when the term definition is malformed
	 */
	public void validate() {
		if ((phrase == null) == (pattern == null)) {
			throw new ConfigurationException("A term needs exactly one of phrase or pattern: " + this);
		}
		if (phrase != null && phrase.isBlank()) {
			throw new ConfigurationException("Term phrase must not be blank.");
		}
		if ((proximity != null && proximity < 0) || (fuzzy != null && fuzzy < 0)
				|| (fuzzyMinLen != null && fuzzyMinLen < 0)) {
			throw new ConfigurationException("Term '" + phrase + "' has negative proximity/fuzzy/fuzzy_min_len.");
		}
	}
}
