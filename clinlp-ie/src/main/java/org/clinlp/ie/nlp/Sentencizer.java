package org.clinlp.ie.nlp;

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
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.Span;
import org.clinlp.ie.om.Token;
import org.clinlp.ie.processing.PipelineStage;

/**
 * Rule-based sentence splitter for clinical notes.
 *
 * <p>
 * A token from {@code sentEndChars} (or, when enabled, a line break between
 * two tokens) may end a sentence. The next sentence then starts at the first
 * following token that is alphanumeric, starts with {@code [}, or is one of
 * {@code sentStartPunct}. Sentences partition the document.
 * </p>
 */
public class Sentencizer implements PipelineStage {

	public static final List<String> DEFAULT_SENT_END_CHARS = List.of(".", "!", "?");
	public static final List<String> DEFAULT_SENT_START_PUNCT = List.of("-", "*", "[", "(");

	private final Set<String> sentEndChars;
	private final Set<String> sentStartPunct;
	private final boolean splitOnNewline;

	public Sentencizer() {
		this(DEFAULT_SENT_END_CHARS, DEFAULT_SENT_START_PUNCT, true);
	}

	public Sentencizer(Collection<String> sentEndChars, Collection<String> sentStartPunct, boolean splitOnNewline) {
		this.sentEndChars = new HashSet<>(sentEndChars);
		this.sentStartPunct = new HashSet<>(sentStartPunct);
		this.splitOnNewline = splitOnNewline;
	}

	@Override
	public Document process(Document document) {
		document.setSentences(split(document));
		return document;
	}

	/** Sentence spans for the document, in order; empty for an empty document. */
	public List<Span> split(Document document) {
		List<Token> tokens = document.getTokens();
		List<Span> sentences = new ArrayList<>();
		if (tokens.isEmpty()) {
			return sentences;
		}

		int sentStart = 0;
		boolean seenEnd = false;
		for (int i = 1; i < tokens.size(); i++) {
			Token prev = tokens.get(i - 1);
			Token tok = tokens.get(i);
			if (canEnd(prev) || (splitOnNewline && lineBreakBetween(document.getText(), prev, tok))) {
				seenEnd = true;
			}
			if (seenEnd && canStart(tok)) {
				sentences.add(document.span(sentStart, i));
				sentStart = i;
				seenEnd = false;
			}
		}
		sentences.add(document.span(sentStart, tokens.size()));
		return sentences;
	}

	private boolean canStart(Token token) {
		String t = token.getText();
		char first = t.charAt(0);
		return Character.isLetterOrDigit(first) || first == '[' || sentStartPunct.contains(t);
	}

	private boolean canEnd(Token token) {
		return sentEndChars.contains(token.getText());
	}

	private static boolean lineBreakBetween(String text, Token prev, Token next) {
		for (int c = prev.getEndChar(); c < next.getStartChar(); c++) {
			char ch = text.charAt(c);
			if (ch == '\n' || ch == '\r') {
				return true;
			}
		}
		return false;
	}
}
