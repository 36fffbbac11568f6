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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw text plus its token sequence. The token list is fixed at construction;
 * sentences and entities are attached while a pipeline runs and are owned by
 * this document for the duration of that run.
 */
public class Document {

	private final String text;
	private final List<Token> tokens;

	private List<Span> sentences = Collections.emptyList();
	private final List<Entity> entities = new ArrayList<>();

	/**
	 * @throws InputContractException when token indices are out of sequence or
	 *                                character offsets are non-monotonic / out
	 *                                of the text
	 */
	public Document(String text, List<Token> tokens) {
		this.text = Objects.requireNonNull(text, "text must not be null");
		this.tokens = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(tokens, "tokens must not be null")));
		validateTokens();
	}

	private void validateTokens() {
		int previousEnd = 0;
		for (int i = 0; i < tokens.size(); i++) {
			Token t = tokens.get(i);
			if (t.getIndex() != i) {
				throw new InputContractException("Token '" + t.getText() + "' has index " + t.getIndex() + ", expected " + i);
			}
			if (t.getStartChar() < previousEnd || t.getEndChar() < t.getStartChar() || t.getEndChar() > text.length()) {
				throw new InputContractException("Token " + i + " '" + t.getText() + "' has non-monotonic offsets ["
						+ t.getStartChar() + ", " + t.getEndChar() + ")");
			}
			previousEnd = t.getEndChar();
		}
	}

	public String getText() {
		return text;
	}

	public List<Token> getTokens() {
		return tokens;
	}

	public Token getToken(int index) {
		return tokens.get(index);
	}

	public int size() {
		return tokens.size();
	}

	public Span span(int start, int end) {
		return new Span(this, start, end);
	}

	// ---- Sentences ---------------------------------------------------------

	public List<Span> getSentences() {
		return sentences;
	}

	public boolean hasSentences() {
		return !sentences.isEmpty();
	}

	/**
	 * @throws InputContractException when a sentence belongs to another document
	 *                                or sentences overlap / are out of order
	 */
	public void setSentences(List<Span> sentences) {
		List<Span> copy = new ArrayList<>(sentences);
		int previousEnd = 0;
		for (Span s : copy) {
			if (s.getDocument() != this) {
				throw new InputContractException("Sentence '" + s.getText() + "' belongs to another document");
			}
			if (s.getStart() < previousEnd) {
				throw new InputContractException("Sentence [" + s.getStart() + ", " + s.getEnd() + ") overlaps its predecessor");
			}
			previousEnd = s.getEnd();
		}
		this.sentences = Collections.unmodifiableList(copy);
	}

	// ---- Entities ----------------------------------------------------------

	public List<Entity> getEntities() {
		return Collections.unmodifiableList(entities);
	}

	public void addEntity(Entity entity) {
		if (entity.getSpan().getDocument() != this) {
			throw new InputContractException("Entity " + entity + " belongs to another document");
		}
		entities.add(entity);
	}

	public void setEntities(List<Entity> newEntities) {
		entities.clear();
		for (Entity e : newEntities) {
			addEntity(e);
		}
	}

	@Override
	public String toString() {
		return text;
	}
}
