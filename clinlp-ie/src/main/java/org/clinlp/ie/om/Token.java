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

import java.util.Objects;

import lombok.Getter;

/**
 * Atomic unit of a {@link Document}: literal text, normalized form and the
 * character offsets into the document text. Immutable once created.
 */
@Getter
public final class Token {

	/** Position in the document's token sequence. */
	private final int index;

	/** Literal text as it appears in the document. */
	private final String text;

	/** Normalized form (lowercased, accents folded by default). */
	private final String norm;

	/** Inclusive start offset in the document text. */
	private final int startChar;

	/** Exclusive end offset in the document text. */
	private final int endChar;

	public Token(int index, String text, String norm, int startChar, int endChar) {
		this.index = index;
		this.text = Objects.requireNonNull(text, "token text must not be null");
		this.norm = (norm == null) ? text : norm;
		this.startChar = startChar;
		this.endChar = endChar;
	}

	public int length() {
		return text.length();
	}

	@Override
	public String toString() {
		return text;
	}
}
