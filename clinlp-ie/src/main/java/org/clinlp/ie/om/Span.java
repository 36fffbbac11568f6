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
 * Half-open token range {@code [start, end)} over a {@link Document}. Value
 * object: two spans are equal when they cover the same range of the same
 * document instance.
 */
@Getter
public class Span {

	private final Document document;
	private final int start;
	private final int end;
	private final String text;

	public Span(Document document, int start, int end) {
		this.document = Objects.requireNonNull(document, "document must not be null");
		if (start < 0 || end > document.size() || start >= end) {
			throw new InputContractException(
					"Span [" + start + ", " + end + ") is empty or outside document bounds [0, " + document.size() + ")");
		}
		this.start = start;
		this.end = end;
		this.text = document.getText().substring(document.getToken(start).getStartChar(),
				document.getToken(end - 1).getEndChar());
	}

	/** Number of tokens covered. */
	public int length() {
		return end - start;
	}

	public boolean contains(Span other) {
		return start <= other.getStart() && other.getEnd() <= end;
	}

	public boolean overlaps(int otherStart, int otherEnd) {
		return start < otherEnd && otherStart < end;
	}

	public boolean overlaps(Span other) {
		return overlaps(other.getStart(), other.getEnd());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Span)) {
			return false;
		}
		Span other = (Span) o;
		return document == other.document && start == other.start && end == other.end;
	}

	@Override
	public int hashCode() {
		return Objects.hash(System.identityHashCode(document), start, end);
	}

	@Override
	public String toString() {
		return text;
	}
}
