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

import java.util.Comparator;

import lombok.Getter;

/**
 * One occurrence of a registered pattern: the pattern's key and the token
 * range {@code [start, end)} it covers.
 */
@Getter
public final class PatternMatch<K> {

	/** Scan order: start, then end, then registration order of the pattern. */
	public static final Comparator<PatternMatch<?>> SCAN_ORDER = Comparator
			.comparingInt((PatternMatch<?> m) -> m.getStart())
			.thenComparingInt(PatternMatch::getEnd)
			.thenComparingInt(PatternMatch::getOrder);

	private final K key;
	private final int start;
	private final int end;

	/** Registration index of the matched pattern. */
	private final int order;

	PatternMatch(K key, int start, int end, int order) {
		this.key = key;
		this.start = start;
		this.end = end;
		this.order = order;
	}

	@Override
	public String toString() {
		return key + "[" + start + ":" + end + "]";
	}
}
