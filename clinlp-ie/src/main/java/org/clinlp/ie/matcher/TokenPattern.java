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

import java.util.List;

import org.clinlp.ie.om.Token;

/**
 * A pattern over a token sequence, registered with a {@link PatternMatcher}.
 * Implementations are immutable and safe to share between threads.
 */
public interface TokenPattern {

	/**
	 * All distinct exclusive end positions of matches that start at
	 * {@code start} and end no later than {@code limit}, in ascending order.
	 * Empty when nothing matches at {@code start}.
	 */
	List<Integer> matchEnds(List<Token> tokens, int start, int limit);
}
