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

import java.util.Locale;

import org.clinlp.ie.conf.ConfigurationException;

/** When a pseudo match of a concept removes a positive match of that concept. */
public enum PseudoExclusion {

	/** Only when both cover exactly the same tokens. */
	EXACT {
		@Override
		public boolean excludes(int start, int end, int pseudoStart, int pseudoEnd) {
			return start == pseudoStart && end == pseudoEnd;
		}
	},

	/** Whenever the two share at least one token. */
	OVERLAP {
		@Override
		public boolean excludes(int start, int end, int pseudoStart, int pseudoEnd) {
			return start < pseudoEnd && pseudoStart < end;
		}
	};

	public abstract boolean excludes(int start, int end, int pseudoStart, int pseudoEnd);

	/**
	 * @throws ConfigurationException for anything but EXACT / OVERLAP
	 */
	public static PseudoExclusion parse(String name) {
		if (name == null || name.isBlank()) {
			return OVERLAP;
		}
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new ConfigurationException("Unknown pseudo exclusion mode '" + name + "', expected EXACT or OVERLAP.");
		}
	}
}
