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

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.TokenAttribute;

import lombok.Getter;

/**
 * Matcher-level settings a {@link Term} falls back to for every field it
 * leaves unset.
 */
@Getter
public final class TermDefaults {

	/** Literal text, no proximity, no fuzzy matching, not pseudo. */
	public static final TermDefaults DEFAULTS = new TermDefaults(TokenAttribute.TEXT, 0, 0, 0, false);

	private final TokenAttribute attr;
	private final int proximity;
	private final int fuzzy;
	private final int fuzzyMinLen;
	private final boolean pseudo;

	/**
	 * @throws ConfigurationException on negative values
	 */
	public TermDefaults(TokenAttribute attr, int proximity, int fuzzy, int fuzzyMinLen, boolean pseudo) {
		if (proximity < 0 || fuzzy < 0 || fuzzyMinLen < 0) {
			throw new ConfigurationException("Term defaults must not be negative (proximity=" + proximity + ", fuzzy="
					+ fuzzy + ", fuzzy_min_len=" + fuzzyMinLen + ").");
		}
		this.attr = (attr == null) ? TokenAttribute.TEXT : attr;
		this.proximity = proximity;
		this.fuzzy = fuzzy;
		this.fuzzyMinLen = fuzzyMinLen;
		this.pseudo = pseudo;
	}

	@Override
	public String toString() {
		return "TermDefaults[attr=" + attr + ", proximity=" + proximity + ", fuzzy=" + fuzzy + ", fuzzyMinLen="
				+ fuzzyMinLen + ", pseudo=" + pseudo + "]";
	}
}
