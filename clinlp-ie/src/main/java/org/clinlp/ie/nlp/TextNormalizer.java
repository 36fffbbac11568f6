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

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Produces the normalized token form: lowercased and with accented characters
 * mapped to their ASCII base letter ({@code "Privé"} becomes {@code "prive"}).
 * Characters without an ASCII base are kept as they are.
 */
public class TextNormalizer {

	private final boolean lowercase;
	private final boolean mapNonAscii;

	public TextNormalizer() {
		this(true, true);
	}

	public TextNormalizer(boolean lowercase, boolean mapNonAscii) {
		this.lowercase = lowercase;
		this.mapNonAscii = mapNonAscii;
	}

	public String normalize(String text) {
		if (text == null) {
			return null;
		}
		String out = text;
		if (lowercase) {
			out = out.toLowerCase(Locale.ROOT);
		}
		if (mapNonAscii) {
			out = StringUtils.stripAccents(out);
		}
		return out;
	}

	public boolean isLowercase() {
		return lowercase;
	}

	public boolean isMapNonAscii() {
		return mapNonAscii;
	}
}
