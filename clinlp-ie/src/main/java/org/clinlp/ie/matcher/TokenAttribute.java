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

import java.util.Locale;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.om.Token;

/**
 * The token attributes patterns can be matched on. Closed set, one accessor
 * per variant.
 */
public enum TokenAttribute {

	/** Literal token text, case sensitive. */
	TEXT {
		@Override
		public String valueOf(Token token) {
			return token.getText();
		}
	},

	/** Normalized form produced by the tokenizer's normalizer. */
	NORM {
		@Override
		public String valueOf(Token token) {
			return token.getNorm();
		}
	},

	/** Literal text, lowercased, no further normalization. */
	LOWER {
		@Override
		public String valueOf(Token token) {
			return token.getText().toLowerCase(Locale.ROOT);
		}
	};

	public abstract String valueOf(Token token);

	/**
	 * Parses attribute names as they appear in rule and term files. {@code ORTH}
	 * is accepted as an alias of {@code TEXT}.
	 *
	 * @throws ConfigurationException for unknown names
	 */
	public static TokenAttribute parse(String name) {
		if (name == null || name.isBlank()) {
			throw new ConfigurationException("Token attribute must not be blank.");
		}
		String n = name.trim().toUpperCase(Locale.ROOT);
		if ("ORTH".equals(n)) {
			return TEXT;
		}
		try {
			return TokenAttribute.valueOf(n);
		} catch (IllegalArgumentException ex) {
			throw new ConfigurationException("Unknown token attribute '" + name + "', expected one of TEXT, NORM, LOWER.");
		}
	}

	/** True if {@code name} is an attribute name understood by {@link #parse(String)}. */
	public static boolean isAttributeName(String name) {
		if (name == null) {
			return false;
		}
		String n = name.trim().toUpperCase(Locale.ROOT);
		return "ORTH".equals(n) || "TEXT".equals(n) || "NORM".equals(n) || "LOWER".equals(n);
	}
}
