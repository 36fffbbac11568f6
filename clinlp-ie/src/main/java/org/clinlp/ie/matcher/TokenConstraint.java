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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.text.similarity.LevenshteinDistance;
import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.om.Token;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * One position of a {@link StructuredPattern}: a conjunction of attribute
 * predicates plus a quantifier. A constraint without predicates accepts any
 * token.
 */
@Getter
public final class TokenConstraint {

	/** How often the constraint may match in a row. */
	public enum Quantifier {
		ONE("1"), OPTIONAL("?"), ZERO_OR_MORE("*"), ONE_OR_MORE("+"), NEGATE("!");

		private final String symbol;

		Quantifier(String symbol) {
			this.symbol = symbol;
		}

		public String symbol() {
			return symbol;
		}

		/**
		 * @throws ConfigurationException for unknown operators
		 */
		public static Quantifier parse(String op) {
			if (op == null) {
				return ONE;
			}
			for (Quantifier q : values()) {
				if (q.symbol.equals(op.trim())) {
					return q;
				}
			}
			throw new ConfigurationException("Unknown pattern operator '" + op + "', expected one of ! ? + * 1.");
		}
	}

	private final List<Predicate> predicates;
	private final Quantifier quantifier;

	public TokenConstraint(List<Predicate> predicates, Quantifier quantifier) {
		this.predicates = (predicates == null) ? Collections.emptyList()
				: Collections.unmodifiableList(new ArrayList<>(predicates));
		this.quantifier = (quantifier == null) ? Quantifier.ONE : quantifier;
	}

	/** Any single token. */
	public static TokenConstraint any(Quantifier quantifier) {
		return new TokenConstraint(Collections.emptyList(), quantifier);
	}

	public static TokenConstraint of(Quantifier quantifier, Predicate... predicates) {
		return new TokenConstraint(List.of(predicates), quantifier);
	}

	/** True when every predicate accepts the token (ignores the quantifier). */
	public boolean test(Token token) {
		for (Predicate p : predicates) {
			if (!p.test(token)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return predicates + quantifier.symbol();
	}

	// ---- Predicates ----------------------------------------------------------

	/** A test on one token attribute. */
	@Getter
	public static final class Predicate {

		public enum Kind { EQUALS, IN, NOT_IN, REGEX, FUZZY }

		private final TokenAttribute attr;
		private final Kind kind;
		private final Set<String> values;
		private final Pattern regex;
		private final int maxEdits;
		@Getter(AccessLevel.NONE)
		private final LevenshteinDistance editDistance;

		private Predicate(TokenAttribute attr, Kind kind, Set<String> values, Pattern regex, int maxEdits) {
			this.attr = attr;
			this.kind = kind;
			this.values = values;
			this.regex = regex;
			this.maxEdits = maxEdits;
			this.editDistance = (kind == Kind.FUZZY) ? new LevenshteinDistance(maxEdits) : null;
		}

		public static Predicate equalTo(TokenAttribute attr, String value) {
			return new Predicate(attr, Kind.EQUALS, Set.of(value), null, 0);
		}

		public static Predicate in(TokenAttribute attr, Collection<String> values) {
			return new Predicate(attr, Kind.IN, Collections.unmodifiableSet(new LinkedHashSet<>(values)), null, 0);
		}

		public static Predicate notIn(TokenAttribute attr, Collection<String> values) {
			return new Predicate(attr, Kind.NOT_IN, Collections.unmodifiableSet(new LinkedHashSet<>(values)), null, 0);
		}

		/**
		 * Regex searched (not fully matched) in the attribute value.
		 *
		 * @throws ConfigurationException when the expression does not compile
		 */
		public static Predicate regex(TokenAttribute attr, String expression) {
			try {
				return new Predicate(attr, Kind.REGEX, Collections.emptySet(), Pattern.compile(expression), 0);
			} catch (RuntimeException ex) {
				throw new ConfigurationException("Invalid REGEX '" + expression + "': " + ex.getMessage(), ex);
			}
		}

		public static Predicate fuzzy(TokenAttribute attr, String value, int maxEdits) {
			if (maxEdits < 0) {
				throw new ConfigurationException("FUZZY edits must not be negative for '" + value + "'.");
			}
			return new Predicate(attr, Kind.FUZZY, Set.of(value), null, maxEdits);
		}

		/**
		 * Edit budget of a bare {@code FUZZY} operator: 30% of the pattern
		 * length, at least 2.
		 */
		public static int defaultFuzzyEdits(String value) {
			return Math.max(2, Math.round(0.3f * value.length()));
		}

		public boolean test(Token token) {
			String v = attr.valueOf(token);
			switch (kind) {
			case EQUALS:
			case IN:
				return values.contains(v);
			case NOT_IN:
				return !values.contains(v);
			case REGEX:
				return regex.matcher(v).find();
			case FUZZY:
				// -1 when the distance exceeds maxEdits
				return editDistance.apply(v, values.iterator().next()) >= 0;
			default:
				throw new IllegalStateException("Unhandled predicate kind " + kind);
			}
		}

		@Override
		public String toString() {
			String operand = (kind == Kind.REGEX) ? regex.pattern() : values.toString();
			return attr + " " + kind.name().toLowerCase(Locale.ROOT) + " " + operand;
		}
	}
}
