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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.TokenConstraint.Predicate;
import org.clinlp.ie.matcher.TokenConstraint.Quantifier;
import org.clinlp.ie.om.Token;

/**
 * Ordered list of {@link TokenConstraint}s, matched without backtracking by
 * tracking the set of live constraint positions while scanning tokens.
 *
 * <p>
 * Rule and concept files write these patterns as a list of token objects, for
 * example:
 * </p>
 *
 * <pre>
 * [ {"NORM": "geen"}, {"OP": "?"}, {"LOWER": {"IN": ["koorts", "pijn"]}} ]
 * </pre>
 *
 * Keys are token attributes ({@code TEXT}/{@code ORTH}, {@code NORM},
 * {@code LOWER}) and {@code OP}. An attribute value is either a literal or an
 * object with one of {@code IN}, {@code NOT_IN}, {@code REGEX},
 * {@code FUZZY}, {@code FUZZY1}..{@code FUZZY9}.
 */
public final class StructuredPattern implements TokenPattern {

	private static final Pattern FUZZY_KEY = Pattern.compile("FUZZY([0-9]?)");

	private final List<TokenConstraint> constraints;

	/**
	 * @throws ConfigurationException when no constraints are given
	 */
	public StructuredPattern(List<TokenConstraint> constraints) {
		if (constraints == null || constraints.isEmpty()) {
			throw new ConfigurationException("A structured pattern must contain at least one token constraint.");
		}
		this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
	}

	public List<TokenConstraint> getConstraints() {
		return constraints;
	}

	public int size() {
		return constraints.size();
	}

	@Override
	public List<Integer> matchEnds(List<Token> tokens, int start, int limit) {
		final int n = constraints.size();
		// state index: position * 2 + (1 when a '+' at position already matched once)
		boolean[] current = new boolean[(n + 1) * 2];
		addWithClosure(current, 0, false);

		List<Integer> ends = new ArrayList<>();
		for (int pos = start; pos < limit; pos++) {
			boolean[] next = new boolean[current.length];
			Token token = tokens.get(pos);

			for (int i = 0; i < n; i++) {
				for (int sat = 0; sat <= 1; sat++) {
					if (!current[i * 2 + sat]) {
						continue;
					}
					TokenConstraint c = constraints.get(i);
					boolean hit = c.test(token);
					switch (c.getQuantifier()) {
					case ONE:
					case OPTIONAL:
						if (hit) {
							addWithClosure(next, i + 1, false);
						}
						break;
					case NEGATE:
						if (!hit) {
							addWithClosure(next, i + 1, false);
						}
						break;
					case ZERO_OR_MORE:
						if (hit) {
							addWithClosure(next, i, false);
						}
						break;
					case ONE_OR_MORE:
						if (hit) {
							addWithClosure(next, i, true);
						}
						break;
					default:
						throw new IllegalStateException("Unhandled quantifier " + c.getQuantifier());
					}
				}
			}

			if (next[n * 2]) {
				ends.add(pos + 1);
			}
			if (!hasLiveState(next, n)) {
				break;
			}
			current = next;
		}
		return ends;
	}

	private static boolean hasLiveState(boolean[] states, int n) {
		for (int idx = 0; idx < n * 2; idx++) {
			if (states[idx]) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Marks {@code (position, satisfied)} and every position reachable from it
	 * without consuming a token.
	 */
	private void addWithClosure(boolean[] states, int position, boolean satisfied) {
		int n = constraints.size();
		int i = position;
		boolean sat = satisfied;
		while (true) {
			states[i * 2 + (sat ? 1 : 0)] = true;
			if (i == n) {
				return;
			}
			Quantifier q = constraints.get(i).getQuantifier();
			boolean skippable = q == Quantifier.OPTIONAL || q == Quantifier.ZERO_OR_MORE
					|| (q == Quantifier.ONE_OR_MORE && sat);
			if (!skippable) {
				return;
			}
			i++;
			sat = false;
		}
	}

	@Override
	public String toString() {
		return constraints.toString();
	}

	// ---- Parsing ---------------------------------------------------------------

	/**
	 * Builds a pattern from its file representation.
	 *
	 * @param tokens list of token objects, as read from JSON
	 * @param source rule or term description used in error messages
	 * @throws ConfigurationException on an empty list, unknown keys, operators
	 *                                or predicate types
	 */
	public static StructuredPattern parse(List<?> tokens, String source) {
		if (tokens == null || tokens.isEmpty()) {
			throw new ConfigurationException("Empty structured pattern in " + source + ".");
		}
		List<TokenConstraint> constraints = new ArrayList<>(tokens.size());
		for (Object entry : tokens) {
			if (!(entry instanceof Map)) {
				throw new ConfigurationException(
						"Structured pattern entries must be objects, got '" + entry + "' in " + source + ".");
			}
			constraints.add(parseToken((Map<?, ?>) entry, source));
		}
		return new StructuredPattern(constraints);
	}

	private static TokenConstraint parseToken(Map<?, ?> token, String source) {
		Quantifier quantifier = Quantifier.ONE;
		List<Predicate> predicates = new ArrayList<>();

		for (Map.Entry<?, ?> e : token.entrySet()) {
			String key = String.valueOf(e.getKey());
			Object value = e.getValue();

			if ("OP".equalsIgnoreCase(key)) {
				try {
					quantifier = Quantifier.parse(String.valueOf(value));
				} catch (ConfigurationException ex) {
					throw new ConfigurationException(ex.getMessage() + " (in " + source + ")", ex);
				}
				continue;
			}
			if (!TokenAttribute.isAttributeName(key)) {
				throw new ConfigurationException("Unknown structured pattern key '" + key + "' in " + source + ".");
			}
			TokenAttribute attr = TokenAttribute.parse(key);

			if (value instanceof Map) {
				for (Map.Entry<?, ?> op : ((Map<?, ?>) value).entrySet()) {
					predicates.add(parsePredicate(attr, String.valueOf(op.getKey()), op.getValue(), source));
				}
			} else if (value instanceof String) {
				predicates.add(Predicate.equalTo(attr, (String) value));
			} else {
				throw new ConfigurationException(
						"Unsupported value '" + value + "' for key '" + key + "' in " + source + ".");
			}
		}
		return new TokenConstraint(predicates, quantifier);
	}

	private static Predicate parsePredicate(TokenAttribute attr, String op, Object operand, String source) {
		String kind = op.trim().toUpperCase(Locale.ROOT);
		switch (kind) {
		case "IN":
			return Predicate.in(attr, stringList(operand, op, source));
		case "NOT_IN":
			return Predicate.notIn(attr, stringList(operand, op, source));
		case "REGEX":
			return Predicate.regex(attr, stringValue(operand, op, source));
		default:
			Matcher m = FUZZY_KEY.matcher(kind);
			if (m.matches()) {
				String literal = stringValue(operand, op, source);
				int edits = m.group(1).isEmpty() ? Predicate.defaultFuzzyEdits(literal) : Integer.parseInt(m.group(1));
				return Predicate.fuzzy(attr, literal, edits);
			}
			throw new ConfigurationException("Unknown predicate '" + op + "' in " + source + ".");
		}
	}

	private static List<String> stringList(Object operand, String op, String source) {
		if (!(operand instanceof Collection)) {
			throw new ConfigurationException(op + " expects a list of strings in " + source + ".");
		}
		List<String> out = new ArrayList<>();
		for (Object o : (Collection<?>) operand) {
			out.add(String.valueOf(o));
		}
		return out;
	}

	private static String stringValue(Object operand, String op, String source) {
		if (!(operand instanceof String)) {
			throw new ConfigurationException(op + " expects a string in " + source + ".");
		}
		return (String) operand;
	}
}
