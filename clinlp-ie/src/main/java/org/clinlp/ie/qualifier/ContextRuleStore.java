package org.clinlp.ie.qualifier;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.PatternMatcher;
import org.clinlp.ie.matcher.PhrasePattern;
import org.clinlp.ie.matcher.StructuredPattern;
import org.clinlp.ie.matcher.TokenAttribute;
import org.clinlp.ie.matcher.TokenPattern;
import org.clinlp.ie.nlp.Tokenizer;
import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.Qualifier;
import org.clinlp.ie.om.QualifierClass;
import org.clinlp.ie.om.Token;
import org.clinlp.ie.util.Logger;

/**
 * Validated qualifier classes and compiled context rules, ready for matching.
 * Read-only once built and safe to share between threads.
 */
public final class ContextRuleStore {

	private static final Pattern QUALIFIER_REF = Pattern.compile("\\w+\\.\\w+");

	private final Map<String, QualifierClass> qualifierClasses;
	private final List<ContextRule> rules;
	private final PatternMatcher<ContextRule> matcher = new PatternMatcher<>();

	/**
	 * @throws ConfigurationException when a rule refers to a class or value not
	 *                                among {@code classes}, or two classes share
	 *                                a name
	 */
	public ContextRuleStore(Collection<QualifierClass> classes, List<ContextRule> rules) {
		Map<String, QualifierClass> byName = new LinkedHashMap<>();
		for (QualifierClass qc : classes) {
			if (byName.put(qc.getName(), qc) != null) {
				throw new ConfigurationException("Qualifier class " + qc.getName() + " is declared twice.");
			}
		}
		for (ContextRule rule : rules) {
			Qualifier q = rule.getQualifier();
			QualifierClass qc = byName.get(q.getName());
			if (qc == null || !qc.hasValue(q.getValue())) {
				throw new ConfigurationException("Rule " + rule + " refers to unknown qualifier " + q + ".");
			}
			matcher.add(rule, rule.getPattern());
		}
		this.qualifierClasses = Collections.unmodifiableMap(byName);
		this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
	}

	/**
	 * Validates and compiles a rule definition. Phrase patterns are split with
	 * {@code tokenizer} and matched on {@code attr}; structured patterns are
	 * matched as written.
	 *
	 * @throws ConfigurationException on any malformed class, rule or pattern
	 */
	public static ContextRuleStore build(RulesDefinition definition, Tokenizer tokenizer, TokenAttribute attr) {
		Objects.requireNonNull(definition, "definition must not be null");
		Objects.requireNonNull(tokenizer, "tokenizer must not be null");
		TokenAttribute phraseAttr = (attr == null) ? TokenAttribute.TEXT : attr;

		List<QualifierClass> classes = new ArrayList<>();
		Map<String, QualifierClass> byName = new LinkedHashMap<>();
		if (definition.getQualifiers() != null) {
			for (QualifierDefinition qd : definition.getQualifiers()) {
				QualifierClass qc = qd.toQualifierClass();
				classes.add(qc);
				byName.put(qc.getName(), qc);
			}
		}

		List<ContextRule> rules = new ArrayList<>();
		if (definition.getRules() != null) {
			for (RuleDefinition rd : definition.getRules()) {
				Qualifier qualifier = parseQualifier(rd.getQualifier(), byName);
				ContextRuleDirection direction = ContextRuleDirection.parse(rd.getDirection());
				if (rd.getPatterns() == null || rd.getPatterns().isEmpty()) {
					throw new ConfigurationException("Rule " + rd.getQualifier() + " (" + rd.getDirection()
							+ ") has no patterns.");
				}
				for (Object p : rd.getPatterns()) {
					String where = rd.getQualifier() + " (" + rd.getDirection() + ")";
					TokenPattern compiled = compilePattern(p, tokenizer, phraseAttr, where);
					rules.add(new ContextRule(compiled, String.valueOf(p), qualifier, direction, rd.getMaxScope()));
				}
			}
		}

		ContextRuleStore store = new ContextRuleStore(classes, rules);
		if (rules.isEmpty()) {
			Logger.warn("Context rule store has no rules; every entity will keep its default qualifiers");
		}
		Logger.info("Context rule store: {} qualifier classes, {} rules", classes.size(), rules.size());
		return store;
	}

	/**
	 * Parses a {@code Class.Value} reference.
	 *
	 * @throws ConfigurationException when malformed or unknown
	 */
	static Qualifier parseQualifier(String reference, Map<String, QualifierClass> classes) {
		if (reference == null || !QUALIFIER_REF.matcher(reference).matches()) {
			throw new ConfigurationException("Cannot parse qualifier " + reference
					+ ", please adhere to format Class.Value (e.g. Presence.Absent)");
		}
		int dot = reference.indexOf('.');
		String className = reference.substring(0, dot);
		String value = reference.substring(dot + 1);
		QualifierClass qc = classes.get(className);
		if (qc == null) {
			throw new ConfigurationException("Rule refers to unknown qualifier class " + className + " (" + reference + ").");
		}
		if (!qc.hasValue(value)) {
			throw new ConfigurationException("The qualifier " + className + " cannot take value '" + value
					+ "'. Please choose one of " + qc.getValues() + ".");
		}
		return qc.create(value);
	}

	private static TokenPattern compilePattern(Object pattern, Tokenizer tokenizer, TokenAttribute attr,
			String where) {
		if (pattern instanceof String) {
			String phrase = (String) pattern;
			Document doc = tokenizer.tokenize(phrase);
			if (doc.size() == 0) {
				throw new ConfigurationException("Empty pattern '" + phrase + "' in rule " + where + ".");
			}
			List<String> words = new ArrayList<>(doc.size());
			for (Token t : doc.getTokens()) {
				words.add(attr.valueOf(t));
			}
			return new PhrasePattern(words, attr);
		}
		if (pattern instanceof List) {
			return StructuredPattern.parse((List<?>) pattern, "rule " + where);
		}
		throw new ConfigurationException("Don't know how to process pattern '" + pattern + "' in rule " + where
				+ "; expected a string or a list of token objects.");
	}

	public Map<String, QualifierClass> getQualifierClasses() {
		return qualifierClasses;
	}

	public List<ContextRule> getRules() {
		return rules;
	}

	/** Matcher over all rule patterns, keyed by rule. */
	public PatternMatcher<ContextRule> getMatcher() {
		return matcher;
	}

	public int size() {
		return rules.size();
	}

	public boolean isEmpty() {
		return rules.isEmpty();
	}
}
