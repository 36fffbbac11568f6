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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.PhrasePattern;
import org.clinlp.ie.matcher.StructuredPattern;
import org.clinlp.ie.matcher.TokenAttribute;
import org.clinlp.ie.nlp.OpenNlpTokenizer;
import org.clinlp.ie.om.Qualifier;
import org.clinlp.ie.om.QualifierClass;
import org.junit.jupiter.api.Test;

class ContextRuleStoreTest {

	private final OpenNlpTokenizer tokenizer = new OpenNlpTokenizer();

	private static QualifierDefinition presence() {
		return new QualifierDefinition("Presence", List.of("Absent", "Uncertain", "Present"), "Present", null);
	}

	private static RulesDefinition definition(RuleDefinition... rules) {
		RulesDefinition def = new RulesDefinition();
		def.setQualifiers(new ArrayList<>(List.of(presence())));
		def.setRules(new ArrayList<>(Arrays.asList(rules)));
		return def;
	}

	private static RuleDefinition rule(String qualifier, String direction, Integer maxScope, Object... patterns) {
		return new RuleDefinition(qualifier, direction, maxScope, new ArrayList<>(Arrays.asList(patterns)));
	}

	private ContextRuleStore build(RuleDefinition... rules) {
		return ContextRuleStore.build(definition(rules), tokenizer, TokenAttribute.NORM);
	}

	@Test
	void each_pattern_becomes_a_rule() {
		ContextRuleStore store = build(
				rule("Presence.Absent", "preceding", 5, "geen", "Afwezigheid van"),
				rule("Presence.Uncertain", "FOLLOWING", null,
						List.of(Map.of("NORM", "niet"), Map.of("NORM", "uitgesloten"))));

		assertEquals(3, store.size());
		List<ContextRule> rules = store.getRules();

		ContextRule second = rules.get(1);
		assertEquals(new Qualifier("Presence", "Absent", false, 0, null), second.getQualifier());
		assertEquals(ContextRuleDirection.PRECEDING, second.getDirection());
		assertEquals(5, second.getMaxScope());
		assertEquals(List.of("afwezigheid", "van"), ((PhrasePattern) second.getPattern()).getWords());

		ContextRule third = rules.get(2);
		assertTrue(third.getPattern() instanceof StructuredPattern);
		assertEquals(ContextRuleDirection.FOLLOWING, third.getDirection());
		assertNull(third.getMaxScope());
		assertEquals(3, store.getMatcher().size());
	}

	@Test
	void rule_qualifier_carries_the_class_priority() {
		ContextRuleStore store = build(rule("Presence.Uncertain", "preceding", null, "mogelijk"));
		assertEquals(1, store.getRules().get(0).getQualifier().getPriority());
		assertEquals("Presence", store.getRules().get(0).getQualifierClassName());
	}

	@Test
	void unknown_class_or_value_is_rejected() {
		assertThrows(ConfigurationException.class, () -> build(rule("Negation.Negated", "preceding", null, "geen")));
		ConfigurationException ex = assertThrows(ConfigurationException.class,
				() -> build(rule("Presence.Maybe", "preceding", null, "geen")));
		assertTrue(ex.getMessage().contains("Maybe"));
	}

	@Test
	void malformed_qualifier_reference_is_rejected() {
		assertThrows(ConfigurationException.class, () -> build(rule("Presence", "preceding", null, "geen")));
		assertThrows(ConfigurationException.class, () -> build(rule("Presence.Absent.X", "preceding", null, "geen")));
		assertThrows(ConfigurationException.class, () -> build(rule(null, "preceding", null, "geen")));
	}

	@Test
	void unknown_direction_is_rejected() {
		assertThrows(ConfigurationException.class, () -> build(rule("Presence.Absent", "sideways", null, "geen")));
		assertThrows(ConfigurationException.class, () -> build(rule("Presence.Absent", null, null, "geen")));
	}

	@Test
	void invalid_patterns_are_rejected() {
		assertThrows(ConfigurationException.class, () -> build(rule("Presence.Absent", "preceding", null)));
		assertThrows(ConfigurationException.class, () -> build(rule("Presence.Absent", "preceding", null, "   ")));
		assertThrows(ConfigurationException.class, () -> build(rule("Presence.Absent", "preceding", null, 42)));
		assertThrows(ConfigurationException.class,
				() -> build(rule("Presence.Absent", "preceding", null, List.of(Map.of("POS", "NOUN")))));
	}

	@Test
	void max_scope_must_be_positive() {
		assertThrows(ConfigurationException.class, () -> build(rule("Presence.Absent", "preceding", 0, "geen")));
		assertThrows(ConfigurationException.class, () -> build(rule("Presence.Absent", "preceding", -3, "geen")));
	}

	@Test
	void invalid_qualifier_class_is_rejected() {
		RulesDefinition def = definition();
		def.getQualifiers().add(new QualifierDefinition("Temporality", List.of("Historical", "Current"), "Future", null));
		assertThrows(ConfigurationException.class, () -> ContextRuleStore.build(def, tokenizer, TokenAttribute.NORM));
	}

	@Test
	void duplicate_class_names_are_rejected() {
		RulesDefinition def = definition();
		def.getQualifiers().add(presence());
		assertThrows(ConfigurationException.class, () -> ContextRuleStore.build(def, tokenizer, TokenAttribute.NORM));
	}

	@Test
	void store_without_rules_is_allowed() {
		ContextRuleStore store = build();
		assertTrue(store.isEmpty());
		assertEquals(1, store.getQualifierClasses().size());
	}

	@Test
	void constructor_checks_rule_qualifiers_against_classes() {
		QualifierClass presence = new QualifierClass("Presence", List.of("Absent", "Present"), "Present");
		ContextRule rule = new ContextRule(new PhrasePattern(List.of("geen"), TokenAttribute.NORM), "geen",
				new Qualifier("Negation", "Negated", false, 0, null), ContextRuleDirection.PRECEDING, null);
		assertThrows(ConfigurationException.class, () -> new ContextRuleStore(List.of(presence), List.of(rule)));
	}

	@Test
	void parse_qualifier_resolves_class_and_value() {
		QualifierClass presence = new QualifierClass("Presence", List.of("Absent", "Present"), "Present");
		Qualifier q = ContextRuleStore.parseQualifier("Presence.Absent", Map.of("Presence", presence));
		assertEquals("Presence.Absent", q.toString());
		assertEquals(0, q.getPriority());
	}
}
