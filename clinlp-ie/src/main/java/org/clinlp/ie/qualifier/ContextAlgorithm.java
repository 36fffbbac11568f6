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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.clinlp.ie.matcher.PatternMatch;
import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.Entity;
import org.clinlp.ie.om.InputContractException;
import org.clinlp.ie.om.QualifierClass;
import org.clinlp.ie.om.Span;
import org.clinlp.ie.util.Logger;

/**
 * Rule-based qualifier detection after the ConText algorithm (Harkema et al.,
 * https://doi.org/10.1016/j.jbi.2009.05.002).
 *
 * <p>
 * Per sentence holding entities:
 * </p>
 * <ol>
 * <li>match all rule patterns inside the sentence;</li>
 * <li>drop directional triggers that overlap a pseudo trigger of the same
 * qualifier;</li>
 * <li>give each trigger a scope: forward from a preceding trigger, backward
 * from a following trigger, both ways for a bidirectional one, limited by
 * max_scope and the sentence, and clipped at the nearest termination trigger of
 * the same class on either side;</li>
 * <li>a trigger claims each entity that overlaps its scope but not the trigger
 * itself. An entity lying inside a trigger of a class gets no value of that
 * class from any other trigger;</li>
 * <li>among claims of one class the lowest priority number wins, then the
 * trigger nearest to the entity, then the earliest trigger, then the rule
 * registered first.</li>
 * </ol>
 * Classes without a winning claim keep their default.
 */
public class ContextAlgorithm extends AbstractQualifierDetector {

	private static final Comparator<TriggerMatch> SCAN_ORDER = Comparator.comparingInt(TriggerMatch::getStart)
			.thenComparingInt(TriggerMatch::getEnd).thenComparingInt(TriggerMatch::getOrder);

	private final ContextRuleStore store;

	public ContextAlgorithm(ContextRuleStore store) {
		this.store = Objects.requireNonNull(store, "store must not be null");
	}

	public ContextRuleStore getStore() {
		return store;
	}

	@Override
	public Collection<QualifierClass> getQualifierClasses() {
		return store.getQualifierClasses().values();
	}

	@Override
	protected void detectQualifiers(Document document) {
		Map<Span, List<Entity>> bySentence = groupBySentence(document);
		if (store.isEmpty()) {
			return;
		}
		for (Map.Entry<Span, List<Entity>> e : bySentence.entrySet()) {
			detectInSentence(e.getKey(), e.getValue());
		}
	}

	/**
	 * Entities per sentence, sentences in document order. Without sentence
	 * annotations the whole document is one sentence.
	 *
	 * @throws InputContractException when an entity is not inside exactly one
	 *                                sentence
	 */
	Map<Span, List<Entity>> groupBySentence(Document document) {
		List<Span> sentences = document.hasSentences() ? document.getSentences()
				: List.of(document.span(0, document.size()));

		Map<Span, List<Entity>> out = new LinkedHashMap<>();
		for (Entity entity : document.getEntities()) {
			Span home = null;
			for (Span s : sentences) {
				if (s.contains(entity.getSpan())) {
					home = s;
					break;
				}
			}
			if (home == null) {
				throw new InputContractException(
						"Entity " + entity + " is not contained in exactly one sentence; it crosses a sentence boundary");
			}
			out.computeIfAbsent(home, k -> new ArrayList<>()).add(entity);
		}
		return out;
	}

	/** Triggers in the sentence that can assign qualifiers, with final scopes. */
	List<TriggerMatch> resolveTriggers(Span sentence) {
		List<TriggerMatch> directional = new ArrayList<>();
		List<TriggerMatch> pseudo = new ArrayList<>();
		List<TriggerMatch> termination = new ArrayList<>();

		for (PatternMatch<ContextRule> m : store.getMatcher().findMatches(sentence)) {
			TriggerMatch t = new TriggerMatch(m.getKey(), m.getStart(), m.getEnd(), m.getOrder());
			switch (m.getKey().getDirection()) {
			case PSEUDO:
				pseudo.add(t);
				break;
			case TERMINATION:
				termination.add(t);
				break;
			default:
				directional.add(t);
			}
		}

		List<TriggerMatch> result = new ArrayList<>(directional.size());
		for (TriggerMatch t : directional) {
			if (isSuppressedByPseudo(t, pseudo)) {
				Logger.trace("Pseudo trigger suppresses {}", t);
				continue;
			}
			t.initializeScope(sentence);
			for (TriggerMatch term : termination) {
				if (term.getRule().getQualifierClassName().equals(t.getRule().getQualifierClassName())) {
					t.limitBy(term);
				}
			}
			result.add(t);
		}
		result.sort(SCAN_ORDER);
		return result;
	}

	private static boolean isSuppressedByPseudo(TriggerMatch t, List<TriggerMatch> pseudo) {
		for (TriggerMatch p : pseudo) {
			if (p.getRule().getQualifier().equals(t.getRule().getQualifier()) && p.overlaps(t)) {
				return true;
			}
		}
		return false;
	}

	private void detectInSentence(Span sentence, List<Entity> entities) {
		List<TriggerMatch> triggers = resolveTriggers(sentence);
		if (triggers.isEmpty()) {
			return;
		}

		for (Entity entity : entities) {
			int es = entity.getStart();
			int ee = entity.getEnd();

			Map<String, TriggerMatch> winners = new LinkedHashMap<>();
			Map<String, Boolean> blocked = new LinkedHashMap<>();

			for (TriggerMatch t : triggers) {
				String cls = t.getRule().getQualifierClassName();
				if (t.spanContains(es, ee)) {
					blocked.put(cls, Boolean.TRUE);
					continue;
				}
				if (t.spanOverlaps(es, ee) || !t.scopeOverlaps(es, ee)) {
					continue;
				}
				TriggerMatch current = winners.get(cls);
				if (current == null || beats(t, current, es, ee)) {
					if (current != null && Logger.isEnabled(Logger.Level.DEBUG)) {
						Logger.debug("{}: {} wins over {}", entity, t, current);
					}
					winners.put(cls, t);
				}
			}

			for (Map.Entry<String, TriggerMatch> w : winners.entrySet()) {
				if (blocked.containsKey(w.getKey())) {
					continue;
				}
				entity.addQualifier(w.getValue().getRule().getQualifier());
			}
		}
	}

	/** True when {@code a} should win over {@code b} for entity {@code [es, ee)}. */
	private static boolean beats(TriggerMatch a, TriggerMatch b, int es, int ee) {
		int pa = a.getRule().getQualifier().getPriority();
		int pb = b.getRule().getQualifier().getPriority();
		if (pa != pb) {
			return pa < pb;
		}
		int da = a.distanceTo(es, ee);
		int db = b.distanceTo(es, ee);
		if (da != db) {
			return da < db;
		}
		if (a.getStart() != b.getStart()) {
			return a.getStart() < b.getStart();
		}
		return a.getOrder() < b.getOrder();
	}

	@Override
	public String name() {
		return "ContextAlgorithm(" + store.size() + " rules)";
	}
}
