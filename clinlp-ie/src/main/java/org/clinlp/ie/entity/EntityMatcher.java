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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.PatternMatch;
import org.clinlp.ie.matcher.PatternMatcher;
import org.clinlp.ie.matcher.TokenPattern;
import org.clinlp.ie.nlp.Tokenizer;
import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.Entity;
import org.clinlp.ie.processing.PipelineStage;
import org.clinlp.ie.util.Logger;

/**
 * Rule-based entity matching against a concept dictionary.
 *
 * <ul>
 * <li>Terms are compiled when added, so a malformed term fails the setup, not
 * a document.</li>
 * <li>A positive match is dropped when a pseudo term of the same concept
 * matches the same tokens ({@link PseudoExclusion#EXACT}) or any of them
 * ({@link PseudoExclusion#OVERLAP}).</li>
 * <li>Several terms of one concept matching the same tokens give one
 * entity.</li>
 * <li>With overlap resolution on, the longest entity (in tokens) wins, then the
 * earliest start, then the concept registered first.</li>
 * </ul>
 *
 * Add all concepts before sharing the matcher between threads; matching itself
 * only reads.
 */
public class EntityMatcher implements PipelineStage {

	/** A compiled term and the concept it belongs to. */
	private static final class CompiledTerm {
		final String concept;
		final Term term;
		final int conceptOrder;

		CompiledTerm(String concept, Term term, int conceptOrder) {
			this.concept = concept;
			this.term = term;
			this.conceptOrder = conceptOrder;
		}

		@Override
		public String toString() {
			return concept + ":" + (term.isStructured() ? term.getPattern() : term.getPhrase());
		}
	}

	private final Tokenizer tokenizer;
	private final TermDefaults defaults;
	private final boolean resolveOverlap;
	private final PseudoExclusion pseudoExclusion;

	// concept -> terms, in registration order
	private final Map<String, List<Term>> concepts = new LinkedHashMap<>();
	private final Map<String, Integer> conceptOrder = new HashMap<>();

	private final PatternMatcher<CompiledTerm> positive = new PatternMatcher<>();
	private final PatternMatcher<CompiledTerm> pseudo = new PatternMatcher<>();

	public EntityMatcher(Tokenizer tokenizer) {
		this(tokenizer, TermDefaults.DEFAULTS, false, PseudoExclusion.OVERLAP);
	}

	public EntityMatcher(Tokenizer tokenizer, TermDefaults defaults, boolean resolveOverlap,
			PseudoExclusion pseudoExclusion) {
		this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
		this.defaults = (defaults == null) ? TermDefaults.DEFAULTS : defaults;
		this.resolveOverlap = resolveOverlap;
		this.pseudoExclusion = (pseudoExclusion == null) ? PseudoExclusion.OVERLAP : pseudoExclusion;
	}

	// ---------------- Registration ------------------------------------------

	/**
	 * Adds one term to {@code concept}; terms of an existing concept accumulate.
	 *
	 * @throws ConfigurationException when the term cannot be compiled
	 */
	public void addTerm(String concept, Term term) {
		if (concept == null || concept.isBlank()) {
			throw new ConfigurationException("Concept identifier must not be blank.");
		}
		if (term == null) {
			throw new ConfigurationException("Null term for concept '" + concept + "'.");
		}
		TokenPattern pattern;
		try {
			pattern = term.compile(defaults, tokenizer);
		} catch (ConfigurationException ex) {
			throw new ConfigurationException("Invalid term for concept '" + concept + "': " + ex.getMessage(), ex);
		}

		int order = conceptOrder.computeIfAbsent(concept, c -> conceptOrder.size());
		CompiledTerm compiled = new CompiledTerm(concept, term, order);
		if (term.isPseudo(defaults)) {
			pseudo.add(compiled, pattern);
		} else {
			positive.add(compiled, pattern);
		}
		concepts.computeIfAbsent(concept, c -> new ArrayList<>()).add(term);
	}

	public void addTerms(String concept, List<Term> terms) {
		for (Term t : terms) {
			addTerm(concept, t);
		}
	}

	/** Adds every concept of a dictionary, e.g. one read by {@link ConceptLoader}. */
	public void loadConcepts(Map<String, List<Term>> dictionary) {
		int before = getTermCount();
		for (Map.Entry<String, List<Term>> e : dictionary.entrySet()) {
			addTerms(e.getKey(), e.getValue());
		}
		Logger.info("Entity matcher: loaded {} terms for {} concepts ({} pseudo)", getTermCount() - before,
				dictionary.size(), pseudo.size());
	}

	/** Read-only view of concept to terms. */
	public Map<String, List<Term>> getConcepts() {
		Map<String, List<Term>> view = new LinkedHashMap<>();
		for (Map.Entry<String, List<Term>> e : concepts.entrySet()) {
			view.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
		}
		return Collections.unmodifiableMap(view);
	}

	public int getTermCount() {
		return positive.size() + pseudo.size();
	}

	public TermDefaults getDefaults() {
		return defaults;
	}

	public boolean isResolveOverlap() {
		return resolveOverlap;
	}

	public PseudoExclusion getPseudoExclusion() {
		return pseudoExclusion;
	}

	// ---------------- Matching ----------------------------------------------

	/**
	 * Entities found in {@code document}, ordered by start, end and concept
	 * registration. The document is not modified.
	 *
	 * @throws IllegalStateException when no concepts were added
	 */
	public List<Entity> match(Document document) {
		if (getTermCount() == 0) {
			throw new IllegalStateException("No concepts added.");
		}

		Map<String, List<PatternMatch<CompiledTerm>>> pseudoByConcept = new HashMap<>();
		for (PatternMatch<CompiledTerm> m : pseudo.findMatches(document)) {
			pseudoByConcept.computeIfAbsent(m.getKey().concept, c -> new ArrayList<>()).add(m);
		}

		List<PatternMatch<CompiledTerm>> accepted = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		int suppressed = 0;
		for (PatternMatch<CompiledTerm> m : positive.findMatches(document)) {
			String concept = m.getKey().concept;
			if (isSuppressed(m, pseudoByConcept.get(concept))) {
				suppressed++;
				continue;
			}
			if (seen.add(m.getStart() + ":" + m.getEnd() + ":" + concept)) {
				accepted.add(m);
			}
		}
		accepted.sort(Comparator.comparingInt((PatternMatch<CompiledTerm> m) -> m.getStart())
				.thenComparingInt(PatternMatch::getEnd)
				.thenComparingInt(m -> m.getKey().conceptOrder));

		List<Entity> entities = new ArrayList<>(accepted.size());
		for (PatternMatch<CompiledTerm> m : accepted) {
			entities.add(new Entity(document.span(m.getStart(), m.getEnd()), m.getKey().concept));
		}
		if (resolveOverlap) {
			entities = resolveOverlap(entities);
		}

		if (Logger.isEnabled(Logger.Level.DEBUG)) {
			Logger.debug("Entity matcher: {} entities, {} suppressed by pseudo terms", entities.size(), suppressed);
		}
		return entities;
	}

	private boolean isSuppressed(PatternMatch<CompiledTerm> m, List<PatternMatch<CompiledTerm>> pseudoMatches) {
		if (pseudoMatches == null) {
			return false;
		}
		for (PatternMatch<CompiledTerm> p : pseudoMatches) {
			if (pseudoExclusion.excludes(m.getStart(), m.getEnd(), p.getStart(), p.getEnd())) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Adds the matched entities to those already on the document. With overlap
	 * resolution on, existing and new entities are resolved together.
	 */
	@Override
	public Document process(Document document) {
		List<Entity> all = new ArrayList<>(document.getEntities());
		all.addAll(match(document));
		if (resolveOverlap) {
			all = resolveOverlap(all);
		}
		document.setEntities(all);
		return document;
	}

	/**
	 * Keeps a set of mutually non-overlapping entities: longer first, then
	 * earlier start; equal candidates keep their list order. Result is ordered
	 * by start.
	 */
	static List<Entity> resolveOverlap(List<Entity> entities) {
		List<Entity> byPreference = new ArrayList<>(entities);
		// stable: list order decides between equal spans
		byPreference.sort(Comparator.comparingInt((Entity e) -> e.getSpan().length()).reversed()
				.thenComparingInt(Entity::getStart));

		List<Entity> kept = new ArrayList<>();
		for (Entity candidate : byPreference) {
			boolean free = true;
			for (Entity k : kept) {
				if (k.getSpan().overlaps(candidate.getSpan())) {
					free = false;
					break;
				}
			}
			if (free) {
				kept.add(candidate);
			} else if (Logger.isEnabled(Logger.Level.DEBUG)) {
				Logger.debug("Overlap resolution dropped {}", candidate);
			}
		}
		kept.sort(Comparator.comparingInt(Entity::getStart));
		return kept;
	}
}
