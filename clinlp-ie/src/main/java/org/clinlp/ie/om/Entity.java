package org.clinlp.ie.om;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import lombok.Getter;

/**
 * A matched concept occurrence. The span and label are fixed at creation; the
 * qualifier map (one {@link Qualifier} per class name) is filled in by
 * qualifier detectors.
 */
public class Entity {

	@Getter
	private final Span span;

	@Getter
	private final String label;

	// null until a detector initializes it
	private Map<String, Qualifier> qualifiers;

	public Entity(Span span, String label) {
		this.span = Objects.requireNonNull(span, "span must not be null");
		this.label = Objects.requireNonNull(label, "label must not be null");
	}

	public int getStart() {
		return span.getStart();
	}

	public int getEnd() {
		return span.getEnd();
	}

	public String getText() {
		return span.getText();
	}

	public boolean hasQualifiers() {
		return qualifiers != null;
	}

	/** Makes the qualifier map available, keeping existing assignments. */
	public void initializeQualifiers() {
		if (qualifiers == null) {
			qualifiers = new LinkedHashMap<>();
		}
	}

	/**
	 * Sets (or replaces) the qualifier for {@code qualifier.getName()}.
	 *
	 * @throws IllegalStateException when the qualifiers were never initialized
	 */
	public void addQualifier(Qualifier qualifier) {
		if (qualifiers == null) {
			throw new IllegalStateException("Cannot add qualifier to entity with non-initialized qualifiers.");
		}
		qualifiers.put(qualifier.getName(), qualifier);
	}

	public Optional<Qualifier> getQualifier(String className) {
		return (qualifiers == null) ? Optional.empty() : Optional.ofNullable(qualifiers.get(className));
	}

	/** Unmodifiable view of class name → qualifier; empty when not initialized. */
	public Map<String, Qualifier> getQualifiers() {
		return (qualifiers == null) ? Collections.emptyMap() : Collections.unmodifiableMap(qualifiers);
	}

	/** Qualifiers as sorted {@code Class.Value} strings. */
	public Set<String> getQualifierStrings() {
		Set<String> out = new TreeSet<>();
		for (Qualifier q : getQualifiers().values()) {
			out.add(q.toString());
		}
		return out;
	}

	public List<Map<String, Object>> getQualifierMaps() {
		List<Map<String, Object>> out = new ArrayList<>();
		for (Qualifier q : getQualifiers().values()) {
			out.add(q.toMap());
		}
		return out;
	}

	@Override
	public String toString() {
		return label + "[" + span.getStart() + ":" + span.getEnd() + "] " + span.getText();
	}
}
