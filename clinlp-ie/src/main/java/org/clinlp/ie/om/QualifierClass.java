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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.clinlp.ie.conf.ConfigurationException;

import lombok.Getter;

/**
 * A categorical qualifier dimension, e.g. {@code Presence} with values
 * {@code Absent, Uncertain, Present}.
 *
 * <p>Each value carries an explicit integer priority used when several triggers
 * of this class claim the same entity. Lower numbers win; when no priorities
 * are declared they follow the declared value order (first value = 0).</p>
 */
@Getter
public final class QualifierClass {

	private final String name;
	private final List<String> values;
	private final String defaultValue;
	private final Map<String, Integer> priorities;

	public QualifierClass(String name, List<String> values) {
		this(name, values, null, null);
	}

	public QualifierClass(String name, List<String> values, String defaultValue) {
		this(name, values, defaultValue, null);
	}

	/**
	 * @param name         class name, e.g. {@code Presence}
	 * @param values       mutually exclusive values, at least one
	 * @param defaultValue value assumed without a trigger; first value when null
	 * @param priorities   value → priority (lower wins); declared order when null
	 * @throws ConfigurationException on duplicate values, an unknown default or
	 *                                incomplete priorities
	 */
	public QualifierClass(String name, List<String> values, String defaultValue, Map<String, Integer> priorities) {
		if (name == null || name.isBlank()) {
			throw new ConfigurationException("Qualifier class name must not be blank.");
		}
		if (values == null || values.isEmpty()) {
			throw new ConfigurationException("Qualifier class " + name + " must declare at least one value.");
		}
		if (new HashSet<>(values).size() != values.size()) {
			throw new ConfigurationException("Please do not provide any duplicate values (" + values + ").");
		}

		this.name = name;
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
		this.defaultValue = (defaultValue == null) ? values.get(0) : defaultValue;

		if (!this.values.contains(this.defaultValue)) {
			throw new ConfigurationException("Default " + defaultValue + " not in provided values " + values + ".");
		}

		Map<String, Integer> prio = new LinkedHashMap<>();
		if (priorities == null || priorities.isEmpty()) {
			for (int i = 0; i < values.size(); i++) {
				prio.put(values.get(i), i);
			}
		} else {
			for (String value : values) {
				Integer p = priorities.get(value);
				if (p == null) {
					throw new ConfigurationException("Qualifier class " + name + " has no priority for value " + value + ".");
				}
				prio.put(value, p);
			}
			for (String key : priorities.keySet()) {
				if (!prio.containsKey(key)) {
					throw new ConfigurationException("Qualifier class " + name + " declares a priority for unknown value " + key + ".");
				}
			}
		}
		this.priorities = Collections.unmodifiableMap(prio);
	}

	public boolean hasValue(String value) {
		return values.contains(value);
	}

	public int priorityOf(String value) {
		Integer p = priorities.get(value);
		if (p == null) {
			throw new IllegalArgumentException("The qualifier " + name + " cannot take value '" + value + "'.");
		}
		return p;
	}

	/** Qualifier holding the default value. */
	public Qualifier create() {
		return create(defaultValue, null);
	}

	public Qualifier create(String value) {
		return create(value, null);
	}

	/**
	 * @throws IllegalArgumentException when {@code value} is not one of {@link #getValues()}
	 */
	public Qualifier create(String value, Double prob) {
		String v = (value == null) ? defaultValue : value;
		if (!values.contains(v)) {
			throw new IllegalArgumentException(
					"The qualifier " + name + " cannot take value '" + v + "'. Please choose one of " + values + ".");
		}
		return new Qualifier(name, v, v.equals(defaultValue), priorities.get(v), prob);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof QualifierClass)) {
			return false;
		}
		QualifierClass other = (QualifierClass) o;
		return name.equals(other.name) && values.equals(other.values) && defaultValue.equals(other.defaultValue)
				&& priorities.equals(other.priorities);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, values, defaultValue, priorities);
	}

	@Override
	public String toString() {
		return name + values;
	}
}
