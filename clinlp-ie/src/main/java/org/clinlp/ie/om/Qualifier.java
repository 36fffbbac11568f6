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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.Getter;

/**
 * Assignment of one {@link QualifierClass} value, e.g. {@code Presence.Absent}.
 * Equality only considers the class name and the value.
 */
@Getter
public final class Qualifier {

	private final String name;
	private final String value;
	private final boolean isDefault;
	private final int priority;

	/** Probability, only set by statistical detectors. */
	private final Double prob;

	public Qualifier(String name, String value, boolean isDefault, int priority, Double prob) {
		this.name = Objects.requireNonNull(name, "qualifier name must not be null");
		this.value = Objects.requireNonNull(value, "qualifier value must not be null");
		this.isDefault = isDefault;
		this.priority = priority;
		this.prob = prob;
	}

	/** Map view with keys name, value, is_default and prob. */
	public Map<String, Object> toMap() {
		Map<String, Object> out = new LinkedHashMap<>();
		out.put("name", name);
		out.put("value", value);
		out.put("is_default", isDefault);
		out.put("prob", prob);
		return out;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Qualifier)) {
			return false;
		}
		Qualifier other = (Qualifier) o;
		return name.equals(other.name) && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}

	@Override
	public String toString() {
		return name + "." + value;
	}
}
