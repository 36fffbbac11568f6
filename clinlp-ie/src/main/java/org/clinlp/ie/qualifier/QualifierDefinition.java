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

import java.util.List;
import java.util.Map;

import org.clinlp.ie.om.QualifierClass;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/** One entry of {@code qualifiers} in a rule file. */
@Data
public class QualifierDefinition {

	private String name;

	private List<String> values;

	@JsonProperty("default")
	private String defaultValue;

	/** Optional; lower number wins. */
	private Map<String, Integer> priorities;

	public QualifierDefinition() {
	}

	public QualifierDefinition(String name, List<String> values, String defaultValue, Map<String, Integer> priorities) {
		this.name = name;
		this.values = values;
		this.defaultValue = defaultValue;
		this.priorities = priorities;
	}

	public QualifierClass toQualifierClass() {
		return new QualifierClass(name, values, defaultValue, priorities);
	}
}
