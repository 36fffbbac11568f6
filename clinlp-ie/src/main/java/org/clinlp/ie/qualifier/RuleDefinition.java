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

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * One entry of {@code rules} in a rule file. Each pattern is either a phrase
 * string or a list of token objects.
 */
@Data
public class RuleDefinition {

	/** {@code Class.Value}, e.g. {@code Presence.Absent}. */
	private String qualifier;

	private String direction;

	@JsonProperty("max_scope")
	private Integer maxScope;

	private List<Object> patterns;

	public RuleDefinition() {
	}

	public RuleDefinition(String qualifier, String direction, Integer maxScope, List<Object> patterns) {
		this.qualifier = qualifier;
		this.direction = direction;
		this.maxScope = maxScope;
		this.patterns = patterns;
	}
}
