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

import java.util.Locale;
import java.util.Objects;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.TokenPattern;
import org.clinlp.ie.om.Qualifier;

import lombok.Getter;

/**
 * One compiled trigger pattern with the qualifier it assigns, its direction and
 * an optional maximum scope in tokens.
 */
@Getter
public final class ContextRule {

	private final TokenPattern pattern;

	/** Pattern as written in the rule file, for messages. */
	private final String source;

	private final Qualifier qualifier;
	private final ContextRuleDirection direction;

	/** Max tokens the trigger reaches; null means up to the sentence boundary. */
	private final Integer maxScope;

	/**
	 * @throws ConfigurationException when {@code maxScope < 1}
	 */
	public ContextRule(TokenPattern pattern, String source, Qualifier qualifier, ContextRuleDirection direction,
			Integer maxScope) {
		this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
		this.source = (source == null) ? pattern.toString() : source;
		this.qualifier = Objects.requireNonNull(qualifier, "qualifier must not be null");
		this.direction = Objects.requireNonNull(direction, "direction must not be null");
		if (maxScope != null && maxScope < 1) {
			throw new ConfigurationException("max_scope must be at least 1, but got " + maxScope + " for rule '"
					+ this.source + "' (" + qualifier + ").");
		}
		this.maxScope = maxScope;
	}

	public String getQualifierClassName() {
		return qualifier.getName();
	}

	@Override
	public String toString() {
		return qualifier + " " + direction.name().toLowerCase(Locale.ROOT) + " '" + source + "'"
				+ (maxScope == null ? "" : " max_scope=" + maxScope);
	}
}
