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

import org.clinlp.ie.conf.ConfigurationException;

/**
 * Where a trigger sits relative to the entities it qualifies.
 * {@code PRECEDING} triggers come before the entity, {@code FOLLOWING}
 * triggers after it and {@code BIDIRECTIONAL} triggers on either side.
 * {@code PSEUDO} and {@code TERMINATION} triggers never qualify anything.
 */
public enum ContextRuleDirection {

	PRECEDING, FOLLOWING, BIDIRECTIONAL, PSEUDO, TERMINATION;

	/** True for the directions that assign qualifiers. */
	public boolean isDirectional() {
		return this == PRECEDING || this == FOLLOWING || this == BIDIRECTIONAL;
	}

	/**
	 * @throws ConfigurationException for unknown direction names
	 */
	public static ContextRuleDirection parse(String direction) {
		if (direction == null) {
			throw new ConfigurationException("Rule direction is missing.");
		}
		try {
			return valueOf(direction.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new ConfigurationException("Unknown rule direction '" + direction
					+ "', expected preceding, following, bidirectional, pseudo or termination.");
		}
	}
}
