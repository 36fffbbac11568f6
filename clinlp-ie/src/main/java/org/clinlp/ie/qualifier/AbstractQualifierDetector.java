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

import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.Entity;
import org.clinlp.ie.om.QualifierClass;

/**
 * Base for qualifier detectors: sets the default value of every owned class on
 * every entity, then runs {@link #detectQualifiers(Document)}. Resetting to
 * defaults first makes repeated runs give the same result.
 */
public abstract class AbstractQualifierDetector implements QualifierDetector {

	@Override
	public Document process(Document document) {
		if (document.getEntities().isEmpty()) {
			return document;
		}
		for (Entity entity : document.getEntities()) {
			initializeQualifiers(entity);
		}
		detectQualifiers(document);
		return document;
	}

	protected void initializeQualifiers(Entity entity) {
		entity.initializeQualifiers();
		for (QualifierClass qc : getQualifierClasses()) {
			entity.addQualifier(qc.create());
		}
	}

	/** Replaces defaults with detected values; entities are initialized. */
	protected abstract void detectQualifiers(Document document);
}
