package org.clinlp.ie.processing;

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

/**
 * One step of a {@link ClinicalPipeline}. A stage annotates the document it is
 * given (sentences, entities, qualifiers) and returns it.
 */
public interface PipelineStage {

	Document process(Document document);

	/** Name used in log lines. */
	default String name() {
		return getClass().getSimpleName();
	}
}
