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

import java.util.Collection;

import org.clinlp.ie.om.QualifierClass;
import org.clinlp.ie.processing.PipelineStage;

/**
 * Pipeline stage that assigns qualifiers to the entities already on a
 * document. After {@link #process} every entity holds exactly one qualifier
 * for each class the detector owns; qualifiers of other classes are left
 * alone, so detectors owning different classes can run one after another.
 */
public interface QualifierDetector extends PipelineStage {

	/** Classes this detector initializes and assigns. */
	Collection<QualifierClass> getQualifierClasses();
}
