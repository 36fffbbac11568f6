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

/**
 * Signals that an upstream collaborator (tokenizer, sentencizer, entity
 * producer) handed over data that breaks the document model, e.g. tokens with
 * non-monotonic offsets or an entity crossing a sentence boundary.
 */
public class InputContractException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public InputContractException(String message) {
		super(message);
	}
}
