package org.clinlp.ie.conf;

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
 * Raised at build/load time when rules, terms or configuration are malformed.
 * Never raised while processing a document.
 */
public class ConfigurationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
