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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.util.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a {@link RulesDefinition} from JSON. A location is tried as a file
 * first, then as a classpath resource (the bundled {@code context_rules.json}
 * is found this way).
 */
public final class ContextRuleLoader {

	/** Rule file bundled with the library. */
	public static final String DEFAULT_RULES_RESOURCE = "context_rules.json";

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private ContextRuleLoader() {
	}

	/** The bundled rules. */
	public static RulesDefinition loadDefault() {
		return load(DEFAULT_RULES_RESOURCE);
	}

	/**
	 * @param location file path or classpath resource
	 * @throws ConfigurationException when nothing is found or the JSON is invalid
	 */
	public static RulesDefinition load(String location) {
		if (location == null || location.isBlank()) {
			throw new ConfigurationException("No context rules location given.");
		}
		try (InputStream in = open(location)) {
			if (in == null) {
				Logger.error("Context rules not found on file system or classpath: {}", location);
				throw new ConfigurationException("Context rules not found: " + location);
			}
			return fromStream(in, location);
		} catch (IOException e) {
			Logger.error("Failed to read context rules {}: {}", location, e.getMessage());
			throw new ConfigurationException("Failed to read context rules " + location, e);
		}
	}

	public static RulesDefinition fromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			return fromStream(in, file.toString());
		} catch (IOException e) {
			Logger.error("Failed to read context rules {}: {}", file, e.getMessage());
			throw new ConfigurationException("Failed to read context rules " + file, e);
		}
	}

	public static RulesDefinition fromStream(InputStream in, String source) {
		RulesDefinition def;
		try {
			def = MAPPER.readValue(in, RulesDefinition.class);
		} catch (IOException e) {
			Logger.error("Context rules {} are malformed: {}", source, e.getMessage());
			throw new ConfigurationException("Context rules " + source + " are malformed: " + e.getMessage(), e);
		}
		if (def == null) {
			throw new ConfigurationException("Context rules " + source + " are empty.");
		}
		Logger.info("Read {} qualifier classes and {} rules from {}", sizeOf(def.getQualifiers()),
				sizeOf(def.getRules()), source);
		return def;
	}

	private static int sizeOf(List<?> list) {
		return (list == null) ? 0 : list.size();
	}

	private static InputStream open(String location) throws IOException {
		Path p = Paths.get(location);
		if (Files.isRegularFile(p)) {
			return new FileInputStream(p.toFile());
		}
		InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(location);
		if (in == null) {
			in = ContextRuleLoader.class.getClassLoader().getResourceAsStream(location);
		}
		return in;
	}
}
