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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.clinlp.ie.matcher.TokenAttribute;
import org.clinlp.ie.util.Logger;

/**
 * Loads configuration for the clinical IE pipeline from a {@code .properties}
 * file.
 * <p>
 * By default, this loader reads <code>config/clinlp.properties</code> from the
 * classpath. You can override this by setting the system property
 * <code>clinlp.config</code> to an absolute path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Every key is optional; getters fall back to the built-in defaults of the
 * corresponding component.</li>
 * <li>List-valued keys (sentence characters) are whitespace separated.</li>
 * <li>Use {@link #validate()} during startup to check for malformed
 * values.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/clinlp.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "clinlp.config";

	/** Rule file bundled with the library. */
	public static final String DEFAULT_CONTEXT_RULES = "context_rules.json";

	// ---- Property keys -------------------------------------------------------
	private static final String K_CONTEXT_RULES = "CONTEXT_RULES";
	private static final String K_CONTEXT_ATTR = "CONTEXT_ATTR";

	private static final String K_CONCEPTS_FILE = "CONCEPTS_FILE";
	private static final String K_ENTITY_ATTR = "ENTITY_ATTR";
	private static final String K_ENTITY_PROXIMITY = "ENTITY_PROXIMITY";
	private static final String K_ENTITY_FUZZY = "ENTITY_FUZZY";
	private static final String K_ENTITY_FUZZY_MIN_LEN = "ENTITY_FUZZY_MIN_LEN";
	private static final String K_ENTITY_PSEUDO = "ENTITY_PSEUDO";
	private static final String K_ENTITY_RESOLVE_OVERLAP = "ENTITY_RESOLVE_OVERLAP";
	private static final String K_ENTITY_PSEUDO_EXCLUSION = "ENTITY_PSEUDO_EXCLUSION";

	private static final String K_NORMALIZER_LOWERCASE = "NORMALIZER_LOWERCASE";
	private static final String K_NORMALIZER_MAP_NON_ASCII = "NORMALIZER_MAP_NON_ASCII";

	private static final String K_SENT_END_CHARS = "SENT_END_CHARS";
	private static final String K_SENT_START_PUNCT = "SENT_START_PUNCT";
	private static final String K_SENT_SPLIT_ON_NEWLINE = "SENT_SPLIT_ON_NEWLINE";

	private static final String K_TOKENIZER_MODEL = "TOKENIZER_MODEL";

	private static final List<String> INT_KEYS = Arrays.asList(K_ENTITY_PROXIMITY, K_ENTITY_FUZZY,
			K_ENTITY_FUZZY_MIN_LEN);
	private static final List<String> BOOL_KEYS = Arrays.asList(K_ENTITY_PSEUDO, K_ENTITY_RESOLVE_OVERLAP,
			K_NORMALIZER_LOWERCASE, K_NORMALIZER_MAP_NON_ASCII, K_SENT_SPLIT_ON_NEWLINE);

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 *
	 * @throws ConfigurationException if the configured file or the default
	 *                                resource cannot be read
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (!Files.isReadable(p)) {
				Logger.error("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
				throw new ConfigurationException(
						"System property " + SYS_PROP_CONFIG_PATH + " points to an unreadable path: " + p);
			}
			loadFromFile(p);
			return;
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 * @throws ConfigurationException   if the file is not a valid properties file
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Create a loader over already loaded properties (copied). */
	public ConfigLoader(Properties props) {
		properties.putAll(props);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks values that would otherwise fail later when the pipeline is built.
	 * This does not fail; it returns a list of human-readable issues.
	 *
	 * @return list of error strings; empty if the configuration looks OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		for (String key : INT_KEYS) {
			String raw = getOptional(key, null);
			if (raw == null) {
				continue;
			}
			try {
				if (Integer.parseInt(raw) < 0) {
					issues.add("Property " + key + " must not be negative: " + raw);
				}
			} catch (NumberFormatException nfe) {
				issues.add("Property " + key + " is not an integer: " + raw);
			}
		}
		for (String key : BOOL_KEYS) {
			String raw = getOptional(key, null);
			if (raw != null && !"true".equalsIgnoreCase(raw) && !"false".equalsIgnoreCase(raw)) {
				issues.add("Property " + key + " must be true or false: " + raw);
			}
		}
		for (String key : Arrays.asList(K_CONTEXT_ATTR, K_ENTITY_ATTR)) {
			String raw = getOptional(key, null);
			if (raw != null && !TokenAttribute.isAttributeName(raw)) {
				issues.add("Property " + key + " must be one of TEXT, ORTH, NORM, LOWER: " + raw);
			}
		}
		String exclusion = getOptional(K_ENTITY_PSEUDO_EXCLUSION, null);
		if (exclusion != null && !"EXACT".equalsIgnoreCase(exclusion) && !"OVERLAP".equalsIgnoreCase(exclusion)) {
			issues.add("Property " + K_ENTITY_PSEUDO_EXCLUSION + " must be EXACT or OVERLAP: " + exclusion);
		}
		String concepts = getOptional(K_CONCEPTS_FILE, null);
		if (concepts != null) {
			String lower = concepts.toLowerCase(Locale.ROOT);
			if (!lower.endsWith(".json") && !lower.endsWith(".csv")) {
				issues.add("Property " + K_CONCEPTS_FILE + " must name a .json or .csv file: " + concepts);
			}
		}
		if (properties.containsKey("CONTEXT_RULES_FILE")) {
			issues.add("Found deprecated/typo key 'CONTEXT_RULES_FILE'. Use '" + K_CONTEXT_RULES + "'.");
		}
		return issues;
	}

	/** Rules JSON: file path or classpath resource. */
	public String getContextRules() {
		return getOptional(K_CONTEXT_RULES, DEFAULT_CONTEXT_RULES);
	}

	/** Token attribute trigger phrases are matched on. */
	public String getContextAttr() {
		return getOptional(K_CONTEXT_ATTR, "TEXT");
	}

	/** Optional concept dictionary (.json or .csv); null when not configured. */
	public String getConceptsFile() {
		return getOptional(K_CONCEPTS_FILE, null);
	}

	public String getEntityAttr() {
		return getOptional(K_ENTITY_ATTR, "TEXT");
	}

	public int getEntityProximity() {
		return getInt(K_ENTITY_PROXIMITY, 0);
	}

	public int getEntityFuzzy() {
		return getInt(K_ENTITY_FUZZY, 0);
	}

	public int getEntityFuzzyMinLen() {
		return getInt(K_ENTITY_FUZZY_MIN_LEN, 0);
	}

	public boolean isEntityPseudo() {
		return getBoolean(K_ENTITY_PSEUDO, false);
	}

	public boolean isEntityResolveOverlap() {
		return getBoolean(K_ENTITY_RESOLVE_OVERLAP, false);
	}

	/** {@code EXACT} or {@code OVERLAP}. */
	public String getEntityPseudoExclusion() {
		return getOptional(K_ENTITY_PSEUDO_EXCLUSION, "OVERLAP").toUpperCase(Locale.ROOT);
	}

	public boolean isNormalizerLowercase() {
		return getBoolean(K_NORMALIZER_LOWERCASE, true);
	}

	public boolean isNormalizerMapNonAscii() {
		return getBoolean(K_NORMALIZER_MAP_NON_ASCII, true);
	}

	public List<String> getSentEndChars() {
		return getList(K_SENT_END_CHARS, Arrays.asList(".", "!", "?"));
	}

	public List<String> getSentStartPunct() {
		return getList(K_SENT_START_PUNCT, Arrays.asList("-", "*", "[", "("));
	}

	public boolean isSentSplitOnNewline() {
		return getBoolean(K_SENT_SPLIT_ON_NEWLINE, true);
	}

	/** Optional OpenNLP tokenizer model; null selects the rule-based tokenizer. */
	public String getTokenizerModel() {
		return getOptional(K_TOKENIZER_MODEL, null);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				throw new ConfigurationException("Unable to find configuration resource on classpath: " + resource);
			}
			load(in);
		} catch (IOException | IllegalArgumentException ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
			throw new ConfigurationException("Failed to load properties from classpath: " + resource, ex);
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			load(in);
		} catch (IOException | IllegalArgumentException ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
			throw new ConfigurationException("Failed to load properties from file: " + file, ex);
		}
	}

	// all or nothing: a malformed line leaves no half-loaded keys behind
	private void load(InputStream in) throws IOException {
		Properties loaded = new Properties();
		loaded.load(in);
		properties.putAll(loaded);
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private int getInt(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Integer.parseInt(raw);
		} catch (NumberFormatException nfe) {
			throw new ConfigurationException("Property " + key + " is not an integer: '" + raw + "'", nfe);
		}
	}

	private boolean getBoolean(String key, boolean defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		if ("true".equalsIgnoreCase(raw))
			return true;
		if ("false".equalsIgnoreCase(raw))
			return false;
		throw new ConfigurationException("Property " + key + " must be true or false: '" + raw + "'");
	}

	private List<String> getList(String key, List<String> defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		return Arrays.asList(raw.split("\\s+"));
	}
}
