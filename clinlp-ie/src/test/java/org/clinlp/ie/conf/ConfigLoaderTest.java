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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@BeforeEach
	void rememberSysProp() {
		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
	}

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void classpath_defaults_are_loaded() {
		System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		ConfigLoader loader = new ConfigLoader();

		assertEquals("context_rules.json", loader.getContextRules());
		assertEquals("NORM", loader.getContextAttr());
		assertNull(loader.getConceptsFile());
		assertNull(loader.getTokenizerModel());
		assertEquals(List.of(".", "!", "?"), loader.getSentEndChars());
		assertEquals(List.of("-", "*", "[", "("), loader.getSentStartPunct());
		assertEquals("OVERLAP", loader.getEntityPseudoExclusion());
		assertTrue(loader.isSentSplitOnNewline());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void missing_keys_fall_back_to_component_defaults() {
		ConfigLoader loader = new ConfigLoader(new Properties());

		assertEquals(ConfigLoader.DEFAULT_CONTEXT_RULES, loader.getContextRules());
		assertEquals("TEXT", loader.getContextAttr());
		assertEquals("TEXT", loader.getEntityAttr());
		assertEquals(0, loader.getEntityProximity());
		assertEquals(0, loader.getEntityFuzzy());
		assertEquals(0, loader.getEntityFuzzyMinLen());
		assertFalse(loader.isEntityPseudo());
		assertFalse(loader.isEntityResolveOverlap());
		assertTrue(loader.isNormalizerLowercase());
		assertTrue(loader.isNormalizerMapNonAscii());
	}

	@Test
	void system_property_overrides_classpath() throws Exception {
		Properties p = new Properties();
		p.setProperty("CONTEXT_RULES", "/rules/custom.json");
		p.setProperty("ENTITY_FUZZY", "2");
		p.setProperty("ENTITY_PSEUDO_EXCLUSION", "exact");
		Path f = writePropsFile(p, "override.properties");

		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toString());
		ConfigLoader loader = new ConfigLoader();

		assertEquals("/rules/custom.json", loader.getContextRules());
		assertEquals(2, loader.getEntityFuzzy());
		assertEquals("EXACT", loader.getEntityPseudoExclusion());
	}

	@Test
	void unreadable_system_property_fails() {
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, tmp.resolve("nope.properties").toString());
		ConfigurationException ex = assertThrows(ConfigurationException.class, ConfigLoader::new);
		assertTrue(ex.getMessage().contains("nope.properties"));
	}

	@Test
	void malformed_properties_file_fails() throws Exception {
		Path f = tmp.resolve("broken.properties");
		Files.writeString(f, "CONTEXT_ATTR=NORM\nENTITY_FUZZY=\\uZZZZ\n");

		ConfigurationException ex = assertThrows(ConfigurationException.class, () -> new ConfigLoader(f));
		assertTrue(ex.getMessage().contains("broken.properties"));

		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toString());
		assertThrows(ConfigurationException.class, ConfigLoader::new);
	}

	@Test
	void file_constructor_rejects_unreadable_path() {
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(tmp.resolve("missing.properties")));
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader((Path) null));
	}

	@Test
	void list_values_are_whitespace_separated() throws Exception {
		Properties p = new Properties();
		p.setProperty("SENT_END_CHARS", ".  ;\t!");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "lists.properties"));
		assertEquals(List.of(".", ";", "!"), loader.getSentEndChars());
	}

	@Test
	void validate_reports_every_malformed_value() {
		Properties p = new Properties();
		p.setProperty("ENTITY_PROXIMITY", "two");
		p.setProperty("ENTITY_FUZZY", "-1");
		p.setProperty("ENTITY_PSEUDO", "yes");
		p.setProperty("CONTEXT_ATTR", "LEMMA");
		p.setProperty("ENTITY_PSEUDO_EXCLUSION", "PARTIAL");
		p.setProperty("CONCEPTS_FILE", "concepts.xlsx");
		p.setProperty("CONTEXT_RULES_FILE", "rules.json");

		List<String> issues = new ConfigLoader(p).validate();

		assertEquals(7, issues.size());
		assertTrue(issues.stream().anyMatch(s -> s.contains("ENTITY_PROXIMITY")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("ENTITY_FUZZY")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("ENTITY_PSEUDO ")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("CONTEXT_ATTR")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("ENTITY_PSEUDO_EXCLUSION")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("CONCEPTS_FILE")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("CONTEXT_RULES_FILE")));
	}

	@Test
	void typed_getters_fail_on_malformed_values() {
		Properties p = new Properties();
		p.setProperty("ENTITY_PROXIMITY", "two");
		p.setProperty("ENTITY_RESOLVE_OVERLAP", "maybe");
		ConfigLoader loader = new ConfigLoader(p);

		assertThrows(ConfigurationException.class, loader::getEntityProximity);
		assertThrows(ConfigurationException.class, loader::isEntityResolveOverlap);
	}
}
