package org.clinlp.ie.entity;

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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.TokenAttribute;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConceptLoaderTest {

	@TempDir
	Path tmp;

	private Path write(String name, String content) throws IOException {
		Path f = tmp.resolve(name);
		Files.writeString(f, content, StandardCharsets.UTF_8);
		return f;
	}

	@Test
	void json_accepts_strings_objects_and_structured_patterns() throws Exception {
		Path f = write("concepts.json", "{\n"
				+ "  \"prematuriteit\": [\n"
				+ "    \"prematuur\",\n"
				+ "    {\"phrase\": \"prematuur ademhalingspatroon\", \"pseudo\": true},\n"
				+ "    {\"phrase\": \"Preterm\", \"attr\": \"NORM\", \"fuzzy\": 1, \"fuzzy_min_len\": 5, \"proximity\": 0}\n"
				+ "  ],\n"
				+ "  \"koorts\": [\n"
				+ "    [{\"NORM\": \"verhoging\"}, {\"OP\": \"?\"}, {\"NORM\": \"temperatuur\"}]\n"
				+ "  ]\n"
				+ "}");

		Map<String, List<Term>> concepts = ConceptLoader.load(f);

		assertEquals(List.of("prematuriteit", "koorts"), List.copyOf(concepts.keySet()));
		List<Term> terms = concepts.get("prematuriteit");
		assertEquals(3, terms.size());
		assertEquals("prematuur", terms.get(0).getPhrase());
		assertNull(terms.get(0).getPseudo());
		assertEquals(Boolean.TRUE, terms.get(1).getPseudo());
		assertEquals(TokenAttribute.NORM, terms.get(2).getAttr());
		assertEquals(1, terms.get(2).getFuzzy());
		assertEquals(5, terms.get(2).getFuzzyMinLen());
		assertEquals(0, terms.get(2).getProximity());

		Term structured = concepts.get("koorts").get(0);
		assertTrue(structured.isStructured());
		assertEquals(3, structured.getPattern().size());
	}

	@Test
	void json_concepts_wrapper_is_unwrapped() throws Exception {
		Path f = write("wrapped.json", "{\"concepts\": {\"hoest\": [\"hoest\", \"hoesten\"]}}");
		Map<String, List<Term>> concepts = ConceptLoader.fromJson(f);
		assertEquals(2, concepts.get("hoest").size());
	}

	@Test
	void json_errors_are_configuration_errors() throws Exception {
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromJson(write("a.json", "[\"hoest\"]")));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromJson(write("b.json", "{\"hoest\": \"hoest\"}")));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromJson(write("c.json", "{\"hoest\": [{\"attr\": \"NORM\"}]}")));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromJson(write("d.json", "{\"hoest\": [{\"phrase\": \"hoest\", \"fuzzy\": \"1\"}]}")));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromJson(write("e.json", "{\"hoest\": [{\"phrase\": \"hoest\", \"pseudo\": \"yes\"}]}")));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromJson(write("f.json", "{\"hoest\": [[{\"SHAPE\": \"xxxx\"}]]}")));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromJson(write("g.json", "{not json")));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromJson(tmp.resolve("missing.json")));
	}

	@Test
	void csv_rows_group_by_concept_in_any_order() throws Exception {
		Path f = write("concepts.csv", "Concept,Phrase,attr,proximity,fuzzy,fuzzy_min_len,pseudo\n"
				+ "prematuriteit,prematuur,,,,,\n"
				+ "hoest,hoesten,NORM,1.0,,,0\n"
				+ "prematuriteit,prematuur ademhalingspatroon,,,,,true\n");

		Map<String, List<Term>> concepts = ConceptLoader.load(f);

		assertEquals(List.of("prematuriteit", "hoest"), List.copyOf(concepts.keySet()));
		assertEquals(2, concepts.get("prematuriteit").size());
		assertEquals(Boolean.TRUE, concepts.get("prematuriteit").get(1).getPseudo());

		Term hoesten = concepts.get("hoest").get(0);
		assertEquals(TokenAttribute.NORM, hoesten.getAttr());
		assertEquals(1, hoesten.getProximity());
		assertNull(hoesten.getFuzzy());
		assertEquals(Boolean.FALSE, hoesten.getPseudo());
	}

	@Test
	void csv_with_only_required_columns() {
		Map<String, List<Term>> concepts = ConceptLoader.fromCsv(new StringReader("concept,phrase\nhoest,hoest\n"),
				"inline");
		assertEquals(1, concepts.get("hoest").size());
	}

	@Test
	void csv_errors_name_the_line() {
		ConfigurationException ex = assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromCsv(new StringReader("concept,phrase,fuzzy\nhoest,hoest,1\nhoest,hoesten,een\n"),
						"inline.csv"));
		assertTrue(ex.getMessage().contains("line"));
		assertTrue(ex.getMessage().contains("inline.csv"));

		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromCsv(new StringReader("concept,term\nhoest,hoest\n"), "inline.csv"));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromCsv(new StringReader("concept,phrase\nhoest,\n"), "inline.csv"));
		assertThrows(ConfigurationException.class,
				() -> ConceptLoader.fromCsv(new StringReader("concept,phrase,pseudo\nhoest,hoest,misschien\n"),
						"inline.csv"));
	}

	@Test
	void unsupported_extension_is_rejected() throws Exception {
		Path f = write("concepts.xlsx", "");
		assertThrows(ConfigurationException.class, () -> ConceptLoader.load(f));
	}
}
