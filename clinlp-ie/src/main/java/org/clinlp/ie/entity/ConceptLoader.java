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

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.matcher.StructuredPattern;
import org.clinlp.ie.matcher.TokenAttribute;
import org.clinlp.ie.util.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads concept dictionaries (concept identifier to terms) from JSON or CSV.
 *
 * <p>
 * JSON: an object mapping each concept to a list whose entries are a phrase
 * string, a term object
 * ({@code phrase, attr, proximity, fuzzy, fuzzy_min_len, pseudo}) or a
 * structured pattern (list of token objects). A top-level {@code "concepts"}
 * wrapper is accepted as well.
 * </p>
 * <p>
 * CSV: header row with a {@code concept} and a {@code phrase} column and
 * optionally {@code attr, proximity, fuzzy, fuzzy_min_len, pseudo}. One phrase
 * per row, any row order; empty cells fall back to the matcher defaults.
 * </p>
 */
public final class ConceptLoader {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private static final String COL_CONCEPT = "concept";
	private static final String COL_PHRASE = "phrase";
	private static final String COL_ATTR = "attr";
	private static final String COL_PROXIMITY = "proximity";
	private static final String COL_FUZZY = "fuzzy";
	private static final String COL_FUZZY_MIN_LEN = "fuzzy_min_len";
	private static final String COL_PSEUDO = "pseudo";

	private ConceptLoader() {
	}

	/** Picks the JSON or CSV reader by file extension. */
	public static Map<String, List<Term>> load(Path file) {
		String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
		if (name.endsWith(".csv")) {
			return fromCsv(file);
		}
		if (name.endsWith(".json")) {
			return fromJson(file);
		}
		throw new ConfigurationException("Unsupported concept file type (expected .json or .csv): " + file);
	}

	// ---------------- JSON -----------------------------------------------------

	public static Map<String, List<Term>> fromJson(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			return fromJson(in, file.toString());
		} catch (IOException e) {
			Logger.error("Failed to read concept file {}: {}", file, e.getMessage());
			throw new ConfigurationException("Failed to read concept file " + file, e);
		}
	}

	public static Map<String, List<Term>> fromJson(InputStream in, String source) {
		JsonNode root;
		try {
			root = MAPPER.readTree(in);
		} catch (IOException e) {
			Logger.error("Concept file {} is not valid JSON: {}", source, e.getMessage());
			throw new ConfigurationException("Concept file " + source + " is not valid JSON", e);
		}
		if (root != null && root.isObject() && root.size() == 1 && root.has("concepts")) {
			root = root.get("concepts");
		}
		if (root == null || !root.isObject()) {
			throw new ConfigurationException("Concept file " + source + " must contain a JSON object.");
		}

		Map<String, List<Term>> concepts = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> it = root.fields();
		while (it.hasNext()) {
			Map.Entry<String, JsonNode> e = it.next();
			String concept = e.getKey();
			if (!e.getValue().isArray()) {
				throw new ConfigurationException("Terms of concept '" + concept + "' must be a list in " + source + ".");
			}
			List<Term> terms = concepts.computeIfAbsent(concept, c -> new ArrayList<>());
			int i = 0;
			for (JsonNode node : e.getValue()) {
				terms.add(parseJsonTerm(node, concept + "[" + i++ + "] in " + source));
			}
		}
		Logger.info("Loaded {} concepts from {}", concepts.size(), source);
		return concepts;
	}

	private static Term parseJsonTerm(JsonNode node, String where) {
		if (node.isTextual()) {
			return new Term(node.asText());
		}
		if (node.isArray()) {
			List<Object> tokens = MAPPER.convertValue(node, new TypeReference<List<Object>>() {
			});
			return Term.structured(StructuredPattern.parse(tokens, where));
		}
		if (node.isObject()) {
			JsonNode phrase = node.get(COL_PHRASE);
			if (phrase == null || !phrase.isTextual()) {
				throw new ConfigurationException("Term object without a 'phrase' string: " + where);
			}
			Term t = new Term(phrase.asText());
			t.setAttr(node.hasNonNull(COL_ATTR) ? TokenAttribute.parse(node.get(COL_ATTR).asText()) : null);
			t.setProximity(jsonInt(node, COL_PROXIMITY, where));
			t.setFuzzy(jsonInt(node, COL_FUZZY, where));
			t.setFuzzyMinLen(jsonInt(node, COL_FUZZY_MIN_LEN, where));
			if (node.hasNonNull(COL_PSEUDO)) {
				JsonNode p = node.get(COL_PSEUDO);
				if (!p.isBoolean()) {
					throw new ConfigurationException("'pseudo' must be true or false: " + where);
				}
				t.setPseudo(p.asBoolean());
			}
			t.validate();
			return t;
		}
		throw new ConfigurationException("Unsupported term '" + node + "': " + where);
	}

	private static Integer jsonInt(JsonNode node, String field, String where) {
		if (!node.hasNonNull(field)) {
			return null;
		}
		JsonNode v = node.get(field);
		if (!v.canConvertToInt() || !v.isIntegralNumber()) {
			throw new ConfigurationException("'" + field + "' must be an integer: " + where);
		}
		return v.asInt();
	}

	// ---------------- CSV ------------------------------------------------------

	public static Map<String, List<Term>> fromCsv(Path file) {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return fromCsv(reader, file.toString());
		} catch (IOException e) {
			Logger.error("Failed to read concept file {}: {}", file, e.getMessage());
			throw new ConfigurationException("Failed to read concept file " + file, e);
		}
	}

	public static Map<String, List<Term>> fromCsv(Reader reader, String source) {
		CSVFormat format = CSVFormat.DEFAULT.withDelimiter(',').withHeader().withIgnoreHeaderCase().withTrim();

		Map<String, List<Term>> concepts = new LinkedHashMap<>();
		try (CSVParser parser = format.parse(reader)) {
			Map<String, Integer> header = parser.getHeaderMap();
			if (!containsIgnoreCase(header, COL_CONCEPT) || !containsIgnoreCase(header, COL_PHRASE)) {
				throw new ConfigurationException(
						"Concept CSV " + source + " needs 'concept' and 'phrase' columns, found " + header.keySet());
			}
			for (CSVRecord record : parser) {
				String where = "line " + (record.getRecordNumber() + 1) + " of " + source;
				String concept = cell(record, COL_CONCEPT);
				String phrase = cell(record, COL_PHRASE);
				if (concept == null || phrase == null) {
					throw new ConfigurationException("Missing concept or phrase on " + where);
				}
				Term t = new Term(phrase);
				try {
					String attr = cell(record, COL_ATTR);
					t.setAttr((attr == null) ? null : TokenAttribute.parse(attr));
					t.setProximity(csvInt(record, COL_PROXIMITY));
					t.setFuzzy(csvInt(record, COL_FUZZY));
					t.setFuzzyMinLen(csvInt(record, COL_FUZZY_MIN_LEN));
					t.setPseudo(csvBool(record, COL_PSEUDO));
					t.validate();
				} catch (ConfigurationException | NumberFormatException ex) {
					throw new ConfigurationException("Cannot parse " + where + ": " + ex.getMessage(), ex);
				}
				concepts.computeIfAbsent(concept, c -> new ArrayList<>()).add(t);
			}
		} catch (IOException | UncheckedIOException e) {
			Logger.error("Failed to parse concept CSV {}: {}", source, e.getMessage());
			throw new ConfigurationException("Failed to parse concept CSV " + source, e);
		}
		Logger.info("Loaded {} concepts from {}", concepts.size(), source);
		return concepts;
	}

	private static boolean containsIgnoreCase(Map<String, Integer> header, String column) {
		for (String h : header.keySet()) {
			if (h.equalsIgnoreCase(column)) {
				return true;
			}
		}
		return false;
	}

	private static String cell(CSVRecord record, String column) {
		if (!record.isMapped(column) || !record.isSet(column)) {
			return null;
		}
		String v = record.get(column);
		return (v == null || v.isBlank()) ? null : v.trim();
	}

	private static Integer csvInt(CSVRecord record, String column) {
		String v = cell(record, column);
		if (v == null) {
			return null;
		}
		// pandas writes integer columns with gaps as floats
		if (v.endsWith(".0")) {
			v = v.substring(0, v.length() - 2);
		}
		return Integer.valueOf(v);
	}

	private static Boolean csvBool(CSVRecord record, String column) {
		String v = cell(record, column);
		if (v == null) {
			return null;
		}
		if ("true".equalsIgnoreCase(v) || "1".equals(v)) {
			return Boolean.TRUE;
		}
		if ("false".equalsIgnoreCase(v) || "0".equals(v)) {
			return Boolean.FALSE;
		}
		throw new ConfigurationException("'" + column + "' must be true or false, got '" + v + "'");
	}
}
