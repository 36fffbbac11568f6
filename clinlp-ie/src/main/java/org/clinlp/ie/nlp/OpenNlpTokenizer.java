package org.clinlp.ie.nlp;

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
import java.util.ArrayList;
import java.util.List;

import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.om.Document;
import org.clinlp.ie.om.Token;
import org.clinlp.ie.util.Logger;

import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.tokenize.TokenizerME;
import opennlp.tools.tokenize.TokenizerModel;

/**
 * {@link Tokenizer} backed by Apache OpenNLP. Without a model it uses the
 * rule-based {@link SimpleTokenizer} (splits on character class changes);
 * with a model it runs a {@link TokenizerME}, one instance per thread over a
 * shared model.
 */
public class OpenNlpTokenizer implements Tokenizer {

	private final TextNormalizer normalizer;
	private final TokenizerModel model;

	// TokenizerME is not thread safe; the model is
	private final ThreadLocal<TokenizerME> tokenizerMe;

	public OpenNlpTokenizer() {
		this(new TextNormalizer());
	}

	public OpenNlpTokenizer(TextNormalizer normalizer) {
		this(normalizer, null);
	}

	public OpenNlpTokenizer(TextNormalizer normalizer, TokenizerModel model) {
		this.normalizer = (normalizer == null) ? new TextNormalizer() : normalizer;
		this.model = model;
		this.tokenizerMe = (model == null) ? null : ThreadLocal.withInitial(() -> new TokenizerME(this.model));
	}

	/**
	 * Loads a tokenizer model from the file system or, failing that, the
	 * classpath.
	 *
	 * @throws ConfigurationException when the model cannot be found or read
	 */
	public static TokenizerModel loadModel(String path) {
		try (InputStream in = tryOpen(path)) {
			if (in == null) {
				throw new ConfigurationException("Tokenizer model not found: " + path);
			}
			TokenizerModel m = new TokenizerModel(in);
			Logger.info("Loaded OpenNLP tokenizer model from {}", path);
			return m;
		} catch (IOException e) {
			Logger.error("Failed to read tokenizer model {}: {}", path, e.getMessage());
			throw new ConfigurationException("Failed to read tokenizer model " + path, e);
		}
	}

	private static InputStream tryOpen(String path) throws IOException {
		Path p = Paths.get(path);
		if (Files.exists(p)) {
			return new FileInputStream(p.toFile());
		}
		return OpenNlpTokenizer.class.getClassLoader().getResourceAsStream(path);
	}

	public boolean usesModel() {
		return model != null;
	}

	@Override
	public Document tokenize(String text) {
		String safe = (text == null) ? "" : text;
		opennlp.tools.util.Span[] spans = (tokenizerMe == null)
				? SimpleTokenizer.INSTANCE.tokenizePos(safe)
				: tokenizerMe.get().tokenizePos(safe);

		List<Token> tokens = new ArrayList<>(spans.length);
		for (opennlp.tools.util.Span s : spans) {
			if (s.length() == 0) {
				continue;
			}
			String tokenText = safe.substring(s.getStart(), s.getEnd());
			tokens.add(new Token(tokens.size(), tokenText, normalizer.normalize(tokenText), s.getStart(), s.getEnd()));
		}
		return new Document(safe, tokens);
	}
}
