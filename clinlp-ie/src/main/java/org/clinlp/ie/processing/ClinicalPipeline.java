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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.clinlp.ie.conf.ConfigLoader;
import org.clinlp.ie.conf.ConfigurationException;
import org.clinlp.ie.entity.ConceptLoader;
import org.clinlp.ie.entity.EntityMatcher;
import org.clinlp.ie.entity.PseudoExclusion;
import org.clinlp.ie.entity.TermDefaults;
import org.clinlp.ie.matcher.TokenAttribute;
import org.clinlp.ie.nlp.OpenNlpTokenizer;
import org.clinlp.ie.nlp.Sentencizer;
import org.clinlp.ie.nlp.TextNormalizer;
import org.clinlp.ie.nlp.Tokenizer;
import org.clinlp.ie.om.Document;
import org.clinlp.ie.qualifier.ContextAlgorithm;
import org.clinlp.ie.qualifier.ContextRuleLoader;
import org.clinlp.ie.qualifier.ContextRuleStore;
import org.clinlp.ie.util.Logger;

/**
 * Tokenizer plus an ordered list of {@link PipelineStage}s. Stages are built
 * (and their rules validated) before the pipeline exists, so a configuration
 * error never surfaces halfway through a batch.
 *
 * <p>
 * A built pipeline keeps no per-document state: {@link #processAll} runs
 * documents in parallel.
 * </p>
 */
public class ClinicalPipeline {

	private final Tokenizer tokenizer;
	private final List<PipelineStage> stages;

	private ClinicalPipeline(Tokenizer tokenizer, List<PipelineStage> stages) {
		this.tokenizer = tokenizer;
		this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
	}

	public static Builder builder(Tokenizer tokenizer) {
		return new Builder(tokenizer);
	}

	/**
	 * Standard pipeline from configuration: sentencizer, entity matcher (when a
	 * concept file is configured) and the context algorithm.
	 *
	 * @throws ConfigurationException on invalid settings, rules or concepts
	 */
	public static ClinicalPipeline fromConfig(ConfigLoader config) {
		List<String> issues = config.validate();
		if (!issues.isEmpty()) {
			for (String issue : issues) {
				Logger.error("Configuration: {}", issue);
			}
			throw new ConfigurationException("Invalid configuration: " + String.join("; ", issues));
		}

		TextNormalizer normalizer = new TextNormalizer(config.isNormalizerLowercase(), config.isNormalizerMapNonAscii());
		String modelPath = config.getTokenizerModel();
		Tokenizer tokenizer = (modelPath == null) ? new OpenNlpTokenizer(normalizer)
				: new OpenNlpTokenizer(normalizer, OpenNlpTokenizer.loadModel(modelPath));

		Builder b = builder(tokenizer)
				.add(new Sentencizer(config.getSentEndChars(), config.getSentStartPunct(), config.isSentSplitOnNewline()));

		String conceptsFile = config.getConceptsFile();
		if (conceptsFile != null) {
			TermDefaults defaults = new TermDefaults(TokenAttribute.parse(config.getEntityAttr()),
					config.getEntityProximity(), config.getEntityFuzzy(), config.getEntityFuzzyMinLen(),
					config.isEntityPseudo());
			EntityMatcher matcher = new EntityMatcher(tokenizer, defaults, config.isEntityResolveOverlap(),
					PseudoExclusion.parse(config.getEntityPseudoExclusion()));
			matcher.loadConcepts(ConceptLoader.load(Path.of(conceptsFile)));
			b.add(matcher);
		} else {
			Logger.info("No CONCEPTS_FILE configured; entities must be supplied by another stage");
		}

		ContextRuleStore store = ContextRuleStore.build(ContextRuleLoader.load(config.getContextRules()), tokenizer,
				TokenAttribute.parse(config.getContextAttr()));
		b.add(new ContextAlgorithm(store));

		return b.build();
	}

	/** Tokenizes {@code text} and runs every stage in order. */
	public Document process(String text) {
		return process(tokenizer.tokenize(text));
	}

	/** Runs every stage over an already tokenized document. */
	public Document process(Document document) {
		Document doc = document;
		for (PipelineStage stage : stages) {
			doc = stage.process(doc);
		}
		if (Logger.isEnabled(Logger.Level.DEBUG)) {
			Logger.debug("Processed document: {} tokens, {} sentences, {} entities", doc.size(),
					doc.getSentences().size(), doc.getEntities().size());
		}
		return doc;
	}

	/** Processes texts independently in parallel; results keep input order. */
	public List<Document> processAll(Collection<String> texts) {
		List<String> in = new ArrayList<>(texts);
		Logger.info("Processing {} documents", in.size());
		return in.parallelStream().map(this::process).collect(Collectors.toList());
	}

	public Tokenizer getTokenizer() {
		return tokenizer;
	}

	public List<PipelineStage> getStages() {
		return stages;
	}

	/** Assembles a pipeline; stages run in the order added. */
	public static final class Builder {

		private final Tokenizer tokenizer;
		private final List<PipelineStage> stages = new ArrayList<>();

		private Builder(Tokenizer tokenizer) {
			this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
		}

		public Builder add(PipelineStage stage) {
			stages.add(Objects.requireNonNull(stage, "stage must not be null"));
			return this;
		}

		public ClinicalPipeline build() {
			ClinicalPipeline p = new ClinicalPipeline(tokenizer, stages);
			Logger.info("Pipeline: {}", stages.stream().map(PipelineStage::name).collect(Collectors.joining(" -> ")));
			return p;
		}
	}
}
