package org.cellgate.gating.processing;

/*
 * This file is part of CellGate.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * CellGate is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * CellGate is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with CellGate.  If not, see <https://www.gnu.org/licenses/>.
 */


import java.util.ArrayList;
import java.util.List;

import org.cellgate.gating.conf.ConfigLoader;
import org.cellgate.gating.om.GateToken;
import org.cellgate.gating.om.GatingResult;
import org.cellgate.gating.om.ResolvedGate;
import org.cellgate.gating.processing.load.ReferenceTables;
import org.cellgate.gating.processing.resolve.OntologyResolver;
import org.cellgate.gating.processing.tokenize.Tokenizer;

/**
 * Tokenizes and resolves one reported gating definition.
 */
public class GatingPipeline {

	/** Output column headers, in {@link GatingResult#toColumns()} order. */
	public static final List<String> OUTPUT_COLUMNS = List.of("Gating tokenized", "Gating mapped to ontologies",
			"Gating preferred labels", "MATCHED_GATES", "TOTAL_GATES");

	private final Tokenizer tokenizer;
	private final OntologyResolver resolver;
	private final String separator;

	public GatingPipeline(Tokenizer tokenizer, OntologyResolver resolver, String separator) {
		this.tokenizer = tokenizer;
		this.resolver = resolver;
		this.separator = separator == null ? ConfigLoader.DEFAULT_OUTPUT_SEPARATOR : separator;
	}

	public GatingPipeline(Tokenizer tokenizer, OntologyResolver resolver) {
		this(tokenizer, resolver, ConfigLoader.DEFAULT_OUTPUT_SEPARATOR);
	}

	/** Wire a pipeline over loaded reference tables. */
	public static GatingPipeline from(ReferenceTables tables, String separator) {
		Tokenizer tokenizer = new Tokenizer(tables.getSuffixTable());
		OntologyResolver resolver = new OntologyResolver(tables.getSuffixTable(), tables.getGateMappings(),
				tables.getSpecialGates(), tables.getPreferredLabels());
		return new GatingPipeline(tokenizer, resolver, separator);
	}

	public GatingResult process(String projectName, String reported) {
		List<GateToken> tokens = tokenizer.tokenizeGates(projectName, reported);
		List<ResolvedGate> gates = new ArrayList<>(tokens.size());
		for (GateToken t : tokens) {
			gates.add(resolver.resolve(t));
		}
		return new GatingResult(tokens, gates, separator);
	}

	public OntologyResolver getResolver() {
		return resolver;
	}
}
