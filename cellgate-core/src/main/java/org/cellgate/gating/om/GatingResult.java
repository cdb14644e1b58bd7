package org.cellgate.gating.om;

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


import java.util.List;
import java.util.stream.Collectors;

import lombok.Data;

/** Tokens and resolved gates for one reported gating definition. */
@Data
public class GatingResult {

	private final List<GateToken> tokens;
	private final List<ResolvedGate> gates;
	private final String separator;

	public GatingResult(List<GateToken> tokens, List<ResolvedGate> gates, String separator) {
		this.tokens = List.copyOf(tokens);
		this.gates = List.copyOf(gates);
		this.separator = separator;
	}

	public String getTokenized() {
		return tokens.stream().map(GateToken::getText).collect(Collectors.joining(separator));
	}

	public String getOntologyMapped() {
		return gates.stream().map(ResolvedGate::getOntologyText).collect(Collectors.joining(separator));
	}

	public String getPreferredLabels() {
		return gates.stream().map(ResolvedGate::getPreferredText).collect(Collectors.joining(separator));
	}

	public int getMatchedCount() {
		return (int) gates.stream().filter(ResolvedGate::isMatched).count();
	}

	public int getTotalCount() {
		return gates.size();
	}

	/** Output columns: tokenized, ontology-mapped, preferred labels, matched, total. */
	public List<String> toColumns() {
		return List.of(getTokenized(), getOntologyMapped(), getPreferredLabels(),
				String.valueOf(getMatchedCount()), String.valueOf(getTotalCount()));
	}
}
