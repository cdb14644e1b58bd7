package org.cellgate.gating.processing.resolve;

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
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.cellgate.gating.om.GateToken;
import org.cellgate.gating.om.ResolvedGate;
import org.cellgate.gating.om.SpecialGateEntry;
import org.cellgate.gating.processing.tokenize.SuffixTable;
import org.cellgate.gating.util.Logger;

/**
 * Maps canonical tokens to ontology identifiers and preferred labels.
 *
 * <h3>Identifier strategies, in rank order</h3>
 * <ol>
 * <li>the gate mapping table</li>
 * <li>the identifier of a matching special gate</li>
 * <li>the unmatched sentinel {@code "!" + label}</li>
 * </ol>
 * Identifiers are reported in compact form. A missing label never throws and
 * never yields an empty identifier.
 */
public class OntologyResolver {

	public static final String UNMATCHED_PREFIX = ResolvedGate.UNMATCHED_PREFIX;

	private final SuffixTable suffixTable;
	private final SpecialGates specialGates;
	private final List<ResolutionStrategy> idStrategies;
	private final PreferredLabelResolver preferredLabels;

	public OntologyResolver(SuffixTable suffixTable, OntologyMapping mapping, SpecialGates specialGates,
			PreferredLabelMap preferredLabels) {
		this(suffixTable, specialGates, standardStrategies(mapping), new PreferredLabelResolver(preferredLabels));
	}

	public OntologyResolver(SuffixTable suffixTable, SpecialGates specialGates, List<ResolutionStrategy> idStrategies,
			PreferredLabelResolver preferredLabels) {
		this.suffixTable = suffixTable;
		this.specialGates = specialGates;
		this.idStrategies = List.copyOf(idStrategies);
		this.preferredLabels = preferredLabels;
	}

	static List<ResolutionStrategy> standardStrategies(OntologyMapping mapping) {
		ResolutionStrategy byMapping = lookup -> mapping.lookup(lookup.getLabel());
		ResolutionStrategy bySpecialGate = lookup -> {
			if (lookup.getSpecial() == null) {
				return Optional.empty();
			}
			return Optional.ofNullable(lookup.getSpecial().getOntologyId()).filter(StringUtils::isNotBlank);
		};
		return List.of(byMapping, bySpecialGate, ResolutionStrategy.unmatched());
	}

	public List<ResolvedGate> resolve(List<String> tokens) {
		List<ResolvedGate> out = new ArrayList<>();
		if (tokens != null) {
			for (String t : tokens) {
				out.add(resolve(t));
			}
		}
		return out;
	}

	public ResolvedGate resolve(String token) {
		return resolve(suffixTable.split(token));
	}

	public ResolvedGate resolve(GateToken token) {
		String label = token.getLabel();
		SpecialGateEntry special = findSpecial(label);

		GateLookup lookup = new GateLookup(label, special, null);
		String id = ResolutionStrategy.firstOf(idStrategies, lookup).orElse(UNMATCHED_PREFIX + label);
		id = CurieNormalizer.shorten(id);

		String preferred = preferredLabels.resolve(new GateLookup(label, special, id));
		return new ResolvedGate(label, id, token.getSuffix(), suffixTable.levelFor(token.getSuffix()), preferred);
	}

	private SpecialGateEntry findSpecial(String label) {
		List<SpecialGateEntry> matches = specialGates.matching(label);
		if (matches.isEmpty()) {
			return null;
		}
		if (matches.size() > 1) {
			Logger.warn("Gate '{}' matches {} special gates, using {}", label, matches.size(),
					matches.get(0).getOntologyId());
		}
		return matches.get(0);
	}

	public SuffixTable getSuffixTable() {
		return suffixTable;
	}
}
