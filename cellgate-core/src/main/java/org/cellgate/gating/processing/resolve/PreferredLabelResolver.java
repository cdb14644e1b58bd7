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


import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * Display label for a resolved gate: the preferred-label table, then the
 * special gate's own label, then {@code "!" + label}.
 */
public class PreferredLabelResolver {

	private final List<ResolutionStrategy> strategies;

	public PreferredLabelResolver(PreferredLabelMap preferredLabels) {
		this(standardStrategies(preferredLabels));
	}

	public PreferredLabelResolver(List<ResolutionStrategy> strategies) {
		this.strategies = List.copyOf(strategies);
	}

	static List<ResolutionStrategy> standardStrategies(PreferredLabelMap table) {
		ResolutionStrategy byTable = lookup -> {
			String id = lookup.getIdentifier();
			if (id == null || id.startsWith(OntologyResolver.UNMATCHED_PREFIX)) {
				return Optional.empty();
			}
			return table.lookup(id);
		};
		ResolutionStrategy bySpecialGate = lookup -> {
			if (lookup.getSpecial() == null) {
				return Optional.empty();
			}
			return Optional.ofNullable(lookup.getSpecial().getLabel()).filter(StringUtils::isNotBlank);
		};
		return List.of(byTable, bySpecialGate, ResolutionStrategy.unmatched());
	}

	public String resolve(GateLookup lookup) {
		return ResolutionStrategy.firstOf(strategies, lookup)
				.orElse(OntologyResolver.UNMATCHED_PREFIX + lookup.getLabel());
	}
}
