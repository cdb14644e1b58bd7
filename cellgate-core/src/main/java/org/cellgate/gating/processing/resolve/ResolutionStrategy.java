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


import java.util.Optional;

/**
 * One source of an answer for a gate. Resolvers try their strategies in rank
 * order and keep the first non-empty answer.
 */
@FunctionalInterface
public interface ResolutionStrategy {

	Optional<String> resolve(GateLookup lookup);

	/** The unmatched sentinel, {@code "!" + label}. Always answers. */
	static ResolutionStrategy unmatched() {
		return lookup -> Optional.of(OntologyResolver.UNMATCHED_PREFIX + lookup.getLabel());
	}

	/** Try {@code strategies} in order; empty only if every one is. */
	static Optional<String> firstOf(Iterable<ResolutionStrategy> strategies, GateLookup lookup) {
		for (ResolutionStrategy s : strategies) {
			Optional<String> r = s.resolve(lookup);
			if (r != null && r.isPresent() && !r.get().isEmpty()) {
				return r;
			}
		}
		return Optional.empty();
	}
}
