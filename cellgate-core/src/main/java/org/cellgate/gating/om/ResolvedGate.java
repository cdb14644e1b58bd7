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


import lombok.Data;

/**
 * A gate after identifier and preferred-label resolution. Unresolved gates
 * carry {@code "!" + label} in both the identifier and the preferred label.
 */
@Data
public class ResolvedGate {

	public static final String UNMATCHED_PREFIX = "!";

	// Label as tokenized, suffix removed
	private final String label;
	private final String ontologyId;
	private final String suffix;
	private final Level level;
	private final String preferredLabel;

	// Set by the conflict detector
	private boolean conflict;

	public boolean isMatched() {
		return ontologyId != null && !ontologyId.startsWith(UNMATCHED_PREFIX);
	}

	public String getOntologyText() {
		return ontologyId + suffix;
	}

	public String getPreferredText() {
		return preferredLabel + suffix;
	}
}
