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


import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Data;

/**
 * One row of the value scale: a canonical expression level name, its suffix
 * symbol and the spellings that mean the same thing.
 */
@Data
public class SuffixSpec {

	// Canonical level name, e.g. "high"
	private final String name;

	// Canonical suffix, e.g. "++"
	private final String symbol;

	// Alternate spellings in table order, e.g. "hi", "bright", "(high)"
	private final Set<String> synonyms;

	public SuffixSpec(String name, String symbol, Set<String> synonyms) {
		this.name = name;
		this.symbol = symbol;
		this.synonyms = synonyms == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(synonyms));
	}
}
