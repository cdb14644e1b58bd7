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


import org.cellgate.gating.om.SpecialGateEntry;

import lombok.Data;

/** What a resolution strategy gets to work with for one gate. */
@Data
public class GateLookup {

	// Label with the suffix stripped
	private final String label;

	// Matching special gate, may be null
	private final SpecialGateEntry special;

	// Identifier resolved so far, may be null
	private final String identifier;
}
