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

import lombok.Data;

/** The gates that define a cell type, in table order. */
@Data
public class CellGateDefinition {

	private final String cellId;
	private final List<Entry> entries;

	public CellGateDefinition(String cellId, List<Entry> entries) {
		this.cellId = cellId;
		this.entries = entries == null ? List.of() : List.copyOf(entries);
	}

	@Data
	public static class Entry {
		private final String markerId;
		private final Level level;
	}
}
