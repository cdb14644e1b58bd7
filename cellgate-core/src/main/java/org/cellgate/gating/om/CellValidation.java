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


import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/** Outcome of checking an explicit gate list against a cell population. */
@Data
public class CellValidation {

	private String cellName;

	// Cell Ontology identifier, null when the name was not recognized
	private String cellId;
	private String cellLabel;

	// Gates from the cell definition followed by those written after '&'
	private List<ResolvedGate> cellGates = new ArrayList<>();
	private List<ResolvedGate> explicitGates = new ArrayList<>();
	private List<ConflictRecord> conflicts = new ArrayList<>();

	// True when some explicit gate could not be resolved
	private boolean hasErrors;

	public boolean isRecognized() {
		return cellId != null;
	}

	public boolean hasConflicts() {
		return !conflicts.isEmpty();
	}
}
