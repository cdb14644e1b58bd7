package org.cellgate.gating.processing.conflict;

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
import java.util.Objects;

import org.cellgate.gating.om.ConflictRecord;
import org.cellgate.gating.om.ResolvedGate;
import org.cellgate.gating.om.Severity;
import org.cellgate.gating.util.Logger;

/**
 * Pairs explicit gates with the gates of a cell population that name the same
 * marker at a different level. Both gates of a pair are flagged.
 */
public class ConflictDetector {

	/**
	 * @param cellGates     gates of the cell definition and its description
	 * @param explicitGates gates reported for the population
	 * @return one record per disagreeing pair, explicit gate order first
	 */
	public List<ConflictRecord> detectConflicts(List<ResolvedGate> cellGates, List<ResolvedGate> explicitGates) {
		List<ConflictRecord> conflicts = new ArrayList<>();
		if (cellGates == null || explicitGates == null) {
			return conflicts;
		}

		for (ResolvedGate explicit : explicitGates) {
			if (!explicit.isMatched()) {
				continue;
			}
			for (ResolvedGate cell : cellGates) {
				if (!cell.isMatched() || !Objects.equals(explicit.getOntologyId(), cell.getOntologyId())) {
					continue;
				}
				Severity severity = LevelComparison.compare(explicit.getLevel(), cell.getLevel());
				if (severity == Severity.NONE) {
					continue;
				}
				explicit.setConflict(true);
				cell.setConflict(true);
				ConflictRecord record = new ConflictRecord(explicit, cell, severity);
				Logger.debug("Conflict on {}: {} vs {} ({})", explicit.getOntologyId(), explicit.getLevel(),
						cell.getLevel(), severity);
				conflicts.add(record);
			}
		}
		return conflicts;
	}
}
