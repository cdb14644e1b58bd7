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
 * An explicit gate disagreeing on level with a gate of the cell population it
 * was reported for.
 */
@Data
public class ConflictRecord {

	private final ResolvedGate explicitGate;
	private final ResolvedGate cellGate;
	private final Severity severity;

	public Level getReportedLevel() {
		return explicitGate.getLevel();
	}

	public Level getExpectedLevel() {
		return cellGate.getLevel();
	}

	/** Readable explanation, named after the cell gate's preferred label. */
	public String getMessage() {
		String marker = cellGate.getPreferredLabel();
		Level expected = getExpectedLevel();
		if (severity == Severity.INFORMATIONAL && getReportedLevel() == Level.POSITIVE) {
			return "For this cell population, " + marker + " has " + expected.getLevelName() + " expression";
		}
		if (severity == Severity.INFORMATIONAL) {
			return "For this cell population, " + marker + " is positive, but not " + getReportedLevel().getLevelName();
		}
		return "For this cell population, " + marker + " must be " + expected.getLevelName();
	}
}
