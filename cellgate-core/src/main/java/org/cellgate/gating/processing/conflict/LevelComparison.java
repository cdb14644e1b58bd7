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


import java.util.EnumMap;
import java.util.Map;

import org.cellgate.gating.om.Level;
import org.cellgate.gating.om.Severity;

/**
 * Severity of a reported level against the level a cell population expects.
 * Plain positive against high or low is informational; every other
 * difference, medium against positive included, is a hard conflict.
 */
public final class LevelComparison {

	private static final Map<Level, Map<Level, Severity>> TABLE = new EnumMap<>(Level.class);

	static {
		for (Level reported : Level.values()) {
			Map<Level, Severity> row = new EnumMap<>(Level.class);
			for (Level expected : Level.values()) {
				row.put(expected, classify(reported, expected));
			}
			TABLE.put(reported, row);
		}
	}

	private LevelComparison() {
	}

	private static Severity classify(Level reported, Level expected) {
		if (reported == expected) {
			return Severity.NONE;
		}
		if (reported == Level.POSITIVE && expected.isAmount()) {
			return Severity.INFORMATIONAL;
		}
		if (reported.isAmount() && expected == Level.POSITIVE) {
			return Severity.INFORMATIONAL;
		}
		return Severity.HARD;
	}

	public static Severity compare(Level reported, Level expected) {
		if (reported == null || expected == null) {
			return Severity.NONE;
		}
		return TABLE.get(reported).get(expected);
	}
}
