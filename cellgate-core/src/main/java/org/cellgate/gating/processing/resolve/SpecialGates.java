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


import java.util.ArrayList;
import java.util.List;

import org.cellgate.gating.om.SpecialGateEntry;

/** Special gate entries in table order. */
public final class SpecialGates {

	private final List<SpecialGateEntry> entries;

	public SpecialGates(List<SpecialGateEntry> entries) {
		this.entries = entries == null ? List.of() : List.copyOf(entries);
	}

	public static SpecialGates empty() {
		return new SpecialGates(List.of());
	}

	/** Every entry naming {@code label}, in table order. */
	public List<SpecialGateEntry> matching(String label) {
		List<SpecialGateEntry> out = new ArrayList<>();
		for (SpecialGateEntry e : entries) {
			if (e.matches(label)) {
				out.add(e);
			}
		}
		return out;
	}

	public List<SpecialGateEntry> entries() {
		return entries;
	}

	public int size() {
		return entries.size();
	}
}
