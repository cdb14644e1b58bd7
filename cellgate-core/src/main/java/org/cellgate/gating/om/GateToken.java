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
 * A marker label with its canonical suffix symbol. An empty suffix means
 * positive by convention.
 */
@Data
public class GateToken {

	private final String label;
	private final String suffix;

	public GateToken(String label, String suffix) {
		this.label = label == null ? "" : label;
		this.suffix = suffix == null ? "" : suffix;
	}

	public String getText() {
		return label + suffix;
	}

	@Override
	public String toString() {
		return getText();
	}
}
