package org.cellgate.gating.processing.load;

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


/**
 * Thrown when a reference table is missing, unreadable or malformed.
 */
public class ReferenceTableException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ReferenceTableException(String message) {
		super(message);
	}

	public ReferenceTableException(String message, Throwable cause) {
		super(message, cause);
	}
}
