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


import java.util.Locale;

/**
 * Expression levels a gate can assert, with the Cell Ontology relation used
 * to state each level in a cell definition.
 */
public enum Level {

	POSITIVE("positive", "http://purl.obolibrary.org/obo/RO_0002104"),
	NEGATIVE("negative", "http://purl.obolibrary.org/obo/cl#lacks_plasma_membrane_part"),
	HIGH("high", "http://purl.obolibrary.org/obo/cl#has_high_plasma_membrane_amount"),
	MEDIUM("medium", null),
	LOW("low", "http://purl.obolibrary.org/obo/cl#has_low_plasma_membrane_amount");

	private final String levelName;
	private final String relationIri;

	Level(String levelName, String relationIri) {
		this.levelName = levelName;
		this.relationIri = relationIri;
	}

	public String getLevelName() {
		return levelName;
	}

	/** Relation IRI, or {@code null} when the level has no relation. */
	public String getRelationIri() {
		return relationIri;
	}

	/** High and low state an amount of a positive marker. Medium does not. */
	public boolean isAmount() {
		return this == HIGH || this == LOW;
	}

	/**
	 * Look up a level by its name, case-insensitively.
	 *
	 * @param name     level name such as "high"
	 * @param fallback returned when the name is unknown
	 */
	public static Level fromName(String name, Level fallback) {
		if (name == null) {
			return fallback;
		}
		String n = name.trim().toLowerCase(Locale.ROOT);
		for (Level l : values()) {
			if (l.levelName.equals(n)) {
				return l;
			}
		}
		return fallback;
	}
}
