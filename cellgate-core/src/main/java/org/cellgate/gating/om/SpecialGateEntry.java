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

import org.apache.commons.lang3.StringUtils;

import lombok.Data;

/**
 * A marker with extra human-friendly names beyond its primary mapping,
 * including a "toxic" alternate spelling.
 */
@Data
public class SpecialGateEntry {

	private final String label;
	private final String ontologyId;
	private final List<String> synonyms;
	private final String toxicSynonym;

	public SpecialGateEntry(String label, String ontologyId, List<String> synonyms, String toxicSynonym) {
		this.label = label;
		this.ontologyId = ontologyId;
		this.synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
		this.toxicSynonym = toxicSynonym;
	}

	/**
	 * Case-insensitive match against the label, any synonym or the toxic
	 * synonym. An empty candidate never matches.
	 */
	public boolean matches(String candidate) {
		if (StringUtils.isEmpty(candidate)) {
			return false;
		}
		if (StringUtils.equalsIgnoreCase(label, candidate) || StringUtils.equalsIgnoreCase(toxicSynonym, candidate)) {
			return true;
		}
		for (String s : synonyms) {
			if (StringUtils.equalsIgnoreCase(s, candidate)) {
				return true;
			}
		}
		return false;
	}
}
