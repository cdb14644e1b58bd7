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


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * Ontology identifier to display label. Identifiers are stored in compact form
 * so a full IRI and its CURIE find the same label.
 */
public final class PreferredLabelMap {

	private final Map<String, String> idToLabel;

	public PreferredLabelMap(Map<String, String> idToLabel) {
		Map<String, String> m = new LinkedHashMap<>();
		if (idToLabel != null) {
			idToLabel.forEach((k, v) -> m.put(CurieNormalizer.shorten(k), v));
		}
		this.idToLabel = Collections.unmodifiableMap(m);
	}

	public static PreferredLabelMap empty() {
		return new PreferredLabelMap(Map.of());
	}

	public Optional<String> lookup(String ontologyId) {
		if (StringUtils.isBlank(ontologyId)) {
			return Optional.empty();
		}
		return Optional.ofNullable(idToLabel.get(CurieNormalizer.shorten(ontologyId))).filter(StringUtils::isNotBlank);
	}

	public int size() {
		return idToLabel.size();
	}
}
