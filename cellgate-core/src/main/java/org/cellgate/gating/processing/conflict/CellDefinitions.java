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


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.cellgate.gating.om.CellGateDefinition;
import org.cellgate.gating.processing.resolve.CurieNormalizer;

/**
 * Known cell populations: their defining gates and their names. Identifiers
 * are kept in compact form.
 */
public final class CellDefinitions {

	private final Map<String, CellGateDefinition> definitions = new LinkedHashMap<>();
	private final Map<String, String> nameToId = new LinkedHashMap<>();
	private final Map<String, String> idToLabel = new LinkedHashMap<>();

	/**
	 * @param definitions cell gate definitions
	 * @param names       (identifier, name) pairs; the first name per identifier
	 *                    is its label, the rest are synonyms
	 */
	public CellDefinitions(List<CellGateDefinition> definitions, List<Map.Entry<String, String>> names) {
		if (definitions != null) {
			for (CellGateDefinition d : definitions) {
				this.definitions.put(CurieNormalizer.shorten(d.getCellId()), d);
			}
		}
		if (names != null) {
			for (Map.Entry<String, String> e : names) {
				String id = CurieNormalizer.shorten(e.getKey());
				String name = StringUtils.trimToEmpty(e.getValue());
				if (name.isEmpty()) {
					continue;
				}
				idToLabel.putIfAbsent(id, name);
				nameToId.putIfAbsent(name.toLowerCase(Locale.ROOT), id);
			}
		}
	}

	public static CellDefinitions empty() {
		return new CellDefinitions(List.of(), List.of());
	}

	/**
	 * Identifier for a cell name, synonym, CURIE or IRI. Names match
	 * case-insensitively; identifiers must be known.
	 */
	public Optional<String> findCellId(String nameOrId) {
		if (StringUtils.isBlank(nameOrId)) {
			return Optional.empty();
		}
		String key = nameOrId.trim();
		String byName = nameToId.get(key.toLowerCase(Locale.ROOT));
		if (byName != null) {
			return Optional.of(byName);
		}
		String id = CurieNormalizer.shorten(key);
		if (idToLabel.containsKey(id) || definitions.containsKey(id)) {
			return Optional.of(id);
		}
		return Optional.empty();
	}

	public Optional<CellGateDefinition> definition(String cellId) {
		return Optional.ofNullable(definitions.get(CurieNormalizer.shorten(cellId)));
	}

	public Optional<String> label(String cellId) {
		return Optional.ofNullable(idToLabel.get(CurieNormalizer.shorten(cellId)));
	}

	public Map<String, CellGateDefinition> definitions() {
		return Collections.unmodifiableMap(definitions);
	}
}
