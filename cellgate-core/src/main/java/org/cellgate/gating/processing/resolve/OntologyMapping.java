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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * Canonical gate label to ontology identifier. Labels match exactly unless the
 * mapping was built case-folded.
 */
public final class OntologyMapping {

	private final Map<String, String> labelToId;
	private final boolean caseFolded;

	public OntologyMapping(Map<String, String> labelToId) {
		this(labelToId, false);
	}

	public OntologyMapping(Map<String, String> labelToId, boolean caseFolded) {
		this.caseFolded = caseFolded;
		Map<String, String> m = new LinkedHashMap<>();
		if (labelToId != null) {
			// first label wins when folding collapses two spellings
			labelToId.forEach((k, v) -> m.putIfAbsent(key(k), v));
		}
		this.labelToId = Collections.unmodifiableMap(m);
	}

	public static OntologyMapping empty() {
		return new OntologyMapping(Map.of());
	}

	private String key(String label) {
		return caseFolded ? label.toLowerCase(Locale.ROOT) : label;
	}

	public Optional<String> lookup(String label) {
		if (StringUtils.isEmpty(label)) {
			return Optional.empty();
		}
		return Optional.ofNullable(labelToId.get(key(label))).filter(StringUtils::isNotBlank);
	}

	public boolean isCaseFolded() {
		return caseFolded;
	}

	public int size() {
		return labelToId.size();
	}
}
