package org.cellgate.gating;

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


import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

import org.cellgate.gating.processing.conflict.CellDefinitions;
import org.cellgate.gating.processing.load.ReferenceTableLoader;
import org.cellgate.gating.processing.resolve.OntologyMapping;
import org.cellgate.gating.processing.resolve.OntologyResolver;
import org.cellgate.gating.processing.resolve.PreferredLabelMap;
import org.cellgate.gating.processing.resolve.SpecialGates;
import org.cellgate.gating.processing.tokenize.SuffixTable;

/** Reference tables from src/test/resources/reference. */
public final class TestTables {

	private TestTables() {
	}

	public static Path resource(String name) {
		URL url = TestTables.class.getResource("/reference/" + name);
		if (url == null) {
			throw new IllegalStateException("Missing test resource " + name);
		}
		try {
			return Path.of(url.toURI());
		} catch (URISyntaxException e) {
			throw new IllegalStateException("Bad test resource location " + url, e);
		}
	}

	public static SuffixTable suffixes() {
		return ReferenceTableLoader.loadValueScale(resource("value-scale.tsv"));
	}

	public static OntologyMapping gateMappings() {
		return ReferenceTableLoader.loadGateMappings(resource("gate-mappings.tsv"), false);
	}

	public static SpecialGates specialGates() {
		return ReferenceTableLoader.loadSpecialGates(resource("special-gates.tsv"));
	}

	public static PreferredLabelMap preferredLabels() {
		return ReferenceTableLoader.loadPreferredLabels(resource("preferred-labels.tsv"));
	}

	public static CellDefinitions cells() {
		return ReferenceTableLoader.loadCellDefinitions(resource("cell-levels.tsv"), resource("cell-names.tsv"));
	}

	public static OntologyResolver resolver() {
		return new OntologyResolver(suffixes(), gateMappings(), specialGates(), preferredLabels());
	}
}
