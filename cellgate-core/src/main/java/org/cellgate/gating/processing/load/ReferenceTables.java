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


import java.nio.file.Path;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.cellgate.gating.conf.ConfigLoader;
import org.cellgate.gating.processing.conflict.CellDefinitions;
import org.cellgate.gating.processing.resolve.OntologyMapping;
import org.cellgate.gating.processing.resolve.PreferredLabelMap;
import org.cellgate.gating.processing.resolve.SpecialGates;
import org.cellgate.gating.processing.tokenize.SuffixTable;

import lombok.Data;

/** Every lookup table a run needs, loaded once. */
@Data
public class ReferenceTables {

	private final SuffixTable suffixTable;
	private final OntologyMapping gateMappings;
	private final SpecialGates specialGates;
	private final PreferredLabelMap preferredLabels;
	private final CellDefinitions cellDefinitions;
	private final Set<String> excludedExperiments;

	/**
	 * Load the tables named in {@code cfg}. Optional tables that are not
	 * configured come back empty.
	 *
	 * @throws ReferenceTableException if a configured table is malformed
	 */
	public static ReferenceTables loadAll(ConfigLoader cfg) {
		SuffixTable suffixes = ReferenceTableLoader.loadValueScale(Path.of(cfg.getValueScaleFile()));
		OntologyMapping mappings = ReferenceTableLoader.loadGateMappings(Path.of(cfg.getGateMappingsFile()),
				cfg.isGateMappingsCaseFolded());
		SpecialGates special = ReferenceTableLoader.loadSpecialGates(Path.of(cfg.getSpecialGatesFile()));
		PreferredLabelMap preferred = ReferenceTableLoader.loadPreferredLabels(Path.of(cfg.getPreferredLabelsFile()));

		CellDefinitions cells = CellDefinitions.empty();
		if (StringUtils.isNotBlank(cfg.getCellLevelsFile()) && StringUtils.isNotBlank(cfg.getCellNamesFile())) {
			cells = ReferenceTableLoader.loadCellDefinitions(Path.of(cfg.getCellLevelsFile()),
					Path.of(cfg.getCellNamesFile()));
		}

		Set<String> excluded = Set.of();
		if (StringUtils.isNotBlank(cfg.getExcludedExperimentsFile())) {
			excluded = ReferenceTableLoader.loadExcludedExperiments(Path.of(cfg.getExcludedExperimentsFile()),
					cfg.getExperimentColumn());
		}
		return new ReferenceTables(suffixes, mappings, special, preferred, cells, Set.copyOf(excluded));
	}
}
