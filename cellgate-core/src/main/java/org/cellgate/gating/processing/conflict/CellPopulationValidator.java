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


import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.cellgate.gating.om.CellGateDefinition;
import org.cellgate.gating.om.CellValidation;
import org.cellgate.gating.om.ConflictRecord;
import org.cellgate.gating.om.GateToken;
import org.cellgate.gating.om.ResolvedGate;
import org.cellgate.gating.processing.resolve.CurieNormalizer;
import org.cellgate.gating.processing.resolve.OntologyResolver;
import org.cellgate.gating.processing.resolve.PreferredLabelMap;
import org.cellgate.gating.processing.tokenize.SuffixTable;
import org.cellgate.gating.util.Logger;

import lombok.Data;

/**
 * Checks a list of explicit gates against the cell population it was reported
 * for.
 * <p>
 * The cells field has the form {@code "cell name & gate, gate, ..."}; the part
 * after {@code &} is optional. The cell's own gates are the gates of its
 * definition followed by the gates written in the cells field.
 */
public class CellPopulationValidator {

	// Lineage prefix some sources put in front of the cell name
	private static final Pattern LINEAGE_PREFIX = Pattern.compile("^(DC|B|M|NK|T): ");
	private static final Pattern ENCLOSING_QUOTES = Pattern.compile("^(\"|')|(\"|')$");
	private static final Pattern BRACKET_COMMENT = Pattern.compile("\\s*\\[.*\\]\\s*");

	private static final CSVFormat GATE_LIST = CSVFormat.DEFAULT.withDelimiter(',').withQuote('"')
			.withIgnoreSurroundingSpaces();

	private final OntologyResolver resolver;
	private final CellDefinitions cells;
	private final PreferredLabelMap preferredLabels;
	private final ConflictDetector detector = new ConflictDetector();

	public CellPopulationValidator(OntologyResolver resolver, CellDefinitions cells, PreferredLabelMap preferredLabels) {
		this.resolver = resolver;
		this.cells = cells;
		this.preferredLabels = preferredLabels;
	}

	/** A cells field split into the cell name and its gate strings. */
	@Data
	public static class CellsField {
		private final String cellName;
		private final List<String> gates;
	}

	public CellsField parseCellsField(String cellsField) {
		String field = StringUtils.trimToEmpty(cellsField);
		int amp = field.indexOf('&');
		if (amp < 0) {
			return new CellsField(StringUtils.strip(field, "\"'"), List.of());
		}
		String name = ENCLOSING_QUOTES.matcher(field.substring(0, amp).trim()).replaceAll("");
		name = name.replaceAll("\\s\\s+", " ");
		List<String> gates = new ArrayList<>();
		for (String g : parseGateList(field.substring(amp + 1).trim())) {
			gates.add(StringUtils.strip(g, "'"));
		}
		return new CellsField(name, gates);
	}

	/**
	 * Comma-separated gate list; double quotes protect commas. A list the CSV
	 * parser rejects, such as one with an unterminated quote, is split on every
	 * comma instead.
	 */
	public List<String> parseGateList(String gatesField) {
		List<String> out = new ArrayList<>();
		if (StringUtils.isBlank(gatesField)) {
			return out;
		}
		try (CSVParser parser = CSVParser.parse(gatesField, GATE_LIST)) {
			for (CSVRecord r : parser) {
				for (String v : r) {
					if (StringUtils.isNotBlank(v)) {
						out.add(v.trim());
					}
				}
			}
		} catch (IOException | UncheckedIOException | IllegalStateException e) {
			Logger.warn("Malformed gate list '{}', splitting on commas: {}", gatesField, e.getMessage());
			return splitOnCommas(gatesField);
		}
		return out;
	}

	private static List<String> splitOnCommas(String gatesField) {
		List<String> out = new ArrayList<>();
		for (String v : gatesField.split(",")) {
			String gate = StringUtils.strip(v.trim(), "\"").trim();
			if (!gate.isEmpty()) {
				out.add(gate);
			}
		}
		return out;
	}

	/**
	 * Canonicalize the suffix of one written gate, drop bracketed comments from
	 * the marker name and resolve it. No suffix means positive.
	 */
	public ResolvedGate processGate(String gateString) {
		SuffixTable suffixes = resolver.getSuffixTable();
		String gate = suffixes.canonicalizeSuffix(StringUtils.trimToEmpty(gateString));
		GateToken split = suffixes.split(gate);
		String kind = BRACKET_COMMENT.matcher(split.getLabel()).replaceAll("");
		return resolver.resolve(new GateToken(kind, split.getSuffix()));
	}

	/** Identifier of the named cell population, if known. */
	public Optional<String> resolveCellId(String cellName) {
		String name = LINEAGE_PREFIX.matcher(StringUtils.trimToEmpty(cellName)).replaceFirst("");
		return cells.findCellId(name);
	}

	public CellValidation validate(String cellsField, String gatesField) {
		CellValidation v = new CellValidation();
		CellsField parsed = parseCellsField(cellsField);
		v.setCellName(parsed.getCellName());

		Optional<String> cellId = resolveCellId(parsed.getCellName());
		if (cellId.isPresent()) {
			v.setCellId(cellId.get());
			v.setCellLabel(cells.label(cellId.get()).orElse(null));
			cells.definition(cellId.get()).ifPresent(d -> v.getCellGates().addAll(definitionGates(d)));
		} else {
			Logger.debug("Unrecognized cell population '{}'", parsed.getCellName());
		}
		for (String g : parsed.getGates()) {
			v.getCellGates().add(processGate(g));
		}

		for (String g : parseGateList(gatesField)) {
			ResolvedGate gate = processGate(g);
			if (!gate.isMatched()) {
				v.setHasErrors(true);
			}
			v.getExplicitGates().add(gate);
		}

		List<ConflictRecord> conflicts = detector.detectConflicts(v.getCellGates(), v.getExplicitGates());
		v.getConflicts().addAll(conflicts);
		return v;
	}

	private List<ResolvedGate> definitionGates(CellGateDefinition definition) {
		SuffixTable suffixes = resolver.getSuffixTable();
		List<ResolvedGate> out = new ArrayList<>();
		for (CellGateDefinition.Entry e : definition.getEntries()) {
			String id = CurieNormalizer.shorten(e.getMarkerId());
			String symbol = Objects.toString(suffixes.symbolFor(e.getLevel().getLevelName()), "");
			String label = preferredLabels.lookup(id).orElse(id);
			out.add(new ResolvedGate(label, id, symbol, e.getLevel(), label));
		}
		return out;
	}
}
