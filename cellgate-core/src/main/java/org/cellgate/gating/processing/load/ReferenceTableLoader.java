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


import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.cellgate.gating.om.CellGateDefinition;
import org.cellgate.gating.om.Level;
import org.cellgate.gating.om.SpecialGateEntry;
import org.cellgate.gating.om.SuffixSpec;
import org.cellgate.gating.processing.conflict.CellDefinitions;
import org.cellgate.gating.processing.resolve.OntologyMapping;
import org.cellgate.gating.processing.resolve.PreferredLabelMap;
import org.cellgate.gating.processing.resolve.SpecialGates;
import org.cellgate.gating.processing.tokenize.SuffixTable;
import org.cellgate.gating.util.Logger;

/**
 * Reads the tab-separated reference tables into immutable lookup tables.
 * <p>
 * Every table has a header row; header names are matched ignoring case. A
 * missing column, or a blank value in a required column, fails the load with
 * a {@link ReferenceTableException} naming the file, row and column.
 */
public final class ReferenceTableLoader {

	// Tab-delimited with header
	private static final CSVFormat TSV = CSVFormat.DEFAULT.withDelimiter('\t').withHeader().withIgnoreHeaderCase()
			.withTrim();

	public static final String COL_NAME = "Name";
	public static final String COL_SYMBOL = "Symbol";
	public static final String COL_SYNONYMS = "Synonyms";
	public static final String COL_LABEL = "Label";
	public static final String COL_ONTOLOGY_ID = "Ontology ID";
	public static final String COL_TOXIC_SYNONYM = "toxic synonym";
	public static final String COL_PREFERRED_LABEL = "Preferred Label";
	public static final String COL_HAS_PART = "has part";
	public static final String COL_LACKS_PART = "lacks part";
	public static final String COL_HIGH_AMOUNT = "has high amount";
	public static final String COL_LOW_AMOUNT = "has low amount";

	private ReferenceTableLoader() {
	}

	// ---------------------------------------------------------------- value scale

	public static List<SuffixSpec> readValueScale(Path file) {
		List<SuffixSpec> specs = new ArrayList<>();
		read(file, List.of(COL_NAME, COL_SYMBOL), row -> {
			String name = row.required(COL_NAME);
			String symbol = row.required(COL_SYMBOL);
			Set<String> synonyms = new LinkedHashSet<>();
			for (String s : row.optional(COL_SYNONYMS).split(",")) {
				if (StringUtils.isNotBlank(s)) {
					synonyms.add(s.trim());
				}
			}
			specs.add(new SuffixSpec(name, symbol, synonyms));
		});
		return specs;
	}

	public static SuffixTable loadValueScale(Path file) {
		SuffixTable table = SuffixTable.fromSpecs(readValueScale(file));
		Logger.info("Loaded {} suffix levels from {}", table.size(), file);
		return table;
	}

	// ---------------------------------------------------------------- gate mappings

	public static OntologyMapping loadGateMappings(Path file, boolean caseFold) {
		Map<String, String> map = new LinkedHashMap<>();
		read(file, List.of(COL_LABEL, COL_ONTOLOGY_ID), row -> {
			String label = row.required(COL_LABEL);
			String id = row.required(COL_ONTOLOGY_ID);
			String prev = map.putIfAbsent(label, id);
			if (prev != null && !prev.equals(id)) {
				Logger.warn("{} row {}: label '{}' already mapped to {}, ignoring {}", file, row.number(), label, prev,
						id);
			}
		});
		Logger.info("Loaded {} gate mappings from {}", map.size(), file);
		return new OntologyMapping(map, caseFold);
	}

	// ---------------------------------------------------------------- special gates

	public static SpecialGates loadSpecialGates(Path file) {
		List<SpecialGateEntry> entries = new ArrayList<>();
		read(file, List.of(COL_LABEL, COL_ONTOLOGY_ID), row -> {
			String label = row.required(COL_LABEL);
			String id = row.required(COL_ONTOLOGY_ID);
			List<String> synonyms = new ArrayList<>();
			String raw = row.optional(COL_SYNONYMS);
			if (!raw.isEmpty()) {
				for (String s : raw.split(",\\s+")) {
					if (StringUtils.isNotBlank(s)) {
						synonyms.add(s.trim());
					}
				}
			}
			String toxic = StringUtils.trimToNull(row.optional(COL_TOXIC_SYNONYM));
			entries.add(new SpecialGateEntry(label, id, synonyms, toxic));
		});
		Logger.info("Loaded {} special gates from {}", entries.size(), file);
		return new SpecialGates(entries);
	}

	// ---------------------------------------------------------------- preferred labels

	public static PreferredLabelMap loadPreferredLabels(Path file) {
		Map<String, String> map = new LinkedHashMap<>();
		read(file, List.of(COL_ONTOLOGY_ID, COL_PREFERRED_LABEL), row -> map
				.putIfAbsent(row.required(COL_ONTOLOGY_ID), row.required(COL_PREFERRED_LABEL)));
		Logger.info("Loaded {} preferred labels from {}", map.size(), file);
		return new PreferredLabelMap(map);
	}

	// ---------------------------------------------------------------- cells

	/** Cell gate definitions; marker columns hold pipe-separated identifiers. */
	public static List<CellGateDefinition> loadCellLevels(Path file) {
		List<CellGateDefinition> defs = new ArrayList<>();
		read(file, List.of(COL_ONTOLOGY_ID, COL_HAS_PART, COL_LACKS_PART, COL_HIGH_AMOUNT, COL_LOW_AMOUNT), row -> {
			String cellId = row.required(COL_ONTOLOGY_ID);
			List<CellGateDefinition.Entry> entries = new ArrayList<>();
			addMarkers(entries, row.optional(COL_HAS_PART), Level.POSITIVE);
			addMarkers(entries, row.optional(COL_LACKS_PART), Level.NEGATIVE);
			addMarkers(entries, row.optional(COL_HIGH_AMOUNT), Level.HIGH);
			addMarkers(entries, row.optional(COL_LOW_AMOUNT), Level.LOW);
			defs.add(new CellGateDefinition(cellId, entries));
		});
		Logger.info("Loaded {} cell definitions from {}", defs.size(), file);
		return defs;
	}

	private static void addMarkers(List<CellGateDefinition.Entry> entries, String cell, Level level) {
		for (String m : cell.split("\\|")) {
			if (StringUtils.isNotBlank(m)) {
				entries.add(new CellGateDefinition.Entry(m.trim(), level));
			}
		}
	}

	/** (identifier, name) pairs; repeated identifiers add synonyms. */
	public static List<Map.Entry<String, String>> loadCellNames(Path file) {
		List<Map.Entry<String, String>> names = new ArrayList<>();
		read(file, List.of(COL_ONTOLOGY_ID, COL_LABEL), row -> names
				.add(new AbstractMap.SimpleImmutableEntry<>(row.required(COL_ONTOLOGY_ID), row.required(COL_LABEL))));
		Logger.info("Loaded {} cell names from {}", names.size(), file);
		return names;
	}

	public static CellDefinitions loadCellDefinitions(Path levelsFile, Path namesFile) {
		return new CellDefinitions(loadCellLevels(levelsFile), loadCellNames(namesFile));
	}

	// ---------------------------------------------------------------- excluded experiments

	/**
	 * Experiment accessions to skip, read from {@code column}, or from the first
	 * column when the file has no such header.
	 */
	public static Set<String> loadExcludedExperiments(Path file, String column) {
		Set<String> out = new LinkedHashSet<>();
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
				CSVParser csv = new CSVParser(reader, TSV)) {
			List<String> headers = csv.getHeaderNames();
			String col = headers.stream().filter(h -> h.equalsIgnoreCase(column)).findFirst()
					.orElse(headers.isEmpty() ? null : headers.get(0));
			if (col == null) {
				return out;
			}
			for (CSVRecord r : csv) {
				if (r.isSet(col) && StringUtils.isNotBlank(r.get(col))) {
					out.add(r.get(col).trim());
				}
			}
		} catch (IOException | UncheckedIOException | IllegalArgumentException e) {
			throw new ReferenceTableException("Unable to read " + file + ": " + e.getMessage(), e);
		}
		Logger.info("Loaded {} excluded experiments from {}", out.size(), file);
		return out;
	}

	// ---------------------------------------------------------------- internals

	/** One data row with its 1-based row number (header excluded). */
	static final class Row {
		private final Path file;
		private final CSVRecord record;
		private final long number;

		Row(Path file, CSVRecord record, long number) {
			this.file = file;
			this.record = record;
			this.number = number;
		}

		long number() {
			return number;
		}

		String required(String column) {
			String v = optional(column);
			if (v.isEmpty()) {
				throw new ReferenceTableException(file + " row " + number + ": missing value for column '" + column + "'");
			}
			return v;
		}

		String optional(String column) {
			return record.isSet(column) ? StringUtils.trimToEmpty(record.get(column)) : "";
		}
	}

	private static void read(Path file, List<String> requiredColumns, Consumer<Row> handler) {
		if (file == null || !Files.isReadable(file)) {
			throw new ReferenceTableException("Reference table is missing or unreadable: " + file);
		}
		try (Reader reader = new FileReader(file.toFile(), StandardCharsets.UTF_8);
				CSVParser csv = new CSVParser(reader, TSV)) {

			List<String> headers = csv.getHeaderNames();
			for (String col : requiredColumns) {
				if (headers.stream().noneMatch(h -> h.equalsIgnoreCase(col))) {
					throw new ReferenceTableException(
							file + ": missing column '" + col + "' (found " + Arrays.toString(headers.toArray()) + ")");
				}
			}

			long rowNo = 0;
			for (CSVRecord r : csv) {
				rowNo++;
				if (isBlankRow(r)) {
					continue;
				}
				handler.accept(new Row(file, r, rowNo));
			}
		} catch (IOException | UncheckedIOException | IllegalArgumentException e) {
			throw new ReferenceTableException("Unable to read " + file + ": " + e.getMessage(), e);
		}
	}

	private static boolean isBlankRow(CSVRecord r) {
		for (String v : r) {
			if (StringUtils.isNotBlank(v)) {
				return false;
			}
		}
		return true;
	}
}
