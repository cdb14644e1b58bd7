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


import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.cellgate.gating.conf.ConfigLoader;
import org.cellgate.gating.om.GatingResult;
import org.cellgate.gating.processing.GatingPipeline;
import org.cellgate.gating.processing.load.ReferenceTables;
import org.cellgate.gating.util.Logger;

/**
 * Batch normalization of reported gating definitions.
 * <p>
 * Reads the source TSV, skips excluded experiments and writes every input
 * column followed by the tokenized, ontology-mapped and preferred-label gates
 * and the matched/total gate counts.
 */
public class CellGateMain {

	// Tab-delimited with header
	private static final CSVFormat TSV_IN = CSVFormat.DEFAULT.withDelimiter('\t').withHeader().withIgnoreHeaderCase()
			.withTrim();
	// Unquoted, values come from a TSV and hold no tabs or newlines
	private static final CSVFormat TSV_OUT = CSVFormat.DEFAULT.withDelimiter('\t').withQuote(null)
			.withRecordSeparator('\n');

	private final ConfigLoader cfg;

	public CellGateMain() {
		this(new ConfigLoader());
	}

	public CellGateMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	/**
	 * Application entry point. An optional first argument names a
	 * {@code .properties} file to use instead of the default configuration.
	 */
	public static void main(String[] args) {
		ConfigLoader cfg = args.length > 0 ? new ConfigLoader(Path.of(args[0])) : new ConfigLoader();
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error("Configuration: {}", i));
			System.exit(1);
		}
		new CellGateMain(cfg).run();
	}

	/**
	 * Load the reference tables, normalize the source file and write the
	 * output.
	 *
	 * @return path of the written file
	 */
	public Path run() {
		ReferenceTables tables = ReferenceTables.loadAll(cfg);
		GatingPipeline pipeline = GatingPipeline.from(tables, cfg.getOutputSeparator());

		Path source = Path.of(cfg.getSourceFile());
		Path output = Path.of(cfg.getOutputPath() + cfg.getOutputFileName());
		Logger.info("Normalizing {} -> {}", source, output);

		int rows = normalize(source, output, pipeline, tables.getExcludedExperiments());
		Logger.info("Wrote {} rows", rows);
		Logger.info("End");
		return output;
	}

	/**
	 * Normalize one source file.
	 *
	 * @return number of data rows written
	 */
	int normalize(Path source, Path output, GatingPipeline pipeline, Set<String> excluded) {
		int written = 0, skipped = 0, matched = 0, total = 0;

		try {
			if (output.getParent() != null) {
				Files.createDirectories(output.getParent());
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to create output directory for " + output, e);
		}

		try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
				CSVParser in = new CSVParser(reader, TSV_IN);
				Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
				CSVPrinter out = new CSVPrinter(writer, TSV_OUT)) {

			List<String> header = new ArrayList<>(in.getHeaderNames());
			header.addAll(GatingPipeline.OUTPUT_COLUMNS);
			out.printRecord(header);

			for (CSVRecord r : in) {
				String experiment = value(r, cfg.getExperimentColumn());
				if (excluded.contains(experiment)) {
					skipped++;
					continue;
				}

				GatingResult result = pipeline.process(value(r, cfg.getProjectColumn()),
						value(r, cfg.getReportedColumn()));

				List<String> row = new ArrayList<>(r.toList());
				row.addAll(result.toColumns());
				out.printRecord(row);

				written++;
				matched += result.getMatchedCount();
				total += result.getTotalCount();
				if (written % 10000 == 0) {
					Logger.info("Processed {} rows", written);
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to normalize " + source, e);
		}

		Logger.info("Rows written: {}, excluded: {}, gates matched: {}/{}", written, skipped, matched, total);
		return written;
	}

	private static String value(CSVRecord r, String column) {
		return r.isSet(column) ? r.get(column) : "";
	}
}
