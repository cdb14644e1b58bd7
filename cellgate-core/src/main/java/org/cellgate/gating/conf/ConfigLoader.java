package org.cellgate.gating.conf;

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

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.cellgate.gating.util.Logger;

/**
 * Loads CellGate configuration from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/cellgate.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>cellgate.config</code> to a path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Reference tables (value scale, gate mappings, special gates, preferred
 * labels) are required; the cell level and cell name tables are optional but
 * must be configured together.</li>
 * <li>{@link #getOutputPath()} is normalized to end with a trailing
 * slash.</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/cellgate.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "cellgate.config";

	/** Separator used between gates in the output columns. */
	public static final String DEFAULT_OUTPUT_SEPARATOR = "; ";

	// ---- Property keys --------------------------------------------------------

	// Reference tables
	private static final String K_VALUE_SCALE_FILE = "VALUE_SCALE_FILE";
	private static final String K_GATE_MAPPINGS_FILE = "GATE_MAPPINGS_FILE";
	private static final String K_SPECIAL_GATES_FILE = "SPECIAL_GATES_FILE";
	private static final String K_PREFERRED_LABELS_FILE = "PREFERRED_LABELS_FILE";
	private static final String K_CELL_LEVELS_FILE = "CELL_LEVELS_FILE";
	private static final String K_CELL_NAMES_FILE = "CELL_NAMES_FILE";
	private static final String K_EXCLUDED_EXPERIMENTS_FILE = "EXCLUDED_EXPERIMENTS_FILE";

	// Batch input / output
	private static final String K_SOURCE_FILE = "SOURCE_FILE";
	private static final String K_OUTPUT_PATH = "OUTPUT_PATH";
	private static final String K_OUTPUT_FILE_NAME = "OUTPUT_FILE_NAME";
	private static final String K_OUTPUT_SEPARATOR = "OUTPUT_SEPARATOR";

	// Source columns
	private static final String K_PROJECT_COLUMN = "PROJECT_COLUMN";
	private static final String K_REPORTED_COLUMN = "REPORTED_COLUMN";
	private static final String K_EXPERIMENT_COLUMN = "EXPERIMENT_COLUMN";

	// Lookup behaviour
	private static final String K_GATE_MAPPINGS_CASE_FOLD = "GATE_MAPPINGS_CASE_FOLD";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			} else {
				Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
			}
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Validates presence of keys that a batch run requires. This does not fail;
	 * it returns a list of human-readable issues so the caller can decide how to
	 * proceed.
	 *
	 * @return list of error strings; empty if all required keys look OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_VALUE_SCALE_FILE, issues);
		requireNonBlank(K_GATE_MAPPINGS_FILE, issues);
		requireNonBlank(K_SPECIAL_GATES_FILE, issues);
		requireNonBlank(K_PREFERRED_LABELS_FILE, issues);
		requireNonBlank(K_SOURCE_FILE, issues);
		requireNonBlank(K_OUTPUT_PATH, issues);

		// Cell definitions are only usable as a pair
		boolean hasLevels = isSet(K_CELL_LEVELS_FILE);
		boolean hasNames = isSet(K_CELL_NAMES_FILE);
		if (hasLevels != hasNames) {
			issues.add(K_CELL_LEVELS_FILE + " and " + K_CELL_NAMES_FILE + " must be configured together.");
		}

		String fold = getOptional(K_GATE_MAPPINGS_CASE_FOLD, null);
		if (fold != null && !fold.equalsIgnoreCase("true") && !fold.equalsIgnoreCase("false")) {
			issues.add(K_GATE_MAPPINGS_CASE_FOLD + " must be 'true' or 'false', found: '" + fold + "'");
		}
		return issues;
	}

	/** TSV with columns Name, Symbol, Synonyms. */
	public String getValueScaleFile() {
		return getRequired(K_VALUE_SCALE_FILE);
	}

	/** TSV with columns Label, Ontology ID. */
	public String getGateMappingsFile() {
		return getRequired(K_GATE_MAPPINGS_FILE);
	}

	/** TSV with columns Label, Ontology ID, Synonyms, toxic synonym. */
	public String getSpecialGatesFile() {
		return getRequired(K_SPECIAL_GATES_FILE);
	}

	/** TSV with columns Ontology ID, Preferred Label. */
	public String getPreferredLabelsFile() {
		return getRequired(K_PREFERRED_LABELS_FILE);
	}

	/** Optional: cell identifiers and their membrane parts. Empty when unset. */
	public String getCellLevelsFile() {
		return getOptional(K_CELL_LEVELS_FILE, "");
	}

	/** Optional: cell identifiers and their labels/synonyms. Empty when unset. */
	public String getCellNamesFile() {
		return getOptional(K_CELL_NAMES_FILE, "");
	}

	/** Optional: experiments to leave out of a batch run. Empty when unset. */
	public String getExcludedExperimentsFile() {
		return getOptional(K_EXCLUDED_EXPERIMENTS_FILE, "");
	}

	/** Source TSV of reported population definitions. */
	public String getSourceFile() {
		return getRequired(K_SOURCE_FILE);
	}

	/** Directory for the normalized output. */
	public String getOutputPath() {
		return normalizedDir(getRequired(K_OUTPUT_PATH));
	}

	public String getOutputFileName() {
		return getOptional(K_OUTPUT_FILE_NAME, "normalized.tsv");
	}

	/**
	 * Separator between gates in output columns. Read untrimmed so that
	 * {@code "; "} keeps its space; defaults to {@value #DEFAULT_OUTPUT_SEPARATOR}.
	 */
	public String getOutputSeparator() {
		String v = properties.getProperty(K_OUTPUT_SEPARATOR);
		return (v == null || v.isEmpty()) ? DEFAULT_OUTPUT_SEPARATOR : v;
	}

	public String getProjectColumn() {
		return getOptional(K_PROJECT_COLUMN, "NAME");
	}

	public String getReportedColumn() {
		return getOptional(K_REPORTED_COLUMN, "POPULATION_DEFNITION_REPORTED");
	}

	public String getExperimentColumn() {
		return getOptional(K_EXPERIMENT_COLUMN, "EXPERIMENT_ACCESSION");
	}

	/** Whether gate-mapping labels are matched case-insensitively. */
	public boolean isGateMappingsCaseFolded() {
		return Boolean.parseBoolean(getOptional(K_GATE_MAPPINGS_CASE_FOLD, "false").toLowerCase(Locale.ROOT));
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private boolean isSet(String key) {
		String v = properties.getProperty(key);
		return v != null && !v.isBlank();
	}

	private String normalizedDir(String path) {
		if (path == null || path.isBlank())
			return path;
		String p = path.trim();
		if (!p.endsWith("/"))
			p = p + "/";
		return p;
	}

	private void requireNonBlank(String key, List<String> issues) {
		if (!isSet(key)) {
			issues.add("Missing required property: " + key);
		}
	}
}
