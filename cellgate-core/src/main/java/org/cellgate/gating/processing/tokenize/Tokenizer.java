package org.cellgate.gating.processing.tokenize;

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


import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.cellgate.gating.om.GateToken;
import org.cellgate.gating.util.Logger;

/**
 * Splits a reported gating string into canonical marker tokens such as
 * {@code CD4+} or {@code CD27++}, using the dialect of the reporting project.
 */
public class Tokenizer {

	// Free-text heading such as "Activated T: ..."
	private static final Pattern LEADING_HEADING = Pattern.compile("^.*?:\\s+");
	private static final Pattern COLON_SPACE = Pattern.compile(":\\s");

	// Hyphen as it appears after a UTF-8/Latin-1 mix-up
	private static final String MISDECODED_HYPHEN = "Ã½";

	private final SuffixTable suffixTable;
	private final DialectRules dialects;

	public Tokenizer(SuffixTable suffixTable) {
		this(suffixTable, DialectRules.standard());
	}

	public Tokenizer(SuffixTable suffixTable, DialectRules dialects) {
		this.suffixTable = suffixTable;
		this.dialects = dialects;
	}

	/**
	 * Tokenize {@code reported} as written by {@code projectName}.
	 *
	 * @return canonical tokens in input order, duplicates kept, never null
	 */
	public List<String> tokenize(String projectName, String reported) {
		List<String> out = new ArrayList<>();
		if (StringUtils.isBlank(reported)) {
			return out;
		}

		String text = reported;
		if (COLON_SPACE.matcher(text).find()) {
			text = LEADING_HEADING.matcher(text).replaceFirst("");
		}

		DialectRule rule = dialects.select(projectName);
		Logger.trace("Project '{}' uses dialect {}", projectName, rule.getName());

		for (String raw : rule.segment(text)) {
			String gate = normalizeGate(raw);
			if (!gate.isEmpty()) {
				out.add(gate);
			}
		}
		return out;
	}

	/** As {@link #tokenize(String, String)}, split into label and suffix. */
	public List<GateToken> tokenizeGates(String projectName, String reported) {
		List<GateToken> out = new ArrayList<>();
		for (String t : tokenize(projectName, reported)) {
			out.add(suffixTable.split(t));
		}
		return out;
	}

	String normalizeGate(String raw) {
		String gate = StringUtils.trimToEmpty(raw);
		gate = gate.replace(MISDECODED_HYPHEN, "-");
		gate = suffixTable.canonicalizeSuffix(gate);
		return gate.replace(' ', '_');
	}

	public SuffixTable getSuffixTable() {
		return suffixTable;
	}
}
