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

/**
 * Ordered dialect rules. The first rule whose keyword occurs in the project
 * name is used; the last rule applies to every project.
 */
public final class DialectRules {

	// Gates written back to back, e.g. CD14-CD56-CD3+ or IFNγ+CD8Ã½
	private static final String WORD_RUN = "[\\w\\p{N}]+[\\-\\+]*";

	private final List<DialectRule> rules;

	public DialectRules(List<DialectRule> rules) {
		if (rules == null || rules.isEmpty()) {
			throw new IllegalArgumentException("At least one dialect rule is required");
		}
		this.rules = List.copyOf(rules);
	}

	/** The dialects of the known contributing projects. */
	public static DialectRules standard() {
		List<DialectRule> r = new ArrayList<>();

		r.add(DialectRule.keyword("LaJolla").extract(WORD_RUN));
		r.add(DialectRule.keyword("Emory").split(",\\s+"));
		r.add(DialectRule.keyword("IPIRC").split("\\/"));
		r.add(DialectRule.keyword("Watson").split("\\/"));
		r.add(DialectRule.keyword("Ltest").split("\\/"));
		r.add(DialectRule.keyword("VRC").split("\\s+AND\\s+"));
		r.add(DialectRule.keyword("Ertl").split("\\s+and\\s+"));
		r.add(DialectRule.keyword("Stanford")
				.rewrite("hi", "++")
				.rewrite("bri", "++")
				.rewrite("low", "+-")
				.rewrite("([\\-\\+])(CD\\d+|CX\\w+\\d+|CCR\\d)", "$1/$2")
				.split("\\/|,\\s+"));
		r.add(DialectRule.keyword("Baylor")
				.rewrite(",,+", ",")
				.rewrite("hi", "++")
				.rewrite("bri", "++")
				.rewrite("br", "++")
				.rewrite("low", "+-")
				.rewrite("dim", "+-")
				.rewrite(" granulocyte", ", granulocyte")
				.rewrite("([\\-\\+])CD(\\d)", "$1/CD$2")
				.split("\\/|,\\s*"));
		r.add(DialectRule.keyword("Rochester").split(";+\\s*|\\/"));
		r.add(DialectRule.keyword("Mayo")
				.rewrite(" CD(\\d)", " /CD$1")
				.rewrite(" high", "++")
				.split("\\/"));
		r.add(DialectRule.keyword("ARA06").extract(WORD_RUN));
		r.add(DialectRule.keyword("Center for Human Immunology")
				.rewrite("high", "++")
				.extract(WORD_RUN));
		r.add(DialectRule.keyword("Seattle Biomed").split("\\/"));
		r.add(DialectRule.keyword("Improving Kidney")
				.rewrite("hi", "++")
				.rewrite("low", "+-")
				.rewrite("([\\-\\+])CD(\\d)", "$1/CD$2")
				.split("\\/"));
		r.add(DialectRule.keyword("New York Influenza")
				.rewrite("high", "++")
				.rewrite("low", "+-")
				.rewrite("dim", "+-")
				.rewrite("([\\-\\+ ])(CD\\d+|CXCR\\d|BCL\\d|IF\\w+|PD\\d+|IL\\d+|TNFa)", "$1/$2")
				.split("\\/|,"));
		r.add(DialectRule.keyword("Modeling Viral").split("\\s+AND\\s+|_AND_|\\s+\\+\\s+"));
		r.add(DialectRule.keyword("Immunobiology of Aging")
				.rewrite("hi", "++")
				.rewrite("low", "+-")
				.rewrite("([\\-\\+])(CD\\d+|Ig\\w+)", "$1/$2")
				.split("\\/"));
		r.add(DialectRule.keyword("Flow Cytometry Analysis")
				.rewrite("(\\+|\\-)(CD\\d+|Ig\\w+|IL\\d+|IF\\w+|TNF\\w+|Per\\w+)", "$1/$2")
				.split("\\/"));
		r.add(DialectRule.keyword("Wistar").extract(WORD_RUN));
		r.add(DialectRule.keyword("ITN019AD")
				.rewrite("(\\s+AND)?\\s+R\\d+.*$", "")
				.rewrite(" Bright", "++")
				.rewrite("\\s+AND\\s+", " ")
				.split("\\s+"));

		r.add(DialectRule.fallback("default").split("\\/|,\\s*|\\s+AND\\s+|\\s+and\\s+"));
		return new DialectRules(r);
	}

	/** First rule that applies to {@code projectName}. */
	public DialectRule select(String projectName) {
		for (DialectRule rule : rules) {
			if (rule.appliesTo(projectName)) {
				return rule;
			}
		}
		// Only reached when a custom list has no fallback
		return rules.get(rules.size() - 1);
	}

	public List<DialectRule> rules() {
		return rules;
	}
}
