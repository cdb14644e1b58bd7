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


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

class DialectRulesTest {

	private final DialectRules rules = DialectRules.standard();

	@Test
	void first_matching_rule_wins() {
		// Both keywords present: Emory is listed before Stanford
		assertEquals("Stanford", rules.select("Stanford").getName());
		assertEquals("Emory", rules.select("Emory and Stanford joint").getName());
	}

	@Test
	void unknown_or_missing_project_uses_default() {
		assertEquals("default", rules.select("Nobody").getName());
		assertEquals("default", rules.select(null).getName());
	}

	@Test
	void keyword_match_is_case_sensitive() {
		assertEquals("default", rules.select("lajolla").getName());
	}

	@Test
	void default_rule_is_last() {
		List<DialectRule> all = rules.rules();
		assertEquals("default", all.get(all.size() - 1).getName());
		assertEquals("LaJolla", all.get(0).getName());
	}

	@Test
	void extract_mode_keeps_word_runs() {
		DialectRule wistar = rules.select("Wistar");
		assertEquals(DialectRule.Mode.EXTRACT, wistar.getMode());
		assertEquals(List.of("CD3+", "CD8-", "IFNg"), wistar.segment("CD3+ CD8-, IFNg"));
	}

	@Test
	void rewrites_run_before_splitting() {
		DialectRule baylor = rules.select("Baylor");
		assertEquals("CD3++/CD4+-", baylor.rewrite("CD3hiCD4dim"));
		assertEquals(List.of("CD3++", "CD4+-"), baylor.segment("CD3hiCD4dim"));
	}

	@Test
	void itn019ad_drops_trailing_run_reference() {
		DialectRule itn = rules.select("ITN019AD");
		assertEquals(List.of("CD19++", "CD27-"), itn.segment("CD19 Bright AND CD27- AND R12 gate"));
	}

	@Test
	void rochester_splits_on_semicolons_and_slashes() {
		assertEquals(List.of("CD3+", "CD4+", "CD8-"), rules.select("Rochester").segment("CD3+;; CD4+/CD8-"));
	}

	@Test
	void custom_rule_list_can_be_used() {
		DialectRules custom = new DialectRules(List.of(
				DialectRule.keyword("Pipe").split("\\|"),
				DialectRule.fallback("default").split("\\s+")));
		assertEquals(List.of("a", "b"), custom.select("Pipe Lab").segment("a|b"));
		assertEquals(List.of("a|b", "c"), custom.select("Other").segment("a|b c"));
	}

	@Test
	void empty_rule_list_is_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new DialectRules(List.of()));
	}
}
