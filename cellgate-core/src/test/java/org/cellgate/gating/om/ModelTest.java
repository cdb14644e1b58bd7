package org.cellgate.gating.om;

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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ModelTest {

	@Test
	void gate_token_text_is_label_and_suffix() {
		GateToken t = new GateToken("CD4", "++");
		assertEquals("CD4++", t.getText());
		assertEquals("CD4++", t.toString());
		assertEquals("viable", new GateToken("viable", null).getText());
	}

	@Test
	void special_gate_matches_any_name_ignoring_case() {
		SpecialGateEntry e = new SpecialGateEntry("Michael", "PR:034", List.of("Mike"), "mikey");
		assertTrue(e.matches("MICHAEL"));
		assertTrue(e.matches("mike"));
		assertTrue(e.matches("Mikey"));
		assertFalse(e.matches("Mic"));
		assertFalse(e.matches(""));
		assertFalse(e.matches(null));
	}

	@Test
	void level_names_and_relations() {
		assertEquals(Level.HIGH, Level.fromName("High", null));
		assertEquals(Level.POSITIVE, Level.fromName("sideways", Level.POSITIVE));
		assertNull(Level.MEDIUM.getRelationIri());
		assertEquals("http://purl.obolibrary.org/obo/RO_0002104", Level.POSITIVE.getRelationIri());
		assertTrue(Level.LOW.isAmount());
		assertFalse(Level.MEDIUM.isAmount());
		assertFalse(Level.NEGATIVE.isAmount());
	}

	@Test
	void gating_result_columns_and_counts() {
		List<GateToken> tokens = List.of(new GateToken("CD4", "+"), new GateToken("viable", ""));
		List<ResolvedGate> gates = List.of(
				new ResolvedGate("CD4", "PR:004", "+", Level.POSITIVE, "CD4 molecule"),
				new ResolvedGate("viable", "!viable", "", Level.POSITIVE, "!viable"));

		GatingResult r = new GatingResult(tokens, gates, "; ");

		assertEquals(List.of("CD4+; viable", "PR:004+; !viable", "CD4 molecule+; !viable", "1", "2"), r.toColumns());
	}

	@Test
	void empty_result_has_empty_columns() {
		GatingResult r = new GatingResult(List.of(), List.of(), "; ");
		assertEquals(List.of("", "", "", "0", "0"), r.toColumns());
	}
}
