package org.cellgate.gating.processing;

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

import java.util.List;

import org.cellgate.gating.TestTables;
import org.cellgate.gating.om.GatingResult;
import org.cellgate.gating.processing.tokenize.Tokenizer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class GatingPipelineTest {

	private static GatingPipeline pipeline;

	@BeforeAll
	static void setUp() {
		pipeline = new GatingPipeline(new Tokenizer(TestTables.suffixes()), TestTables.resolver());
	}

	@Test
	void record_yields_output_columns_in_order() {
		GatingResult r = pipeline.process("LaJolla", "CD14-CD3+CD4+viable");

		assertEquals("CD14-; CD3+; CD4+; viable", r.getTokenized());
		assertEquals("PR:006-; PR:003+; PR:004+; !viable", r.getOntologyMapped());
		assertEquals("CD14 molecule-; CD3 epsilon+; CD4 molecule+; !viable", r.getPreferredLabels());
		assertEquals(3, r.getMatchedCount());
		assertEquals(4, r.getTotalCount());
		assertEquals(5, r.toColumns().size());
		assertEquals(GatingPipeline.OUTPUT_COLUMNS.size(), r.toColumns().size());
	}

	@Test
	void special_gate_flows_through() {
		GatingResult r = pipeline.process("Emory", "Mikeyhigh, CD19-");

		assertEquals("Mikey++; CD19-", r.getTokenized());
		assertEquals("PR:034++; PR:019-", r.getOntologyMapped());
		assertEquals("Michael++; CD19 molecule-", r.getPreferredLabels());
	}

	@Test
	void empty_input_gives_empty_columns() {
		assertEquals(List.of("", "", "", "0", "0"), pipeline.process("Emory", "").toColumns());
	}

	@Test
	void custom_separator() {
		GatingPipeline p = new GatingPipeline(new Tokenizer(TestTables.suffixes()), TestTables.resolver(), " | ");
		assertEquals("CD3+ | CD4+", p.process("IPIRC", "CD3+/CD4+").getTokenized());
	}

	@Test
	void same_input_same_output() {
		String reported = "Activated T: viable/singlets/CD3+/CD4hi";
		assertEquals(pipeline.process("Stanford", reported).toColumns(),
				pipeline.process("Stanford", reported).toColumns());
	}
}
