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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.cellgate.gating.TestTables;
import org.cellgate.gating.om.GateToken;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class TokenizerTest {

	private static Tokenizer tokenizer;

	@BeforeAll
	static void setUp() {
		tokenizer = new Tokenizer(TestTables.suffixes());
	}

	private static void assertTokens(String project, String reported, String... expected) {
		assertEquals(List.of(expected), tokenizer.tokenize(project, reported));
	}

	@Test
	void lajolla_gates_written_back_to_back() {
		assertTokens("LaJolla", "CD14-CD56-CD3+CD4+CD8-CD45RA+CCR7+",
				"CD14-", "CD56-", "CD3+", "CD4+", "CD8-", "CD45RA+", "CCR7+");
	}

	@Test
	void emory_comma_separated_with_hi() {
		assertTokens("Emory", "CD3-, CD19+, CD20-, CD27hi, CD38hi",
				"CD3-", "CD19+", "CD20-", "CD27++", "CD38++");
	}

	@Test
	void ipirc_slash_separated_with_lo_and_hi() {
		assertTokens("IPIRC", "CD3-/CD19+/CD20lo/CD38hi/CD27hi",
				"CD3-", "CD19+", "CD20+-", "CD38++", "CD27++");
	}

	@Test
	void watson_int_means_medium() {
		assertTokens("Watson", "CD21hi/CD24int", "CD21++", "CD24+~");
	}

	@Test
	void ltest_spelled_out_negative() {
		assertTokens("Ltest", "Annexin negative", "Annexin-");
	}

	@Test
	void vrc_upper_case_and() {
		assertTokens("VRC", "CD3+ AND CD4+ AND small lymphocyte", "CD3+", "CD4+", "small_lymphocyte");
	}

	@Test
	void ertl_lower_case_and() {
		assertTokens("Ertl", "Lymphocytes and CD8+ and NP tet+", "Lymphocytes", "CD8+", "NP_tet+");
	}

	@Test
	void stanford_heading_is_dropped() {
		assertTokens("Stanford", "Activated T: viable/singlets/Lymph/CD3+", "viable", "singlets", "Lymph", "CD3+");
	}

	@Test
	void stanford_markers_split_after_level() {
		assertTokens("Stanford", "CD14-CD33-/CD3-/CD16+CD56+/CD94+",
				"CD14-", "CD33-", "CD3-", "CD16+", "CD56+", "CD94+");
	}

	@Test
	void mayo_space_before_marker_and_trailing_low() {
		assertTokens("Mayo", "Live cells/CD4 T cells/CD4+ CD45RA-/Uninfected/SSC low",
				"Live_cells", "CD4_T_cells", "CD4+", "CD45RA-", "Uninfected", "SSC+-");
	}

	@Test
	void new_york_influenza_high_runs() {
		assertTokens("New York Influenza", "B220- live,doublet excluded,CD4+ CD44highCXCR5highPD1high,ICOS+",
				"B220-_live", "doublet_excluded", "CD4+", "CD44++", "CXCR5++", "PD1++", "ICOS+");
	}

	@Test
	void new_york_influenza_cytokines() {
		assertTokens("New York Influenza", "lymphocytes/singlets/live/CD19-CD14-/CD3+/CD8+/CD69+IFNg+IL2+TNFa+",
				"lymphocytes", "singlets", "live", "CD19-", "CD14-", "CD3+", "CD8+", "CD69+", "IFNg+", "IL2+",
				"TNFa+");
	}

	@Test
	void modeling_viral_parenthesized_levels() {
		assertTokens("Modeling Viral", "Alexa350 (high) + Alexa750 (medium)", "Alexa350++", "Alexa750+~");
	}

	@Test
	void flow_cytometry_analysis_cytokines() {
		assertTokens("Flow Cytometry Analysis", "TNFa+IFNg-", "TNFa+", "IFNg-");
	}

	@Test
	void project_keyword_may_be_part_of_a_longer_name() {
		assertTokens("ImmPort LaJolla study 12", "CD3+CD4+", "CD3+", "CD4+");
	}

	@Test
	void unknown_project_uses_default_delimiters() {
		assertTokens("Somewhere Else", "CD3+/CD4+, CD8- AND CD19- and CD20+",
				"CD3+", "CD4+", "CD8-", "CD19-", "CD20+");
	}

	@Test
	void misdecoded_hyphen_is_repaired() {
		assertTokens("Seattle Biomed", "CD3+/CD8Ã½", "CD3+", "CD8-");
	}

	@Test
	void back_to_back_gates_keep_non_ascii_markers() {
		assertTokens("LaJolla", "CD3+IFNγ+CD8-", "CD3+", "IFNγ+", "CD8-");
		assertTokens("Wistar", "CD4+ TCRγδ+", "CD4+", "TCRγδ+");
	}

	@Test
	void misdecoded_hyphen_is_repaired_in_back_to_back_gates() {
		assertTokens("LaJolla", "CD3+CD8Ã½", "CD3+", "CD8-");
	}

	@Test
	void empty_segments_are_dropped_and_duplicates_kept() {
		assertTokens("IPIRC", "CD3+//CD3+/ ", "CD3+", "CD3+");
	}

	@Test
	void blank_input_yields_no_tokens() {
		assertTrue(tokenizer.tokenize("Emory", "").isEmpty());
		assertTrue(tokenizer.tokenize("Emory", null).isEmpty());
		assertTrue(tokenizer.tokenize(null, "   ").isEmpty());
	}

	@Test
	void only_the_first_heading_is_dropped() {
		assertTokens("IPIRC", "Panel A: Tcells: CD3+/CD4+", "Tcells:_CD3+", "CD4+");
	}

	@Test
	void gate_tokens_carry_label_and_suffix() {
		List<GateToken> tokens = tokenizer.tokenizeGates("IPIRC", "CD3-/CD38hi/viable");
		assertEquals(List.of(new GateToken("CD3", "-"), new GateToken("CD38", "++"), new GateToken("viable", "")),
				tokens);
	}

	@Test
	void tokenizing_is_deterministic() {
		String reported = "lymphocytes/singlets/live/CD19-CD14-/CD3+/CD8+/CD69+IFNg+IL2+TNFa+";
		assertEquals(tokenizer.tokenize("New York Influenza", reported),
				tokenizer.tokenize("New York Influenza", reported));
	}
}
