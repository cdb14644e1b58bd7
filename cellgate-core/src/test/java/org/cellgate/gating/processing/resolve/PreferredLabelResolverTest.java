package org.cellgate.gating.processing.resolve;

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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.cellgate.gating.om.SpecialGateEntry;
import org.junit.jupiter.api.Test;

class PreferredLabelResolverTest {

	private static final SpecialGateEntry MICHAEL = new SpecialGateEntry("Michael", "PR:034", List.of("Mike"), "mikey");

	@Test
	void strategies_are_tried_in_rank_order() {
		ResolutionStrategy first = mock(ResolutionStrategy.class);
		ResolutionStrategy second = mock(ResolutionStrategy.class);
		ResolutionStrategy third = mock(ResolutionStrategy.class);
		when(first.resolve(any())).thenReturn(Optional.empty());
		when(second.resolve(any())).thenReturn(Optional.of("from second"));

		PreferredLabelResolver r = new PreferredLabelResolver(List.of(first, second, third));

		assertEquals("from second", r.resolve(new GateLookup("CD4", null, "PR:004")));
		verify(first).resolve(any());
		verify(third, never()).resolve(any());
	}

	@Test
	void empty_answers_are_skipped() {
		ResolutionStrategy blank = lookup -> Optional.of("");
		ResolutionStrategy real = lookup -> Optional.of("CD4 molecule");

		PreferredLabelResolver r = new PreferredLabelResolver(List.of(blank, real));
		assertEquals("CD4 molecule", r.resolve(new GateLookup("CD4", null, "PR:004")));
	}

	@Test
	void no_answer_falls_back_to_sentinel() {
		PreferredLabelResolver r = new PreferredLabelResolver(List.of(lookup -> Optional.empty()));
		assertEquals("!CD4", r.resolve(new GateLookup("CD4", null, "PR:004")));
	}

	@Test
	void table_then_special_label_then_sentinel() {
		PreferredLabelResolver r = new PreferredLabelResolver(
				new PreferredLabelMap(Map.of("http://purl.obolibrary.org/obo/PR_004", "CD4 molecule")));

		assertEquals("CD4 molecule", r.resolve(new GateLookup("CD4", null, "PR:004")));
		assertEquals("Michael", r.resolve(new GateLookup("Mikey", MICHAEL, "PR:034")));
		assertEquals("!viable", r.resolve(new GateLookup("viable", null, "!viable")));
	}

	@Test
	void sentinel_identifier_is_not_looked_up() {
		PreferredLabelResolver r = new PreferredLabelResolver(new PreferredLabelMap(Map.of("!x", "should not show")));
		assertEquals("!x", r.resolve(new GateLookup("x", null, "!x")));
	}
}
