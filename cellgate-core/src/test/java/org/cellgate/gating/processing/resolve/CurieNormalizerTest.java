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
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class CurieNormalizerTest {

	@Test
	void obo_iri_is_shortened() {
		assertEquals("PR:000001004", CurieNormalizer.shorten("http://purl.obolibrary.org/obo/PR_000001004"));
		assertEquals("CL:0000624", CurieNormalizer.shorten(" http://purl.obolibrary.org/obo/CL_0000624 "));
	}

	@Test
	void other_values_pass_through() {
		assertEquals("PR:034", CurieNormalizer.shorten("PR:034"));
		assertEquals("!viable", CurieNormalizer.shorten("!viable"));
		assertEquals("http://example.org/thing_1", CurieNormalizer.shorten("http://example.org/thing_1"));
		assertEquals("http://purl.obolibrary.org/obo/cl#lacks_plasma_membrane_part",
				CurieNormalizer.shorten("http://purl.obolibrary.org/obo/cl#lacks_plasma_membrane_part"));
		assertNull(CurieNormalizer.shorten(null));
	}

	@Test
	void curie_is_expanded() {
		assertEquals("http://purl.obolibrary.org/obo/CL_0000236", CurieNormalizer.expand("CL:0000236"));
		assertEquals("http://purl.obolibrary.org/obo/PR_1", CurieNormalizer.expand("http://purl.obolibrary.org/obo/PR_1"));
		assertEquals("viable", CurieNormalizer.expand("viable"));
	}
}
