package org.cellgate.gating.util;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LoggerTest {

	@Test
	void placeholders_are_filled_in_order() {
		assertEquals("a=1 b=two", Logger.format("a={} b={}", 1, "two"));
	}

	@Test
	void surplus_arguments_are_appended() {
		assertEquals("x 3 4", Logger.format("x", 3, 4));
	}

	@Test
	void missing_arguments_leave_placeholders() {
		assertEquals("only 1 and {}", Logger.format("only {} and {}", 1));
	}

	@Test
	void null_template_and_null_args() {
		assertEquals("null", Logger.format(null, 1));
		assertEquals("v=null", Logger.format("v={}", (Object) null));
	}

	@Test
	void error_level_is_always_enabled() {
		assertTrue(Logger.isEnabled(Logger.Level.ERROR));
		assertFalse(Logger.isEnabled(null));
	}
}
