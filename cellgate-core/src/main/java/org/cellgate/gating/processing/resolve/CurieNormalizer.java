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


import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between full OBO IRIs and compact identifiers, e.g.
 * {@code http://purl.obolibrary.org/obo/PR_000001} and {@code PR:000001}.
 * Anything else passes through unchanged.
 */
public final class CurieNormalizer {

	public static final String OBO_BASE = "http://purl.obolibrary.org/obo/";

	private static final Pattern OBO_IRI = Pattern
			.compile("^" + Pattern.quote(OBO_BASE) + "([A-Za-z][A-Za-z0-9]*)_(\\S+)$");
	private static final Pattern CURIE = Pattern.compile("^([A-Za-z][A-Za-z0-9]*):(\\S+)$");

	private CurieNormalizer() {
	}

	public static String shorten(String id) {
		if (id == null) {
			return null;
		}
		String s = id.trim();
		Matcher m = OBO_IRI.matcher(s);
		return m.matches() ? m.group(1) + ":" + m.group(2) : s;
	}

	public static String expand(String id) {
		if (id == null) {
			return null;
		}
		String s = id.trim();
		if (s.startsWith("http://") || s.startsWith("https://")) {
			return s;
		}
		Matcher m = CURIE.matcher(s);
		return m.matches() ? OBO_BASE + m.group(1) + "_" + m.group(2) : s;
	}
}
