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
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.cellgate.gating.om.GateToken;
import org.cellgate.gating.om.Level;
import org.cellgate.gating.om.SuffixSpec;
import org.cellgate.gating.processing.load.ReferenceTableException;

/**
 * Canonical suffix names, their symbols and the synonyms that spell them.
 * <p>
 * Synonyms are kept in table order; the canonical name of each row is
 * registered as its own first synonym. Stripping compares symbols longest
 * first so that {@code "++"} wins over {@code "+"}.
 */
public final class SuffixTable {

	private final Map<String, String> nameToSymbol = new LinkedHashMap<>();
	private final Map<String, String> symbolToName = new LinkedHashMap<>();
	private final Map<String, String> synonymToName = new LinkedHashMap<>();
	private final List<String> symbolsLongestFirst;

	private SuffixTable(List<SuffixSpec> specs) {
		int row = 0;
		for (SuffixSpec spec : specs) {
			row++;
			if (StringUtils.isBlank(spec.getName())) {
				throw new ReferenceTableException("Value scale row " + row + " has no Name");
			}
			if (StringUtils.isBlank(spec.getSymbol())) {
				throw new ReferenceTableException("Value scale row " + row + " (" + spec.getName() + ") has no Symbol");
			}
			String name = spec.getName().trim();
			String symbol = spec.getSymbol().trim();
			nameToSymbol.put(name, symbol);
			symbolToName.putIfAbsent(symbol, name);

			register(name, name);
			for (String syn : spec.getSynonyms()) {
				String s = StringUtils.trimToEmpty(syn);
				if (!s.isEmpty()) {
					register(s, name);
				}
			}
		}

		List<String> symbols = new ArrayList<>(symbolToName.keySet());
		symbols.sort(Comparator.comparingInt(String::length).reversed());
		this.symbolsLongestFirst = Collections.unmodifiableList(symbols);
	}

	private void register(String synonym, String name) {
		String previous = synonymToName.putIfAbsent(synonym, name);
		if (previous != null && !previous.equals(name)) {
			throw new ReferenceTableException(
					"Suffix synonym '" + synonym + "' is registered for both '" + previous + "' and '" + name + "'");
		}
	}

	/** Build a table from parsed value-scale rows, in file order. */
	public static SuffixTable fromSpecs(List<SuffixSpec> specs) {
		return new SuffixTable(specs == null ? List.of() : specs);
	}

	/** Symbol for a canonical name, or {@code null}. */
	public String symbolFor(String name) {
		return nameToSymbol.get(name);
	}

	/** Canonical name for a symbol, or {@code null}. */
	public String nameForSymbol(String symbol) {
		return symbolToName.get(symbol);
	}

	/** Level expressed by a symbol; the empty symbol means positive. */
	public Level levelFor(String symbol) {
		if (StringUtils.isEmpty(symbol)) {
			return Level.POSITIVE;
		}
		return Level.fromName(nameForSymbol(symbol), Level.POSITIVE);
	}

	/** Synonyms (canonical names included) in registration order. */
	public List<String> synonyms() {
		return List.copyOf(synonymToName.keySet());
	}

	public List<String> symbolsLongestFirst() {
		return symbolsLongestFirst;
	}

	/**
	 * Split a canonical token into label and suffix using the longest symbol it
	 * ends with. A token with no known suffix comes back with an empty suffix.
	 */
	public GateToken split(String token) {
		if (token == null) {
			return new GateToken("", "");
		}
		for (String symbol : symbolsLongestFirst) {
			if (token.endsWith(symbol)) {
				return new GateToken(token.substring(0, token.length() - symbol.length()), symbol);
			}
		}
		return new GateToken(token, "");
	}

	/**
	 * Replace a trailing suffix synonym, and any whitespace before it, with the
	 * canonical symbol. Synonyms are tried in table order and only the first one
	 * the gate ends with (case-insensitively) is replaced.
	 */
	public String canonicalizeSuffix(String gate) {
		if (StringUtils.isEmpty(gate)) {
			return gate;
		}
		for (Map.Entry<String, String> e : synonymToName.entrySet()) {
			String synonym = e.getKey();
			if (StringUtils.endsWithIgnoreCase(gate, synonym)) {
				Pattern p = Pattern.compile("\\s*" + Pattern.quote(synonym) + "$", Pattern.CASE_INSENSITIVE);
				return p.matcher(gate).replaceFirst(Matcher.quoteReplacement(nameToSymbol.get(e.getValue())));
			}
		}
		return gate;
	}

	public int size() {
		return nameToSymbol.size();
	}
}
