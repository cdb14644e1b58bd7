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
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How one family of projects writes its gating strings: text rewrites applied
 * first, then either a delimiter to split on or a pattern whose matches are
 * the gates.
 */
public final class DialectRule {

	public enum Mode {
		/** Split the text on the pattern. */
		SPLIT,
		/** Each match of the pattern is a gate. */
		EXTRACT
	}

	/** A regex replacement; {@code $1}-style group references are allowed. */
	public static final class Rewrite {
		private final Pattern pattern;
		private final String replacement;

		Rewrite(String regex, String replacement) {
			this.pattern = compile(regex);
			this.replacement = replacement;
		}

		String apply(String text) {
			return pattern.matcher(text).replaceAll(replacement);
		}

		@Override
		public String toString() {
			return pattern.pattern() + " -> " + replacement;
		}
	}

	private final String name;
	private final Predicate<String> projectMatcher;
	private final List<Rewrite> rewrites;
	private final Mode mode;
	private final Pattern pattern;

	private DialectRule(String name, Predicate<String> projectMatcher, List<Rewrite> rewrites, Mode mode,
			Pattern pattern) {
		this.name = name;
		this.projectMatcher = projectMatcher;
		this.rewrites = List.copyOf(rewrites);
		this.mode = mode;
		this.pattern = pattern;
	}

	/** Start a rule that applies to project names containing {@code keyword}. */
	public static Builder keyword(String keyword) {
		return new Builder(keyword, project -> project != null && project.contains(keyword));
	}

	/** Start a rule that applies to every project. */
	public static Builder fallback(String name) {
		return new Builder(name, project -> true);
	}

	public String getName() {
		return name;
	}

	public Mode getMode() {
		return mode;
	}

	public boolean appliesTo(String projectName) {
		return projectMatcher.test(projectName);
	}

	/** Apply the rewrites to {@code text}. */
	public String rewrite(String text) {
		String out = text;
		for (Rewrite r : rewrites) {
			out = r.apply(out);
		}
		return out;
	}

	/** Rewrite, then cut {@code text} into raw gate strings. */
	public List<String> segment(String text) {
		String rewritten = rewrite(text == null ? "" : text);
		if (mode == Mode.EXTRACT) {
			List<String> out = new ArrayList<>();
			Matcher m = pattern.matcher(rewritten);
			while (m.find()) {
				out.add(m.group());
			}
			return out;
		}
		return Arrays.asList(pattern.split(rewritten, -1));
	}

	/** Character classes such as {@code \w} and {@code \s} match Unicode text. */
	static Pattern compile(String regex) {
		return Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
	}

	@Override
	public String toString() {
		return name + " " + mode + " " + pattern.pattern() + " " + rewrites;
	}

	public static final class Builder {
		private final String name;
		private final Predicate<String> projectMatcher;
		private final List<Rewrite> rewrites = new ArrayList<>();

		private Builder(String name, Predicate<String> projectMatcher) {
			this.name = name;
			this.projectMatcher = projectMatcher;
		}

		public Builder rewrite(String regex, String replacement) {
			rewrites.add(new Rewrite(regex, replacement));
			return this;
		}

		public DialectRule split(String delimiterRegex) {
			return new DialectRule(name, projectMatcher, rewrites, Mode.SPLIT, compile(delimiterRegex));
		}

		public DialectRule extract(String gateRegex) {
			return new DialectRule(name, projectMatcher, rewrites, Mode.EXTRACT, compile(gateRegex));
		}
	}
}
