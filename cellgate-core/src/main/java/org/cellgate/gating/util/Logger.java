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

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Console logger for batch runs and table loading.
 * <p>
 * {@code -Dcellgate.log.level=DEBUG} lowers the threshold (INFO by default)
 * and {@code -Dcellgate.log.datetime} changes the timestamp pattern. Warnings
 * and errors are printed to stderr.
 */
public final class Logger {

	public enum Level {
		TRACE, DEBUG, INFO, WARN, ERROR
	}

	private static final Level THRESHOLD = levelProperty("cellgate.log.level", Level.INFO);

	private static final DateTimeFormatter STAMP = DateTimeFormatter
			.ofPattern(System.getProperty("cellgate.log.datetime", "yyyy-MM-dd HH:mm:ss"));

	private Logger() {
	}

	public static boolean isEnabled(Level level) {
		return level != null && level.compareTo(THRESHOLD) >= 0;
	}

	public static void trace(String msg, Object... args) {
		write(Level.TRACE, msg, args);
	}

	public static void debug(String msg, Object... args) {
		write(Level.DEBUG, msg, args);
	}

	public static void info(String msg, Object... args) {
		write(Level.INFO, msg, args);
	}

	public static void warn(String msg, Object... args) {
		write(Level.WARN, msg, args);
	}

	public static void error(String msg, Object... args) {
		write(Level.ERROR, msg, args);
	}

	private static void write(Level level, String msg, Object... args) {
		if (!isEnabled(level)) {
			return;
		}
		String line = STAMP.format(LocalDateTime.now()) + " " + level + " " + format(msg, args);
		PrintStream out = level.compareTo(Level.WARN) >= 0 ? System.err : System.out;
		synchronized (Logger.class) {
			out.println(line);
		}
	}

	/** Fill {@code {}} slots in order; arguments without a slot are appended. */
	static String format(String template, Object... args) {
		if (template == null) {
			return "null";
		}
		if (args == null || args.length == 0) {
			return template;
		}
		StringBuilder sb = new StringBuilder();
		int next = 0;
		int from = 0;
		int slot;
		while (next < args.length && (slot = template.indexOf("{}", from)) >= 0) {
			sb.append(template, from, slot).append(args[next++]);
			from = slot + 2;
		}
		sb.append(template.substring(from));
		for (; next < args.length; next++) {
			sb.append(' ').append(args[next]);
		}
		return sb.toString();
	}

	private static Level levelProperty(String key, Level fallback) {
		String v = System.getProperty(key);
		if (v == null || v.isBlank()) {
			return fallback;
		}
		try {
			return Level.valueOf(v.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			System.err.println("Unknown " + key + " '" + v + "', using " + fallback);
			return fallback;
		}
	}
}
