package org.clinlp.ie.util;

/*
 * This file is part of ClinLP.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * ClinLP is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ClinLP is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ClinLP.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Console logger used across the extraction pipeline.
 * <p>
 * Loading and building (rule stores, concept dictionaries, pipelines) report
 * at INFO, configuration problems at ERROR just before the corresponding
 * {@code ConfigurationException} is thrown, and per-document work (sentence
 * counts, trigger tie-breaks, entities found) at DEBUG. Documents may be
 * processed in parallel, so each line carries the thread name and is written
 * atomically.
 * <p>
 * The threshold comes from {@code -Dclinlp.log.level} (default INFO) and the
 * timestamp pattern from {@code -Dclinlp.log.datetime}. Wrap costly DEBUG
 * arguments in {@link #isEnabled(Level)}.
 */
public final class Logger {

    /** Log levels in increasing order of severity. */
    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR;

        static Level parse(String s, Level fallback) {
            if (s == null) return fallback;
            try {
                return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return fallback;
            }
        }
    }

    // ---- Configuration (read once at class load) ----
    private static final Level MIN_LEVEL =
            Level.parse(System.getProperty("clinlp.log.level"), Level.INFO);

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern(
                    System.getProperty("clinlp.log.datetime", "yyyy-MM-dd HH:mm:ss")
            );

    private Logger() {}

    // ---- Public API ----

    /** True when messages at {@code level} would be printed. */
    public static boolean isEnabled(Level level) {
        return level.ordinal() >= MIN_LEVEL.ordinal();
    }

    public static void trace(String msg, Object... args) { log(Level.TRACE, null, msg, args); }
    public static void debug(String msg, Object... args) { log(Level.DEBUG, null, msg, args); }
    public static void info (String msg, Object... args) { log(Level.INFO , null, msg, args); }
    public static void warn (String msg, Object... args) { log(Level.WARN , null, msg, args); }
    public static void error(String msg, Object... args) { log(Level.ERROR, null, msg, args); }

    public static void warn (String msg, Throwable t, Object... args) { log(Level.WARN , t, msg, args); }
    public static void error(String msg, Throwable t, Object... args) { log(Level.ERROR, t, msg, args); }

    // ---- Core implementation ----

    private static void log(Level level, Throwable t, String msg, Object... args) {
        if (!isEnabled(level)) return;

        final String ts = LocalDateTime.now().format(TS);
        final String thread = Thread.currentThread().getName();
        final String body = format(msg, args);

        // INFO and below -> stdout; WARN/ERROR -> stderr
        final PrintStream out = (level.ordinal() >= Level.WARN.ordinal()) ? System.err : System.out;

        synchronized (Logger.class) {
            out.println("[" + ts + "] [" + thread + "] " + level + " clinlp " + body);
            if (t != null) {
                t.printStackTrace(out);
            }
        }
    }

    /**
     * Replaces each "{}" with the stringified next argument.
     * Surplus arguments are appended, missing ones leave the placeholder.
     */
    static String format(String template, Object... args) {
        if (template == null) return "null";
        if (args == null || args.length == 0) return template;

        StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
        int argIdx = 0;
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            boolean placeholder = c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '}';
            if (placeholder && argIdx < args.length) {
                sb.append(String.valueOf(args[argIdx++]));
                i += 2;
            } else {
                sb.append(c);
                i++;
            }
        }
        while (argIdx < args.length) {
            sb.append(' ').append(String.valueOf(args[argIdx++]));
        }
        return sb.toString();
    }
}
