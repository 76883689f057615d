package com.tyron.markj.testFramework;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output via system property:
 * - markj.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "markj.test.logLevel";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY, "INFO"));

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(new CompactFormatter());
            }
        }

        root.log(Level.FINE, "test logging configured level=" + level.getName());
    }

    static Level parseLevel(String raw) {
        if (raw == null || raw.isBlank()) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("Unknown " + LEVEL_PROPERTY + " '" + raw + "', using INFO");
            return Level.INFO;
        }
    }

    /**
     * One line per record: {@code HH:mm:ss.SSS LEVEL  SimpleName - message}.
     */
    static final class CompactFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(padRight(record.getLevel().getName(), 7)).append(' ')
                    .append(simpleName(record.getLoggerName())).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            String simple = loggerName.substring(loggerName.lastIndexOf('.') + 1);
            int dollar = simple.indexOf('$');
            return dollar >= 0 ? simple.substring(0, dollar) : simple;
        }

        private static String padRight(String s, int width) {
            return s.length() >= width ? s : s + " ".repeat(width - s.length());
        }
    }
}
