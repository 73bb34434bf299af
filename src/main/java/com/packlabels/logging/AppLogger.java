package com.packlabels.logging;

import java.io.UnsupportedEncodingException;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Shared logger for the label sheet tooling.
 * <p>
 * Console output is one line per record ({@code LEVEL message}). When a JDBC URL is configured the
 * records are also shipped to the central log table through {@link DatabaseLogHandler}.
 */
public final class AppLogger {
    static final String LOGGER_NAME = "com.packlabels.PackLabels";
    private static final String LEVEL_PROPERTY = "labelsheet.logLevel";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() != null) {
                    line += "    caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException ex) {
            logger.fine("UTF-8 console encoding unavailable, using platform default");
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(resolveLevel());

        try {
            DatabaseLogHandler dbHandler = new DatabaseLogHandler();
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (IllegalStateException ex) {
            logger.fine("Central logging disabled: " + ex.getMessage());
        } catch (RuntimeException ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }
        return logger;
    }

    private static Level resolveLevel() {
        String override = System.getProperty(LEVEL_PROPERTY);
        if (override == null || override.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(override.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }
}
