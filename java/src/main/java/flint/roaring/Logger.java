package flint.roaring;

/**
 * Logger interface for codec and aggregation diagnostics
 *
 * Decoders report why an input was rejected, aggregations report group sizes.
 */
public interface Logger {
    /**
     * Log informational message
     *
     * @param fmt printf-style format
     * @param args format arguments
     */
    void log(String fmt, Object... args);

    /**
     * Log error message
     *
     * @param fmt printf-style format
     * @param args format arguments
     */
    void error(String fmt, Object... args);

    /**
     * Returns the logger selected by {@code flint.roaring.logger}.
     *
     * @param name logger name, usually the calling class
     */
    static Logger of(String name) {
        return "null".equalsIgnoreCase(Config.LOGGER) ? new NullLogger() : new DefaultLogger(name);
    }

    /**
	 * Null logger that discards log messages but prints errors
	 */
    public static final class NullLogger implements Logger {
        @Override
        public void log(String fmt, Object... args) {
        }

        @Override
        public void error(String fmt, Object... args) {
            System.err.printf(fmt + "%n", args);
        }
    }

    public static final class DefaultLogger implements Logger {
        private final java.util.logging.Logger LOGGER;

        public DefaultLogger(String name) {
            LOGGER = java.util.logging.Logger.getLogger(name);
        }

        @Override
        public void log(String fmt, Object... args) {
            if (LOGGER.isLoggable(java.util.logging.Level.FINE))
                LOGGER.log(java.util.logging.Level.FINE, String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            LOGGER.log(java.util.logging.Level.SEVERE, String.format(fmt, args));
        }
    }
}
