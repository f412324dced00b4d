package util.logging;

/**
 * Logger used by the unroller passes, modelled after the Log4j API.
 * Formatted variants replace each {} placeholder with the next argument.
 */
public interface Logger {
    // plain messages
    void trace(String message);
    void debug(String message);
    void info(String message);
    void warn(String message);
    void error(String message);

    // {} placeholders
    void trace(String format, Object... args);
    void debug(String format, Object... args);
    void info(String format, Object... args);
    void warn(String format, Object... args);
    void error(String format, Object... args);

    /** log an error together with the stack trace of {@code cause} */
    void error(String message, Throwable cause);

    boolean isTraceEnabled();
    boolean isDebugEnabled();
    boolean isInfoEnabled();
    boolean isWarnEnabled();
    boolean isErrorEnabled();

    /** the level this logger was created with */
    LogLevel getLevel();
}
