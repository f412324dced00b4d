package util.logging;

/**
 * Severity levels understood by {@link SimpleLogger}, ordered from the most
 * verbose to the most severe.
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    FATAL(5);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * True if this level is more verbose than {@code other}, i.e. a logger
     * configured at {@code other} drops messages of this level.
     */
    public boolean isLessSpecificThan(LogLevel other) {
        return value < other.value;
    }

    /**
     * Parse a level name, falling back to {@code fallback} for null or unknown names.
     */
    public static LogLevel parse(String name, LogLevel fallback) {
        if (name == null) {
            return fallback;
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(name.trim())) {
                return level;
            }
        }
        return fallback;
    }
}
