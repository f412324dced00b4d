package util;

import util.logging.LogLevel;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Facade over {@link LogManager} used by the pass classes.
 */
public class LoggingManager {
    private static boolean inited = false;

    public static synchronized void init() {
        if (inited) return;
        LogManager.init();
        inited = true;
    }

    public static Logger getLogger(Class<?> cls) {
        if (!inited) init();
        return LogManager.getLogger(cls);
    }

    public static Logger getLogger(Class<?> cls, LogLevel level) {
        if (!inited) init();
        return LogManager.getLogger(cls, level);
    }

    /**
     * Run {@code action} with {@code context} attached to every log line of this thread,
     * restoring the previous context afterwards.
     */
    public static <T> T withContext(String context, java.util.function.Supplier<T> action) {
        String previous = LogManager.getContext();
        LogManager.setContext(context);
        try {
            return action.get();
        } finally {
            LogManager.setContext(previous);
        }
    }
}
