package driver;

import exception.UnrollException;

/*
 * process-wide configuration of the unroller, read from system properties
 * eg: -Ddebug=true -Dlog.console=true -Dlog.level=trace
 */
public class Config {
    private static Config config = new Config();

    public boolean isDebug = false;
    public boolean logToConsole = false;
    public boolean logToFile = false;
    public String logLevel = null;

    private Config() {
        isDebug = getFlag("debug");
        logToConsole = getFlag("log.console");
        logToFile = getFlag("log.file");
        logLevel = getProperty("log.level");
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    /**
     * Like {@link #getFlag(String)} but with a default for an absent property.
     */
    public static boolean getFlag(String name, boolean fallback) {
        String raw = getProperty(name);
        return raw == null ? fallback : raw.equalsIgnoreCase("true");
    }

    /**
     * Trimmed value of a system property, null when absent or blank.
     */
    public static String getProperty(String name) {
        String raw = System.getProperty(name);
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        return raw.trim();
    }

    /**
     * Integer value of a system property, null when absent.
     * @throws UnrollException if the value is not an integer
     */
    public static Integer getInt(String name) {
        String raw = getProperty(name);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw UnrollException.invalidOption(name + " is not an integer: " + raw);
        }
    }

    public static Config getInstance() {
        return config;
    }
}
