package ir;

/**
 * One arm of a select: a keyset pattern and the id of the successor state.
 */
public final class SelectCase {
    public static final String DEFAULT = "default";

    private final String pattern;
    private final int target;

    public SelectCase(String pattern, int target) {
        this.pattern = pattern;
        this.target = target;
    }

    public String getPattern() {
        return pattern;
    }

    public int getTarget() {
        return target;
    }

    public boolean isDefault() {
        return DEFAULT.equals(pattern) || "_".equals(pattern);
    }

    public SelectCase withTarget(int newTarget) {
        return newTarget == target ? this : new SelectCase(pattern, newTarget);
    }

    @Override
    public String toString() {
        return pattern + ": " + target;
    }
}
