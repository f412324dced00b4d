package pass.analysis;

/**
 * How the iteration bound of a loop was chosen.
 */
public enum BoundHeuristic {
    /** capacity of the header stack extracted into; exact */
    HEADER_STACK("header-stack capacity", true),
    /** the configured default bound; the program is bounded but may behave differently past it */
    DEFAULT_BOUND("default bound", false);

    private final String name;
    private final boolean exact;

    BoundHeuristic(String name, boolean exact) {
        this.name = name;
        this.exact = exact;
    }

    public String getName() {
        return name;
    }

    public boolean isExact() {
        return exact;
    }
}
