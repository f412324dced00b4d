package driver;

/**
 * What to do with a loop that cannot be proven bounded.
 */
public enum ValidationMode {
    /** abort the whole pass and hand back the input graph */
    STRICT,
    /** leave the loop as it is, warn, and unroll the others */
    LENIENT
}
