package driver;

/**
 * Where the back edges of the last unrolled copy go.
 */
public enum OverflowPolicy {
    /** back to the first copy, leaving a smaller loop */
    RESIDUAL,
    /** to the overflow state, rejecting packets that need more iterations */
    ERROR_ON_OVERFLOW
}
