package diag;

/**
 * Every kind of finding the unroller reports.
 */
public enum DiagnosticKind {
    // structural, always fatal
    UNKNOWN_SUCCESSOR,
    DUPLICATE_STATE,

    UNREACHABLE_NODE,

    // soundness, fatal only in strict mode
    IRREDUCIBLE_CONTROL_FLOW,
    UNBOUNDED_LOOP,
    REJECTED_NESTED_LOOP,

    // configuration, always fatal
    MISSING_DEFAULT_BOUND,

    LOOP_BOUND;

    public boolean isStructural() {
        return this == UNKNOWN_SUCCESSOR || this == DUPLICATE_STATE;
    }

    public boolean isSoundnessViolation() {
        return this == IRREDUCIBLE_CONTROL_FLOW || this == UNBOUNDED_LOOP || this == REJECTED_NESTED_LOOP;
    }
}
