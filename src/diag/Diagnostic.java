package diag;

import pass.analysis.BoundHeuristic;

import java.util.List;
import java.util.Objects;

/**
 * One finding of the unroller. The kind decides which of the optional fields are set:
 * <ul>
 * <li>{@code states}: the offending states (unknown-successor source, unreachable state,
 * members of an irreducible region)</li>
 * <li>{@code header}: the loop header for loop related kinds</li>
 * <li>{@code bound}, {@code copies}, {@code heuristic}: only for {@link DiagnosticKind#LOOP_BOUND}</li>
 * </ul>
 */
public final class Diagnostic {
    private final DiagnosticKind kind;
    private final Severity severity;
    private final String message;
    private final List<String> states;
    private final String header;
    private final int bound;
    private final int copies;
    private final BoundHeuristic heuristic;

    private Diagnostic(DiagnosticKind kind, Severity severity, String message, List<String> states,
            String header, int bound, int copies, BoundHeuristic heuristic) {
        this.kind = kind;
        this.severity = severity;
        this.message = message;
        this.states = List.copyOf(states);
        this.header = header;
        this.bound = bound;
        this.copies = copies;
        this.heuristic = heuristic;
    }

    private static Diagnostic of(DiagnosticKind kind, Severity severity, String message,
            List<String> states, String header) {
        return new Diagnostic(kind, severity, message, states, header, -1, -1, null);
    }

    /**
     * @param state state holding the transition, null for the parser entry
     */
    public static Diagnostic unknownSuccessor(String state, String target) {
        String where = state == null ? "parser entry" : "state " + state;
        return of(DiagnosticKind.UNKNOWN_SUCCESSOR, Severity.ERROR,
                where + " refers to unknown state " + target,
                state == null ? List.of(target) : List.of(state, target), null);
    }

    public static Diagnostic duplicateState(String state) {
        return of(DiagnosticKind.DUPLICATE_STATE, Severity.ERROR,
                "state " + state + " is declared more than once", List.of(state), null);
    }

    public static Diagnostic unreachableNode(String state) {
        return of(DiagnosticKind.UNREACHABLE_NODE, Severity.WARNING,
                "state " + state + " is unreachable from the start state and is left as is",
                List.of(state), null);
    }

    public static Diagnostic irreducibleControlFlow(List<String> states, List<String> entries, Severity severity) {
        return of(DiagnosticKind.IRREDUCIBLE_CONTROL_FLOW, severity,
                "loop " + states + " has no single dominating entry (entered at " + entries
                        + "); restructure it so that every path into the loop goes through one state",
                states, null);
    }

    public static Diagnostic unboundedLoop(String header, List<String> states, Severity severity) {
        return of(DiagnosticKind.UNBOUNDED_LOOP, severity,
                "loop with header " + header + " " + states
                        + " does not extract or advance on every iteration; it may not terminate",
                states, header);
    }

    /**
     * @param nested members of the rejected nested loop
     * @param states members of the enclosing loop
     */
    public static Diagnostic rejectedNestedLoop(String header, List<String> nested, List<String> states,
            Severity severity) {
        return of(DiagnosticKind.REJECTED_NESTED_LOOP, severity,
                "loop with header " + header + " is left unrolled because its nested loop " + nested
                        + " was rejected",
                states, header);
    }

    public static Diagnostic missingDefaultBound(String header) {
        return of(DiagnosticKind.MISSING_DEFAULT_BOUND, Severity.ERROR,
                "no header stack bounds the loop with header " + header
                        + " and no default bound is configured",
                List.of(header), header);
    }

    public static Diagnostic loopBound(String header, int bound, int copies, BoundHeuristic heuristic) {
        return new Diagnostic(DiagnosticKind.LOOP_BOUND, Severity.INFO,
                "loop with header " + header + " bounded to " + bound + " iterations by "
                        + heuristic.getName() + ", unrolled into " + copies + " copies",
                List.of(header), header, bound, copies, heuristic);
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getStates() {
        return states;
    }

    public String getHeader() {
        return header;
    }

    public int getBound() {
        return bound;
    }

    public int getCopies() {
        return copies;
    }

    public BoundHeuristic getHeuristic() {
        return heuristic;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic other)) return false;
        return kind == other.kind && severity == other.severity && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity, message);
    }

    @Override
    public String toString() {
        return severity + " " + kind + ": " + message;
    }
}
