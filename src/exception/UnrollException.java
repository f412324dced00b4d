package exception;

import diag.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

public class UnrollException extends RuntimeException {
    private final List<Diagnostic> diagnostics;

    public UnrollException(String message) {
        this(message, List.of());
    }

    public UnrollException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Diagnostics that caused the failure; empty for option and internal errors.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public static UnrollException malformedGraph(String parser, List<Diagnostic> diagnostics) {
        String detail = diagnostics.stream()
                .map(Diagnostic::getMessage)
                .collect(Collectors.joining("; "));
        return new UnrollException("Malformed parser " + parser + ": " + detail, diagnostics);
    }

    public static UnrollException invalidOption(String msg) {
        return new UnrollException("Invalid option: " + msg);
    }

    public static UnrollException unknownState(String msg) {
        return new UnrollException("Unknown state: " + msg);
    }

    public static UnrollException illegalGraph(String msg) {
        return new UnrollException("Illegal graph: " + msg);
    }

    public static UnrollException unSupported(String msg) {
        return new UnrollException("UnSupported: " + msg);
    }
}
