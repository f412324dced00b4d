package diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics of one run in the order they were found.
 */
public class Diagnostics {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void addAll(List<Diagnostic> more) {
        diagnostics.addAll(more);
    }

    public List<Diagnostic> getAll() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics.stream()
                .filter(d -> d.getKind() == kind)
                .collect(Collectors.toList());
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.WARNING);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }
}
