package driver;

import diag.Diagnostic;
import diag.DiagnosticKind;
import ir.ParserGraph;
import ir.decl.ParserDecl;
import pass.analysis.UnrollPlan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one unroller run: the verdict, the graph to hand downstream, every
 * diagnostic and the plan of every unrolled loop.
 */
public final class UnrollResult {

    public enum Verdict {
        ACCEPTED,
        ACCEPTED_WITH_WARNING,
        REJECTED
    }

    private final Verdict verdict;
    private final ParserGraph input;
    private final ParserGraph graph;
    private final List<Diagnostic> diagnostics;
    private final List<UnrollPlan> plans;

    public UnrollResult(Verdict verdict, ParserGraph input, ParserGraph graph,
            List<Diagnostic> diagnostics, List<UnrollPlan> plans) {
        this.verdict = verdict;
        this.input = input;
        this.graph = graph;
        this.diagnostics = List.copyOf(diagnostics);
        this.plans = List.copyOf(plans);
    }

    /**
     * Result for a state table that could not be turned into a graph at all.
     */
    public static UnrollResult malformed(List<Diagnostic> diagnostics) {
        return new UnrollResult(Verdict.REJECTED, null, null, diagnostics, List.of());
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isAccepted() {
        return verdict != Verdict.REJECTED;
    }

    /** null only for malformed input */
    public ParserGraph getInput() {
        return input;
    }

    /**
     * The rewritten graph, or the input graph when the run was rejected; null only for
     * malformed input.
     */
    public ParserGraph getGraph() {
        return graph;
    }

    /** the output as a state table, null only for malformed input */
    public ParserDecl toDecl() {
        return graph == null ? null : graph.toDecl();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getDiagnostics(DiagnosticKind kind) {
        return diagnostics.stream()
                .filter(d -> d.getKind() == kind)
                .collect(Collectors.toList());
    }

    public List<UnrollPlan> getPlans() {
        return plans;
    }

    /**
     * Plan of the loop whose header was called {@code header} in the input, or null.
     */
    public UnrollPlan getPlan(String header) {
        for (UnrollPlan plan : plans) {
            if (plan.getHeader().equals(header)) {
                return plan;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "UnrollResult{" + verdict + ", diagnostics=" + diagnostics.size() + ", plans=" + plans.size() + "}";
    }
}
