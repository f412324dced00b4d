package pass;

import diag.Diagnostic;
import diag.Diagnostics;
import diag.Severity;
import driver.UnrollOptions;
import driver.UnrollResult;
import ir.ParserGraph;
import pass.analysis.DominanceAnalysis;
import pass.analysis.LoopInfo;
import pass.analysis.SCCAnalysis;
import pass.analysis.UnrollPlan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Everything one run of the pipeline knows: the input graph and options, the derived
 * analyses, the diagnostics found so far and, at the end, the output graph.
 */
public class PassContext {
    private final ParserGraph input;
    private final UnrollOptions options;
    private final Diagnostics diagnostics = new Diagnostics();

    private SCCAnalysis scc;
    private DominanceAnalysis dominance;
    private LoopInfo loopInfo;
    private final List<UnrollPlan> plans = new ArrayList<>();
    private ParserGraph output;

    private boolean aborted = false;
    private String abortReason;

    public PassContext(ParserGraph input, UnrollOptions options) {
        this.input = input;
        this.options = options;
    }

    public ParserGraph getInput() {
        return input;
    }

    public UnrollOptions getOptions() {
        return options;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Severity of soundness violations under the configured mode.
     */
    public Severity soundnessSeverity() {
        return options.isStrict() ? Severity.ERROR : Severity.WARNING;
    }

    public String stateName(int id) {
        return input.getState(id).getName();
    }

    public List<String> stateNames(Collection<Integer> ids) {
        List<String> names = new ArrayList<>(ids.size());
        for (int id : ids) {
            names.add(stateName(id));
        }
        return names;
    }

    public SCCAnalysis getScc() {
        return scc;
    }

    public void setScc(SCCAnalysis scc) {
        this.scc = scc;
    }

    public DominanceAnalysis getDominance() {
        return dominance;
    }

    public void setDominance(DominanceAnalysis dominance) {
        this.dominance = dominance;
    }

    public LoopInfo getLoopInfo() {
        return loopInfo;
    }

    public void setLoopInfo(LoopInfo loopInfo) {
        this.loopInfo = loopInfo;
    }

    public List<UnrollPlan> getPlans() {
        return Collections.unmodifiableList(plans);
    }

    public void setPlans(List<UnrollPlan> newPlans) {
        plans.clear();
        plans.addAll(newPlans);
    }

    public ParserGraph getOutput() {
        return output;
    }

    public void setOutput(ParserGraph output) {
        this.output = output;
    }

    /**
     * Stop the pipeline after the current pass; the run then yields the input graph.
     */
    public void abort(String reason) {
        this.aborted = true;
        this.abortReason = reason;
    }

    public boolean isAborted() {
        return aborted;
    }

    public String getAbortReason() {
        return abortReason;
    }

    public UnrollResult toResult() {
        if (aborted) {
            return new UnrollResult(UnrollResult.Verdict.REJECTED, input, input,
                    diagnostics.getAll(), List.of());
        }
        UnrollResult.Verdict verdict = diagnostics.hasWarnings()
                ? UnrollResult.Verdict.ACCEPTED_WITH_WARNING
                : UnrollResult.Verdict.ACCEPTED;
        return new UnrollResult(verdict, input, output != null ? output : input,
                diagnostics.getAll(), plans);
    }
}
