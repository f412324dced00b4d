package pass;

import exception.UnrollException;
import ir.ParserGraph;
import ir.ParserState;
import pass.analysis.UnrollPlan;
import util.LoggingManager;
import util.logging.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Sanity checks on the output graph and the unroll plans. A failure here is a bug in
 * the rewriter, never a problem of the input.
 */
public class VerifyGraphPass implements Pass.GraphPass {
    private static final Logger log = LoggingManager.getLogger(VerifyGraphPass.class);

    @Override
    public GraphPassType getType() {
        return GraphPassType.VerifyGraph;
    }

    @Override
    public void run(PassContext context) {
        ParserGraph graph = context.getOutput() != null ? context.getOutput() : context.getInput();
        verifyGraph(graph);
        for (UnrollPlan plan : context.getPlans()) {
            verifyPlan(graph, plan);
        }
        log.debug("verified {} states, {} plan(s)", graph.size(), context.getPlans().size());
    }

    public static void verifyGraph(ParserGraph graph) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < graph.size(); i++) {
            ParserState state = graph.getState(i);
            check(state.getId() == i, "state " + state.getName() + " has id " + state.getId() + " at position " + i);
            check(names.add(state.getName()), "duplicate state name " + state.getName());
            if (graph.isSentinel(i)) {
                check(state.getStatements().isEmpty(), "sentinel " + state.getName() + " has statements");
            }
            if (state.isTerminal()) {
                continue;
            }
            for (int target : state.getSuccessors()) {
                check(target >= 0 && target < graph.size(),
                        "state " + state.getName() + " jumps to invalid id " + target);
            }
        }
        check(graph.getStart() >= 0 && graph.getStart() < graph.size(), "invalid start id " + graph.getStart());
        check(graph.getState(graph.getAccept()).isTerminal(), "accept has a transition");
        check(graph.getState(graph.getReject()).isTerminal(), "reject has a transition");
    }

    public static void verifyPlan(ParserGraph graph, UnrollPlan plan) {
        String header = plan.getHeader();
        check(plan.getCopyCount() == plan.getBound().getCopies(),
                "loop " + header + " has " + plan.getCopyCount() + " copies instead of " + plan.getBound().getCopies());
        for (List<Integer> copy : plan.getCopies()) {
            for (int id : copy) {
                check(id >= 0 && id < graph.size() && !graph.getState(id).isTerminal(),
                        "loop " + header + " refers to invalid state id " + id);
            }
        }
        int k = plan.getCopyCount();
        for (int i = 1; i <= k; i++) {
            int expected;
            if (i < k) {
                expected = plan.getHeaderCopy(i + 1);
            } else if (plan.getOverflowTarget() < 0) {
                expected = plan.getHeaderCopy(1);
            } else {
                expected = plan.getOverflowTarget();
            }
            check(hasEdgeTo(graph, plan.getCopies().get(i - 1), expected),
                    "copy " + i + " of loop " + header + " does not continue to " + graph.getState(expected).getName());
        }
    }

    private static boolean hasEdgeTo(ParserGraph graph, List<Integer> copy, int target) {
        for (int id : copy) {
            for (int w : graph.getSuccessors(id)) {
                if (w == target) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            log.error("output verification failed: {}", message);
            throw UnrollException.illegalGraph(message);
        }
    }
}
