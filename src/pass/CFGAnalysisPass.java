package pass;

import diag.Diagnostic;
import ir.ParserGraph;
import ir.ParserState;
import pass.analysis.DominanceAnalysis;
import pass.analysis.SCCAnalysis;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Reachability, strongly connected components and dominators of the input graph.
 * States the start cannot reach are reported and left out of loop analysis.
 */
public class CFGAnalysisPass implements Pass.GraphPass {
    private static final Logger log = LoggingManager.getLogger(CFGAnalysisPass.class);

    @Override
    public GraphPassType getType() {
        return GraphPassType.CFGAnalysis;
    }

    @Override
    public void run(PassContext context) {
        ParserGraph graph = context.getInput();
        SCCAnalysis scc = new SCCAnalysis(graph).run();
        context.setScc(scc);

        for (ParserState state : graph.getStates()) {
            int id = state.getId();
            if (scc.isReachable(id) || graph.isSentinel(id)) {
                continue;
            }
            context.report(Diagnostic.unreachableNode(state.getName()));
            log.warn("state {} is unreachable from {}", state.getName(), graph.getStartState().getName());
        }

        context.setDominance(new DominanceAnalysis(graph).run());
        log.debug("{} of {} states reachable, {} cyclic components", scc.getReachableCount(), graph.size(),
                scc.getLoops().size());
    }
}
