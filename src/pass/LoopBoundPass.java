package pass;

import diag.Diagnostic;
import ir.ParserGraph;
import ir.statement.PacketConsumingCall;
import ir.type.HeaderStackType;
import pass.analysis.LoopBound;
import pass.analysis.LoopInfo;
import pass.analysis.NaturalLoop;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Chooses how many copies each accepted loop is unrolled into.
 * <p>
 * An extract into a header stack of capacity c on every iteration bounds the loop
 * exactly: the stack takes c elements and the next extract fails, so c + 1 copies
 * cover every behaviour. Without one the configured default bound is used.
 * <p>
 * Advance counts as consuming regardless of its argument, so a loop whose only
 * consumer is {@code advance(0)} is accepted although nothing bounds it.
 */
public class LoopBoundPass implements Pass.GraphPass {
    private static final Logger log = LoggingManager.getLogger(LoopBoundPass.class);

    @Override
    public GraphPassType getType() {
        return GraphPassType.LoopBound;
    }

    @Override
    public void run(PassContext context) {
        LoopInfo loopInfo = context.getLoopInfo();
        if (loopInfo == null) {
            return;
        }
        int missing = 0;
        for (NaturalLoop loop : loopInfo.getAllLoops()) {
            LoopBound bound = computeBound(context.getInput(), loop, context.getOptions().getDefaultBound());
            String header = context.stateName(loop.getHeader());
            if (bound == null) {
                missing++;
                context.report(Diagnostic.missingDefaultBound(header));
                log.error("no bound for loop {}: set a default bound", header);
                continue;
            }
            loop.setBound(bound);
            context.report(Diagnostic.loopBound(header, bound.getBound(), bound.getCopies(), bound.getHeuristic()));
            log.debug("loop {}: {}", header, bound);
        }
        if (missing > 0) {
            context.abort(missing + " loop(s) need a default bound");
        }
    }

    /**
     * @return the bound, or null when only the default bound applies and none is set
     */
    static LoopBound computeBound(ParserGraph graph, NaturalLoop loop, Integer defaultBound) {
        for (int consumer : loop.getConsumers()) {
            for (PacketConsumingCall call : graph.getState(consumer).getPacketConsumingCalls()) {
                HeaderStackType stack = call.getWrittenStack();
                if (stack != null) {
                    return LoopBound.headerStack(consumer, stack);
                }
            }
        }
        return defaultBound == null ? null : LoopBound.defaultBound(defaultBound);
    }
}
