package pass;

import diag.Diagnostic;
import diag.Severity;
import ir.ParserGraph;
import pass.analysis.DominanceAnalysis;
import pass.analysis.LoopInfo;
import pass.analysis.NaturalLoop;
import pass.analysis.SCCAnalysis;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Decides which cyclic regions may be unrolled. A region qualifies when it has a
 * single entry that dominates it, when some packet-consuming state lies on every path
 * around it, and when every loop nested inside it qualifies as well.
 * <p>
 * The last condition is stricter than the first two alone: an outer loop whose own
 * back edges all pass through a consumer is still rejected (with
 * {@code REJECTED_NESTED_LOOP}) when a cycle nested inside it is unbounded or
 * irreducible. Such a region is left as it is in lenient mode.
 */
public class LoopValidationPass implements Pass.GraphPass {
    private static final Logger log = LoggingManager.getLogger(LoopValidationPass.class);

    private PassContext context;
    private ParserGraph graph;
    private SCCAnalysis scc;
    private DominanceAnalysis dominance;
    private boolean rejected;

    @Override
    public GraphPassType getType() {
        return GraphPassType.LoopValidation;
    }

    @Override
    public void run(PassContext context) {
        this.context = context;
        this.graph = context.getInput();
        this.rejected = false;
        if (context.getScc() == null) {
            context.setScc(new SCCAnalysis(graph).run());
        }
        if (context.getDominance() == null) {
            context.setDominance(new DominanceAnalysis(graph).run());
        }
        this.scc = context.getScc();
        this.dominance = context.getDominance();

        LoopInfo loopInfo = new LoopInfo();
        for (SortedSet<Integer> component : scc.getLoops()) {
            NaturalLoop loop = validate(component);
            if (loop != null) {
                loopInfo.addTopLevelLoop(loop);
            } else {
                loopInfo.addRejectedRegion(component);
            }
        }
        context.setLoopInfo(loopInfo);
        log.debug("{}", loopInfo);

        // every region is checked before giving up, so all problems are reported at once
        if (rejected && context.getOptions().isStrict()) {
            context.abort(loopInfo.getRejectedRegions().size() + " loop(s) cannot be unrolled");
        }
    }

    /**
     * Validate one strongly connected region and, recursively, the loops nested in it.
     *
     * @return the loop, or null if it was rejected (the reason is reported)
     */
    private NaturalLoop validate(SortedSet<Integer> region) {
        Severity severity = context.soundnessSeverity();
        List<String> names = context.stateNames(region);

        // 1. a single entry that dominates the whole region
        List<Integer> entries = findEntries(region);
        int header = entries.size() == 1 ? entries.get(0) : -1;
        if (header != -1) {
            for (int v : region) {
                if (!dominance.dominates(header, v)) {
                    header = -1;
                    break;
                }
            }
        }
        if (header == -1) {
            reject(Diagnostic.irreducibleControlFlow(names, context.stateNames(entries), severity));
            return null;
        }
        String headerName = context.stateName(header);

        // 2. loops nested inside, found with the back edges cut
        List<NaturalLoop> subLoops = new ArrayList<>();
        List<SortedSet<Integer>> rejectedSubLoops = new ArrayList<>();
        SCCAnalysis inner = SCCAnalysis.forRegion(graph, region, header).run(header);
        for (SortedSet<Integer> component : inner.getLoops()) {
            NaturalLoop subLoop = validate(component);
            if (subLoop != null) {
                subLoops.add(subLoop);
            } else {
                rejectedSubLoops.add(component);
            }
        }

        // 3. something consumes packet data on every path from the header back to it
        SortedSet<Integer> backEdgeSources = new TreeSet<>();
        for (int v : region) {
            for (int w : graph.getSuccessors(v)) {
                if (w == header) {
                    backEdgeSources.add(v);
                }
            }
        }
        DominanceAnalysis local = new DominanceAnalysis(graph, header, region).run();
        List<Integer> consumers = new ArrayList<>();
        for (int p : region) {
            if (!graph.getState(p).hasPacketConsumingCall()) {
                continue;
            }
            boolean onEveryPath = true;
            for (int b : backEdgeSources) {
                if (!local.dominates(p, b)) {
                    onEveryPath = false;
                    break;
                }
            }
            if (onEveryPath) {
                consumers.add(p);
            }
        }
        // the candidates form a chain in the dominator tree
        consumers.sort(Comparator.comparingInt(local::getDomLevel));

        boolean accepted = true;
        if (consumers.isEmpty()) {
            reject(Diagnostic.unboundedLoop(headerName, names, severity));
            accepted = false;
        }
        for (SortedSet<Integer> nested : rejectedSubLoops) {
            reject(Diagnostic.rejectedNestedLoop(headerName, context.stateNames(nested), names, severity));
            accepted = false;
        }
        if (!accepted) {
            return null;
        }

        NaturalLoop loop = new NaturalLoop(header, region, backEdgeSources, consumers);
        for (NaturalLoop subLoop : subLoops) {
            loop.addSubLoop(subLoop);
        }
        log.debug("loop {} accepted, consumers {}", headerName, context.stateNames(consumers));
        return loop;
    }

    /**
     * Members entered from a reachable state outside the region; the start state counts
     * as entered from outside.
     */
    private List<Integer> findEntries(SortedSet<Integer> region) {
        List<Integer> entries = new ArrayList<>();
        for (int v : region) {
            boolean entry = v == graph.getStart();
            for (int p : graph.getPredecessors(v)) {
                if (entry) {
                    break;
                }
                entry = !region.contains(p) && scc.isReachable(p);
            }
            if (entry) {
                entries.add(v);
            }
        }
        return entries;
    }

    private void reject(Diagnostic diagnostic) {
        rejected = true;
        context.report(diagnostic);
        log.warn("{}", diagnostic.getMessage());
    }
}
