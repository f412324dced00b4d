package pass;

import driver.OverflowPolicy;
import driver.UnrollOptions;
import exception.UnrollException;
import ir.GraphEditor;
import ir.ParserGraph;
import ir.Transition;
import pass.analysis.LoopBound;
import pass.analysis.LoopInfo;
import pass.analysis.NaturalLoop;
import pass.analysis.UnrollPlan;
import util.LoggingManager;
import util.logging.Logger;

import java.util.*;

/**
 * Replaces every accepted loop by a chain of copies of its body.
 * <p>
 * Copy i's back edges go to the header of copy i + 1. The last copy's back edges go
 * to the first copy's header (residual loop) or to the overflow state. Edges leaving
 * the loop are kept in every copy, edges entering it go to the first copy. Nested
 * loops are unrolled first and the enclosing loop then copies their copies.
 */
public class LoopUnrollPass implements Pass.GraphPass {
    private static final Logger log = LoggingManager.getLogger(LoopUnrollPass.class);

    private PassContext context;
    private GraphEditor editor;
    private int overflowTarget;
    private int unrolled;

    @Override
    public GraphPassType getType() {
        return GraphPassType.LoopUnroll;
    }

    @Override
    public void run(PassContext context) {
        this.context = context;
        ParserGraph input = context.getInput();
        LoopInfo loopInfo = context.getLoopInfo();
        if (loopInfo == null || loopInfo.getTopLevelLoops().isEmpty()) {
            context.setOutput(input);
            return;
        }

        editor = new GraphEditor(input);
        unrolled = 0;
        overflowTarget = -1;
        if (context.getOptions().getOverflowPolicy() == OverflowPolicy.ERROR_ON_OVERFLOW) {
            overflowTarget = resolveOverflowState(loopInfo);
        }

        List<UnrollPlan> plans = new ArrayList<>();
        for (NaturalLoop loop : loopInfo.getTopLevelLoops()) {
            plans.addAll(unroll(loop).plans);
        }
        if (unrolled == 0) {
            context.setOutput(input);
            return;
        }

        int[] remap = new int[editor.size()];
        ParserGraph output = editor.finish(remap);
        List<UnrollPlan> result = new ArrayList<>(plans.size());
        for (UnrollPlan plan : plans) {
            result.add(plan.remap(id -> remap[id]));
        }
        context.setOutput(output);
        context.setPlans(result);
        log.debug("{} loop(s) unrolled, {} -> {} states", unrolled, input.size(), output.size());
    }

    /**
     * The configured overflow state, created as a terminal state if the graph has none
     * of that name. An existing state inside a loop that is about to be removed cannot
     * serve.
     */
    private int resolveOverflowState(LoopInfo loopInfo) {
        UnrollOptions options = context.getOptions();
        String name = options.getOverflowState();
        int id = editor.find(name);
        if (id == -1) {
            log.debug("creating overflow state {}", name);
            return editor.addTerminal(name);
        }
        for (NaturalLoop loop : loopInfo.getTopLevelLoops()) {
            if (loop.contains(id)) {
                throw UnrollException.invalidOption("overflow state " + name + " lies inside the loop with header "
                        + context.stateName(loop.getHeader()));
            }
        }
        return id;
    }

    /** members of an unrolled region in the editor and the plans made for it */
    private static final class Unrolled {
        private final SortedSet<Integer> members;
        private final List<UnrollPlan> plans;

        Unrolled(SortedSet<Integer> members, List<UnrollPlan> plans) {
            this.members = members;
            this.plans = plans;
        }
    }

    private Unrolled unroll(NaturalLoop loop) {
        SortedSet<Integer> region = new TreeSet<>(loop.getNodes());
        List<UnrollPlan> nestedPlans = new ArrayList<>();
        // 先展开内层循环，外层的区域换成内层的副本
        for (NaturalLoop subLoop : loop.getSubLoops()) {
            Unrolled inner = unroll(subLoop);
            region.removeAll(subLoop.getNodes());
            region.addAll(inner.members);
            nestedPlans.addAll(inner.plans);
        }

        LoopBound bound = loop.getBound();
        if (bound == null) {
            return new Unrolled(region, nestedPlans);
        }

        int header = loop.getHeader();
        String headerName = context.stateName(header);
        OverflowPolicy policy = context.getOptions().getOverflowPolicy();
        int k = bound.getCopies();

        List<Map<Integer, Integer>> copies = new ArrayList<>(k);
        for (int i = 1; i <= k; i++) {
            Map<Integer, Integer> copy = new LinkedHashMap<>();
            for (int v : region) {
                copy.put(v, editor.cloneState(v, i));
            }
            copies.add(copy);
        }

        for (int i = 0; i < k; i++) {
            Map<Integer, Integer> copy = copies.get(i);
            int next;
            if (i + 1 < k) {
                next = copies.get(i + 1).get(header);
            } else if (policy == OverflowPolicy.RESIDUAL) {
                next = copies.get(0).get(header);
            } else {
                next = overflowTarget;
            }
            for (Map.Entry<Integer, Integer> e : copy.entrySet()) {
                Transition t = editor.getTransition(e.getKey());
                editor.setTransition(e.getValue(), t.retarget(target -> {
                    if (target == header) {
                        return next;
                    }
                    return copy.getOrDefault(target, target);
                }));
            }
        }

        // edges from outside now enter the first copy; only the header is entered from
        // reachable states, other members at most from unreachable ones
        Map<Integer, Integer> first = copies.get(0);
        for (int v : region) {
            editor.redirectEdges(v, first.get(v), region);
        }
        for (int v : region) {
            editor.remove(v);
        }

        SortedSet<Integer> members = new TreeSet<>();
        List<List<Integer>> copyIds = new ArrayList<>(k);
        List<Integer> headerCopies = new ArrayList<>(k);
        for (Map<Integer, Integer> copy : copies) {
            copyIds.add(new ArrayList<>(copy.values()));
            headerCopies.add(copy.get(header));
            members.addAll(copy.values());
        }

        List<UnrollPlan> plans = new ArrayList<>();
        // nested loops live on in the first copy
        for (UnrollPlan nested : nestedPlans) {
            plans.add(nested.remap(id -> first.getOrDefault(id, id)));
        }
        plans.add(new UnrollPlan(headerName, bound, policy, copyIds, headerCopies,
                policy == OverflowPolicy.RESIDUAL ? -1 : overflowTarget));
        unrolled++;

        log.info("unrolled loop {} into {} copies ({}, n = {}, {})", headerName, k,
                bound.getHeuristic().getName(), bound.getBound(), policy);
        return new Unrolled(members, plans);
    }
}
