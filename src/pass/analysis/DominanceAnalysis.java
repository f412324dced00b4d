package pass.analysis;

import ir.ParserGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immediate dominators of the states reachable from an entry, by the iterative
 * algorithm of Cooper, Harvey and Kennedy over reverse post-order.
 * <p>
 * The analysis can be restricted to a region (a loop body): only edges between
 * region members are followed, so a node dominates another exactly when it lies on
 * every path from the entry that stays inside the region.
 */
public class DominanceAnalysis {
    private final ParserGraph graph;
    private final int entry;
    private final Set<Integer> region;

    private final int[] idom;
    private final int[] postNumber;
    private final int[] domLevel;
    private final Map<Integer, List<Integer>> domTreeChildren = new LinkedHashMap<>();
    private int[] reversePostOrder = new int[0];
    private boolean done = false;

    public DominanceAnalysis(ParserGraph graph) {
        this(graph, graph.getStart(), null);
    }

    /**
     * @param region nodes the analysis may visit, null for the whole graph; must contain {@code entry}
     */
    public DominanceAnalysis(ParserGraph graph, int entry, Set<Integer> region) {
        this.graph = graph;
        this.entry = entry;
        this.region = region;
        this.idom = new int[graph.size()];
        this.postNumber = new int[graph.size()];
        this.domLevel = new int[graph.size()];
    }

    public DominanceAnalysis run() {
        if (done) {
            return this;
        }
        Arrays.fill(idom, -1);
        Arrays.fill(postNumber, -1);
        Arrays.fill(domLevel, -1);
        computeReversePostOrder();
        computeImmediateDominators();
        buildDomTree();
        done = true;
        return this;
    }

    private boolean inRegion(int v) {
        return region == null || region.contains(v);
    }

    private void computeReversePostOrder() {
        boolean[] visited = new boolean[graph.size()];
        List<Integer> postOrder = new ArrayList<>();
        Deque<int[]> frames = new ArrayDeque<>();
        visited[entry] = true;
        frames.push(new int[] { entry, 0 });
        while (!frames.isEmpty()) {
            int[] frame = frames.peek();
            int[] succs = graph.getSuccessors(frame[0]);
            if (frame[1] < succs.length) {
                int w = succs[frame[1]++];
                if (inRegion(w) && !visited[w]) {
                    visited[w] = true;
                    frames.push(new int[] { w, 0 });
                }
            } else {
                frames.pop();
                postNumber[frame[0]] = postOrder.size();
                postOrder.add(frame[0]);
            }
        }
        reversePostOrder = new int[postOrder.size()];
        for (int i = 0; i < reversePostOrder.length; i++) {
            reversePostOrder[i] = postOrder.get(postOrder.size() - 1 - i);
        }
    }

    private void computeImmediateDominators() {
        idom[entry] = entry;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int v : reversePostOrder) {
                if (v == entry) {
                    continue;
                }
                int newIdom = -1;
                // 只考虑区域内、已处理的前驱
                for (int p : graph.getPredecessors(v)) {
                    if (!inRegion(p) || idom[p] == -1) {
                        continue;
                    }
                    newIdom = newIdom == -1 ? p : intersect(p, newIdom);
                }
                if (idom[v] != newIdom) {
                    idom[v] = newIdom;
                    changed = true;
                }
            }
        }
    }

    private int intersect(int a, int b) {
        while (a != b) {
            while (postNumber[a] < postNumber[b]) {
                a = idom[a];
            }
            while (postNumber[b] < postNumber[a]) {
                b = idom[b];
            }
        }
        return a;
    }

    private void buildDomTree() {
        for (int v : reversePostOrder) {
            domTreeChildren.put(v, new ArrayList<>());
        }
        for (int v : reversePostOrder) {
            if (v != entry) {
                domTreeChildren.get(idom[v]).add(v);
            }
        }
        // reverse post-order visits a dominator before everything it dominates
        for (int v : reversePostOrder) {
            domLevel[v] = v == entry ? 0 : domLevel[idom[v]] + 1;
        }
    }

    public int getEntry() {
        return entry;
    }

    public boolean isReachable(int v) {
        return postNumber[v] != -1;
    }

    /**
     * True if every path from the entry to {@code b} goes through {@code a}; every
     * reachable node dominates itself. False if either node is unreachable.
     */
    public boolean dominates(int a, int b) {
        if (!isReachable(a) || !isReachable(b)) {
            return false;
        }
        while (domLevel[b] > domLevel[a]) {
            b = idom[b];
        }
        return a == b;
    }

    /** -1 for the entry and for unreachable nodes */
    public int getImmediateDominator(int v) {
        return v == entry || !isReachable(v) ? -1 : idom[v];
    }

    /** depth in the dominator tree, 0 for the entry, -1 if unreachable */
    public int getDomLevel(int v) {
        return domLevel[v];
    }

    public List<Integer> getDomTreeChildren(int v) {
        return Collections.unmodifiableList(domTreeChildren.getOrDefault(v, Collections.emptyList()));
    }

    /**
     * The dominator tree as a map from node to immediate dominator, reachable
     * non-entry nodes only, in reverse post-order.
     */
    public Map<Integer, Integer> getImmediateDominators() {
        Map<Integer, Integer> result = new LinkedHashMap<>();
        for (int v : reversePostOrder) {
            if (v != entry) {
                result.put(v, idom[v]);
            }
        }
        return result;
    }

    public int[] getReversePostOrder() {
        return reversePostOrder.clone();
    }
}
