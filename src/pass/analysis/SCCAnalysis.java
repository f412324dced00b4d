package pass.analysis;

import ir.ParserGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Strongly connected components by Tarjan's algorithm. Only nodes reachable from the
 * roots are visited, so the analysis doubles as the reachability check.
 * <p>
 * The depth-first walk keeps its own frame stack; unrolled parsers can be deep enough
 * to overflow the Java call stack with a recursive walk.
 */
public class SCCAnalysis {

    /** edges the analysis is allowed to follow */
    @FunctionalInterface
    public interface EdgeFilter {
        boolean test(int from, int to);
    }

    private final ParserGraph graph;
    private final EdgeFilter filter;

    private final int[] index;
    private final int[] lowLink;
    private final boolean[] onStack;
    private final int[] componentOf;
    private final Deque<Integer> stack = new ArrayDeque<>();
    private final List<SortedSet<Integer>> components = new ArrayList<>();
    private int nextIndex = 0;

    public SCCAnalysis(ParserGraph graph) {
        this(graph, (from, to) -> true);
    }

    public SCCAnalysis(ParserGraph graph, EdgeFilter filter) {
        this.graph = graph;
        this.filter = filter;
        this.index = new int[graph.size()];
        this.lowLink = new int[graph.size()];
        this.onStack = new boolean[graph.size()];
        this.componentOf = new int[graph.size()];
        Arrays.fill(index, -1);
        Arrays.fill(componentOf, -1);
    }

    /**
     * Analysis of the sub-graph induced by {@code region}, minus the edges into
     * {@code excludedTarget}. Used to find loops nested in a loop once its back edges
     * are cut.
     */
    public static SCCAnalysis forRegion(ParserGraph graph, Set<Integer> region, int excludedTarget) {
        return new SCCAnalysis(graph,
                (from, to) -> to != excludedTarget && region.contains(from) && region.contains(to));
    }

    /** whole graph from the start state */
    public SCCAnalysis run() {
        return run(graph.getStart());
    }

    public SCCAnalysis run(int... roots) {
        for (int root : roots) {
            if (index[root] == -1) {
                strongConnect(root);
            }
        }
        return this;
    }

    private void strongConnect(int root) {
        // per frame: node and position in its successor array
        Deque<int[]> frames = new ArrayDeque<>();
        visit(root);
        frames.push(new int[] { root, 0 });

        while (!frames.isEmpty()) {
            int[] frame = frames.peek();
            int v = frame[0];
            int[] succs = graph.getSuccessors(v);

            if (frame[1] < succs.length) {
                int w = succs[frame[1]++];
                if (!filter.test(v, w)) {
                    continue;
                }
                if (index[w] == -1) {
                    visit(w);
                    frames.push(new int[] { w, 0 });
                } else if (onStack[w]) {
                    lowLink[v] = Math.min(lowLink[v], index[w]);
                }
                continue;
            }

            // v is finished
            frames.pop();
            if (!frames.isEmpty()) {
                int parent = frames.peek()[0];
                lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
            }
            if (lowLink[v] == index[v]) {
                SortedSet<Integer> component = new TreeSet<>();
                int w;
                do {
                    w = stack.pop();
                    onStack[w] = false;
                    component.add(w);
                    componentOf[w] = components.size();
                } while (w != v);
                components.add(component);
            }
        }
    }

    private void visit(int v) {
        index[v] = nextIndex;
        lowLink[v] = nextIndex;
        nextIndex++;
        stack.push(v);
        onStack[v] = true;
    }

    /**
     * All components, in topological order of the condensed graph (a component comes
     * before every component it has edges to).
     */
    public List<SortedSet<Integer>> getComponents() {
        List<SortedSet<Integer>> ordered = new ArrayList<>(components);
        // Tarjan closes components in reverse topological order
        Collections.reverse(ordered);
        return ordered;
    }

    /**
     * Components that contain a cycle: more than one node, or one node with a self edge.
     */
    public List<SortedSet<Integer>> getLoops() {
        List<SortedSet<Integer>> loops = new ArrayList<>();
        for (SortedSet<Integer> component : getComponents()) {
            if (!isTrivial(component)) {
                loops.add(component);
            }
        }
        return loops;
    }

    public boolean isTrivial(Set<Integer> component) {
        if (component.size() != 1) {
            return false;
        }
        int v = component.iterator().next();
        for (int w : graph.getSuccessors(v)) {
            if (w == v && filter.test(v, w)) {
                return false;
            }
        }
        return true;
    }

    public boolean isReachable(int v) {
        return index[v] != -1;
    }

    /** position in {@link #getComponents()}, -1 if unreachable */
    public int getComponentIndex(int v) {
        return componentOf[v] == -1 ? -1 : components.size() - 1 - componentOf[v];
    }

    public int getReachableCount() {
        return nextIndex;
    }
}
