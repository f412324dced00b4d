package pass.analysis;

import ir.ParserGraph;

import java.util.*;

/**
 * A validated loop: a single-entry strongly connected region whose header dominates
 * every member and which consumes packet data on every iteration.
 */
public class NaturalLoop {
    private final int header; // 循环头
    private final SortedSet<Integer> nodes; // 循环中的所有状态
    private final SortedSet<Integer> backEdgeSources; // 有边指向循环头的状态
    private final List<Integer> consumers; // 支配所有回边源的消费状态，离循环头近的在前
    private final List<NaturalLoop> subLoops = new ArrayList<>();
    private NaturalLoop parentLoop;
    private LoopBound bound;

    public NaturalLoop(int header, Set<Integer> nodes, Set<Integer> backEdgeSources, List<Integer> consumers) {
        this.header = header;
        this.nodes = Collections.unmodifiableSortedSet(new TreeSet<>(nodes));
        this.backEdgeSources = Collections.unmodifiableSortedSet(new TreeSet<>(backEdgeSources));
        this.consumers = List.copyOf(consumers);
    }

    public int getHeader() {
        return header;
    }

    public SortedSet<Integer> getNodes() {
        return nodes;
    }

    public SortedSet<Integer> getBackEdgeSources() {
        return backEdgeSources;
    }

    /**
     * States that extract or advance and lie on every path from the header back to it.
     */
    public List<Integer> getConsumers() {
        return consumers;
    }

    public List<NaturalLoop> getSubLoops() {
        return Collections.unmodifiableList(subLoops);
    }

    public NaturalLoop getParentLoop() {
        return parentLoop;
    }

    public void addSubLoop(NaturalLoop subLoop) {
        subLoops.add(subLoop);
        subLoop.parentLoop = this;
    }

    public boolean contains(int state) {
        return nodes.contains(state);
    }

    public LoopBound getBound() {
        return bound;
    }

    public void setBound(LoopBound bound) {
        this.bound = bound;
    }

    /**
     * 获取循环深度（嵌套层数）
     */
    public int getLoopDepth() {
        int depth = 1;
        NaturalLoop parent = parentLoop;
        while (parent != null) {
            depth++;
            parent = parent.parentLoop;
        }
        return depth;
    }

    /**
     * Targets outside the loop reached by some edge from inside it.
     */
    public SortedSet<Integer> getExitTargets(ParserGraph graph) {
        SortedSet<Integer> exits = new TreeSet<>();
        for (int v : nodes) {
            for (int w : graph.getSuccessors(v)) {
                if (!nodes.contains(w)) {
                    exits.add(w);
                }
            }
        }
        return exits;
    }

    public List<String> getNodeNames(ParserGraph graph) {
        List<String> names = new ArrayList<>();
        for (int v : nodes) {
            names.add(graph.getState(v).getName());
        }
        return names;
    }

    @Override
    public String toString() {
        return "NaturalLoop{header=" + header + ", nodes=" + nodes +
                ", subLoops=" + subLoops.size() + "}";
    }
}
