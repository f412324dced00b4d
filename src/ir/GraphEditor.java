package ir;

import exception.UnrollException;
import ir.statement.Statement;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntUnaryOperator;

/**
 * Mutable working copy of a {@link ParserGraph}. The source graph is never touched:
 * states keep their ids in the copy, new states get fresh ids past the end, and
 * {@link #finish(int[])} compacts the surviving states into a new graph.
 */
public class GraphEditor {
    private final ParserGraph source;
    private final List<String> names = new ArrayList<>();
    private final List<List<Statement>> statements = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final List<String> origins = new ArrayList<>();
    private final Set<String> usedNames = new HashSet<>();
    private final BitSet removed = new BitSet();
    private int start;

    public GraphEditor(ParserGraph source) {
        this.source = source;
        for (ParserState s : source.getStates()) {
            append(s.getName(), s.getStatements(), s.getTransition(), s.getOriginName());
        }
        this.start = source.getStart();
    }

    private int append(String name, List<Statement> stmts, Transition transition, String origin) {
        int id = names.size();
        names.add(name);
        statements.add(stmts);
        transitions.add(transition);
        origins.add(origin);
        usedNames.add(name);
        return id;
    }

    public int size() {
        return names.size();
    }

    public boolean isLive(int id) {
        return id < names.size() && !removed.get(id);
    }

    public String getName(int id) {
        return names.get(id);
    }

    public Transition getTransition(int id) {
        return transitions.get(id);
    }

    public void setTransition(int id, Transition transition) {
        checkLive(id);
        if (transitions.get(id) == null) {
            throw UnrollException.illegalGraph("cannot give terminal state " + names.get(id) + " a transition");
        }
        transitions.set(id, transition);
    }

    public int getStart() {
        return start;
    }

    public void setStart(int id) {
        checkLive(id);
        this.start = id;
    }

    /**
     * Id of the live state called {@code name}, or -1.
     */
    public int find(String name) {
        for (int i = 0; i < names.size(); i++) {
            if (!removed.get(i) && names.get(i).equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * {@code base} if no state uses it yet, otherwise {@code base_2}, {@code base_3}, ...
     */
    public String uniqueName(String base) {
        if (!usedNames.contains(base)) {
            return base;
        }
        int n = 2;
        while (usedNames.contains(base + "_" + n)) {
            n++;
        }
        return base + "_" + n;
    }

    /**
     * Copy {@code id} under the name {@code <name>_<suffix>}. The copy keeps the
     * original transition; callers retarget it.
     */
    public int cloneState(int id, int suffix) {
        checkLive(id);
        String name = uniqueName(names.get(id) + "_" + suffix);
        return append(name, statements.get(id), transitions.get(id), origins.get(id));
    }

    public int addTerminal(String name) {
        if (usedNames.contains(name)) {
            throw UnrollException.illegalGraph("state name already in use: " + name);
        }
        return append(name, List.of(), null, name);
    }

    /**
     * Point every edge of a live state outside {@code excluded} that targets {@code from}
     * to {@code to} instead. Moves the start along if it is {@code from}.
     */
    public void redirectEdges(int from, int to, Set<Integer> excluded) {
        IntUnaryOperator mapping = t -> t == from ? to : t;
        for (int i = 0; i < names.size(); i++) {
            if (removed.get(i) || excluded.contains(i) || transitions.get(i) == null) {
                continue;
            }
            if (transitions.get(i).targets(from)) {
                transitions.set(i, transitions.get(i).retarget(mapping));
            }
        }
        // the parser entry counts as an edge from outside
        if (start == from) {
            start = to;
        }
    }

    public void remove(int id) {
        if (id == source.getAccept() || id == source.getReject()) {
            throw UnrollException.illegalGraph("cannot remove sentinel " + names.get(id));
        }
        if (id == start) {
            throw UnrollException.illegalGraph("cannot remove the start state " + names.get(id));
        }
        removed.set(id);
        usedNames.remove(names.get(id));
    }

    /**
     * Build the resulting graph. Removed states are dropped and the remaining ones are
     * renumbered in id order, so sentinels stay at 0 and 1.
     *
     * @param remap receives the new id of every old id, -1 for removed ones; its
     *              length must be at least {@link #size()}
     */
    public ParserGraph finish(int[] remap) {
        int next = 0;
        for (int i = 0; i < names.size(); i++) {
            remap[i] = removed.get(i) ? -1 : next++;
        }
        IntUnaryOperator mapping = t -> {
            int m = remap[t];
            if (m < 0) {
                throw UnrollException.illegalGraph("edge into removed state " + names.get(t));
            }
            return m;
        };
        List<ParserState> states = new ArrayList<>(next);
        for (int i = 0; i < names.size(); i++) {
            if (removed.get(i)) {
                continue;
            }
            Transition t = transitions.get(i);
            states.add(new ParserState(remap[i], names.get(i), statements.get(i),
                    t == null ? null : t.retarget(mapping), origins.get(i)));
        }
        return new ParserGraph(source.getName(), states, mapping.applyAsInt(start),
                remap[source.getAccept()], remap[source.getReject()]);
    }

    private void checkLive(int id) {
        if (!isLive(id)) {
            throw UnrollException.illegalGraph("state id " + id + " is not live");
        }
    }
}
