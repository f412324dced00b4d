package ir;

import exception.UnrollException;
import ir.decl.CaseDecl;
import ir.decl.ParserDecl;
import ir.decl.StateDecl;
import ir.decl.TransitionDecl;
import ir.statement.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Control-flow graph of one parser. States live in an arena and are addressed by id,
 * the id being the position in {@link #getStates()}. Edges are the cases of the
 * transitions. A graph is immutable once built; the unroller produces a new one.
 */
public final class ParserGraph {
    public static final String ACCEPT = "accept";
    public static final String REJECT = "reject";

    private final String name;
    private final List<ParserState> states;
    private final Map<String, Integer> nameToId;
    private final int start;
    private final int accept;
    private final int reject;

    // derived lazily, the graph never changes
    private int[][] predecessors;

    ParserGraph(String name, List<ParserState> states, int start, int accept, int reject) {
        this.name = name;
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.nameToId = new HashMap<>();
        this.start = start;
        this.accept = accept;
        this.reject = reject;
        checkWellFormed();
    }

    private void checkWellFormed() {
        for (int i = 0; i < states.size(); i++) {
            ParserState state = states.get(i);
            if (state.getId() != i) {
                throw UnrollException.illegalGraph("state " + state.getName() + " has id "
                        + state.getId() + " at position " + i);
            }
            if (nameToId.put(state.getName(), i) != null) {
                throw UnrollException.illegalGraph("duplicate state name " + state.getName());
            }
            for (int target : state.getSuccessors()) {
                if (target < 0 || target >= states.size()) {
                    throw UnrollException.illegalGraph("state " + state.getName()
                            + " transitions to missing id " + target);
                }
            }
        }
        for (int id : new int[] { start, accept, reject }) {
            if (id < 0 || id >= states.size()) {
                throw UnrollException.illegalGraph("missing entry or sentinel id " + id);
            }
        }
        if (!states.get(accept).isTerminal() || !states.get(reject).isTerminal()) {
            throw UnrollException.illegalGraph("accept and reject must be terminal");
        }
    }

    public String getName() {
        return name;
    }

    public List<ParserState> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public ParserState getState(int id) {
        return states.get(id);
    }

    public ParserState getState(String stateName) {
        Integer id = nameToId.get(stateName);
        if (id == null) {
            throw UnrollException.unknownState(stateName + " in parser " + name);
        }
        return states.get(id);
    }

    public boolean hasState(String stateName) {
        return nameToId.containsKey(stateName);
    }

    public int getStart() {
        return start;
    }

    public int getAccept() {
        return accept;
    }

    public int getReject() {
        return reject;
    }

    public ParserState getStartState() {
        return states.get(start);
    }

    public int[] getSuccessors(int id) {
        return states.get(id).getSuccessors();
    }

    /**
     * Sources of the edges entering {@code id}, one entry per edge.
     */
    public int[] getPredecessors(int id) {
        if (predecessors == null) {
            predecessors = computePredecessors();
        }
        return predecessors[id];
    }

    private int[][] computePredecessors() {
        int[] counts = new int[states.size()];
        for (ParserState s : states) {
            for (int t : s.getSuccessors()) {
                counts[t]++;
            }
        }
        int[][] preds = new int[states.size()][];
        for (int i = 0; i < preds.length; i++) {
            preds[i] = new int[counts[i]];
            counts[i] = 0;
        }
        for (ParserState s : states) {
            for (int t : s.getSuccessors()) {
                preds[t][counts[t]++] = s.getId();
            }
        }
        return preds;
    }

    public int getEdgeCount() {
        int edges = 0;
        for (ParserState s : states) {
            edges += s.getSuccessors().length;
        }
        return edges;
    }

    public boolean isSentinel(int id) {
        return id == accept || id == reject;
    }

    /**
     * Convert back to a state table. {@code accept} and {@code reject} stay implicit;
     * other terminal states are emitted as states without transition.
     */
    public ParserDecl toDecl() {
        List<StateDecl> decls = new ArrayList<>();
        for (ParserState s : states) {
            if (isSentinel(s.getId())) {
                continue;
            }
            decls.add(StateDecl.of(s.getName(), s.getStatements(), toDecl(s.getTransition())));
        }
        return new ParserDecl(name, states.get(start).getName(), decls);
    }

    private TransitionDecl toDecl(Transition transition) {
        if (transition == null) {
            return null;
        }
        if (transition.isUnconditional()) {
            return TransitionDecl.direct(states.get(transition.getCases().get(0).getTarget()).getName());
        }
        List<CaseDecl> cases = new ArrayList<>();
        for (SelectCase c : transition.getCases()) {
            cases.add(CaseDecl.of(c.getPattern(), states.get(c.getTarget()).getName()));
        }
        return TransitionDecl.select(transition.getSelector(), cases);
    }

    /**
     * Readable dump of the state table, one state per block.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("parser ").append(name).append(" (start ")
                .append(states.get(start).getName()).append(") {\n");
        for (ParserState s : states) {
            if (isSentinel(s.getId())) {
                continue;
            }
            sb.append("  state ").append(s.getName());
            if (s.isTerminal()) {
                sb.append(";\n");
                continue;
            }
            sb.append(" {\n");
            for (Statement stmt : s.getStatements()) {
                sb.append("    ").append(stmt.toSource()).append('\n');
            }
            sb.append("    ").append(toDecl(s.getTransition())).append('\n');
            sb.append("  }\n");
        }
        return sb.append("}").toString();
    }
}
