package ir;

import ir.statement.PacketConsumingCall;
import ir.statement.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the parser graph. Terminal states ({@code accept}, {@code reject} and any
 * other sentinel) have no statements and no transition.
 */
public final class ParserState {
    private static final int[] NO_SUCCESSORS = new int[0];

    private final int id;
    private final String name;
    private final List<Statement> statements;
    private final Transition transition;
    // name of the input state this one was copied from
    private final String originName;
    private final int[] successors;

    ParserState(int id, String name, List<Statement> statements, Transition transition, String originName) {
        this.id = id;
        this.name = name;
        this.statements = List.copyOf(statements);
        this.transition = transition;
        this.originName = originName;
        this.successors = transition == null ? NO_SUCCESSORS : transition.getTargets();
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    /** null for terminal states */
    public Transition getTransition() {
        return transition;
    }

    public String getOriginName() {
        return originName;
    }

    public boolean isTerminal() {
        return transition == null;
    }

    /**
     * Successor ids in case order, shared; callers must not modify the array.
     */
    public int[] getSuccessors() {
        return successors;
    }

    public boolean hasPacketConsumingCall() {
        for (Statement s : statements) {
            if (s.isPacketConsuming()) {
                return true;
            }
        }
        return false;
    }

    public List<PacketConsumingCall> getPacketConsumingCalls() {
        List<PacketConsumingCall> calls = new ArrayList<>();
        for (Statement s : statements) {
            if (s instanceof PacketConsumingCall call) {
                calls.add(call);
            }
        }
        return calls;
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
