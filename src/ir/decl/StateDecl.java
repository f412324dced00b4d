package ir.decl;

import ir.statement.Statement;

import java.util.List;

/**
 * A parser state as delivered by the front end. A state without transition is an
 * extra terminal state.
 */
public final class StateDecl {
    private final String name;
    private final List<Statement> statements;
    private final TransitionDecl transition;

    public StateDecl(String name, List<Statement> statements, TransitionDecl transition) {
        this.name = name;
        this.statements = List.copyOf(statements);
        this.transition = transition;
    }

    public static StateDecl of(String name, List<Statement> statements, TransitionDecl transition) {
        return new StateDecl(name, statements, transition);
    }

    public static StateDecl terminal(String name) {
        return new StateDecl(name, List.of(), null);
    }

    public String getName() {
        return name;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public TransitionDecl getTransition() {
        return transition;
    }

    public boolean isTerminal() {
        return transition == null;
    }

    @Override
    public String toString() {
        return "state " + name;
    }
}
