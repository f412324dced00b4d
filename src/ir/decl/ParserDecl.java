package ir.decl;

import ir.statement.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The state table of one parser: the boundary between the front end and the unroller,
 * in both directions.
 */
public final class ParserDecl {
    private final String name;
    private final String start;
    private final List<StateDecl> states;

    public ParserDecl(String name, String start, List<StateDecl> states) {
        this.name = name;
        this.start = start;
        this.states = List.copyOf(states);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getStart() {
        return start;
    }

    public List<StateDecl> getStates() {
        return states;
    }

    public Optional<StateDecl> getState(String stateName) {
        return states.stream().filter(s -> s.getName().equals(stateName)).findFirst();
    }

    public static final class Builder {
        private final String name;
        private String start = "start";
        private final List<StateDecl> states = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder start(String startState) {
            this.start = startState;
            return this;
        }

        public Builder state(String stateName, List<Statement> statements, TransitionDecl transition) {
            states.add(StateDecl.of(stateName, statements, transition));
            return this;
        }

        public Builder state(StateDecl state) {
            states.add(state);
            return this;
        }

        public ParserDecl build() {
            return new ParserDecl(name, start, states);
        }
    }
}
