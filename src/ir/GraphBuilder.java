package ir;

import diag.Diagnostic;
import exception.UnrollException;
import ir.decl.CaseDecl;
import ir.decl.ParserDecl;
import ir.decl.StateDecl;
import ir.decl.TransitionDecl;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link ParserGraph} of a declared state table. The sentinels get ids 0
 * ({@code accept}) and 1 ({@code reject}); declared states follow in declaration order.
 * <p>
 * Only names are checked here. Reachability and loops are left to the passes.
 */
public class GraphBuilder {
    private static final Logger log = LoggingManager.getLogger(GraphBuilder.class);

    private final ParserDecl decl;
    private final Map<String, Integer> ids = new HashMap<>();
    private final List<Diagnostic> problems = new ArrayList<>();

    private GraphBuilder(ParserDecl decl) {
        this.decl = decl;
    }

    /**
     * @throws UnrollException carrying every unknown successor and duplicate state found
     */
    public static ParserGraph build(ParserDecl decl) {
        return new GraphBuilder(decl).build();
    }

    private ParserGraph build() {
        ids.put(ParserGraph.ACCEPT, 0);
        ids.put(ParserGraph.REJECT, 1);
        int next = 2;
        for (StateDecl s : decl.getStates()) {
            if (ids.containsKey(s.getName())) {
                problems.add(Diagnostic.duplicateState(s.getName()));
                continue;
            }
            ids.put(s.getName(), next++);
        }

        List<ParserState> states = new ArrayList<>(next);
        states.add(new ParserState(0, ParserGraph.ACCEPT, List.of(), null, ParserGraph.ACCEPT));
        states.add(new ParserState(1, ParserGraph.REJECT, List.of(), null, ParserGraph.REJECT));

        for (StateDecl s : decl.getStates()) {
            int id = ids.get(s.getName());
            if (id != states.size()) {
                // a duplicate, already reported
                continue;
            }
            Transition transition = resolve(s.getName(), s.getTransition());
            states.add(new ParserState(id, s.getName(), s.getStatements(), transition, s.getName()));
        }

        Integer start = ids.get(decl.getStart());
        if (start == null) {
            problems.add(Diagnostic.unknownSuccessor(null, decl.getStart()));
        }

        if (!problems.isEmpty()) {
            for (Diagnostic d : problems) {
                log.error(d.getMessage());
            }
            throw UnrollException.malformedGraph(decl.getName(), problems);
        }

        ParserGraph graph = new ParserGraph(decl.getName(), states, start, 0, 1);
        log.debug("built parser {}: {} states, {} edges", graph.getName(), graph.size(), graph.getEdgeCount());
        return graph;
    }

    private Transition resolve(String from, TransitionDecl transition) {
        if (transition == null) {
            return null;
        }
        List<SelectCase> cases = new ArrayList<>();
        for (CaseDecl c : transition.getCases()) {
            Integer target = ids.get(c.target());
            if (target == null) {
                problems.add(Diagnostic.unknownSuccessor(from, c.target()));
                // placeholder, the graph is never built with it
                target = 1;
            }
            cases.add(new SelectCase(c.pattern(), target));
        }
        if (transition.getSelector() == null && cases.size() == 1) {
            return Transition.direct(cases.get(0).getTarget());
        }
        return Transition.select(transition.getSelector(), cases);
    }
}
