package ir;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * The transition that ends a parser state: a selector and an ordered list of cases,
 * or a single case without selector for an unconditional jump. Every case is one edge
 * of the graph.
 */
public final class Transition {
    private final String selector;
    private final List<SelectCase> cases;

    private Transition(String selector, List<SelectCase> cases) {
        this.selector = selector;
        this.cases = List.copyOf(cases);
    }

    public static Transition direct(int target) {
        return new Transition(null, List.of(new SelectCase(SelectCase.DEFAULT, target)));
    }

    public static Transition select(String selector, List<SelectCase> cases) {
        return new Transition(selector, cases);
    }

    /** null for an unconditional transition */
    public String getSelector() {
        return selector;
    }

    public List<SelectCase> getCases() {
        return cases;
    }

    public boolean isUnconditional() {
        return selector == null && cases.size() == 1;
    }

    /**
     * Target of every case in case order; a state reached by two cases appears twice.
     */
    public int[] getTargets() {
        int[] targets = new int[cases.size()];
        for (int i = 0; i < targets.length; i++) {
            targets[i] = cases.get(i).getTarget();
        }
        return targets;
    }

    public boolean targets(int id) {
        for (SelectCase c : cases) {
            if (c.getTarget() == id) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copy of this transition with every target passed through {@code mapping}.
     */
    public Transition retarget(IntUnaryOperator mapping) {
        List<SelectCase> mapped = new ArrayList<>(cases.size());
        boolean changed = false;
        for (SelectCase c : cases) {
            SelectCase n = c.withTarget(mapping.applyAsInt(c.getTarget()));
            changed |= n != c;
            mapped.add(n);
        }
        return changed ? new Transition(selector, mapped) : this;
    }
}
