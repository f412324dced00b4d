package ir.decl;

import java.util.List;

/**
 * Transition of a declared state, successors given by name.
 */
public final class TransitionDecl {
    private final String selector;
    private final List<CaseDecl> cases;

    private TransitionDecl(String selector, List<CaseDecl> cases) {
        this.selector = selector;
        this.cases = List.copyOf(cases);
    }

    public static TransitionDecl direct(String target) {
        return new TransitionDecl(null, List.of(CaseDecl.otherwise(target)));
    }

    public static TransitionDecl select(String selector, CaseDecl... cases) {
        return new TransitionDecl(selector, List.of(cases));
    }

    public static TransitionDecl select(String selector, List<CaseDecl> cases) {
        return new TransitionDecl(selector, cases);
    }

    public String getSelector() {
        return selector;
    }

    public List<CaseDecl> getCases() {
        return cases;
    }

    @Override
    public String toString() {
        if (selector == null && cases.size() == 1) {
            return "transition " + cases.get(0).target() + ";";
        }
        StringBuilder sb = new StringBuilder("transition select(").append(selector).append(") {");
        for (CaseDecl c : cases) {
            sb.append(' ').append(c.pattern()).append(": ").append(c.target()).append(';');
        }
        return sb.append(" }").toString();
    }
}
