package ir.decl;

import ir.SelectCase;

/**
 * A select case naming its successor state.
 */
public record CaseDecl(String pattern, String target) {

    public static CaseDecl of(String pattern, String target) {
        return new CaseDecl(pattern, target);
    }

    public static CaseDecl otherwise(String target) {
        return new CaseDecl(SelectCase.DEFAULT, target);
    }
}
