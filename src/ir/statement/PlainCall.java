package ir.statement;

import java.util.List;

/**
 * A call that does not move the packet cursor, e.g. {@code verify(...)} or a lookahead.
 */
public final class PlainCall extends Statement {
    private final String callee;
    private final List<String> arguments;

    public PlainCall(String callee, String... arguments) {
        super(StatementKind.PLAIN_CALL);
        this.callee = callee;
        this.arguments = List.of(arguments);
    }

    public String getCallee() {
        return callee;
    }

    public List<String> getArguments() {
        return arguments;
    }

    @Override
    public String toSource() {
        return callee + "(" + String.join(", ", arguments) + ");";
    }
}
