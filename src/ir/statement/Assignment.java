package ir.statement;

public final class Assignment extends Statement {
    private final String target;
    private final String value;

    public Assignment(String target, String value) {
        super(StatementKind.ASSIGNMENT);
        this.target = target;
        this.value = value;
    }

    public String getTarget() {
        return target;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toSource() {
        return target + " = " + value + ";";
    }
}
