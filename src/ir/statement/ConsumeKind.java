package ir.statement;

/**
 * The two ways a parser moves its cursor over the packet.
 */
public enum ConsumeKind {
    EXTRACT("extract"),
    ADVANCE("advance");

    private final String method;

    ConsumeKind(String method) {
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
