package ir.statement;

import ir.type.Type;

/**
 * A straight-line statement of a parser state. Statements are immutable, so copies of a
 * state made by the unroller share them.
 */
public abstract class Statement {
    private final StatementKind kind;

    protected Statement(StatementKind kind) {
        this.kind = kind;
    }

    public StatementKind getKind() {
        return kind;
    }

    public boolean isPacketConsuming() {
        return kind == StatementKind.PACKET_CONSUMING_CALL;
    }

    /** source-like rendering, used in dumps and log lines */
    public abstract String toSource();

    @Override
    public String toString() {
        return toSource();
    }

    /* factories */

    public static Assignment assign(String target, String value) {
        return new Assignment(target, value);
    }

    public static PlainCall call(String callee, String... arguments) {
        return new PlainCall(callee, arguments);
    }

    public static PacketConsumingCall extract(String target) {
        return new PacketConsumingCall(ConsumeKind.EXTRACT, target, null);
    }

    public static PacketConsumingCall extract(String target, Type targetType) {
        return new PacketConsumingCall(ConsumeKind.EXTRACT, target, targetType);
    }

    public static PacketConsumingCall advance(String bits) {
        return new PacketConsumingCall(ConsumeKind.ADVANCE, bits, null);
    }
}
