package ir.statement;

import ir.type.HeaderStackType;
import ir.type.Type;

/**
 * {@code packet.extract(target)} or {@code packet.advance(bits)}.
 * <p>
 * For {@link ConsumeKind#EXTRACT} the argument is the l-value written and
 * {@code targetType} is its type when the front end knows it; when the l-value is the
 * {@code next} element of a header stack the front end reports the stack type.
 * For {@link ConsumeKind#ADVANCE} the argument is the bit count and there is no target type.
 * <p>
 * An advance is treated as consuming whatever its argument is. A zero-bit advance
 * does not actually bound a loop; telling the two apart needs value analysis of the
 * argument, which is not done here.
 */
public final class PacketConsumingCall extends Statement {
    private final ConsumeKind consumeKind;
    private final String argument;
    private final Type targetType;

    public PacketConsumingCall(ConsumeKind consumeKind, String argument, Type targetType) {
        super(StatementKind.PACKET_CONSUMING_CALL);
        this.consumeKind = consumeKind;
        this.argument = argument;
        this.targetType = targetType;
    }

    public ConsumeKind getConsumeKind() {
        return consumeKind;
    }

    public String getArgument() {
        return argument;
    }

    /** may be null */
    public Type getTargetType() {
        return targetType;
    }

    /**
     * The header stack this call writes into, or null if it writes no statically sized stack.
     */
    public HeaderStackType getWrittenStack() {
        if (consumeKind == ConsumeKind.EXTRACT && targetType instanceof HeaderStackType stack) {
            return stack;
        }
        return null;
    }

    @Override
    public String toSource() {
        return "packet." + consumeKind.getMethod() + "(" + argument + ");";
    }
}
