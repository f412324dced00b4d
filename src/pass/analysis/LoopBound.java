package pass.analysis;

import ir.type.HeaderStackType;

/**
 * The bound chosen for one loop: {@code bound} iterations unrolled into {@code copies}
 * copies of the body. Under the header-stack heuristic one more copy than the capacity
 * is made, the extra iteration being the one that overflows the stack.
 */
public final class LoopBound {
    private final BoundHeuristic heuristic;
    private final int bound;
    private final int copies;
    private final int consumer;
    private final HeaderStackType stack;

    private LoopBound(BoundHeuristic heuristic, int bound, int copies, int consumer, HeaderStackType stack) {
        this.heuristic = heuristic;
        this.bound = bound;
        this.copies = copies;
        this.consumer = consumer;
        this.stack = stack;
    }

    public static LoopBound headerStack(int consumer, HeaderStackType stack) {
        return new LoopBound(BoundHeuristic.HEADER_STACK, stack.getCapacity(), stack.getCapacity() + 1,
                consumer, stack);
    }

    public static LoopBound defaultBound(int bound) {
        return new LoopBound(BoundHeuristic.DEFAULT_BOUND, bound, bound, -1, null);
    }

    public BoundHeuristic getHeuristic() {
        return heuristic;
    }

    public int getBound() {
        return bound;
    }

    public int getCopies() {
        return copies;
    }

    /** state holding the extract that fixed the bound, -1 for the default bound */
    public int getConsumer() {
        return consumer;
    }

    /** null for the default bound */
    public HeaderStackType getStack() {
        return stack;
    }

    @Override
    public String toString() {
        return "LoopBound{" + heuristic.getName() + ", n=" + bound + ", copies=" + copies + "}";
    }
}
