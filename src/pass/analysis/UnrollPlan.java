package pass.analysis;

import driver.OverflowPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * What the rewriter did to one loop. Ids refer to the output graph; for a loop nested
 * in another unrolled loop they are the ids inside the enclosing loop's first copy.
 */
public final class UnrollPlan {
    private final String header;
    private final LoopBound bound;
    private final OverflowPolicy policy;
    private final List<List<Integer>> copies;
    private final List<Integer> headerCopies;
    private final int overflowTarget;

    /**
     * @param copies         ids of each copy, copy 1 first, members in the order of the original ids
     * @param headerCopies   id of the header in each copy
     * @param overflowTarget where the last copy's back edges go under
     *                       {@link OverflowPolicy#ERROR_ON_OVERFLOW}, -1 otherwise
     */
    public UnrollPlan(String header, LoopBound bound, OverflowPolicy policy, List<List<Integer>> copies,
            List<Integer> headerCopies, int overflowTarget) {
        this.header = header;
        this.bound = bound;
        this.policy = policy;
        List<List<Integer>> frozen = new ArrayList<>();
        for (List<Integer> copy : copies) {
            frozen.add(List.copyOf(copy));
        }
        this.copies = Collections.unmodifiableList(frozen);
        this.headerCopies = List.copyOf(headerCopies);
        this.overflowTarget = overflowTarget;
    }

    /** name of the header in the input graph */
    public String getHeader() {
        return header;
    }

    public LoopBound getBound() {
        return bound;
    }

    public int getBoundValue() {
        return bound.getBound();
    }

    public BoundHeuristic getHeuristic() {
        return bound.getHeuristic();
    }

    public OverflowPolicy getPolicy() {
        return policy;
    }

    public int getCopyCount() {
        return copies.size();
    }

    public List<List<Integer>> getCopies() {
        return copies;
    }

    /**
     * Header of copy {@code i}, counting from 1.
     */
    public int getHeaderCopy(int i) {
        return headerCopies.get(i - 1);
    }

    public List<Integer> getHeaderCopies() {
        return headerCopies;
    }

    public int getOverflowTarget() {
        return overflowTarget;
    }

    /**
     * Same plan with every id passed through {@code mapping}.
     */
    public UnrollPlan remap(IntUnaryOperator mapping) {
        List<List<Integer>> mapped = new ArrayList<>();
        for (List<Integer> copy : copies) {
            List<Integer> m = new ArrayList<>(copy.size());
            for (int id : copy) {
                m.add(mapping.applyAsInt(id));
            }
            mapped.add(m);
        }
        List<Integer> headers = new ArrayList<>();
        for (int id : headerCopies) {
            headers.add(mapping.applyAsInt(id));
        }
        int target = overflowTarget < 0 ? -1 : mapping.applyAsInt(overflowTarget);
        return new UnrollPlan(header, bound, policy, mapped, headers, target);
    }

    @Override
    public String toString() {
        return "UnrollPlan{header=" + header + ", " + bound + ", policy=" + policy + "}";
    }
}
