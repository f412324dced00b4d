package pass.analysis;

import java.util.*;

/**
 * The loop forest of a parser: validated loops with their nested loops, plus the
 * regions that were rejected and must be left untouched.
 */
public class LoopInfo {
    private final List<NaturalLoop> topLevelLoops = new ArrayList<>();
    private final List<SortedSet<Integer>> rejectedRegions = new ArrayList<>();
    private final Map<Integer, NaturalLoop> stateToLoop = new HashMap<>(); // 状态到最内层循环

    public List<NaturalLoop> getTopLevelLoops() {
        return Collections.unmodifiableList(topLevelLoops);
    }

    public void addTopLevelLoop(NaturalLoop loop) {
        topLevelLoops.add(loop);
        registerLoop(loop);
    }

    public void addRejectedRegion(Set<Integer> region) {
        rejectedRegions.add(Collections.unmodifiableSortedSet(new TreeSet<>(region)));
    }

    public List<SortedSet<Integer>> getRejectedRegions() {
        return Collections.unmodifiableList(rejectedRegions);
    }

    /**
     * 注册循环及其所有子循环到映射表中，内层循环覆盖外层
     */
    private void registerLoop(NaturalLoop loop) {
        for (int state : loop.getNodes()) {
            stateToLoop.put(state, loop);
        }
        for (NaturalLoop subLoop : loop.getSubLoops()) {
            registerLoop(subLoop);
        }
    }

    /**
     * 获取包含指定状态的最内层循环
     */
    public NaturalLoop getLoopFor(int state) {
        return stateToLoop.get(state);
    }

    public boolean isLoopHeader(int state) {
        NaturalLoop loop = stateToLoop.get(state);
        return loop != null && loop.getHeader() == state;
    }

    public boolean isRejected(int state) {
        for (Set<Integer> region : rejectedRegions) {
            if (region.contains(state)) {
                return true;
            }
        }
        return false;
    }

    /**
     * All accepted loops, nested loops before the loops containing them.
     */
    public List<NaturalLoop> getAllLoops() {
        List<NaturalLoop> allLoops = new ArrayList<>();
        for (NaturalLoop topLoop : topLevelLoops) {
            collectInnermostFirst(topLoop, allLoops);
        }
        return allLoops;
    }

    private void collectInnermostFirst(NaturalLoop loop, List<NaturalLoop> result) {
        for (NaturalLoop subLoop : loop.getSubLoops()) {
            collectInnermostFirst(subLoop, result);
        }
        result.add(loop);
    }

    public boolean isEmpty() {
        return topLevelLoops.isEmpty() && rejectedRegions.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LoopInfo:\n");
        for (NaturalLoop loop : topLevelLoops) {
            printLoop(loop, sb, 1);
        }
        for (Set<Integer> region : rejectedRegions) {
            sb.append("  rejected ").append(region).append('\n');
        }
        return sb.toString();
    }

    private void printLoop(NaturalLoop loop, StringBuilder sb, int indent) {
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        sb.append(loop).append('\n');
        for (NaturalLoop subLoop : loop.getSubLoops()) {
            printLoop(subLoop, sb, indent + 1);
        }
    }
}
