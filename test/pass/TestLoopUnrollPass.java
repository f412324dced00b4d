package pass;

import diag.DiagnosticKind;
import driver.OverflowPolicy;
import driver.UnrollDriver;
import driver.UnrollOptions;
import driver.UnrollResult;
import driver.ValidationMode;
import exception.UnrollException;
import ir.ParserGraph;
import ir.ParserState;
import ir.SelectCase;
import ir.decl.ParserDecl;
import ir.decl.StateDecl;
import pass.analysis.BoundHeuristic;
import pass.analysis.UnrollPlan;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import static ir.Parsers.*;

public class TestLoopUnrollPass {

    private static UnrollResult unroll(ParserDecl decl, int bound, OverflowPolicy policy) {
        UnrollOptions options = UnrollOptions.builder()
                .defaultBound(bound)
                .overflowPolicy(policy)
                .build();
        return new UnrollDriver(options).run(decl);
    }

    /** name of the state the case {@code pattern} of {@code state} goes to */
    private static String target(ParserGraph g, String state, String pattern) {
        for (SelectCase c : g.getState(state).getTransition().getCases()) {
            if (c.getPattern().equals(pattern)) {
                return g.getState(c.getTarget()).getName();
            }
        }
        throw new AssertionError("no case " + pattern + " in " + state);
    }

    @Test
    public void twelveCopiesEndInReject() {
        UnrollResult result = unroll(consumingSelfLoop(), 12, OverflowPolicy.ERROR_ON_OVERFLOW);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED, result.getVerdict());
        ParserGraph g = result.getGraph();
        Assert.assertEquals(14, g.size());
        Assert.assertFalse(g.hasState("start"));
        Assert.assertEquals("start_1", g.getStartState().getName());
        for (int i = 1; i <= 12; i++) {
            String copy = "start_" + i;
            ParserState s = g.getState(copy);
            Assert.assertEquals(i + 1, s.getId());
            Assert.assertEquals("start", s.getOriginName());
            Assert.assertEquals(1, s.getStatements().size());
            Assert.assertEquals(i < 12 ? "start_" + (i + 1) : "reject", target(g, copy, "0"));
            Assert.assertEquals("accept", target(g, copy, "default"));
        }

        UnrollPlan plan = result.getPlan("start");
        Assert.assertNotNull(plan);
        Assert.assertEquals(12, plan.getCopyCount());
        Assert.assertEquals(12, plan.getBoundValue());
        Assert.assertEquals(BoundHeuristic.DEFAULT_BOUND, plan.getHeuristic());
        Assert.assertEquals(OverflowPolicy.ERROR_ON_OVERFLOW, plan.getPolicy());
        Assert.assertEquals(g.getReject(), plan.getOverflowTarget());
        Assert.assertEquals(g.getState("start_1").getId(), plan.getHeaderCopy(1));
        Assert.assertEquals(g.getState("start_12").getId(), plan.getHeaderCopy(12));
        Assert.assertEquals(List.of(g.getState("start_5").getId()), plan.getCopies().get(4));
    }

    @Test
    public void residualLoopsBackToTheFirstCopy() {
        UnrollResult result = unroll(consumingSelfLoop(), 3, OverflowPolicy.RESIDUAL);
        ParserGraph g = result.getGraph();
        Assert.assertEquals("start_2", target(g, "start_1", "0"));
        Assert.assertEquals("start_3", target(g, "start_2", "0"));
        Assert.assertEquals("start_1", target(g, "start_3", "0"));
        Assert.assertEquals(-1, result.getPlan("start").getOverflowTarget());
    }

    @Test
    public void exitsArePreservedInEveryCopy() {
        UnrollResult result = unroll(twoStateLoop(), 3, OverflowPolicy.RESIDUAL);
        ParserGraph g = result.getGraph();
        Assert.assertEquals(9, g.size());
        Assert.assertEquals("tlv_1", target(g, "start", "default"));
        for (int i = 1; i <= 3; i++) {
            Assert.assertEquals("accept", target(g, "tlv_" + i, "0"));
            Assert.assertEquals("check_" + i, target(g, "tlv_" + i, "default"));
            Assert.assertEquals("reject", target(g, "check_" + i, "0"));
            Assert.assertEquals("tlv_" + (i < 3 ? i + 1 : 1), target(g, "check_" + i, "default"));
        }
        UnrollPlan plan = result.getPlan("tlv");
        Assert.assertEquals(List.of(g.getState("tlv_2").getId(), g.getState("check_2").getId()),
                plan.getCopies().get(1));
    }

    @Test
    public void headerStackGivesOneCopyMoreThanTheCapacity() {
        UnrollResult result = unroll(headerStackLoop(2), 10, OverflowPolicy.ERROR_ON_OVERFLOW);
        ParserGraph g = result.getGraph();
        Assert.assertEquals(6, g.size());
        Assert.assertEquals("parse_mpls_1", target(g, "start", "default"));
        Assert.assertEquals("parse_mpls_2", target(g, "parse_mpls_1", "0"));
        Assert.assertEquals("parse_mpls_3", target(g, "parse_mpls_2", "0"));
        Assert.assertEquals("reject", target(g, "parse_mpls_3", "0"));
        UnrollPlan plan = result.getPlan("parse_mpls");
        Assert.assertEquals(2, plan.getBoundValue());
        Assert.assertEquals(3, plan.getCopyCount());
        Assert.assertEquals(BoundHeuristic.HEADER_STACK, plan.getHeuristic());
    }

    @Test
    public void customOverflowStateIsCreated() {
        UnrollOptions options = UnrollOptions.builder()
                .defaultBound(2)
                .overflowState("too_deep")
                .build();
        UnrollResult result = new UnrollDriver(options).run(consumingSelfLoop());
        ParserGraph g = result.getGraph();
        Assert.assertEquals(5, g.size());
        ParserState overflow = g.getState("too_deep");
        Assert.assertTrue(overflow.isTerminal());
        Assert.assertEquals(2, overflow.getId());
        Assert.assertEquals("too_deep", target(g, "start_2", "0"));
        Assert.assertEquals("start_2", target(g, "start_1", "0"));
        Assert.assertEquals(overflow.getId(), result.getPlan("start").getOverflowTarget());

        ParserDecl out = result.toDecl();
        Assert.assertTrue(out.getState("too_deep").get().isTerminal());
        Assert.assertEquals("start_1", out.getStart());
    }

    @Test
    public void existingOverflowStateIsReused() {
        ParserDecl decl = ParserDecl.builder("custom_error")
                .state("start", List.of(extract("hdrs.next")),
                        select("hdrs.last.bos", on("0", "start"), otherwise("accept")))
                .state(StateDecl.terminal("bad"))
                .build();
        UnrollOptions options = UnrollOptions.builder().defaultBound(2).overflowState("bad").build();
        UnrollResult result = new UnrollDriver(options).run(decl);
        ParserGraph g = result.getGraph();
        Assert.assertEquals("bad", target(g, "start_2", "0"));
        Assert.assertEquals(5, g.size());
        // bad is unreachable in the input
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED_WITH_WARNING, result.getVerdict());
        Assert.assertEquals(List.of("bad"), result.getDiagnostics().get(0).getStates());
    }

    @Test(expected = UnrollException.class)
    public void overflowStateInsideTheLoopIsRefused() {
        UnrollOptions options = UnrollOptions.builder().defaultBound(2).overflowState("check").build();
        new UnrollDriver(options).run(twoStateLoop());
    }

    @Test
    public void nestedLoopIsUnrolledInsideEveryOuterCopy() {
        UnrollResult result = unroll(nestedLoops(), 2, OverflowPolicy.ERROR_ON_OVERFLOW);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED, result.getVerdict());
        ParserGraph g = result.getGraph();
        Assert.assertEquals(9, g.size());
        Assert.assertEquals("outer_1", target(g, "start", "default"));
        Assert.assertEquals("inner_1_1", target(g, "outer_1", "default"));
        Assert.assertEquals("inner_2_1", target(g, "inner_1_1", "1"));
        Assert.assertEquals("outer_2", target(g, "inner_1_1", "2"));
        Assert.assertEquals("reject", target(g, "inner_2_1", "1"));
        Assert.assertEquals("outer_2", target(g, "inner_2_1", "2"));
        Assert.assertEquals("inner_1_2", target(g, "outer_2", "default"));
        Assert.assertEquals("reject", target(g, "inner_1_2", "2"));
        Assert.assertEquals("reject", target(g, "inner_2_2", "2"));
        Assert.assertEquals("accept", target(g, "inner_2_2", "default"));

        Assert.assertEquals(2, result.getPlans().size());
        UnrollPlan inner = result.getPlans().get(0);
        Assert.assertEquals("inner", inner.getHeader());
        // reported inside the first copy of the outer loop
        Assert.assertEquals(List.of(g.getState("inner_1_1").getId(), g.getState("inner_2_1").getId()),
                inner.getHeaderCopies());
        UnrollPlan outer = result.getPlans().get(1);
        Assert.assertEquals("outer", outer.getHeader());
        Assert.assertEquals(3, outer.getCopies().get(0).size());
        Assert.assertEquals(g.getState("outer_2").getId(), outer.getHeaderCopy(2));
    }

    @Test
    public void rejectedLoopIsLeftAloneInLenientMode() {
        ParserDecl decl = ParserDecl.builder("mixed")
                .state("start", List.of(extract("hdr.eth")), select("x", on("1", "spin"), otherwise("hop")))
                .state("spin", List.of(), select("y", on("1", "spin"), otherwise("accept")))
                .state("hop", List.of(extract("hdr.hop.next")),
                        select("hdr.hop.last.bos", on("0", "hop"), otherwise("accept")))
                .build();
        UnrollOptions options = UnrollOptions.builder().mode(ValidationMode.LENIENT).defaultBound(2).build();
        UnrollResult result = new UnrollDriver(options).run(decl);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED_WITH_WARNING, result.getVerdict());
        ParserGraph g = result.getGraph();
        Assert.assertEquals(6, g.size());
        Assert.assertEquals("spin", target(g, "spin", "1"));
        Assert.assertEquals("spin", target(g, "start", "1"));
        Assert.assertEquals("hop_1", target(g, "start", "default"));
        Assert.assertEquals("reject", target(g, "hop_2", "0"));
        Assert.assertEquals(1, result.getDiagnostics(DiagnosticKind.UNBOUNDED_LOOP).size());
        Assert.assertEquals(1, result.getPlans().size());
    }

    @Test
    public void unreachableEdgeIntoTheBodyFollowsTheFirstCopy() {
        ParserDecl decl = ParserDecl.builder("tlv_lost")
                .state("start", List.of(extract("hdr.eth")), go("tlv"))
                .state("tlv", List.of(extract("hdr.tlv.next")),
                        select("hdr.tlv.last.type", on("0", "accept"), otherwise("check")))
                .state("check", List.of(), select("hdr.tlv.last.len", on("0", "reject"), otherwise("tlv")))
                .state("lost", List.of(), go("check"))
                .build();
        UnrollResult result = unroll(decl, 2, OverflowPolicy.ERROR_ON_OVERFLOW);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED_WITH_WARNING, result.getVerdict());
        Assert.assertEquals("check_1", target(result.getGraph(), "lost", "default"));
        Assert.assertEquals(1, result.getDiagnostics(DiagnosticKind.UNREACHABLE_NODE).size());
    }

    @Test
    public void inputGraphIsNotModified() {
        ParserGraph input = graph(twoStateLoop());
        String before = input.toString();
        UnrollResult result = new UnrollDriver(UnrollOptions.builder().defaultBound(4).build()).run(input);
        Assert.assertNotSame(input, result.getGraph());
        Assert.assertSame(input, result.getInput());
        Assert.assertEquals(before, input.toString());
        Assert.assertTrue(input.hasState("tlv"));
    }
}
