package driver;

import diag.Diagnostic;
import diag.DiagnosticKind;
import diag.Severity;
import ir.ParserGraph;
import ir.decl.ParserDecl;
import ir.decl.StateDecl;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import static ir.Parsers.*;

public class TestUnrollDriver {

    @Test
    public void acyclicGraphIsReturnedUnchanged() {
        ParserGraph input = graph(acyclic());
        UnrollResult result = new UnrollDriver(UnrollOptions.defaults()).run(input);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED, result.getVerdict());
        Assert.assertSame(input, result.getGraph());
        Assert.assertTrue(result.getDiagnostics().isEmpty());
        Assert.assertTrue(result.getPlans().isEmpty());
        Assert.assertEquals(input.toString(), result.getGraph().toString());
    }

    @Test
    public void acyclicTableRoundTrips() {
        ParserDecl decl = acyclic();
        UnrollResult result = new UnrollDriver(UnrollOptions.builder().defaultBound(3).build()).run(decl);
        Assert.assertTrue(result.isAccepted());
        Assert.assertEquals(graph(decl).toString(), result.getGraph().toString());
        Assert.assertEquals(decl.getStates().size(), result.toDecl().getStates().size());
    }

    @Test
    public void strictRejectionReturnsTheInput() {
        ParserGraph input = graph(irreducible());
        UnrollResult result = new UnrollDriver(UnrollOptions.defaults()).run(input);
        Assert.assertEquals(UnrollResult.Verdict.REJECTED, result.getVerdict());
        Assert.assertFalse(result.isAccepted());
        Assert.assertSame(input, result.getGraph());
        Assert.assertTrue(result.getPlans().isEmpty());
        Diagnostic d = result.getDiagnostics(DiagnosticKind.IRREDUCIBLE_CONTROL_FLOW).get(0);
        Assert.assertEquals(Severity.ERROR, d.getSeverity());
    }

    @Test
    public void lenientRejectionIsAWarning() {
        UnrollOptions options = UnrollOptions.builder().mode(ValidationMode.LENIENT).build();
        ParserGraph input = graph(irreducible());
        UnrollResult result = new UnrollDriver(options).run(input);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED_WITH_WARNING, result.getVerdict());
        Assert.assertSame(input, result.getGraph());
        Assert.assertEquals(Severity.WARNING, result.getDiagnostics().get(0).getSeverity());
    }

    @Test
    public void consumingSelfLoopGivesExactlyKCopies() {
        for (int k = 1; k <= 5; k++) {
            for (OverflowPolicy policy : OverflowPolicy.values()) {
                UnrollOptions options = UnrollOptions.builder().defaultBound(k).overflowPolicy(policy).build();
                UnrollResult result = new UnrollDriver(options).run(consumingSelfLoop());
                Assert.assertEquals(UnrollResult.Verdict.ACCEPTED, result.getVerdict());
                Assert.assertEquals(2 + k, result.getGraph().size());
                Assert.assertEquals(k, result.getPlan("start").getCopyCount());
                Assert.assertEquals(policy, result.getPlan("start").getPolicy());
            }
        }
    }

    @Test
    public void missingBoundRejectsEvenWhenLenient() {
        UnrollOptions options = UnrollOptions.builder().mode(ValidationMode.LENIENT).build();
        UnrollResult result = new UnrollDriver(options).run(consumingSelfLoop());
        Assert.assertEquals(UnrollResult.Verdict.REJECTED, result.getVerdict());
        Assert.assertEquals(1, result.getDiagnostics(DiagnosticKind.MISSING_DEFAULT_BOUND).size());
        Assert.assertEquals("start", result.getGraph().getStartState().getName());
    }

    @Test
    public void malformedTableHasNoGraph() {
        ParserDecl decl = ParserDecl.builder("broken")
                .state("start", List.of(extract("hdr.eth")), go("parse_ip"))
                .build();
        UnrollResult result = new UnrollDriver(UnrollOptions.defaults()).run(decl);
        Assert.assertEquals(UnrollResult.Verdict.REJECTED, result.getVerdict());
        Assert.assertNull(result.getGraph());
        Assert.assertNull(result.getInput());
        Assert.assertNull(result.toDecl());
        Assert.assertEquals(DiagnosticKind.UNKNOWN_SUCCESSOR, result.getDiagnostics().get(0).getKind());
        Assert.assertTrue(DiagnosticKind.UNKNOWN_SUCCESSOR.isStructural());
    }

    @Test
    public void unreachableStateIsAWarning() {
        ParserDecl decl = ParserDecl.builder("orphan")
                .state("start", List.of(extract("hdr.eth")), go("accept"))
                .state("lost", List.of(extract("hdr.x")), go("accept"))
                .build();
        UnrollResult result = new UnrollDriver(UnrollOptions.defaults()).run(decl);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED_WITH_WARNING, result.getVerdict());
        Assert.assertEquals(List.of("lost"), result.getDiagnostics().get(0).getStates());
        Assert.assertTrue(result.getGraph().hasState("lost"));
    }

    @Test
    public void driverCanBeReused() {
        UnrollDriver driver = new UnrollDriver(UnrollOptions.builder().defaultBound(2).build());
        UnrollResult first = driver.run(consumingSelfLoop());
        UnrollResult second = driver.run(consumingSelfLoop());
        Assert.assertEquals(first.getGraph().toString(), second.getGraph().toString());
        Assert.assertEquals(first.getDiagnostics(), second.getDiagnostics());
    }

    @Test
    public void terminalStateMayHaveStatements() {
        ParserDecl decl = ParserDecl.builder("trailer")
                .state("start", List.of(extract("hdr.eth")), go("tail"))
                .state(StateDecl.of("tail", List.of(extract("hdr.trailer")), null))
                .build();
        ParserGraph input = graph(decl);
        UnrollResult result = new UnrollDriver(UnrollOptions.defaults()).run(input);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED, result.getVerdict());
        Assert.assertSame(input, result.getGraph());
        Assert.assertTrue(result.getGraph().getState("tail").isTerminal());
        Assert.assertEquals(1, result.getGraph().getState("tail").getStatements().size());
    }

    @Test
    public void unreachableTerminalStateIsAWarning() {
        ParserDecl decl = ParserDecl.builder("orphan_exit")
                .state("start", List.of(extract("hdr.eth")), go("accept"))
                .state(StateDecl.terminal("orphan"))
                .build();
        UnrollResult result = new UnrollDriver(UnrollOptions.defaults()).run(decl);
        Assert.assertEquals(UnrollResult.Verdict.ACCEPTED_WITH_WARNING, result.getVerdict());
        List<Diagnostic> diags = result.getDiagnostics(DiagnosticKind.UNREACHABLE_NODE);
        Assert.assertEquals(1, diags.size());
        Assert.assertEquals(List.of("orphan"), diags.get(0).getStates());
    }
}
