package pass.analysis;

import ir.ParserGraph;
import ir.decl.ParserDecl;

import java.util.List;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import static ir.Parsers.*;

public class TestDominanceAnalysis {

    @Test
    public void diamondMergeIsDominatedByTheBranch() {
        ParserGraph g = graph(acyclic());
        DominanceAnalysis dom = new DominanceAnalysis(g).run();
        int start = g.getStart();
        int ipv4 = id(g, "parse_ipv4");
        int ipv6 = id(g, "parse_ipv6");
        int l4 = id(g, "parse_l4");

        Assert.assertEquals(start, dom.getImmediateDominator(l4));
        Assert.assertEquals(start, dom.getImmediateDominator(ipv4));
        Assert.assertTrue(dom.dominates(start, l4));
        Assert.assertFalse(dom.dominates(ipv4, l4));
        Assert.assertFalse(dom.dominates(ipv6, l4));
        Assert.assertEquals(1, dom.getDomLevel(l4));
    }

    @Test
    public void acceptIsDominatedOnlyByStart() {
        ParserGraph g = graph(acyclic());
        DominanceAnalysis dom = new DominanceAnalysis(g).run();
        // accept is reached both from start and from parse_l4
        Assert.assertEquals(g.getStart(), dom.getImmediateDominator(g.getAccept()));
        Assert.assertEquals(4, dom.getDomTreeChildren(g.getStart()).size());
    }

    @Test
    public void dominanceIsReflexive() {
        ParserGraph g = graph(acyclic());
        DominanceAnalysis dom = new DominanceAnalysis(g).run();
        for (int v = 0; v < g.size(); v++) {
            Assert.assertEquals(dom.isReachable(v), dom.dominates(v, v));
        }
    }

    @Test
    public void unreachableNodesHaveNoDominator() {
        ParserGraph g = graph(acyclic());
        DominanceAnalysis dom = new DominanceAnalysis(g).run();
        Assert.assertFalse(dom.isReachable(g.getReject()));
        Assert.assertEquals(-1, dom.getImmediateDominator(g.getReject()));
        Assert.assertEquals(-1, dom.getDomLevel(g.getReject()));
        Assert.assertFalse(dom.dominates(g.getStart(), g.getReject()));
        Assert.assertEquals(-1, dom.getImmediateDominator(g.getStart()));
    }

    @Test
    public void chainDominatesAlongTheWay() {
        ParserGraph g = graph(twoStateLoop());
        DominanceAnalysis dom = new DominanceAnalysis(g).run();
        int tlv = id(g, "tlv");
        int check = id(g, "check");
        Assert.assertTrue(dom.dominates(tlv, check));
        Assert.assertFalse(dom.dominates(check, tlv));
        Assert.assertEquals(check, dom.getImmediateDominator(g.getReject()));
        Assert.assertEquals(tlv, dom.getImmediateDominator(g.getAccept()));
        Assert.assertEquals(4, dom.getImmediateDominators().size());
    }

    @Test
    public void regionRestrictedDominance() {
        // inside the loop, mid is skipped by the shortcut from head to tail
        ParserDecl decl = ParserDecl.builder("region")
                .state("start", List.of(), go("head"))
                .state("head", List.of(), select("x", on("1", "mid"), otherwise("tail")))
                .state("mid", List.of(extract("hdr.m")), go("tail"))
                .state("tail", List.of(extract("hdr.t")), select("y", on("1", "head"), otherwise("accept")))
                .build();
        ParserGraph g = graph(decl);
        int head = id(g, "head");
        int mid = id(g, "mid");
        int tail = id(g, "tail");
        DominanceAnalysis local = new DominanceAnalysis(g, head, Set.of(head, mid, tail)).run();
        Assert.assertEquals(head, local.getEntry());
        Assert.assertTrue(local.dominates(head, tail));
        Assert.assertFalse(local.dominates(mid, tail));
        Assert.assertTrue(local.dominates(tail, tail));
        // the region excludes start and accept
        Assert.assertFalse(local.isReachable(g.getStart()));
        Assert.assertFalse(local.isReachable(g.getAccept()));
        Assert.assertArrayEquals(new int[] { head, mid, tail }, local.getReversePostOrder());
    }

    @Test
    public void runIsIdempotent() {
        ParserGraph g = graph(acyclic());
        DominanceAnalysis dom = new DominanceAnalysis(g);
        Assert.assertSame(dom, dom.run());
        Assert.assertEquals(dom.getImmediateDominators(), dom.run().getImmediateDominators());
    }
}
