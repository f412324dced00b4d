package pass;

import java.util.function.Supplier;
import pass.Pass.GraphPass;

/**
 * GraphPassFactory: create the GraphPass here
 */
public enum GraphPassType implements PassType<GraphPass> {
    CFGAnalysis(CFGAnalysisPass::new),
    LoopValidation(LoopValidationPass::new),
    LoopBound(LoopBoundPass::new),
    LoopUnroll(LoopUnrollPass::new),
    VerifyGraph(VerifyGraphPass::new),
    // add more pass here
    ;

    private final Supplier<GraphPass> supplier;

    GraphPassType(Supplier<GraphPass> constructor) {
        this.supplier = constructor;
    }

    @Override
    public Supplier<GraphPass> constructor() {
        return supplier;
    }
}
