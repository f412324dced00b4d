package pass;

import driver.UnrollOptions;
import exception.UnrollException;
import ir.ParserGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import pass.Pass.GraphPass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Runs the unroller pipeline over one parser graph. One instance per set of options;
 * every run gets a fresh {@link PassContext}, so an instance may be reused.
 */
public class PassManager {
    private final List<GraphPass> pipeline = new ArrayList<>();
    private final UnrollOptions options;

    private final Set<String> enabled;

    // the unroller reads what these leave in the context
    private static final List<GraphPassType> REQUIRED = List.of(
            GraphPassType.CFGAnalysis, GraphPassType.LoopValidation, GraphPassType.LoopBound);

    private static final Logger log = LoggingManager.getLogger(PassManager.class);

    public PassManager(UnrollOptions options) {
        this.options = options;
        // read the system property
        // eg: -Dunroll.passes=cfganalysis,loopvalidation,loopbound
        enabled = loadEnabled("unroll.passes");
        for (GraphPassType type : REQUIRED) {
            if (!enabled.isEmpty() && !enabled.contains(type.getName())) {
                throw UnrollException.invalidOption("unroll.passes must keep " + type.getName());
            }
        }

        if (options.isVerifyOutput()) {
            setPipeline(
                    GraphPassType.CFGAnalysis,
                    GraphPassType.LoopValidation,
                    GraphPassType.LoopBound,
                    GraphPassType.LoopUnroll,
                    GraphPassType.VerifyGraph);
        } else {
            setPipeline(
                    GraphPassType.CFGAnalysis,
                    GraphPassType.LoopValidation,
                    GraphPassType.LoopBound,
                    GraphPassType.LoopUnroll);
        }
    }

    public UnrollOptions getOptions() {
        return options;
    }

    /**
     * Run every pass in order. A pass that aborts the run stops the pipeline; the
     * context then describes a rejected run.
     */
    public PassContext run(ParserGraph graph) {
        PassContext context = new PassContext(graph, options);
        return LoggingManager.withContext(graph.getName(), () -> {
            log.debug("unrolling {} ({} states) with {}", graph.getName(), graph.size(), options);
            for (GraphPass p : pipeline) {
                log.debug("[Graph] {}", p.getType().getName());
                p.run(context);
                if (context.isAborted()) {
                    log.warn("{} rejected after {}: {}", graph.getName(), p.getType().getName(),
                            context.getAbortReason());
                    break;
                }
            }
            return context;
        });
    }

    /** read “a,b,c” from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    public List<GraphPassType> getPipeline() {
        return pipeline.stream().map(GraphPass::getType).collect(Collectors.toList());
    }

    /**
     * 按顺序整体设置 pipeline（会清空重建）
     */
    private void setPipeline(GraphPassType... types) {
        pipeline.clear();
        for (GraphPassType type : types) {
            if (enabled.isEmpty() || enabled.contains(type.getName())) {
                pipeline.add(type.create());
            }
        }
    }
}
