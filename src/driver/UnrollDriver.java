package driver;

import exception.UnrollException;
import ir.GraphBuilder;
import ir.ParserGraph;
import ir.decl.ParserDecl;
import pass.PassContext;
import pass.PassManager;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Entry point of the unroller: state table in, {@link UnrollResult} out.
 * <pre>
 *     UnrollResult result = new UnrollDriver(UnrollOptions.builder().defaultBound(8).build()).run(decl);
 * </pre>
 */
public class UnrollDriver {
    private static final Logger logger = LoggingManager.getLogger(UnrollDriver.class);

    private final UnrollOptions options;
    private final PassManager passManager;

    public UnrollDriver(UnrollOptions options) {
        this.options = options;
        this.passManager = new PassManager(options);
    }

    /** options from system properties */
    public UnrollDriver() {
        this(UnrollOptions.fromSystemProperties());
    }

    public UnrollOptions getOptions() {
        return options;
    }

    /*
     * malformed tables are reported through the result, never thrown
     */
    public UnrollResult run(ParserDecl decl) {
        ParserGraph graph;
        try {
            graph = GraphBuilder.build(decl);
        } catch (UnrollException e) {
            if (e.getDiagnostics().isEmpty()) {
                throw e;
            }
            logger.warn("parser {} is malformed: {} problem(s)", decl.getName(), e.getDiagnostics().size());
            return UnrollResult.malformed(e.getDiagnostics());
        }
        return run(graph);
    }

    public UnrollResult run(ParserGraph graph) {
        PassContext context = passManager.run(graph);
        UnrollResult result = context.toResult();
        logger.debug("{}: {}", graph.getName(), result);
        return result;
    }
}
