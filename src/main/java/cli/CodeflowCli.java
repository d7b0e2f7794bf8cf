package cli;

import graph.ControlFlowGraph;
import graph.DataFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parsing.SourceParseException;
import parsing.SourceParser;
import parsing.SourceUnit;
import picocli.CommandLine;
import render.GraphJsonExporter;
import render.MermaidRenderer;
import render.NodeTable;
import render.RenderOptions;
import sanalysis.ControlFlowGraphBuilder;
import sanalysis.DataFlowGraphBuilder;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "codeflow",
        mixinStandardHelpOptions = true,
        description = "Generate control flow and data flow graphs of Java code as Mermaid flowcharts.")
public class CodeflowCli implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(CodeflowCli.class);

    @CommandLine.Parameters(description = "Java source files.")
    private List<Path> sourceFiles = new ArrayList<>();

    @CommandLine.Option(names = "--source", description = "Java source string.")
    private String source;

    @CommandLine.Option(names = "--type", description = "Type of graph to build: ${COMPLETION-CANDIDATES}.")
    private GraphType type;

    @CommandLine.Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES}.")
    private OutputFormat format;

    @CommandLine.Option(names = "--hide-hidden", description = "Skip hidden branch marker nodes.")
    private boolean hideHidden;

    @CommandLine.Option(names = "--exclude-start-stop", description = "Skip the start and stop nodes.")
    private boolean excludeStartStop;

    @CommandLine.Option(names = "--print-ast", description = "Print the abstract syntax tree to stderr.")
    private boolean printAst;

    @CommandLine.Option(names = "--verbose", description = "Print the node table of each graph to stderr.")
    private boolean verbose;

    private final PrintStream out;
    private final PrintStream err;
    private final CodeflowConfig config;
    private final SourceParser parser = new SourceParser();

    public CodeflowCli() {
        this(System.out, System.err, CodeflowConfig.load());
    }

    public CodeflowCli(PrintStream out, PrintStream err, CodeflowConfig config) {
        this.out = out;
        this.err = err;
        this.config = config;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new CodeflowCli()).execute(args));
    }

    static CommandLine commandLine(CodeflowCli cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        boolean failed = false;

        if (source != null) {
            failed |= !process("<source>", source);
        }

        for (Path sourceFile : sourceFiles) {
            err.println(sourceFile);

            String sourceText;
            try {
                sourceText = Files.readString(sourceFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.warn("Failed to read {}", sourceFile, e);
                err.println("error: cannot read " + sourceFile + ": " + e.getMessage());
                failed = true;
                continue;
            }
            failed |= !process(sourceFile.toString(), sourceText);
        }

        return failed ? 1 : 0;
    }

    // Returns false when the source could not be parsed.
    private boolean process(String name, String sourceText) {
        SourceUnit unit;
        try {
            unit = parser.parse(sourceText);
        } catch (SourceParseException e) {
            err.println("error: " + name + ": " + e.getMessage());
            return false;
        }

        if (printAst) {
            err.println(parser.printAst(unit));
        }

        GraphType graphType = type != null ? type : config.getGraphType();
        OutputFormat outputFormat = format != null ? format : config.getOutputFormat();
        MermaidRenderer renderer = new MermaidRenderer(renderOptions());
        GraphJsonExporter exporter = new GraphJsonExporter();

        if (graphType == GraphType.CFG) {
            ControlFlowGraph cfg = new ControlFlowGraphBuilder().build(unit);
            if (verbose) {
                err.println(NodeTable.format(cfg.getRegistry()));
            }
            out.println(outputFormat == OutputFormat.JSON ? exporter.toJson(cfg) : renderer.render(cfg));
        } else {
            DataFlowGraph dfg = new DataFlowGraphBuilder().build(unit);
            if (verbose) {
                printNodeTables("main", dfg);
            }
            out.println(outputFormat == OutputFormat.JSON ? exporter.toJson(dfg) : renderer.render(dfg));
        }
        return true;
    }

    private RenderOptions renderOptions() {
        boolean includeHidden = !hideHidden && config.isIncludeHidden();
        boolean includeStartStop = !excludeStartStop && config.isIncludeStartStop();
        return new RenderOptions(includeHidden, includeStartStop);
    }

    private void printNodeTables(String name, DataFlowGraph dfg) {
        err.println(name);
        err.println(NodeTable.format(dfg.getRegistry()));
        for (Map.Entry<String, DataFlowGraph> method : dfg.getMethods().entrySet()) {
            printNodeTables(method.getKey(), method.getValue());
        }
    }
}
