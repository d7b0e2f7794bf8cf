package sanalysis;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import graph.ControlFlowGraph;
import graph.FlowNode;
import graph.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parsing.SourceUnit;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds a {@link ControlFlowGraph} from a parsed source unit.
 *
 * Every node takes the current frontier as its predecessors and becomes the new frontier,
 * so straight-line code forms a chain. Branches fork the frontier and merge the two
 * resulting frontiers. Loops, switches and try blocks are not modelled and show up as a
 * single opaque statement.
 */
public class ControlFlowGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ControlFlowGraphBuilder.class);

    public ControlFlowGraph build(SourceUnit unit) {
        Traversal traversal = new Traversal();
        ControlFlowGraph cfg = traversal.run(unit);
        logger.debug("Built control flow graph with {} nodes and {} definitions",
                cfg.getRegistry().size(), cfg.getDefinitions().size());
        return cfg;
    }

    // State of one build pass.
    private static class Traversal {
        private final ControlFlowGraph cfg = new ControlFlowGraph();
        private final FrontierStack frontiers = new FrontierStack();
        private final Deque<String> classStack = new ArrayDeque<>();

        ControlFlowGraph run(SourceUnit unit) {
            addNode("start", NodeType.START);

            if (unit.isScript()) {
                processBlock(unit.getScript());
            } else {
                for (TypeDeclaration<?> type : unit.getCompilationUnit().getTypes()) {
                    processType(type);
                }
            }

            addNode("stop", NodeType.STOP);
            cfg.seal();
            return cfg;
        }

        private FlowNode addNode(String label, NodeType type) {
            Set<Integer> preds = frontiers.pop();
            FlowNode node = cfg.getRegistry().add(label, type, preds);
            frontiers.push(Collections.singleton(node.getId()));
            return node;
        }

        private void processBlock(BlockStmt block) {
            for (Statement stmt : block.getStatements()) {
                processStatement(stmt);
            }
        }

        private void processStatement(Statement stmt) {
            if (stmt.isBlockStmt()) {
                processBlock(stmt.asBlockStmt());
            } else if (stmt.isIfStmt()) {
                processIfStmt(stmt.asIfStmt());
            } else if (stmt.isExpressionStmt()) {
                addNode(stmt.asExpressionStmt().getExpression().toString(), NodeType.STATEMENT);
            } else if (stmt.isEmptyStmt()) {
                // nothing to execute
            } else if (stmt.isLocalClassDeclarationStmt()) {
                processType(stmt.asLocalClassDeclarationStmt().getClassDeclaration());
            } else if (stmt.isLocalRecordDeclarationStmt()) {
                processType(stmt.asLocalRecordDeclarationStmt().getRecordDeclaration());
            } else if (stmt.isReturnStmt() || stmt.isBreakStmt() || stmt.isContinueStmt()
                    || stmt.isThrowStmt() || stmt.isAssertStmt() || stmt.isYieldStmt()
                    || stmt.isExplicitConstructorInvocationStmt()) {
                addNode(statementText(stmt), NodeType.STATEMENT);
            } else {
                processOpaqueStmt(stmt);
            }
        }

        private void processIfStmt(IfStmt ifStmt) {
            addNode(ifStmt.getCondition().toString(), NodeType.IF);

            // both branches start from the IF node
            frontiers.duplicate();
            addNode("", NodeType.IF_TRUE);
            processStatement(ifStmt.getThenStmt());
            Set<Integer> trueExits = frontiers.pop();

            addNode("", NodeType.IF_FALSE);
            ifStmt.getElseStmt().ifPresent(this::processStatement);
            Set<Integer> falseExits = frontiers.pop();

            Set<Integer> merged = new LinkedHashSet<>(trueExits);
            merged.addAll(falseExits);
            frontiers.push(merged);
        }

        private void processType(TypeDeclaration<?> type) {
            String name = type.getNameAsString();

            frontiers.duplicate();
            addNode("class " + name, NodeType.DEFINITION);

            // only methods are visited; fields, initializers and nested types are skipped
            classStack.push(name);
            for (MethodDeclaration method : type.getMethods()) {
                processMethod(method);
            }
            classStack.pop();

            frontiers.pop();
        }

        private void processMethod(MethodDeclaration method) {
            String name = classStack.isEmpty()
                    ? method.getNameAsString()
                    : classStack.peek() + "." + method.getNameAsString();

            // the body runs on a copy of the enclosing frontier which is discarded afterwards
            frontiers.duplicate();
            FlowNode definition = addNode(name, NodeType.DEFINITION);
            cfg.addDefinition(uniqueDefinitionName(name), definition);
            method.getBody().ifPresent(this::processBlock);
            frontiers.pop();
        }

        private void processOpaqueStmt(Statement stmt) {
            logger.debug("No control flow model for {}; adding it as a single statement",
                    stmt.getClass().getSimpleName());
            addNode(headerText(stmt), NodeType.STATEMENT);
        }

        private String uniqueDefinitionName(String name) {
            String candidate = name;
            int n = 2;
            while (cfg.getDefinitions().containsKey(candidate)) {
                candidate = name + "#" + n++;
            }
            return candidate;
        }
    }

    static String statementText(Statement stmt) {
        String text = stmt.toString().trim();
        return text.endsWith(";") ? text.substring(0, text.length() - 1) : text;
    }

    // First line of a compound statement, e.g. "while (i < n)".
    static String headerText(Statement stmt) {
        String text = stmt.toString().trim();
        int newline = text.indexOf('\n');
        String header = newline < 0 ? text : text.substring(0, newline);
        header = header.trim();
        if (header.endsWith("{")) {
            header = header.substring(0, header.length() - 1).trim();
        }
        if (header.endsWith(";")) {
            header = header.substring(0, header.length() - 1).trim();
        }
        return header;
    }
}
