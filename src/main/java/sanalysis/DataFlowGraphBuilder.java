package sanalysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import graph.DataFlowGraph;
import graph.FlowNode;
import graph.NodeRegistry;
import graph.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parsing.SourceUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link DataFlowGraph} from a parsed source unit.
 *
 * Nodes are values (constants, named values, operator results) and an edge means
 * "computed from". Every write creates a new node, so a name keeps one node per
 * assignment. Reading a name nobody wrote yet creates a free {@code NAME} node, which
 * keeps snippets with unbound variables analysable.
 *
 * Method bodies are built into independent sub-graphs seeded with one placeholder
 * node per parameter.
 */
public class DataFlowGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DataFlowGraphBuilder.class);

    public DataFlowGraph build(SourceUnit unit) {
        Traversal traversal = new Traversal();
        if (unit.isScript()) {
            traversal.visitAll(unit.getScript().getStatements());
        } else {
            traversal.visitAll(unit.getCompilationUnit().getTypes());
        }
        DataFlowGraph dfg = traversal.finish();
        logger.debug("Built data flow graph with {} nodes and {} methods",
                dfg.getRegistry().size(), dfg.getMethods().size());
        return dfg;
    }

    static DataFlowGraph buildMethod(List<String> parameters, Optional<BlockStmt> body) {
        Traversal traversal = new Traversal();
        for (String parameter : parameters) {
            traversal.addInput(parameter);
        }
        // the body shares the root scope with the parameters
        body.ifPresent(block -> traversal.visitAll(block.getStatements()));
        return traversal.finish();
    }

    /**
     * One build pass over one lexical unit. Sub-graphs get their own traversal, so they
     * never see the enclosing frontier or scopes.
     */
    private static class Traversal extends VoidVisitorAdapter<Void> {
        private final DataFlowGraph dfg = new DataFlowGraph();
        private final NodeRegistry registry = dfg.getRegistry();
        private final FrontierStack frontiers = new FrontierStack();
        private final ScopeChain scopes = new ScopeChain();
        private final Deque<String> classStack = new ArrayDeque<>();
        // ids of nodes created by assignments, used to find the outputs of if branches
        private final Set<Integer> assignedIds = new HashSet<>();
        private boolean withinOutput = false;
        // returns inside lambda bodies belong to the lambda, not to this unit
        private int lambdaDepth = 0;

        void visitAll(Collection<? extends Node> nodes) {
            for (Node node : nodes) {
                node.accept(this, null);
            }
        }

        void addInput(String name) {
            FlowNode placeholder = registry.add(name, NodeType.NAME, Collections.emptySet());
            dfg.addInput(name, placeholder);
            scopes.declare(name, placeholder.getId());
        }

        DataFlowGraph finish() {
            dfg.seal(scopes.snapshotRoot());
            return dfg;
        }

        // helpers

        private FlowNode addNode(String label, NodeType type, Set<Integer> preds) {
            return addNode(label, type, preds, true);
        }

        private FlowNode addNode(String label, NodeType type, Set<Integer> preds, boolean updateFrontier) {
            FlowNode node = registry.add(label, type, preds);
            if (updateFrontier) {
                frontiers.add(node.getId());
            }
            return node;
        }

        // Traverses nodes in an isolated frontier and returns what they produced.
        private Set<Integer> visitWithPreds(Node node) {
            return visitWithPreds(Collections.singletonList(node));
        }

        private Set<Integer> visitWithPreds(Node first, Node second) {
            List<Node> list = new ArrayList<>();
            list.add(first);
            list.add(second);
            return visitWithPreds(list);
        }

        private Set<Integer> visitWithPreds(Collection<? extends Node> nodes) {
            frontiers.pushEmpty();
            visitAll(nodes);
            return frontiers.pop();
        }

        private Set<Integer> visitTargets(Expression target) {
            boolean saved = withinOutput;
            withinOutput = true;
            Set<Integer> targets = visitWithPreds(target);
            withinOutput = saved;
            return targets;
        }

        private void read(String name) {
            Optional<Integer> bound = scopes.lookup(name);
            if (bound.isPresent()) {
                frontiers.add(bound.get());
            } else {
                FlowNode free = addNode(name, NodeType.NAME, Collections.emptySet());
                scopes.declare(name, free.getId());
            }
        }

        private FlowNode write(String name, Set<Integer> preds) {
            FlowNode node = addNode(name, NodeType.NAME, preds);
            scopes.assign(name, node.getId());
            assignedIds.add(node.getId());
            return node;
        }

        private void connect(Set<Integer> targets, Set<Integer> inputs) {
            for (Integer target : targets) {
                registry.addPredecessors(target, inputs);
            }
            frontiers.addAll(targets);
        }

        private FlowNode binaryNode(Expression left, String operator, Expression right, boolean updateFrontier) {
            boolean leftConstant = left instanceof LiteralExpr;
            boolean rightConstant = right instanceof LiteralExpr;

            // fold a single literal operand into the label, e.g. "x + 1"
            if (leftConstant != rightConstant) {
                Set<Integer> preds = visitWithPreds(leftConstant ? right : left);
                String label = left + " " + operator + " " + right;
                return addNode(label, NodeType.OP, preds, updateFrontier);
            }

            return addNode(operator, NodeType.OP, visitWithPreds(left, right), updateFrontier);
        }

        private void opaque(Node node, String keyword) {
            logger.debug("No data flow model for {}; adding it as a single '{}' node",
                    node.getClass().getSimpleName(), keyword);
            scopes.enter();
            Set<Integer> preds = visitWithPreds(node.getChildNodes());
            scopes.exit();
            addNode(keyword, NodeType.OP, preds);
        }

        private String qualify(String name) {
            return classStack.isEmpty() ? name : classStack.peek() + "." + name;
        }

        private String uniqueMethodName(String name) {
            String candidate = name;
            int n = 2;
            while (dfg.getMethods().containsKey(candidate)) {
                candidate = name + "#" + n++;
            }
            return candidate;
        }

        private void visitType(TypeDeclaration<?> type) {
            String name = type.getNameAsString();

            classStack.push(name);
            scopes.enter();
            Set<Integer> preds = visitWithPreds(type.getMethods());
            scopes.exit();
            classStack.pop();

            FlowNode node = addNode(name, NodeType.NAME, preds);
            scopes.declare(name, node.getId());
        }

        // declarations

        @Override
        public void visit(ClassOrInterfaceDeclaration n, Void arg) {
            visitType(n);
        }

        @Override
        public void visit(EnumDeclaration n, Void arg) {
            visitType(n);
        }

        @Override
        public void visit(RecordDeclaration n, Void arg) {
            visitType(n);
        }

        @Override
        public void visit(AnnotationDeclaration n, Void arg) {
            visitType(n);
        }

        @Override
        public void visit(MethodDeclaration n, Void arg) {
            String name = qualify(n.getNameAsString());
            List<String> parameters = new ArrayList<>();
            for (Parameter parameter : n.getParameters()) {
                parameters.add(parameter.getNameAsString());
            }
            dfg.addMethod(uniqueMethodName(name), buildMethod(parameters, n.getBody()));
        }

        // statements

        @Override
        public void visit(BlockStmt n, Void arg) {
            scopes.enter();
            visitAll(n.getStatements());
            scopes.exit();
        }

        @Override
        public void visit(IfStmt n, Void arg) {
            Set<Integer> test = visitWithPreds(n.getCondition());
            Set<Integer> predsTrue = visitBranch(n.getThenStmt());
            Set<Integer> predsFalse = n.getElseStmt().map(this::visitBranch).orElse(Collections.emptySet());

            // names assigned on both sides flow out of the if
            Set<String> outputs = assignedNames(predsTrue);
            outputs.retainAll(assignedNames(predsFalse));

            FlowNode dnTrue = addNode("true", NodeType.OP, filterByName(predsTrue, outputs), false);
            FlowNode dnFalse = addNode("false", NodeType.OP, filterByName(predsFalse, outputs), false);

            Set<Integer> preds = new LinkedHashSet<>();
            first(test).ifPresent(preds::add);
            preds.add(dnTrue.getId());
            preds.add(dnFalse.getId());
            FlowNode dnIf = addNode("if", NodeType.OP, preds);

            for (String output : outputs) {
                write(output, Collections.singleton(dnIf.getId()));
            }
        }

        private Set<Integer> visitBranch(Statement branch) {
            scopes.enter();
            Set<Integer> preds = visitWithPreds(branch);
            scopes.exit();
            return preds;
        }

        private Set<String> assignedNames(Set<Integer> ids) {
            Set<String> names = new LinkedHashSet<>();
            for (Integer id : ids) {
                if (assignedIds.contains(id)) {
                    names.add(registry.get(id).getLabel());
                }
            }
            return names;
        }

        private Set<Integer> filterByName(Set<Integer> ids, Set<String> names) {
            Set<Integer> result = new LinkedHashSet<>();
            for (Integer id : ids) {
                if (assignedIds.contains(id) && names.contains(registry.get(id).getLabel())) {
                    result.add(id);
                }
            }
            return result;
        }

        @Override
        public void visit(ReturnStmt n, Void arg) {
            n.getExpression().ifPresent(expr -> {
                if (expr.isNameExpr() && lambdaDepth == 0) {
                    dfg.addOutput(expr.asNameExpr().getNameAsString());
                }
                expr.accept(this, arg);
            });
        }

        @Override
        public void visit(WhileStmt n, Void arg) {
            opaque(n, "while");
        }

        @Override
        public void visit(DoStmt n, Void arg) {
            opaque(n, "do");
        }

        @Override
        public void visit(ForStmt n, Void arg) {
            opaque(n, "for");
        }

        @Override
        public void visit(ForEachStmt n, Void arg) {
            opaque(n, "for");
        }

        @Override
        public void visit(SwitchStmt n, Void arg) {
            opaque(n, "switch");
        }

        @Override
        public void visit(TryStmt n, Void arg) {
            opaque(n, "try");
        }

        @Override
        public void visit(SynchronizedStmt n, Void arg) {
            opaque(n, "synchronized");
        }

        @Override
        public void visit(ThrowStmt n, Void arg) {
            opaque(n, "throw");
        }

        @Override
        public void visit(AssertStmt n, Void arg) {
            opaque(n, "assert");
        }

        // expressions

        @Override
        public void visit(AssignExpr n, Void arg) {
            if (n.getOperator() == AssignExpr.Operator.ASSIGN) {
                Set<Integer> inputs = visitWithPreds(n.getValue());
                connect(visitTargets(n.getTarget()), inputs);
                return;
            }

            String operator = n.getOperator().toBinaryOperator()
                    .map(BinaryExpr.Operator::asString)
                    .orElse(n.getOperator().asString());
            FlowNode op = binaryNode(n.getTarget(), operator, n.getValue(), false);
            connect(visitTargets(n.getTarget()), Collections.singleton(op.getId()));
        }

        @Override
        public void visit(VariableDeclarationExpr n, Void arg) {
            for (VariableDeclarator declarator : n.getVariables()) {
                Set<Integer> inputs = declarator.getInitializer()
                        .map(this::visitWithPreds)
                        .orElse(Collections.emptySet());
                String name = declarator.getNameAsString();
                FlowNode node = addNode(name, NodeType.NAME, inputs);
                scopes.declare(name, node.getId());
            }
        }

        @Override
        public void visit(NameExpr n, Void arg) {
            String name = n.getNameAsString();
            if (withinOutput) {
                write(name, Collections.emptySet());
            } else {
                read(name);
            }
        }

        @Override
        public void visit(FieldAccessExpr n, Void arg) {
            String name = n.toString();
            if (withinOutput) {
                write(name, Collections.emptySet());
            } else {
                read(name);
            }
        }

        @Override
        public void visit(ArrayAccessExpr n, Void arg) {
            if (!withinOutput) {
                addNode("[]", NodeType.OP, visitWithPreds(n.getName(), n.getIndex()));
                return;
            }

            // a[i][j] = v rebinds a, which now also depends on i and j
            Deque<Expression> indexes = new ArrayDeque<>();
            Expression array = n;
            while (array.isArrayAccessExpr()) {
                indexes.push(array.asArrayAccessExpr().getIndex());
                array = array.asArrayAccessExpr().getName();
            }
            withinOutput = false;
            Set<Integer> preds = visitWithPreds(indexes);
            withinOutput = true;
            write(array.toString(), preds);
        }

        @Override
        public void visit(BinaryExpr n, Void arg) {
            binaryNode(n.getLeft(), n.getOperator().asString(), n.getRight(), true);
        }

        @Override
        public void visit(UnaryExpr n, Void arg) {
            UnaryExpr.Operator operator = n.getOperator();
            boolean update = operator == UnaryExpr.Operator.PREFIX_INCREMENT
                    || operator == UnaryExpr.Operator.PREFIX_DECREMENT
                    || operator == UnaryExpr.Operator.POSTFIX_INCREMENT
                    || operator == UnaryExpr.Operator.POSTFIX_DECREMENT;

            FlowNode op = addNode(operator.asString(), NodeType.OP, visitWithPreds(n.getExpression()), !update);
            if (update) {
                connect(visitTargets(n.getExpression()), Collections.singleton(op.getId()));
            }
        }

        @Override
        public void visit(ConditionalExpr n, Void arg) {
            Set<Integer> test = visitWithPreds(n.getCondition());
            Set<Integer> predsTrue = visitWithPreds(n.getThenExpr());
            Set<Integer> predsFalse = visitWithPreds(n.getElseExpr());

            FlowNode dnTrue = addNode("true", NodeType.OP, predsTrue, false);
            FlowNode dnFalse = addNode("false", NodeType.OP, predsFalse, false);

            Set<Integer> preds = new LinkedHashSet<>();
            first(test).ifPresent(preds::add);
            preds.add(dnTrue.getId());
            preds.add(dnFalse.getId());
            addNode("if", NodeType.OP, preds);
        }

        @Override
        public void visit(MethodCallExpr n, Void arg) {
            // the call node comes after its receiver and arguments so edges point backwards
            Set<Integer> preds = new LinkedHashSet<>();
            n.getScope().ifPresent(scope -> preds.addAll(visitWithPreds(scope)));
            preds.addAll(visitWithPreds(n.getArguments()));

            String callee = n.getScope().map(scope -> scope + ".").orElse("") + n.getNameAsString();
            addNode(callee + "()", NodeType.NAME, preds);
        }

        @Override
        public void visit(ObjectCreationExpr n, Void arg) {
            Set<Integer> preds = new LinkedHashSet<>();
            n.getScope().ifPresent(scope -> preds.addAll(visitWithPreds(scope)));
            preds.addAll(visitWithPreds(n.getArguments()));

            addNode("new " + n.getType() + "()", NodeType.NAME, preds);
        }

        @Override
        public void visit(ArrayInitializerExpr n, Void arg) {
            addNode("[]", NodeType.CONSTANT, visitWithPreds(n.getValues()));
        }

        @Override
        public void visit(InstanceOfExpr n, Void arg) {
            addNode("instanceof", NodeType.OP, visitWithPreds(n.getExpression()));
        }

        @Override
        public void visit(LambdaExpr n, Void arg) {
            scopes.enter();
            lambdaDepth++;
            Set<Integer> preds;
            try {
                preds = visitWithPreds(n.getBody());
            } finally {
                lambdaDepth--;
            }
            scopes.exit();
            addNode(n.toString(), NodeType.NAME, preds);
        }

        @Override
        public void visit(MethodReferenceExpr n, Void arg) {
            addNode(n.toString(), NodeType.NAME, Collections.emptySet());
        }

        @Override
        public void visit(SwitchExpr n, Void arg) {
            opaque(n, "switch");
        }

        @Override
        public void visit(IntegerLiteralExpr n, Void arg) {
            constant(n);
        }

        @Override
        public void visit(LongLiteralExpr n, Void arg) {
            constant(n);
        }

        @Override
        public void visit(DoubleLiteralExpr n, Void arg) {
            constant(n);
        }

        @Override
        public void visit(CharLiteralExpr n, Void arg) {
            constant(n);
        }

        @Override
        public void visit(StringLiteralExpr n, Void arg) {
            constant(n);
        }

        @Override
        public void visit(TextBlockLiteralExpr n, Void arg) {
            constant(n);
        }

        @Override
        public void visit(BooleanLiteralExpr n, Void arg) {
            constant(n);
        }

        @Override
        public void visit(NullLiteralExpr n, Void arg) {
            constant(n);
        }

        private void constant(LiteralExpr literal) {
            addNode(literal.toString(), NodeType.CONSTANT, Collections.emptySet());
        }

        private static Optional<Integer> first(Set<Integer> ids) {
            return ids.isEmpty() ? Optional.empty() : Optional.of(ids.iterator().next());
        }
    }
}
