package se.kth.codetree.clause;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import se.kth.codetree.IndentedSourceParser;
import se.kth.codetree.exception.InvariantViolationException;
import se.kth.codetree.exception.MalformedSourceException;
import se.kth.codetree.syntax.Dialect;
import se.kth.codetree.syntax.SimpleSyntaxNode;
import se.kth.codetree.syntax.SourceLines;
import se.kth.codetree.syntax.SourcePosition;
import se.kth.codetree.syntax.SyntaxKind;
import se.kth.codetree.syntax.SyntaxNode;

class ClauseBuilderTest {
    private static final String MIXED_SOURCE = String.join("\n",
            "import os",
            "class Shape:",
            "    def area(self):",
            "        if self.empty:",
            "            return 0",
            "        elif self.round:",
            "            return pi",
            "        elif self.square:",
            "            for side in self.sides:",
            "                check(side)",
            "            else:",
            "                log()",
            "            return side * side",
            "        else:",
            "            if self.other:",
            "                pass",
            "            return None",
            "    def close(self):",
            "        try:",
            "            self.handle.close()",
            "        except IOError:",
            "            pass",
            "        except OSError:",
            "            raise",
            "        else:",
            "            self.closed = True",
            "        finally:",
            "            self.handle = None",
            "with open(path) as f:",
            "    while f.more():",
            "        f.read()",
            "main()");

    private static ClauseGraph build(String source) {
        return ClauseBuilder.build(IndentedSourceParser.parse(source), SourceLines.of(source), Dialect.PYTHON);
    }

    private static List<ClauseTag> tags(List<ClauseNode> clauses) {
        return clauses.stream().map(ClauseNode::getTag).collect(Collectors.toList());
    }

    private static List<ClauseNode> toList(java.util.Iterator<ClauseNode> it) {
        List<ClauseNode> result = new ArrayList<>();
        it.forEachRemaining(result::add);
        return result;
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x = 1",
            "if a:\n    b\nelif c:\n    d\nelse:\n    e",
            "for x in y:\n    if a:\n        b\n    elif c:\n        d\nelse:\n    e\nf",
    })
    void successorLinks_shouldVisitEveryClauseOnceInPreOrder(String source) {
        ClauseGraph graph = build(source);
        successorOrderEqualsPreOrder(graph);
    }

    @Test
    void successorLinks_shouldVisitEveryClauseOnceInPreOrder_whenSourceIsMixed() {
        ClauseGraph graph = build(MIXED_SOURCE);

        successorOrderEqualsPreOrder(graph);
        assertNull(graph.getFirst().getPredecessor());
        assertNull(graph.getLast().getSuccessor());
    }

    private static void successorOrderEqualsPreOrder(ClauseGraph graph) {
        List<ClauseNode> linear = new ArrayList<>();
        graph.forEach(linear::add);
        List<ClauseNode> preOrder = toList(graph.preOrder());

        assertEquals(preOrder, linear);
        assertEquals(graph.size(), linear.size());

        Map<ClauseNode, Boolean> seen = new IdentityHashMap<>();
        for (int i = 0; i < linear.size(); i++) {
            ClauseNode clause = linear.get(i);
            assertNull(seen.put(clause, true), "visited twice: " + clause);
            assertEquals(i, clause.getIndex());
            if (i > 0) {
                assertSame(linear.get(i - 1), clause.getPredecessor());
            }
        }
    }

    @Test
    void build_shouldPromoteCascadedConditional_toSiblingOfOuterConditional() {
        String source = "if a:\n    b\nelif c:\n    d\n    e";

        ClauseNode module = build(source).getFirst();
        List<ClauseNode> clauses = module.getChildren();

        assertEquals(Arrays.asList(ClauseTag.BODY, ClauseTag.ALTERNATE_BRANCH), tags(clauses));
        ClauseNode body = clauses.get(0);
        ClauseNode alternate = clauses.get(1);
        assertSame(module, alternate.getParent());
        assertSame(alternate, body.getNextSibling());
        assertSame(body, alternate.getPrevSibling());
        assertSame(SyntaxKind.CONDITIONAL, alternate.getSyntaxKind());
        assertNotSame(body.getSyntax(), alternate.getSyntax());
        assertEquals(3, alternate.getLine());
        assertEquals(Arrays.asList(ClauseTag.NONE, ClauseTag.NONE), tags(alternate.getChildren()));
        // the promoted clause directly follows the primary branch's subtree
        assertSame(body.getChildren().get(0), alternate.getPredecessor());
    }

    @Test
    void build_shouldProduceNoElseBranch_whenAlternateIsOnlyCascadedConditionals() {
        String source = "if a:\n    b\nelif c:\n    d\nelif e:\n    f";

        List<ClauseNode> clauses = build(source).getFirst().getChildren();

        assertEquals(
                Arrays.asList(ClauseTag.BODY, ClauseTag.ALTERNATE_BRANCH, ClauseTag.ALTERNATE_BRANCH),
                tags(clauses));
    }

    @Test
    void build_shouldProduceThreeSiblings_whenConditionalHasCascadedAndTrailingElse() {
        String source = "if a:\n    b\nelif c:\n    d\nelse:\n    e";

        ClauseGraph graph = build(source);
        List<ClauseNode> clauses = graph.getFirst().getChildren();

        assertEquals(
                Arrays.asList(ClauseTag.BODY, ClauseTag.ALTERNATE_BRANCH, ClauseTag.ELSE_BRANCH), tags(clauses));
        assertEquals(1, clauses.get(1).getChildren().size());
        assertEquals(5, clauses.get(2).getLine());
        assertEquals(7, graph.size());
    }

    @Test
    void build_shouldNestConditional_whenElseBlockContainsIf() {
        String source = "if a:\n    b\nelse:\n    if c:\n        d";

        List<ClauseNode> clauses = build(source).getFirst().getChildren();

        assertEquals(Arrays.asList(ClauseTag.BODY, ClauseTag.ELSE_BRANCH), tags(clauses));
        assertEquals(Collections.singletonList(ClauseTag.BODY), tags(clauses.get(1).getChildren()));
    }

    @Test
    void build_shouldEmitLoopAndTryClausesInFixedOrder() {
        ClauseGraph graph = build(MIXED_SOURCE);
        ClauseNode shape = graph.getFirst().getChildren().get(1);
        ClauseNode close = shape.getChildren().get(1);

        assertTrue(shape.isNamedDefinition());
        assertEquals("close", close.getSyntax().getName());
        assertEquals(
                Arrays.asList(
                        ClauseTag.BODY,
                        ClauseTag.HANDLER_BRANCH,
                        ClauseTag.HANDLER_BRANCH,
                        ClauseTag.ELSE_BRANCH,
                        ClauseTag.CLEANUP_BRANCH),
                tags(close.getChildren()));
        assertSame(SyntaxKind.HANDLER, close.getChildren().get(1).getSyntaxKind());
        assertEquals(21, close.getChildren().get(1).getLine());
        assertEquals(27, close.getChildren().get(4).getLine());

        ClauseNode square = shape.getChildren().get(0).getChildren().get(2);
        assertEquals(ClauseTag.ALTERNATE_BRANCH, square.getTag());
        assertEquals(
                Arrays.asList(ClauseTag.BODY, ClauseTag.ELSE_BRANCH, ClauseTag.NONE), tags(square.getChildren()));
    }

    @Test
    void build_shouldOmitEmptyBranches() {
        SimpleSyntaxNode loop = SimpleSyntaxNode.builder(SyntaxKind.ITERATION, SourcePosition.of(1, 1))
                .alternate(SourcePosition.of(2, 1), Collections.singletonList(SimpleSyntaxNode.statement(3, 5)))
                .build();
        SimpleSyntaxNode module = SimpleSyntaxNode.builder(SyntaxKind.MODULE, SourcePosition.of(1, 1))
                .body(Collections.singletonList(loop))
                .build();

        ClauseGraph graph = ClauseBuilder.build(
                module, SourceLines.of("for x in y:\nelse:\n    z"), Dialect.PYTHON);

        assertEquals(
                Collections.singletonList(ClauseTag.ELSE_BRANCH), tags(graph.getFirst().getChildren()));
    }

    @Test
    void build_shouldDropBranch_whenNoStatementProducesAClause() {
        SimpleSyntaxNode emptyLoop = SimpleSyntaxNode.builder(SyntaxKind.ITERATION, SourcePosition.of(2, 5)).build();
        SimpleSyntaxNode scope = SimpleSyntaxNode.builder(SyntaxKind.SCOPE, SourcePosition.of(1, 1))
                .body(Collections.singletonList(emptyLoop))
                .build();
        SimpleSyntaxNode module = SimpleSyntaxNode.builder(SyntaxKind.MODULE, SourcePosition.of(1, 1))
                .body(Arrays.asList(scope, SimpleSyntaxNode.statement(3, 1)))
                .build();

        ClauseGraph graph = ClauseBuilder.build(
                module, SourceLines.of("with x:\n    while y:\nz"), Dialect.PYTHON);

        assertEquals(2, graph.size());
        assertEquals(Collections.singletonList(ClauseTag.NONE), tags(graph.getFirst().getChildren()));
        assertSame(graph.getFirst(), graph.getLast().getPredecessor());
    }

    @Test
    void build_shouldReturnEmptyGraph_whenModuleIsEmpty() {
        SimpleSyntaxNode module = SimpleSyntaxNode.builder(SyntaxKind.MODULE, SourcePosition.of(1, 1)).build();

        ClauseGraph graph = ClauseBuilder.build(module, SourceLines.of(""), Dialect.PYTHON);

        assertTrue(graph.isEmpty());
        assertNull(graph.getFirst());
        assertFalse(graph.iterator().hasNext());
    }

    @Test
    void build_shouldPlaceBranchesAtTopLevel_whenRootIsNotAModule() {
        String source = "if a:\n    b\nelse:\n    c";
        SyntaxNode conditional = IndentedSourceParser.parse(source).getBody().get(0);

        ClauseGraph graph = ClauseBuilder.build(conditional, SourceLines.of(source), Dialect.PYTHON);

        assertEquals(Arrays.asList(ClauseTag.BODY, ClauseTag.ELSE_BRANCH), tags(graph.getTopLevel()));
        assertNull(graph.getTopLevel().get(1).getParent());
        successorOrderEqualsPreOrder(graph);
    }

    @Test
    void build_shouldThrow_whenStatementHasBranches() {
        SimpleSyntaxNode statement = SimpleSyntaxNode.builder(SyntaxKind.STATEMENT, SourcePosition.of(1, 1))
                .body(Collections.singletonList(SimpleSyntaxNode.statement(2, 5)))
                .build();
        SimpleSyntaxNode module = SimpleSyntaxNode.builder(SyntaxKind.MODULE, SourcePosition.of(1, 1))
                .body(Collections.singletonList(statement))
                .build();

        assertThrows(InvariantViolationException.class,
                () -> ClauseBuilder.build(module, SourceLines.of("switch x:\n    y"), Dialect.PYTHON));
    }

    @Test
    void build_shouldThrow_whenHandlerIsOutsideOfProtectedRegion() {
        SimpleSyntaxNode handler = SimpleSyntaxNode.builder(SyntaxKind.HANDLER, SourcePosition.of(1, 1))
                .body(Collections.singletonList(SimpleSyntaxNode.statement(2, 5)))
                .build();
        SimpleSyntaxNode module = SimpleSyntaxNode.builder(SyntaxKind.MODULE, SourcePosition.of(1, 1))
                .body(Collections.singletonList(handler))
                .build();

        assertThrows(InvariantViolationException.class,
                () -> ClauseBuilder.build(module, SourceLines.of("except:\n    y"), Dialect.PYTHON));
    }

    @Test
    void build_shouldReportPosition_whenNodeIsOutsideOfSource() {
        SimpleSyntaxNode module = SimpleSyntaxNode.builder(SyntaxKind.MODULE, SourcePosition.of(1, 1))
                .body(Arrays.asList(SimpleSyntaxNode.statement(1, 1), SimpleSyntaxNode.statement(7, 1)))
                .build();

        MalformedSourceException e = assertThrows(MalformedSourceException.class,
                () -> ClauseBuilder.build(module, SourceLines.of("a\nb"), Dialect.PYTHON));

        assertEquals(SourcePosition.of(7, 1), e.getPosition());
    }

    @Test
    void linkSuccessor_shouldThrow_whenEitherEndIsAlreadyLinked() {
        SyntaxNode statement = SimpleSyntaxNode.statement(1, 1);
        ClauseNode first = new ClauseNode(statement, ClauseTag.NONE, statement.getPosition(), null);
        ClauseNode second = new ClauseNode(statement, ClauseTag.NONE, statement.getPosition(), null);
        ClauseNode third = new ClauseNode(statement, ClauseTag.NONE, statement.getPosition(), null);

        first.linkSuccessor(second);

        assertThrows(InvariantViolationException.class, () -> first.linkSuccessor(third));
        assertThrows(InvariantViolationException.class, () -> third.linkSuccessor(second));
        assertNull(third.getPredecessor());
        assertNull(third.getSuccessor());
    }

    @Test
    void build_shouldProduceFreshGraph_onEveryCall() {
        ClauseGraph first = build(MIXED_SOURCE);
        ClauseGraph second = build(MIXED_SOURCE);

        assertEquals(first.size(), second.size());
        assertNotSame(first.getFirst(), second.getFirst());
        assertEquals(tags(toList(first.iterator())), tags(toList(second.iterator())));
    }
}
