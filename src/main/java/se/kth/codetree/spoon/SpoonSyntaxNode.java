package se.kth.codetree.spoon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import se.kth.codetree.exception.MalformedSourceException;
import se.kth.codetree.syntax.Branch;
import se.kth.codetree.syntax.SourcePosition;
import se.kth.codetree.syntax.SyntaxKind;
import se.kth.codetree.syntax.SyntaxNode;
import se.kth.codetree.util.LazyLogger;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtCatch;
import spoon.reflect.code.CtIf;
import spoon.reflect.code.CtLoop;
import spoon.reflect.code.CtStatement;
import spoon.reflect.code.CtSynchronized;
import spoon.reflect.code.CtTry;
import spoon.reflect.cu.position.DeclarationSourcePosition;
import spoon.reflect.declaration.CtAnonymousExecutable;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtEnum;
import spoon.reflect.declaration.CtEnumValue;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtType;
import spoon.reflect.declaration.CtTypeMember;

/**
 * Adapts a Spoon tree to the {@link SyntaxNode} interface. Only statements and type members are adapted;
 * expressions, including lambdas and anonymous classes, are part of the statement that contains them.
 *
 * A compound construct whose branches are all empty, such as an abstract method or an empty loop, is adapted as a
 * plain statement, as it has no clauses to indent. Handlers are the exception, as they only occur in the handler
 * list of a try statement.
 */
public class SpoonSyntaxNode implements SyntaxNode {
    private static final LazyLogger LOGGER = new LazyLogger(SpoonSyntaxNode.class);

    private final CtElement element;
    private final SyntaxKind kind;
    private final String name;
    private final SourcePosition position;
    private final List<SyntaxNode> body;
    private final List<SyntaxNode> alternate;
    private final List<SyntaxNode> handlers;
    private final List<SyntaxNode> cleanup;
    private final Map<Branch, SourcePosition> branchPositions;

    private SpoonSyntaxNode(
            CtElement element,
            SyntaxKind kind,
            String name,
            SourcePosition position,
            List<SyntaxNode> body,
            List<SyntaxNode> alternate,
            List<SyntaxNode> handlers,
            List<SyntaxNode> cleanup,
            Map<Branch, SourcePosition> branchPositions) {
        boolean empty = body.isEmpty() && alternate.isEmpty() && cleanup.isEmpty()
                && handlers.stream().allMatch(handler -> handler.getBody().isEmpty());
        boolean container = kind == SyntaxKind.MODULE || kind == SyntaxKind.HANDLER;
        this.element = element;
        this.kind = empty && !container ? SyntaxKind.STATEMENT : kind;
        this.name = name;
        this.position = position;
        this.body = body;
        this.alternate = alternate;
        this.handlers = this.kind == SyntaxKind.STATEMENT ? Collections.emptyList() : handlers;
        this.cleanup = cleanup;
        this.branchPositions = branchPositions;
    }

    /**
     * Create the module node of a compilation unit.
     *
     * @param types The top-level types of the compilation unit.
     * @param source The text the compilation unit was parsed from.
     * @return A module node with the types as its body, in source order.
     */
    public static SpoonSyntaxNode module(List<CtType<?>> types, String source) {
        SourceText text = new SourceText(source);
        List<SyntaxNode> body = types.stream()
                .filter(type -> type.getPosition().isValidPosition())
                .sorted(Comparator.comparingInt(type -> type.getPosition().getSourceStart()))
                .map(type -> wrap(type, text))
                .collect(Collectors.toList());
        return new SpoonSyntaxNode(null, SyntaxKind.MODULE, null, SourcePosition.of(1, 1), body,
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
                new EnumMap<>(Branch.class));
    }

    /**
     * Wrap a type member or a statement.
     *
     * @param element A Spoon element.
     * @param text The text the element was parsed from.
     * @return The adapted element.
     */
    static SpoonSyntaxNode wrap(CtElement element, SourceText text) {
        Map<Branch, SourcePosition> branchPositions = new EnumMap<>(Branch.class);
        List<SyntaxNode> none = Collections.emptyList();

        if (element instanceof CtType) {
            CtType<?> type = (CtType<?>) element;
            return new SpoonSyntaxNode(element, SyntaxKind.NAMED_DEFINITION, type.getSimpleName(),
                    positionOf(element, text), members(type, text), none, none, none, branchPositions);
        } else if (element instanceof CtAnonymousExecutable) {
            return new SpoonSyntaxNode(element, SyntaxKind.SCOPE, null, positionOf(element, text),
                    statementsOf(((CtAnonymousExecutable) element).getBody(), text), none, none, none,
                    branchPositions);
        } else if (element instanceof CtExecutable) {
            CtExecutable<?> executable = (CtExecutable<?>) element;
            return new SpoonSyntaxNode(element, SyntaxKind.NAMED_DEFINITION, executableName(executable),
                    positionOf(element, text), statementsOf(executable.getBody(), text), none, none, none,
                    branchPositions);
        } else if (element instanceof CtIf) {
            CtIf ctIf = (CtIf) element;
            CtStatement elseStatement = ctIf.getElseStatement();
            List<SyntaxNode> alternate = statementsOf(elseStatement, text);
            if (!alternate.isEmpty()) {
                branchPositions.put(Branch.ALTERNATE,
                        keywordAfter(ctIf.getThenStatement(), "else", elseStatement, text));
            }
            return new SpoonSyntaxNode(element, SyntaxKind.CONDITIONAL, null, positionOf(element, text),
                    statementsOf(ctIf.getThenStatement(), text), alternate, none, none, branchPositions);
        } else if (element instanceof CtLoop) {
            return new SpoonSyntaxNode(element, SyntaxKind.ITERATION, null, positionOf(element, text),
                    statementsOf(((CtLoop) element).getBody(), text), none, none, none, branchPositions);
        } else if (element instanceof CtTry) {
            CtTry ctTry = (CtTry) element;
            List<SyntaxNode> handlers = new ArrayList<>();
            CtElement previous = ctTry.getBody();
            for (CtCatch ctCatch : ctTry.getCatchers()) {
                handlers.add(wrapCatch(ctCatch, previous, text));
                previous = ctCatch;
            }
            List<SyntaxNode> cleanup = statementsOf(ctTry.getFinalizer(), text);
            if (!cleanup.isEmpty()) {
                branchPositions.put(Branch.CLEANUP, keywordAfter(previous, "finally", ctTry.getFinalizer(), text));
            }
            return new SpoonSyntaxNode(element, SyntaxKind.PROTECTED_REGION, null, positionOf(element, text),
                    statementsOf(ctTry.getBody(), text), none, handlers, cleanup, branchPositions);
        } else if (element instanceof CtSynchronized) {
            return new SpoonSyntaxNode(element, SyntaxKind.SCOPE, null, positionOf(element, text),
                    statementsOf(((CtSynchronized) element).getBlock(), text), none, none, none, branchPositions);
        } else if (element instanceof CtBlock) {
            return new SpoonSyntaxNode(element, SyntaxKind.SCOPE, null, positionOf(element, text),
                    statementsOf((CtBlock<?>) element, text), none, none, none, branchPositions);
        }
        return new SpoonSyntaxNode(element, SyntaxKind.STATEMENT, null, positionOf(element, text),
                none, none, none, none, branchPositions);
    }

    /**
     * A handler is positioned at its catch keyword, which is looked up after the end of the preceding body or
     * handler.
     */
    private static SpoonSyntaxNode wrapCatch(CtCatch ctCatch, CtElement previous, SourceText text) {
        List<SyntaxNode> none = Collections.emptyList();
        return new SpoonSyntaxNode(ctCatch, SyntaxKind.HANDLER, null, keywordAfter(previous, "catch", ctCatch, text),
                statementsOf(ctCatch.getBody(), text), none, none, none, new EnumMap<>(Branch.class));
    }

    /**
     * @return The type members in source order, excluding implicit ones such as default constructors. The constants
     *      of an enum are members too.
     */
    private static List<SyntaxNode> members(CtType<?> type, SourceText text) {
        List<CtElement> members = new ArrayList<>();
        Set<CtElement> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        if (type instanceof CtEnum) {
            for (CtEnumValue<?> value : ((CtEnum<?>) type).getEnumValues()) {
                if (seen.add(value)) {
                    members.add(value);
                }
            }
        }
        for (CtTypeMember member : type.getTypeMembers()) {
            if (seen.add(member)) {
                members.add(member);
            }
        }
        return members.stream()
                .filter(member -> !member.isImplicit())
                .filter(member -> member.getPosition().isValidPosition())
                .sorted(Comparator.comparingInt(member -> member.getPosition().getSourceStart()))
                .map(member -> wrap(member, text))
                .collect(Collectors.toList());
    }

    private static List<SyntaxNode> statementsOf(CtStatement statement, SourceText text) {
        if (statement == null) {
            return Collections.emptyList();
        } else if (statement instanceof CtBlock) {
            return ((CtBlock<?>) statement).getStatements().stream()
                    .filter(s -> !s.isImplicit())
                    .map(s -> wrap(s, text))
                    .collect(Collectors.toList());
        } else if (statement.isImplicit()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(wrap(statement, text));
    }

    /**
     * Find the keyword that opens a branch. The keyword is the first token after the end of the preceding part of
     * the construct, which holds with or without braces around either part.
     *
     * @param previous The part of the construct that precedes the branch.
     * @param keyword The keyword opening the branch.
     * @param branch The branch itself, whose own position is used if the keyword cannot be found.
     * @param text The text the construct was parsed from.
     * @return The position of the keyword.
     */
    private static SourcePosition keywordAfter(CtElement previous, String keyword, CtElement branch, SourceText text) {
        CtElement last = lastPositioned(previous);
        if (last != null) {
            int offset = text.skipTrivia(last.getPosition().getSourceEnd() + 1);
            if (text.startsWithKeyword(offset, keyword)) {
                return text.positionOf(offset);
            }
        }
        LOGGER.debug(() -> "No " + keyword + " keyword found after " + previous + ", using the branch position");
        return branchPositionOf(branch, text);
    }

    /**
     * @return The element itself, or the last explicit statement of an implicit block. Null if neither has a
     *      position.
     */
    private static CtElement lastPositioned(CtElement element) {
        if (element == null) {
            return null;
        }
        if (element instanceof CtBlock && (element.isImplicit() || !element.getPosition().isValidPosition())) {
            List<CtStatement> statements = ((CtBlock<?>) element).getStatements();
            for (int i = statements.size() - 1; i >= 0; i--) {
                CtStatement statement = statements.get(i);
                if (!statement.isImplicit() && statement.getPosition().isValidPosition()) {
                    return statement;
                }
            }
            return null;
        }
        return element.getPosition().isValidPosition() ? element : null;
    }

    /**
     * Branches without braces are positioned at their first statement.
     */
    private static SourcePosition branchPositionOf(CtElement branch, SourceText text) {
        if (branch instanceof CtBlock && (branch.isImplicit() || !branch.getPosition().isValidPosition())) {
            CtStatement first = ((CtBlock<?>) branch).getStatements().stream()
                    .filter(s -> !s.isImplicit())
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Branch has no explicit statements"));
            return positionOf(first, text);
        }
        return positionOf(branch, text);
    }

    private static String executableName(CtExecutable<?> executable) {
        if (executable instanceof CtConstructor) {
            return ((CtConstructor<?>) executable).getDeclaringType().getSimpleName();
        }
        return executable.getSimpleName();
    }

    /**
     * The position of an element's first token. For declarations, Spoon's source start is the declared name, so
     * the start of the declaration is used instead to include its annotations and modifiers.
     */
    private static SourcePosition positionOf(CtElement element, SourceText text) {
        spoon.reflect.cu.SourcePosition position = element.getPosition();
        if (!position.isValidPosition()) {
            throw new MalformedSourceException(
                    "No source position for " + element.getClass().getSimpleName(),
                    nearestValidPosition(element, text));
        }
        int start = position.getSourceStart();
        if (position instanceof DeclarationSourcePosition) {
            int declarationStart = ((DeclarationSourcePosition) position).getDeclarationStart();
            if (declarationStart >= 0 && declarationStart < start) {
                // the declaration start may include a leading javadoc comment
                start = Math.min(text.skipTrivia(declarationStart), start);
            }
        }
        return text.positionOf(start);
    }

    private static SourcePosition nearestValidPosition(CtElement element, SourceText text) {
        for (CtElement e = element; e != null && e.isParentInitialized(); e = e.getParent()) {
            if (e.getPosition().isValidPosition()) {
                return text.positionOf(e.getPosition().getSourceStart());
            }
        }
        return SourcePosition.of(0, 0);
    }

    /**
     * @return The wrapped Spoon element, or null for the module node.
     */
    public CtElement getElement() {
        return element;
    }

    @Override
    public SyntaxKind getKind() {
        return kind;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public SourcePosition getPosition() {
        return position;
    }

    @Override
    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getAlternate() {
        return alternate;
    }

    @Override
    public List<SyntaxNode> getHandlers() {
        return handlers;
    }

    @Override
    public List<SyntaxNode> getCleanup() {
        return cleanup;
    }

    @Override
    public SourcePosition getBranchPosition(Branch branch) {
        return branchPositions.getOrDefault(branch, position);
    }

    @Override
    public String toString() {
        String type = element == null ? "CompilationUnit" : element.getClass().getSimpleName();
        return type + (name != null ? "(" + name + ")" : "") + "@" + position;
    }
}
