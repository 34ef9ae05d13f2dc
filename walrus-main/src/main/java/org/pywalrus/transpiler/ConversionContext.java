package org.pywalrus.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.pywalrus.ConversionConfig;
import org.pywalrus.WalrusContextException;
import org.pywalrus.WalrusSyntaxException;
import org.pywalrus.parser.SourceParser;
import org.pywalrus.parser.ast.Leaf;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.ast.NodeKind;
import org.pywalrus.parser.util.AstUtils;
import org.pywalrus.parser.util.ScopeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the assignment expressions of one subtree.
 * <p>
 * The context walks its root once, in its constructor. Text rendered before the first
 * child holding an assignment expression goes to the prefix, the rest to the suffix, and
 * the declarations the rewritten code needs (hidden bindings, wrapper functions and
 * functions extracted from lambdas) are emitted between the two. A <em>raw</em> context
 * converts an expression spliced into its caller's text: it emits nothing itself and its
 * caller absorbs its pending declarations.
 * <p>
 * Nested scopes and indented suites get their own child contexts. The child contexts of
 * one class body share a single {@link ClassMemberTable}.
 */
public final class ConversionContext {

    private static final Logger LOG = LoggerFactory.getLogger(ConversionContext.class);

    private final ContextKind kind;
    private final Node root;
    private final ConversionConfig config;
    private final UniqueNameGenerator uniqueNames;
    private final int indentLevel;
    private final String indentation;
    private final ScopeKeyword scopeKeyword;
    private final Set<String> seenGlobals;
    private final Set<String> seenNonlocals;
    private final boolean raw;
    private final ClassMemberTable classMembers;

    private final StringBuilder prefix = new StringBuilder();
    private final StringBuilder suffix = new StringBuilder();
    private boolean insertionPointReached;
    private Node insertionPointMarker;

    private final List<String> pendingBindings = new ArrayList<>();
    private final List<WrapperFunction> pendingFunctions = new ArrayList<>();
    private final List<LambdaFunction> pendingLambdas = new ArrayList<>();

    private final String output;

    private ConversionContext(Settings settings) {
        this.kind = settings.kind;
        this.root = settings.root;
        this.config = settings.config;
        this.uniqueNames = settings.uniqueNames;
        this.indentLevel = settings.indentLevel;
        this.indentation = settings.indentation;
        this.scopeKeyword = settings.scopeKeyword;
        this.seenGlobals = new LinkedHashSet<>(settings.seenGlobals);
        this.seenNonlocals = new LinkedHashSet<>(settings.seenNonlocals);
        this.raw = settings.raw;
        this.classMembers = settings.classMembers;

        process(root);
        this.output = finish();
    }

    /**
     * Converts a whole module.
     *
     * @param root the {@link NodeKind#FILE_INPUT} node of the module
     */
    public static ConversionContext forModule(Node root, ConversionConfig config, UniqueNameGenerator uniqueNames) {
        Settings settings = new Settings(ContextKind.PLAIN, root, config, uniqueNames);
        settings.indentLevel = 0;
        settings.indentation = "";
        settings.scopeKeyword = ScopeKeyword.GLOBAL;
        settings.seenGlobals = ScopeResolver.declaredNames(root, NodeKind.GLOBAL_STMT);
        return new ConversionContext(settings);
    }

    public String getOutput() {
        return output;
    }

    public ContextKind getKind() {
        return kind;
    }

    public List<String> getPendingBindings() {
        return Collections.unmodifiableList(pendingBindings);
    }

    public List<WrapperFunction> getPendingFunctions() {
        return Collections.unmodifiableList(pendingFunctions);
    }

    public List<LambdaFunction> getPendingLambdas() {
        return Collections.unmodifiableList(pendingLambdas);
    }

    public Set<String> getSeenGlobals() {
        return Collections.unmodifiableSet(seenGlobals);
    }

    /**
     * @return the member table of the enclosing class body, or {@code null} outside class bodies
     */
    public ClassMemberTable getClassMembers() {
        return classMembers;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public String getIndentation() {
        return indentation;
    }

    public ScopeKeyword getScopeKeyword() {
        return scopeKeyword;
    }

    public boolean isRaw() {
        return raw;
    }

    // ── traversal ──

    private void process(Node node) {
        switch (node.getKind()) {
            case FUNCDEF:
            case CLASSDEF:
            case IF_STMT:
            case WHILE_STMT:
            case FOR_STMT:
            case TRY_STMT:
            case WITH_STMT:
                walk(node, true);
                return;
            case LAMBDEF:
            case LAMBDEF_NOCOND:
                processLambda(node);
                return;
            case GLOBAL_STMT:
            case NONLOCAL_STMT:
                processDeclaration(node);
                return;
            case NAMEDEXPR_TEST:
                processNamedExpr(node);
                return;
            case ARGUMENT:
                if (AstUtils.isNamedExpr(node)) {
                    processNamedExpr(node);
                } else {
                    walk(node, false);
                }
                return;
            case STRING:
            case STRINGS:
                processStringLiteral(node);
                return;
            default:
                break;
        }
        if (node instanceof Leaf) {
            append(node.getCode());
        } else {
            walk(node, false);
        }
    }

    /**
     * Visits the children in order. In a compound statement the suite following a
     * {@code :} is converted by a child context.
     */
    private void walk(Node node, boolean compound) {
        Node previous = null;
        for (Node child : node.getChildren()) {
            if (!insertionPointReached && AstUtils.containsNamedExpr(child)) {
                insertionPointReached = true;
                insertionPointMarker = previous;
            }
            if (compound && AstUtils.isSuite(child) && previous != null && AstUtils.isOperator(previous, ":")) {
                processSuite(node, child);
            } else {
                process(child);
            }
            previous = child;
        }
    }

    private void processSuite(Node owner, Node suite) {
        if (!AstUtils.containsNamedExpr(suite)) {
            append(suite.getCode());
            return;
        }
        boolean oneLiner = suite.is(NodeKind.SIMPLE_STMT);
        Settings settings = derive(kind, suite);
        settings.indentLevel = indentLevel + 1;
        settings.indentation = oneLiner
                ? indentation + config.getIndentation()
                : Whitespace.indentationOf(AstUtils.firstStatement(suite));
        settings.raw = false;

        ScopeResolver.ScopeKind scope = ScopeResolver.scopeOpenedBy(owner);
        settings.scopeKeyword = ScopeKeyword.forBody(scope, scopeKeyword);
        if (scope != null) {
            // a declaration may follow the statement whose bindings are inserted first
            settings.seenGlobals = ScopeResolver.declaredNames(suite, NodeKind.GLOBAL_STMT);
            settings.seenNonlocals = ScopeResolver.declaredNames(suite, NodeKind.NONLOCAL_STMT);
        }
        if (scope == ScopeResolver.ScopeKind.FUNCTION) {
            settings.kind = ContextKind.PLAIN;
            settings.classMembers = null;
        } else if (scope == ScopeResolver.ScopeKind.CLASS) {
            settings.kind = ContextKind.CLASS;
            settings.classMembers = new ClassMemberTable(((Leaf) owner.getChild(1)).getValue());
            settings.seenGlobals.forEach(name -> settings.classMembers.declareExternal(name, ScopeKeyword.GLOBAL));
            settings.seenNonlocals.forEach(name -> settings.classMembers.declareExternal(name, ScopeKeyword.NONLOCAL));
        } else if (classMembers != null) {
            settings.kind = ContextKind.CLASS;
        } else {
            settings.kind = ContextKind.PLAIN;
        }

        ConversionContext child = new ConversionContext(settings);
        if (scope == null) {
            seenGlobals.addAll(child.seenGlobals);
            seenNonlocals.addAll(child.seenNonlocals);
        }
        if (oneLiner) {
            append(config.getLinesepText() + settings.indentation + child.getOutput().stripLeading());
        } else {
            append(child.getOutput());
        }
    }

    private void processDeclaration(Node node) {
        ScopeKeyword keyword = node.is(NodeKind.GLOBAL_STMT) ? ScopeKeyword.GLOBAL : ScopeKeyword.NONLOCAL;
        for (Node child : node.getChildren()) {
            if (!child.is(NodeKind.NAME)) {
                continue;
            }
            String name = ((Leaf) child).getValue();
            if (keyword == ScopeKeyword.GLOBAL) {
                seenGlobals.add(name);
            } else {
                seenNonlocals.add(name);
            }
            if (classMembers != null) {
                classMembers.declareExternal(name, keyword);
            }
        }
        append(node.getCode());
    }

    private void processNamedExpr(Node node) {
        Node target = node.getChild(0);
        if (!target.is(NodeKind.NAME)) {
            throw new WalrusContextException("Assignment expression target is not a name", node.describe());
        }
        String name = ((Leaf) target).getValue();
        ScopeKeyword external = classMembers == null ? null : classMembers.externalKeyword(name);
        boolean classMember = classMembers != null && external == null;
        String uid = uniqueNames.next();

        ConversionContext value = rawContext(inheritedKind(), node.getChild(2));
        absorb(value);
        String expression = value.getOutput().strip();

        String replacement;
        if (classMember) {
            String mangled = classMembers.mangle(name);
            String first = classMembers.register(mangled, uid);
            LOG.trace("Class member {} of {} bound, first binding {}", mangled, classMembers.getClassName(), first);
            replacement = WrapperTemplates.classStorage(mangled, name, expression);
        } else {
            ScopeKeyword keyword;
            if (external != null) {
                keyword = external;
            } else if (seenGlobals.contains(name)) {
                keyword = ScopeKeyword.GLOBAL;
            } else {
                keyword = scopeKeyword;
            }
            if (classMembers == null && !seenGlobals.contains(name) && !seenNonlocals.contains(name)) {
                pendingBindings.add(name);
            }
            WrapperFunction function = new WrapperFunction(name, uid, keyword);
            pendingFunctions.add(function);
            LOG.trace("Wrapper {} binds {} with {}", function.functionName(), name, keyword.getKeyword());
            replacement = function.functionName() + "(" + expression + ")";
        }

        Whitespace.Span span = Whitespace.extract(node);
        append(span.leading() + replacement + span.trailing());
    }

    private void processLambda(Node node) {
        Node body = node.getChild(node.getChildren().size() - 1);
        if (!AstUtils.containsNamedExpr(body)) {
            walk(node, false);
            return;
        }
        String uid = uniqueNames.next();

        String parameters = "";
        if (node.getChildren().size() == 4) {
            ConversionContext converted = rawContext(inheritedKind(), node.getChild(1));
            absorb(converted);
            parameters = converted.getOutput().strip();
        }

        Settings settings = derive(ContextKind.LAMBDA, body);
        settings.indentLevel = indentLevel + 1;
        settings.indentation = indentation + config.getIndentation();
        settings.scopeKeyword = ScopeKeyword.NONLOCAL;
        settings.seenGlobals = Set.of();
        settings.seenNonlocals = Set.of();
        settings.classMembers = null;
        settings.raw = false;
        ConversionContext lambda = new ConversionContext(settings);

        LambdaFunction function = new LambdaFunction(uid, parameters, lambda.getOutput());
        pendingLambdas.add(function);
        LOG.trace("Lambda at {}:{} extracted to {}", node.getLine(), node.getColumn(), function.functionName());

        Whitespace.Span span = Whitespace.extract(node);
        append(span.leading() + function.functionName() + span.trailing());
    }

    private void processStringLiteral(Node node) {
        if (!AstUtils.containsNamedExpr(node)) {
            append(node.getCode());
            return;
        }
        Whitespace.Span span = Whitespace.extract(node);
        String rewritten = config.getLiteralRewriter().rewrite(span.code(), config.getSourceVersion());
        Node expression;
        try {
            expression = SourceParser.parseExpression(rewritten, config.getSourceVersion());
        } catch (WalrusSyntaxException e) {
            throw new WalrusContextException("Rewritten string literal is not an expression: " + rewritten,
                    node.describe(), e);
        }
        ConversionContext converted = rawContext(ContextKind.STRING, expression);
        absorb(converted);
        append(span.leading() + converted.getOutput().strip() + span.trailing());
    }

    private ConversionContext rawContext(ContextKind contextKind, Node subtree) {
        Settings settings = derive(contextKind, subtree);
        settings.raw = true;
        return new ConversionContext(settings);
    }

    private ContextKind inheritedKind() {
        return classMembers != null ? ContextKind.CLASS : ContextKind.PLAIN;
    }

    private void absorb(ConversionContext child) {
        pendingBindings.addAll(child.pendingBindings);
        pendingFunctions.addAll(child.pendingFunctions);
        pendingLambdas.addAll(child.pendingLambdas);
        seenGlobals.addAll(child.seenGlobals);
        seenNonlocals.addAll(child.seenNonlocals);
    }

    private void append(String text) {
        (insertionPointReached ? suffix : prefix).append(text);
    }

    // ── emission ──

    private String finish() {
        if (kind == ContextKind.LAMBDA) {
            return finishLambda();
        }
        if (raw || !hasPending()) {
            return prefix.toString() + suffix;
        }

        String linesep = config.getLinesepText();
        Whitespace.CommentSplit split = Whitespace.splitComments(suffix.toString());
        StringBuilder out = new StringBuilder(prefix).append(split.comments());
        if (out.length() > 0 && !Whitespace.endsWithLineBreak(out)) {
            out.append(linesep);
        }
        if (config.isPep8() && Whitespace.hasCode(out)) {
            boolean afterDefinition = insertionPointMarker != null && AstUtils.isDefinition(insertionPointMarker);
            int expected = indentLevel == 0 && afterDefinition ? 2 : 1;
            out.append(linesep.repeat(Whitespace.missingNewlines(out.toString(), "", expected)));
        }
        int blankLines = indentLevel == 0 ? 2 : 1;
        out.append(declarations(config.isPep8() ? blankLines : 0));
        if (config.isPep8()) {
            out.append(linesep.repeat(blankLines));
        }
        out.append(indentation).append(split.code().stripLeading());
        return out.toString();
    }

    /**
     * The body of the function standing in for a lambda: its declarations and a
     * {@code return} of the converted expression.
     */
    private String finishLambda() {
        String linesep = config.getLinesepText();
        StringBuilder out = new StringBuilder();
        if (hasPending()) {
            out.append(declarations(config.isPep8() ? 1 : 0));
            if (config.isPep8()) {
                out.append(linesep);
            }
        }
        String body = (prefix.toString() + suffix).strip();
        if (body.indexOf('\n') >= 0 || body.indexOf('\r') >= 0) {
            body = "(" + body + ")";
        }
        return out.append(indentation).append("return ").append(body).append(linesep).toString();
    }

    private boolean hasPending() {
        return !pendingBindings.isEmpty() || !pendingFunctions.isEmpty() || !pendingLambdas.isEmpty();
    }

    private String declarations(int blankLines) {
        String linesep = config.getLinesepText();
        String unit = config.getIndentation();
        List<String> items = new ArrayList<>();
        if (!pendingBindings.isEmpty()) {
            items.add(WrapperTemplates.hiddenBindings(new TreeSet<>(pendingBindings), indentation, unit, linesep));
        }
        List<WrapperFunction> functions = new ArrayList<>(pendingFunctions);
        functions.sort(Comparator.comparing(WrapperFunction::name).thenComparing(WrapperFunction::uid));
        for (WrapperFunction function : functions) {
            items.add(WrapperTemplates.wrapperFunction(function, indentation, unit, linesep));
        }
        for (LambdaFunction function : pendingLambdas) {
            items.add(WrapperTemplates.lambdaFunction(function, indentation, unit, linesep));
        }
        return String.join(linesep.repeat(blankLines), items);
    }

    private Settings derive(ContextKind childKind, Node childRoot) {
        Settings settings = new Settings(childKind, childRoot, config, uniqueNames);
        settings.indentLevel = indentLevel;
        settings.indentation = indentation;
        settings.scopeKeyword = scopeKeyword;
        settings.seenGlobals = seenGlobals;
        settings.seenNonlocals = seenNonlocals;
        settings.raw = raw;
        settings.classMembers = classMembers;
        return settings;
    }

    /**
     * Construction arguments of a context; the constructor copies what it keeps.
     */
    private static final class Settings {

        private ContextKind kind;
        private final Node root;
        private final ConversionConfig config;
        private final UniqueNameGenerator uniqueNames;
        private int indentLevel;
        private String indentation;
        private ScopeKeyword scopeKeyword;
        private Set<String> seenGlobals = Set.of();
        private Set<String> seenNonlocals = Set.of();
        private boolean raw;
        private ClassMemberTable classMembers;

        private Settings(ContextKind kind, Node root, ConversionConfig config, UniqueNameGenerator uniqueNames) {
            this.kind = kind;
            this.root = root;
            this.config = config;
            this.uniqueNames = uniqueNames;
        }
    }
}
