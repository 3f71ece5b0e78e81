package org.tabula.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabula.frontend.parser.ast.*;
import org.tabula.rules.features.ArrayObjectIndentRule;
import org.tabula.rules.features.AssignmentIndentRule;
import org.tabula.rules.features.BinaryIndentRule;
import org.tabula.rules.features.BlockIndentRule;
import org.tabula.rules.features.BlocklessBodyIndentRule;
import org.tabula.rules.features.CallIndentRule;
import org.tabula.rules.features.ConditionalIndentRule;
import org.tabula.rules.features.ForIndentRule;
import org.tabula.rules.features.FunctionIndentRule;
import org.tabula.rules.features.MemberIndentRule;
import org.tabula.rules.features.PropertyIndentRule;
import org.tabula.rules.features.SwitchIndentRule;
import org.tabula.rules.features.UnknownNodeRule;
import org.tabula.rules.features.VariableDeclarationIndentRule;
import org.tabula.rules.features.VariableDeclaratorIndentRule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A registry for indentation rules. This class holds a map of AST node classes to the
 * rules that declare their offsets, and turns it into the handler maps of a
 * {@link org.tabula.frontend.TreeWalker}.
 */
public class IndentRuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(IndentRuleRegistry.class);

    /** Every node class of the tree, for looking up node kinds by name. */
    private static final List<Class<? extends AstNode>> NODE_CLASSES = List.of(
            ProgramNode.class, BlockNode.class, IfNode.class, WhileNode.class, DoWhileNode.class,
            ForNode.class, SwitchNode.class, SwitchCaseNode.class, ReturnNode.class, BreakNode.class,
            EmptyStatementNode.class, ExpressionStatementNode.class, VariableDeclarationNode.class,
            VariableDeclaratorNode.class, FunctionDeclarationNode.class, FunctionExpressionNode.class,
            IdentifierNode.class, LiteralNode.class, ArrayNode.class, ObjectNode.class, PropertyNode.class,
            CallNode.class, MemberNode.class, UnaryNode.class, BinaryNode.class, AssignmentNode.class,
            ConditionalNode.class);

    private final Map<Class<? extends AstNode>, IIndentRule> rules = new HashMap<>();
    private final IIndentRule unknownNodeRule;

    private IndentRuleRegistry(IIndentRule unknownNodeRule) {
        this.unknownNodeRule = unknownNodeRule;
    }

    /**
     * Registers a rule for a node class, replacing any rule registered before.
     * @param nodeClass The node class.
     * @param rule The rule run when such a node is entered.
     */
    public void register(Class<? extends AstNode> nodeClass, IIndentRule rule) {
        rules.put(nodeClass, rule);
    }

    /**
     * @param nodeClass The node class.
     * @return An {@link Optional} containing the rule if one is registered, otherwise empty.
     */
    public Optional<IIndentRule> get(Class<? extends AstNode> nodeClass) {
        return Optional.ofNullable(rules.get(nodeClass));
    }

    /**
     * Builds the handlers run when nodes are entered. Node kinds listed as ignored get no handler.
     * @param context The state of the file being checked.
     * @param ignoredKinds Node kinds whose contents are not checked.
     * @return The enter handlers.
     */
    public Map<Class<? extends AstNode>, Consumer<AstNode>> enterHandlers(IndentContext context, Set<String> ignoredKinds) {
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        rules.forEach((nodeClass, rule) -> {
            if (!ignoredKinds.contains(kindOf(nodeClass))) {
                handlers.put(nodeClass, node -> rule.apply(node, context));
            }
        });
        return handlers;
    }

    /**
     * Builds the handlers run when nodes are left: the unknown-node handling for every ignored kind.
     * @param context The state of the file being checked.
     * @param ignoredKinds Node kinds whose contents are not checked.
     * @return The exit handlers.
     */
    public Map<Class<? extends AstNode>, Consumer<AstNode>> exitHandlers(IndentContext context, Set<String> ignoredKinds) {
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        for (String kind : ignoredKinds) {
            Optional<Class<? extends AstNode>> nodeClass = classOf(kind);
            if (nodeClass.isPresent()) {
                handlers.put(nodeClass.get(), node -> unknownNodeRule.apply(node, context));
            } else {
                LOG.warn("Ignoring unknown node kind '{}' in ignored-nodes", kind);
            }
        }
        return handlers;
    }

    /**
     * @param nodeClass A node class.
     * @return The kind name of the node, e.g. "Array" for {@link ArrayNode}.
     */
    public static String kindOf(Class<? extends AstNode> nodeClass) {
        String name = nodeClass.getSimpleName();
        return name.endsWith("Node") ? name.substring(0, name.length() - "Node".length()) : name;
    }

    private static Optional<Class<? extends AstNode>> classOf(String kind) {
        return NODE_CLASSES.stream().filter(c -> kindOf(c).equals(kind)).findFirst();
    }

    /**
     * Initializes the registry with all the built-in rules.
     * @return A new instance of {@link IndentRuleRegistry} with all rules registered.
     */
    public static IndentRuleRegistry initialize() {
        IndentRuleRegistry registry = new IndentRuleRegistry(new UnknownNodeRule());

        IIndentRule arrayOrObject = new ArrayObjectIndentRule();
        registry.register(ArrayNode.class, arrayOrObject);
        registry.register(ObjectNode.class, arrayOrObject);
        registry.register(AssignmentNode.class, new AssignmentIndentRule());
        registry.register(BinaryNode.class, new BinaryIndentRule());
        registry.register(BlockNode.class, new BlockIndentRule());
        registry.register(CallNode.class, new CallIndentRule());
        registry.register(ConditionalNode.class, new ConditionalIndentRule());

        IIndentRule blockless = new BlocklessBodyIndentRule();
        registry.register(DoWhileNode.class, blockless);
        registry.register(WhileNode.class, blockless);
        registry.register(IfNode.class, blockless);
        registry.register(ForNode.class, new ForIndentRule());

        IIndentRule function = new FunctionIndentRule();
        registry.register(FunctionDeclarationNode.class, function);
        registry.register(FunctionExpressionNode.class, function);

        registry.register(MemberNode.class, new MemberIndentRule());
        registry.register(PropertyNode.class, new PropertyIndentRule());
        registry.register(SwitchNode.class, new SwitchIndentRule());
        registry.register(VariableDeclarationNode.class, new VariableDeclarationIndentRule());
        registry.register(VariableDeclaratorNode.class, new VariableDeclaratorIndentRule());

        return registry;
    }
}
