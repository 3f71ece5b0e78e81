package org.tabula.rules;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tabula.frontend.parser.ast.ArrayNode;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.CallNode;
import org.tabula.frontend.parser.ast.IdentifierNode;
import org.tabula.frontend.parser.ast.VariableDeclaratorNode;

import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests how the registry turns rules into walker handlers.
 */
public class IndentRuleRegistryTest {

    @Test
    @Tag("unit")
    void kindNamesDropTheNodeSuffix() {
        assertThat(IndentRuleRegistry.kindOf(ArrayNode.class)).isEqualTo("Array");
        assertThat(IndentRuleRegistry.kindOf(VariableDeclaratorNode.class)).isEqualTo("VariableDeclarator");
    }

    @Test
    @Tag("unit")
    void builtInRulesAreRegistered() {
        IndentRuleRegistry registry = IndentRuleRegistry.initialize();

        assertThat(registry.get(CallNode.class)).isPresent();
        assertThat(registry.get(IdentifierNode.class)).isEmpty();
    }

    /**
     * An ignored kind loses its enter handler and gains an exit handler; unknown kinds are skipped.
     */
    @Test
    @Tag("unit")
    void ignoredKindsSwapEnterForExitHandler() {
        // Arrange
        IndentRuleRegistry registry = IndentRuleRegistry.initialize();
        Set<String> ignored = Set.of("Array", "NoSuchKind");

        // Act
        Map<Class<? extends AstNode>, Consumer<AstNode>> enter = registry.enterHandlers(null, ignored);
        Map<Class<? extends AstNode>, Consumer<AstNode>> exit = registry.exitHandlers(null, ignored);

        // Assert
        assertThat(enter).doesNotContainKey(ArrayNode.class).containsKey(CallNode.class);
        assertThat(exit).containsOnlyKeys(ArrayNode.class);
    }
}
