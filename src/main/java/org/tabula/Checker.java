package org.tabula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabula.api.IndentCheckException;
import org.tabula.api.IndentChecker;
import org.tabula.api.IndentViolation;
import org.tabula.diagnostics.DiagnosticsEngine;
import org.tabula.frontend.TreeWalker;
import org.tabula.frontend.lexer.Lexer;
import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.Parser;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.ProgramNode;
import org.tabula.indent.IndentResolver;
import org.tabula.indent.OffsetStorage;
import org.tabula.indent.TokenIndex;
import org.tabula.report.IndentFixer;
import org.tabula.report.IndentReporter;
import org.tabula.rules.IndentContext;
import org.tabula.rules.IndentOptions;
import org.tabula.rules.IndentRuleRegistry;
import org.tabula.rules.ParenthesesIndenter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * The main checker implementation. This class orchestrates one check from source text
 * to violations: lexing, parsing, declaring offsets while walking the tree, the
 * parentheses pass, resolution and reporting. Every call works on fresh state.
 */
public class Checker implements IndentChecker {

    private static final Logger LOG = LoggerFactory.getLogger(Checker.class);

    private final IndentOptions options;
    private final IndentRuleRegistry registry;

    /**
     * Creates a checker with the default options.
     */
    public Checker() {
        this(IndentOptions.defaults());
    }

    /**
     * @param options The indentation policy.
     */
    public Checker(IndentOptions options) {
        this.options = options;
        this.registry = IndentRuleRegistry.initialize();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<IndentViolation> check(String source, String fileName) throws IndentCheckException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new IndentCheckException(diagnostics.summary());
        }

        // Phase 2: Parsing (comments are not part of the tree)
        List<Token> codeTokens = tokens.stream().filter(t -> !t.isComment()).collect(Collectors.toList());
        ProgramNode program = new Parser(codeTokens, diagnostics).parse();
        if (diagnostics.hasErrors()) {
            throw new IndentCheckException(diagnostics.summary());
        }

        // Phase 3: Offset declaration
        TokenStream tokenStream = new TokenStream(tokens);
        TokenIndex tokenIndex = new TokenIndex(tokens, source);
        OffsetStorage offsets = new OffsetStorage(tokenIndex, options.style());

        Map<Class<? extends AstNode>, Consumer<AstNode>> enterHandlers = new HashMap<>();
        Map<Class<? extends AstNode>, Consumer<AstNode>> exitHandlers = new HashMap<>();
        TreeWalker walker = new TreeWalker(enterHandlers, exitHandlers);
        IndentContext context = new IndentContext(tokenStream, tokenIndex, offsets, options, walker);
        enterHandlers.putAll(registry.enterHandlers(context, options.ignoredNodes()));
        exitHandlers.putAll(registry.exitHandlers(context, options.ignoredNodes()));

        walker.walk(program);
        new ParenthesesIndenter().apply(context);

        // Phase 4: Resolution and reporting
        IndentResolver resolver = offsets.freeze();
        List<IndentViolation> violations = new IndentReporter(tokenIndex, tokenStream, resolver).report();
        LOG.debug("{}: {} tokens, {} violations", fileName, tokenIndex.size(), violations.size());
        return violations;
    }

    /**
     * Checks a file and returns its text with all violations corrected.
     *
     * @param source The full text of the file.
     * @param fileName A name for the file, used in error messages.
     * @return The corrected text.
     * @throws IndentCheckException if the file cannot be lexed or parsed.
     */
    public String fix(String source, String fileName) throws IndentCheckException {
        return IndentFixer.fix(source, check(source, fileName));
    }

    public IndentOptions options() {
        return options;
    }
}
