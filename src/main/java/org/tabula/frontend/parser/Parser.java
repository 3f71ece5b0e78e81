package org.tabula.frontend.parser;

import org.tabula.diagnostics.DiagnosticsEngine;
import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.lexer.TokenType;
import org.tabula.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The parser for the brace language. It consumes the code tokens produced by the
 * {@link org.tabula.frontend.lexer.Lexer} (comments removed, end-of-file kept) and
 * produces an Abstract Syntax Tree rooted in a {@link ProgramNode}.
 * <p>
 * Syntax errors are reported to the {@link DiagnosticsEngine}; the parser then skips to the
 * next statement boundary and continues, so that all errors of a file are collected.
 */
public class Parser {

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("||", 1),
            Map.entry("&&", 2),
            Map.entry("==", 3), Map.entry("!=", 3), Map.entry("===", 3), Map.entry("!==", 3),
            Map.entry("<", 4), Map.entry(">", 4), Map.entry("<=", 4), Map.entry(">=", 4),
            Map.entry("+", 5), Map.entry("-", 5),
            Map.entry("*", 6), Map.entry("/", 6), Map.entry("%", 6));

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=");
    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "-", "+", "++", "--");
    private static final Set<String> DECLARATION_KINDS = Set.of("var", "let", "const");

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The code tokens to parse, terminated by an end-of-file token.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The root of the tree.
     */
    public ProgramNode parse() {
        List<AstNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            AstNode statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        Token first = tokens.size() > 1 ? tokens.get(0) : null;
        Token last = tokens.size() > 1 ? tokens.get(tokens.size() - 2) : null;
        return new ProgramNode(statements, first, last);
    }

    private AstNode declaration() {
        try {
            return statement();
        } catch (ParseError ex) {
            synchronize();
            return null;
        }
    }

    private AstNode statement() {
        if (check(TokenType.LEFT_BRACE)) return block();
        if (match(TokenType.SEMICOLON)) return new EmptyStatementNode(previous());

        if (check(TokenType.KEYWORD)) {
            String keyword = peek().text();
            switch (keyword) {
                case "if": advance(); return ifStatement();
                case "while": advance(); return whileStatement();
                case "do": advance(); return doWhileStatement();
                case "for": advance(); return forStatement();
                case "switch": advance(); return switchStatement();
                case "return": advance(); return returnStatement();
                case "break", "continue": advance(); return breakStatement();
                case "var", "let", "const": advance(); return variableDeclaration(true);
                case "function":
                    if (checkNext(TokenType.IDENTIFIER)) {
                        advance();
                        return functionDeclaration();
                    }
                    break;
                default:
                    break;
            }
        }
        return expressionStatement();
    }

    private BlockNode block() {
        Token open = consume(TokenType.LEFT_BRACE, "Expected '{'.");
        List<AstNode> body = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            body.add(statement());
        }
        Token close = consume(TokenType.RIGHT_BRACE, "Expected '}' to close the block.");
        return new BlockNode(open, body, close);
    }

    private IfNode ifStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'.");
        AstNode test = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the condition.");
        AstNode consequent = statement();
        AstNode alternate = matchKeyword("else") ? statement() : null;
        return new IfNode(keyword, test, consequent, alternate);
    }

    private WhileNode whileStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'.");
        AstNode test = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the condition.");
        return new WhileNode(keyword, test, statement());
    }

    private DoWhileNode doWhileStatement() {
        Token keyword = previous();
        AstNode body = statement();
        if (!matchKeyword("while")) {
            throw error(peek(), "Expected 'while' after the body of 'do'.");
        }
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'.");
        AstNode test = expression();
        Token last = consume(TokenType.RIGHT_PAREN, "Expected ')' after the condition.");
        if (match(TokenType.SEMICOLON)) {
            last = previous();
        }
        return new DoWhileNode(keyword, body, test, last);
    }

    private ForNode forStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'for'.");
        AstNode init = null;
        if (!check(TokenType.SEMICOLON)) {
            if (check(TokenType.KEYWORD) && DECLARATION_KINDS.contains(peek().text())) {
                advance();
                init = variableDeclaration(false);
            } else {
                init = expression();
            }
        }
        consume(TokenType.SEMICOLON, "Expected ';' after the loop initializer.");
        AstNode test = check(TokenType.SEMICOLON) ? null : expression();
        consume(TokenType.SEMICOLON, "Expected ';' after the loop condition.");
        AstNode update = check(TokenType.RIGHT_PAREN) ? null : expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the loop header.");
        return new ForNode(keyword, init, test, update, statement());
    }

    private SwitchNode switchStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'switch'.");
        AstNode discriminant = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the switch value.");
        consume(TokenType.LEFT_BRACE, "Expected '{' to open the switch body.");

        List<SwitchCaseNode> cases = new ArrayList<>();
        while (checkKeyword("case") || checkKeyword("default")) {
            Token caseKeyword = advance();
            AstNode test = "case".equals(caseKeyword.text()) ? expression() : null;
            Token last = consume(TokenType.COLON, "Expected ':' after the case.");
            List<AstNode> consequent = new ArrayList<>();
            while (!checkKeyword("case") && !checkKeyword("default")
                    && !check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                consequent.add(statement());
            }
            if (!consequent.isEmpty()) {
                last = consequent.get(consequent.size() - 1).lastToken();
            }
            cases.add(new SwitchCaseNode(caseKeyword, test, consequent, last));
        }
        Token close = consume(TokenType.RIGHT_BRACE, "Expected '}' to close the switch body.");
        return new SwitchNode(keyword, discriminant, cases, close);
    }

    private ReturnNode returnStatement() {
        Token keyword = previous();
        AstNode argument = null;
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE) && !isAtEnd()
                && peek().line() == keyword.line()) {
            argument = expression();
        }
        Token last = previous();
        if (match(TokenType.SEMICOLON)) {
            last = previous();
        }
        return new ReturnNode(keyword, argument, last);
    }

    private BreakNode breakStatement() {
        Token keyword = previous();
        Token last = keyword;
        if (match(TokenType.SEMICOLON)) {
            last = previous();
        }
        return new BreakNode(keyword, last);
    }

    private VariableDeclarationNode variableDeclaration(boolean allowSemicolon) {
        Token kind = previous();
        List<VariableDeclaratorNode> declarations = new ArrayList<>();
        do {
            IdentifierNode id = new IdentifierNode(consume(TokenType.IDENTIFIER, "Expected a variable name."));
            AstNode init = null;
            if (matchOperator("=")) {
                init = assignment();
            }
            declarations.add(new VariableDeclaratorNode(id, init, previous()));
        } while (match(TokenType.COMMA));

        Token last = previous();
        if (allowSemicolon && match(TokenType.SEMICOLON)) {
            last = previous();
        }
        return new VariableDeclarationNode(kind, declarations, last);
    }

    private FunctionDeclarationNode functionDeclaration() {
        Token keyword = previous();
        Token name = consume(TokenType.IDENTIFIER, "Expected a function name.");
        List<IdentifierNode> params = parameters();
        return new FunctionDeclarationNode(keyword, name, params, block());
    }

    private FunctionExpressionNode functionExpression() {
        Token keyword = previous();
        Token name = match(TokenType.IDENTIFIER) ? previous() : null;
        List<IdentifierNode> params = parameters();
        return new FunctionExpressionNode(keyword, name, params, block());
    }

    private List<IdentifierNode> parameters() {
        consume(TokenType.LEFT_PAREN, "Expected '(' before the parameters.");
        List<IdentifierNode> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(new IdentifierNode(consume(TokenType.IDENTIFIER, "Expected a parameter name.")));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the parameters.");
        return params;
    }

    private ExpressionStatementNode expressionStatement() {
        Token first = peek();
        AstNode expression = expression();
        Token last = previous();
        if (match(TokenType.SEMICOLON)) {
            last = previous();
        }
        return new ExpressionStatementNode(expression, first, last);
    }

    /**
     * Parses an expression.
     * @return The parsed {@link AstNode} for the expression.
     */
    public AstNode expression() {
        return assignment();
    }

    private AstNode assignment() {
        Token first = peek();
        AstNode left = conditional();
        if (check(TokenType.OPERATOR) && ASSIGNMENT_OPERATORS.contains(peek().text())) {
            Token operator = advance();
            AstNode right = assignment();
            return new AssignmentNode(left, operator, right, first, previous());
        }
        return left;
    }

    private AstNode conditional() {
        Token first = peek();
        AstNode test = binary(1);
        if (match(TokenType.QUESTION)) {
            Token question = previous();
            AstNode consequent = assignment();
            Token colon = consume(TokenType.COLON, "Expected ':' in conditional expression.");
            AstNode alternate = assignment();
            return new ConditionalNode(test, question, consequent, colon, alternate, first, previous());
        }
        return test;
    }

    private AstNode binary(int minPrecedence) {
        Token first = peek();
        AstNode left = unary();
        while (true) {
            int precedence = check(TokenType.OPERATOR) ? BINARY_PRECEDENCE.getOrDefault(peek().text(), -1) : -1;
            if (precedence < minPrecedence) {
                return left;
            }
            Token operator = advance();
            AstNode right = binary(precedence + 1);
            left = new BinaryNode(left, operator, right, first, previous());
        }
    }

    private AstNode unary() {
        if (check(TokenType.OPERATOR) && PREFIX_OPERATORS.contains(peek().text())) {
            Token operator = advance();
            AstNode argument = unary();
            return new UnaryNode(operator, argument, true, operator, previous());
        }
        return postfix();
    }

    private AstNode postfix() {
        Token first = peek();
        AstNode expression = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                List<AstNode> arguments = new ArrayList<>();
                if (!check(TokenType.RIGHT_PAREN)) {
                    do {
                        arguments.add(assignment());
                    } while (match(TokenType.COMMA));
                }
                Token close = consume(TokenType.RIGHT_PAREN, "Expected ')' after the arguments.");
                expression = new CallNode(expression, arguments, first, close);
            } else if (match(TokenType.DOT)) {
                IdentifierNode property = new IdentifierNode(consume(TokenType.IDENTIFIER, "Expected a property name after '.'."));
                expression = new MemberNode(expression, property, false, first, previous());
            } else if (match(TokenType.LEFT_BRACKET)) {
                AstNode property = expression();
                Token close = consume(TokenType.RIGHT_BRACKET, "Expected ']' after the index.");
                expression = new MemberNode(expression, property, true, first, close);
            } else if (check(TokenType.OPERATOR) && ("++".equals(peek().text()) || "--".equals(peek().text()))
                    && peek().line() == previous().endLine()) {
                Token operator = advance();
                expression = new UnaryNode(operator, expression, false, first, operator);
            } else {
                return expression;
            }
        }
    }

    private AstNode primary() {
        if (match(TokenType.IDENTIFIER)) return new IdentifierNode(previous());
        if (match(TokenType.NUMBER, TokenType.STRING, TokenType.TEMPLATE)) return new LiteralNode(previous());
        if (matchKeyword("true") || matchKeyword("false") || matchKeyword("null")) return new LiteralNode(previous());
        if (matchKeyword("function")) return functionExpression();

        if (match(TokenType.LEFT_PAREN)) {
            AstNode inner = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after the expression.");
            return inner;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token open = previous();
            List<AstNode> elements = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd()) {
                elements.add(assignment());
                if (!match(TokenType.COMMA)) break;
            }
            Token close = consume(TokenType.RIGHT_BRACKET, "Expected ']' to close the array.");
            return new ArrayNode(open, elements, close);
        }

        if (match(TokenType.LEFT_BRACE)) {
            Token open = previous();
            List<PropertyNode> properties = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                properties.add(property());
                if (!match(TokenType.COMMA)) break;
            }
            Token close = consume(TokenType.RIGHT_BRACE, "Expected '}' to close the object.");
            return new ObjectNode(open, properties, close);
        }

        throw error(peek(), "Unexpected token while parsing expression: " + describe(peek()));
    }

    private PropertyNode property() {
        AstNode key;
        if (match(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
            key = new IdentifierNode(previous());
        } else if (match(TokenType.STRING, TokenType.NUMBER)) {
            key = new LiteralNode(previous());
        } else {
            throw error(peek(), "Expected a property name but got " + describe(peek()) + ".");
        }
        Token colon = consume(TokenType.COLON, "Expected ':' after the property name.");
        AstNode value = assignment();
        return new PropertyNode(key, colon, value, previous());
    }

    private void synchronize() {
        if (!isAtEnd()) advance();
        while (!isAtEnd()) {
            TokenType previousType = previous().type();
            if (previousType == TokenType.SEMICOLON || previousType == TokenType.RIGHT_BRACE) return;
            if (check(TokenType.KEYWORD) && !"function".equals(peek().text())) return;
            advance();
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchOperator(String operator) {
        if (check(TokenType.OPERATOR) && peek().text().equals(operator)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkKeyword(String keyword) {
        return check(TokenType.KEYWORD) && peek().text().equals(keyword);
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, token.fileName(), token.line(), token.column() + 1);
        return new ParseError(message);
    }

    private static String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "end of file" : "'" + token.text() + "'";
    }

    /**
     * Unwinds the recursive descent to the next statement boundary.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
