package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.models.nodes.BinaryNode;
import com.spreadsheet.formula.models.nodes.CellNode;
import com.spreadsheet.formula.models.nodes.CellRangeNode;
import com.spreadsheet.formula.models.nodes.FormulaNode;
import com.spreadsheet.formula.models.nodes.FunctionNode;
import com.spreadsheet.formula.models.nodes.LiteralNode;
import com.spreadsheet.formula.models.nodes.UnaryNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser turning formula text into a {@link FormulaNode} tree.
 * <p>
 * Precedence, lowest first: comparisons, {@code + -}, {@code * / %}, {@code ^},
 * prefix {@code + -}. All binary operators are left-associative, {@code ^} included.
 * A leading {@code =} is optional.
 * <p>
 * Nesting (parentheses, function arguments, chained prefix operators) is limited
 * to a maximum depth so that hostile input fails with a parse error instead of
 * exhausting the thread stack.
 * <p>
 * Reference tokens are not validated here: {@code z9} becomes a {@link CellNode}
 * and is rejected when it is evaluated.
 */
public final class FormulaParser {

    public static final int DEFAULT_MAX_DEPTH = 200;

    private final FormulaLexer lexer;
    private final int maxDepth;
    private Token lookahead;
    private int depth;

    private FormulaParser(String text, int maxDepth) {
        this.lexer = new FormulaLexer(text);
        this.maxDepth = maxDepth;
        this.lookahead = lexer.next();
    }

    /**
     * Parses a whole formula with the default nesting limit.
     *
     * @throws FormulaParseException if the text is blank or malformed
     */
    public static FormulaNode parse(String text) {
        return parse(text, DEFAULT_MAX_DEPTH);
    }

    /**
     * Parses a whole formula, rejecting nesting deeper than {@code maxDepth}.
     *
     * @throws FormulaParseException if the text is blank, malformed or nested too deeply
     */
    public static FormulaNode parse(String text, int maxDepth) {
        if (text == null || text.trim().isEmpty()) {
            throw new FormulaParseException("Formula is empty", 0);
        }
        FormulaParser parser = new FormulaParser(text, maxDepth);
        if (parser.lookahead.type == TokenType.EQ) {
            parser.advance();
        }
        FormulaNode root = parser.comparison();
        parser.expect(TokenType.EOF);
        return root;
    }

    private FormulaNode comparison() {
        enter();
        try {
            return comparisonBody();
        } finally {
            depth--;
        }
    }

    private FormulaNode comparisonBody() {
        FormulaNode left = additive();
        while (isComparison(lookahead.type)) {
            String operator = advance().text;
            left = new BinaryNode(operator, left, additive());
        }
        return left;
    }

    private FormulaNode additive() {
        FormulaNode left = term();
        while (lookahead.type == TokenType.PLUS || lookahead.type == TokenType.MINUS) {
            String operator = advance().text;
            left = new BinaryNode(operator, left, term());
        }
        return left;
    }

    private FormulaNode term() {
        FormulaNode left = power();
        while (lookahead.type == TokenType.STAR
                || lookahead.type == TokenType.SLASH
                || lookahead.type == TokenType.PERCENT) {
            String operator = advance().text;
            left = new BinaryNode(operator, left, power());
        }
        return left;
    }

    private FormulaNode power() {
        FormulaNode left = unary();
        while (lookahead.type == TokenType.CARET) {
            advance();
            left = new BinaryNode("^", left, unary());
        }
        return left;
    }

    private FormulaNode unary() {
        if (lookahead.type == TokenType.PLUS || lookahead.type == TokenType.MINUS) {
            Token operator = advance();
            enter();
            try {
                return new UnaryNode(operator.text, unary());
            } finally {
                depth--;
            }
        }
        return primary();
    }

    private FormulaNode primary() {
        Token token = lookahead;
        switch (token.type) {
            case NUMBER:
                advance();
                return new LiteralNode(number(token));
            case STRING:
                advance();
                return new LiteralNode(token.text);
            case LPAREN:
                advance();
                FormulaNode inner = comparison();
                expect(TokenType.RPAREN);
                return inner;
            case IDENT:
                advance();
                return identifier(token);
            default:
                throw unexpected(token);
        }
    }

    private FormulaNode identifier(Token ident) {
        if (lookahead.type == TokenType.LPAREN) {
            advance();
            return new FunctionNode(ident.text.toUpperCase(Locale.ROOT), arguments());
        }
        if (lookahead.type == TokenType.COLON) {
            advance();
            Token end = expect(TokenType.IDENT);
            return new CellRangeNode(new CellNode(ident.text), new CellNode(end.text));
        }
        if ("TRUE".equalsIgnoreCase(ident.text)) {
            return new LiteralNode(Boolean.TRUE);
        }
        if ("FALSE".equalsIgnoreCase(ident.text)) {
            return new LiteralNode(Boolean.FALSE);
        }
        return new CellNode(ident.text);
    }

    // The opening parenthesis has already been consumed
    private List<FormulaNode> arguments() {
        List<FormulaNode> args = new ArrayList<>();
        if (lookahead.type == TokenType.RPAREN) {
            advance();
            return args;
        }
        args.add(comparison());
        while (lookahead.type == TokenType.COMMA) {
            advance();
            args.add(comparison());
        }
        expect(TokenType.RPAREN);
        return args;
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new FormulaParseException("Formula is nested deeper than " + maxDepth + " levels",
                    lookahead.position);
        }
    }

    private static Double number(Token token) {
        try {
            return Double.valueOf(token.text);
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Malformed number " + token.describe(), token.position);
        }
    }

    private Token advance() {
        Token current = lookahead;
        lookahead = lexer.next();
        return current;
    }

    private Token expect(TokenType type) {
        if (lookahead.type != type) {
            throw unexpected(lookahead);
        }
        return advance();
    }

    private static FormulaParseException unexpected(Token token) {
        return new FormulaParseException("Unexpected " + token.describe(), token.position);
    }

    private static boolean isComparison(TokenType type) {
        switch (type) {
            case EQ:
            case NE:
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
