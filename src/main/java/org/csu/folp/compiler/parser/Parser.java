package org.csu.folp.compiler.parser;

import org.csu.folp.common.exception.ParseException;
import org.csu.folp.compiler.lexer.Lexer;
import org.csu.folp.compiler.lexer.Token;
import org.csu.folp.compiler.lexer.TokenType;
import org.csu.folp.compiler.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为公式的抽象语法树(AST)。
 *
 * 文法中所有二元联结词都必须加括号，因此不需要优先级处理，也不需要回溯：
 * 游标只会向前移动，遇到第一个错误立即抛出 {@link ParseException}。
 */
public class Parser {

    private static final String FORALL = "forall";
    private static final String EXISTS = "exists";

    // 公式的最大嵌套层数，超过后报错而不是耗尽调用栈
    public static final int MAX_DEPTH = 1000;

    private final List<Token> tokens;
    private int position = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * 词法+语法分析的便捷入口，不会抛出异常。
     */
    public static ParseResult parse(String text) {
        try {
            return ParseResult.success(new Parser(new Lexer(text).tokenize()).parse());
        } catch (ParseException e) {
            return ParseResult.failure(ParseError.from(e));
        }
    }

    /**
     * 解析整个Token流，要求恰好构成一个公式。
     */
    public FormulaNode parse() {
        FormulaNode formula = parseFormula();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected token '" + peek().lexeme() + "' at end of expression", peek());
        }
        return formula;
    }

    private FormulaNode parseFormula() {
        if (isAtEnd()) {
            throw endOfInput("a formula");
        }
        if (depth >= MAX_DEPTH) {
            throw new ParseException("Formula nested too deeply (more than " + MAX_DEPTH + " levels) at token " + peek().index(), peek());
        }
        depth++;
        try {
            return parseFormulaBody();
        } finally {
            depth--;
        }
    }

    private FormulaNode parseFormulaBody() {
        Token token = peek();
        if (match(TokenType.LPAREN)) {
            return parseParenthesized();
        }
        if (match(TokenType.NEG)) {
            return new NegationNode(parseFormula());
        }
        if (isQuantifierKeyword(token)) {
            return parseQuantifier();
        }
        if (check(TokenType.IDENT_UPPER)) {
            return parsePredicate();
        }
        throw new ParseException("Unexpected token for a formula: '" + token.lexeme() + "' at token " + token.index(), token);
    }

    /**
     * '(' 已被消耗。(l op r) 构造二元节点，(f) 只是多余的一层括号。
     */
    private FormulaNode parseParenthesized() {
        FormulaNode left = parseFormula();
        if (match(TokenType.RPAREN)) {
            return left;
        }
        if (isAtEnd()) {
            throw endOfInput("a binary operator or ')'");
        }
        Token operator = advance();
        if (!operator.isBinaryOperator()) {
            throw new ParseException("Unknown binary operator: '" + operator.lexeme() + "' at token " + operator.index(), operator);
        }
        FormulaNode right = parseFormula();
        consume(TokenType.RPAREN, "')'");
        switch (operator.type()) {
            case AND:
                return new ConjunctionNode(left, right);
            case OR:
                return new DisjunctionNode(left, right);
            default:
                return new ImplicationNode(left, right);
        }
    }

    private QuantifierNode parseQuantifier() {
        Token keyword = advance();
        if (isAtEnd()) {
            throw endOfInput("a variable after '" + keyword.lexeme() + "'");
        }
        Token varToken = advance();
        if (!varToken.is(TokenType.IDENT_LOWER)) {
            throw new ParseException("Expected a lowercase variable after quantifier, but got '" + varToken.lexeme() + "'", varToken);
        }
        VariableNode variable = new VariableNode(varToken.lexeme());
        consume(TokenType.DOT, "'.'");
        FormulaNode body = parseFormula();
        if (FORALL.equals(keyword.lexeme())) {
            return new ForallNode(variable, body);
        }
        return new ExistsNode(variable, body);
    }

    private PredicateNode parsePredicate() {
        Token name = advance();
        consume(TokenType.LPAREN, "'(' after predicate name");
        List<TermNode> terms = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                terms.add(parseTerm());
                if (check(TokenType.RPAREN)) {
                    break;
                }
                consume(TokenType.COMMA, "',' or ')'");
            } while (true);
        }
        consume(TokenType.RPAREN, "')' after predicate arguments");
        return new PredicateNode(name.lexeme(), terms);
    }

    private TermNode parseTerm() {
        if (isAtEnd()) {
            throw endOfInput("a term");
        }
        Token token = peek();
        if (match(TokenType.IDENT_LOWER)) {
            return new VariableNode(token.lexeme());
        }
        if (match(TokenType.IDENT_UPPER)) {
            return new ConstantNode(token.lexeme());
        }
        throw new ParseException("Invalid term: '" + token.lexeme() + "' at token " + token.index(), token);
    }

    // --- 辅助方法 ---

    private static boolean isQuantifierKeyword(Token token) {
        return token.is(TokenType.IDENT_LOWER)
                && (FORALL.equals(token.lexeme()) || EXISTS.equals(token.lexeme()));
    }

    private ParseException endOfInput(String expected) {
        return new ParseException("Unexpected end of input, expected " + expected, tokens.size());
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        if (isAtEnd()) throw endOfInput(expected);
        throw new ParseException(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        return tokens.get(position++);
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }

    private Token peek() {
        return tokens.get(position);
    }
}
