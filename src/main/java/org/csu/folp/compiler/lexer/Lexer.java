package org.csu.folp.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的一阶逻辑公式分解为一系列的Token。
 * 该词法分析器是"宽容"的：任何无法识别的字符（数字开头的单词、下划线、单独的 '-' 等）
 * 都会被当作分隔符直接丢弃，所有的合法性检查都留给语法分析器。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置

    public Lexer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，空输入返回空列表（不追加EOF）
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (position < input.length()) {
            Token token = nextToken(tokens.size());
            if (token != null) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * 读取下一个Token；当前字符不能开始任何Token时跳过它并返回null
     */
    private Token nextToken(int index) {
        char currentChar = peek();

        if (isLower(currentChar)) {
            return readIdentifier(index, TokenType.IDENT_LOWER, true);
        }
        if (isUpper(currentChar)) {
            return readIdentifier(index, TokenType.IDENT_UPPER, false);
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(", index);
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")", index);
            case '.':
                return consumeAndReturn(TokenType.DOT, ".", index);
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",", index);
            case '~':
                return consumeAndReturn(TokenType.NEG, "~", index);
            case '&':
                return consumeAndReturn(TokenType.AND, "&", index);
            case '|':
                return consumeAndReturn(TokenType.OR, "|", index);
            case '-':
                if (peekNext() == '>') {
                    int start = position;
                    position += 2;
                    return new Token(TokenType.IMPLIES, "->", index, start);
                }
                // 单独的 '-' 不属于文法
                position++;
                return null;
            default:
                // 空白或非法字符，静默丢弃
                position++;
                return null;
        }
    }

    /**
     * 读取最长的 [a-z][a-z0-9]* 或 [A-Z][A-Z0-9]* 串。
     * 大小写混写会被切成多个Token，例如 "Pa" -> "P", "a"。
     */
    private Token readIdentifier(int index, TokenType type, boolean lower) {
        int startPos = position;
        position++;
        while (position < input.length()) {
            char ch = peek();
            boolean sameCase = lower ? isLower(ch) : isUpper(ch);
            if (!sameCase && !isDigit(ch)) {
                break;
            }
            position++;
        }
        return new Token(type, input.substring(startPos, position), index, startPos);
    }

    // --- 辅助方法 ---

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private Token consumeAndReturn(TokenType type, String lexeme, int index) {
        Token token = new Token(type, lexeme, index, position);
        position++;
        return token;
    }

    private static boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
