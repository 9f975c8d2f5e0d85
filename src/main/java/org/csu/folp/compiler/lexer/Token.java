package org.csu.folp.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param index 在Token流中的下标，错误信息中的位置以它为准
 * @param offset 在源文本中的字符偏移，仅用于提示
 */
public record Token(TokenType type, String lexeme, int index, int offset) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isBinaryOperator() {
        return type == TokenType.AND || type == TokenType.OR || type == TokenType.IMPLIES;
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-11s, Lexeme='%s', Index=%d]", type, lexeme, index);
    }
}
