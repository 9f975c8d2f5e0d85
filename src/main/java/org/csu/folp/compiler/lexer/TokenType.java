package org.csu.folp.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 量词关键字 forall / exists 不单独成类，它们在词法阶段就是普通的小写标识符，
 * 由语法分析器按字面文本识别。
 */
public enum TokenType {
    // ---- 标识符 (Identifier) ----
    IDENT_LOWER,    // 变量，e.g., x, y1, forall
    IDENT_UPPER,    // 常量或谓词名，e.g., A, P, C1

    // ---- 逻辑联结词 (Connectives) ----
    NEG,        // ~
    AND,        // &
    OR,         // |
    IMPLIES,    // ->

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )
    DOT,        // .
    COMMA       // ,
}
