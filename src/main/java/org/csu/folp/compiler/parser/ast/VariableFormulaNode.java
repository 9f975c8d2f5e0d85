package org.csu.folp.compiler.parser.ast;

/**
 * AST 节点: 单独作为公式出现的变量。
 * 与 {@link VariableNode} 结构相同但名义上不同，语法分析器不会生成它。
 */
public record VariableFormulaNode(String name) implements FormulaNode {

    public VariableFormulaNode {
        Identifiers.requireLower(name, "Variable");
    }
}
