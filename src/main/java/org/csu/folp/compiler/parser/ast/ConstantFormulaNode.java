package org.csu.folp.compiler.parser.ast;

/**
 * AST 节点: 单独作为公式出现的常量，参见 {@link VariableFormulaNode}。
 */
public record ConstantFormulaNode(String name) implements FormulaNode {

    public ConstantFormulaNode {
        Identifiers.requireUpper(name, "Constant");
    }
}
