package org.csu.folp.compiler.parser.ast;

/**
 * 量词节点。约束变量永远是 {@link VariableNode}，不可能是常量。
 */
public sealed interface QuantifierNode extends FormulaNode permits ForallNode, ExistsNode {

    VariableNode variable();

    FormulaNode body();
}
