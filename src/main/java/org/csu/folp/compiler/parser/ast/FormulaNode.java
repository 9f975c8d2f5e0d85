package org.csu.folp.compiler.parser.ast;

/**
 * @author hidyouth
 * @description: 所有公式节点的公共接口。
 *
 * 这是一个封闭的类型族，所有可能的节点种类都列在 permits 中，
 * 遍历和打印时按这个列表做穷尽的分派。所有节点都是不可变的 record。
 */
public sealed interface FormulaNode permits VariableFormulaNode, ConstantFormulaNode, PredicateNode,
        NegationNode, BinaryConnectiveNode, QuantifierNode {
}
