package org.csu.folp.compiler.parser.ast;

/**
 * AST 节点: 项 (Term)，只出现在谓词的参数列表里，以及作为量词的约束变量。
 */
public sealed interface TermNode permits VariableNode, ConstantNode {

    String name();
}
