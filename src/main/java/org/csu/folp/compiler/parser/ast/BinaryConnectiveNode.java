package org.csu.folp.compiler.parser.ast;

/**
 * 二元联结词。在文法里它们总是写在一对显式的括号中。
 */
public sealed interface BinaryConnectiveNode extends FormulaNode
        permits ConjunctionNode, DisjunctionNode, ImplicationNode {

    FormulaNode left();

    FormulaNode right();
}
