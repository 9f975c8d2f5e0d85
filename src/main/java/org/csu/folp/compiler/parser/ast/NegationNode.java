package org.csu.folp.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 否定 ~f
 */
public record NegationNode(FormulaNode operand) implements FormulaNode {

    public NegationNode {
        Objects.requireNonNull(operand, "operand");
    }
}
