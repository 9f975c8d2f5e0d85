package org.csu.folp.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 全称量词 forall x. f
 */
public record ForallNode(VariableNode variable, FormulaNode body) implements QuantifierNode {

    public ForallNode {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(body, "body");
    }
}
