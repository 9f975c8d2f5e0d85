package org.csu.folp.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 存在量词 exists x. f
 */
public record ExistsNode(VariableNode variable, FormulaNode body) implements QuantifierNode {

    public ExistsNode {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(body, "body");
    }
}
