package org.csu.folp.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 析取 (l | r)
 */
public record DisjunctionNode(FormulaNode left, FormulaNode right) implements BinaryConnectiveNode {

    public DisjunctionNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
