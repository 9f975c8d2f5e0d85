package org.csu.folp.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 合取 (l &amp; r)
 */
public record ConjunctionNode(FormulaNode left, FormulaNode right) implements BinaryConnectiveNode {

    public ConjunctionNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
