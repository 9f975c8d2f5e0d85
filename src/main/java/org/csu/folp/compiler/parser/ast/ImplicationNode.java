package org.csu.folp.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 蕴含 (l -&gt; r)
 */
public record ImplicationNode(FormulaNode left, FormulaNode right) implements BinaryConnectiveNode {

    public ImplicationNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
