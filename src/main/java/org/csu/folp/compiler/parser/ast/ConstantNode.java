package org.csu.folp.compiler.parser.ast;

/**
 * AST 节点: 常量项，e.g., A, C1
 */
public record ConstantNode(String name) implements TermNode {

    public ConstantNode {
        Identifiers.requireUpper(name, "Constant");
    }
}
