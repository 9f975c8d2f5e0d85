package org.csu.folp.compiler.parser.ast;

/**
 * AST 节点: 变量项，e.g., x, y1
 */
public record VariableNode(String name) implements TermNode {

    public VariableNode {
        Identifiers.requireLower(name, "Variable");
    }
}
