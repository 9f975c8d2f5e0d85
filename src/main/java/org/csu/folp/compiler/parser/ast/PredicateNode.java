package org.csu.folp.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 谓词应用，e.g., Q(x, A)。参数顺序有意义，参数列表可以为空。
 */
public record PredicateNode(String name, List<TermNode> terms) implements FormulaNode {

    public PredicateNode {
        Identifiers.requireUpper(name, "Predicate");
        terms = List.copyOf(terms);
    }

    public int arity() {
        return terms.size();
    }
}
