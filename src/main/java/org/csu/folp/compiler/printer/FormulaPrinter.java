package org.csu.folp.compiler.printer;

import org.csu.folp.compiler.parser.ast.*;

import java.util.stream.Collectors;

/**
 * 将AST渲染成规范文本形式。
 *
 * 量词和否定的作用对象总是再包一层括号，二元联结词总是带括号，
 * 因此渲染结果可以被 {@link org.csu.folp.compiler.parser.Parser} 重新解析成相同的AST。
 */
public final class FormulaPrinter {

    private FormulaPrinter() {
    }

    /**
     * @param formula 任意公式节点
     * @return 规范文本，e.g., forall x. ((P(x) -&gt; Q(x, A)))
     */
    public static String render(FormulaNode formula) {
        if (formula instanceof VariableFormulaNode variable) {
            return variable.name();
        }
        if (formula instanceof ConstantFormulaNode constant) {
            return constant.name();
        }
        if (formula instanceof PredicateNode predicate) {
            return predicate.name() + "(" + predicate.terms().stream()
                    .map(TermNode::name)
                    .collect(Collectors.joining(", ")) + ")";
        }
        if (formula instanceof NegationNode negation) {
            return "~(" + render(negation.operand()) + ")";
        }
        if (formula instanceof BinaryConnectiveNode binary) {
            return "(" + render(binary.left()) + " " + symbolOf(binary) + " " + render(binary.right()) + ")";
        }
        if (formula instanceof QuantifierNode quantifier) {
            return keywordOf(quantifier) + " " + quantifier.variable().name() + ". (" + render(quantifier.body()) + ")";
        }
        throw new IllegalArgumentException("Unknown formula node: " + formula);
    }

    public static String symbolOf(BinaryConnectiveNode binary) {
        if (binary instanceof ConjunctionNode) {
            return "&";
        }
        if (binary instanceof DisjunctionNode) {
            return "|";
        }
        return "->";
    }

    public static String keywordOf(QuantifierNode quantifier) {
        return quantifier instanceof ForallNode ? "forall" : "exists";
    }

    /**
     * 节点种类的简短名字，用于命令行输出，e.g., Forall, Predicate
     */
    public static String kindOf(FormulaNode formula) {
        if (formula instanceof VariableFormulaNode) {
            return "Variable";
        }
        if (formula instanceof ConstantFormulaNode) {
            return "Constant";
        }
        if (formula instanceof PredicateNode) {
            return "Predicate";
        }
        if (formula instanceof NegationNode) {
            return "Negation";
        }
        if (formula instanceof ConjunctionNode) {
            return "Conjunction";
        }
        if (formula instanceof DisjunctionNode) {
            return "Disjunction";
        }
        if (formula instanceof ImplicationNode) {
            return "Implication";
        }
        if (formula instanceof ForallNode) {
            return "Forall";
        }
        if (formula instanceof ExistsNode) {
            return "Exists";
        }
        throw new IllegalArgumentException("Unknown formula node: " + formula);
    }
}
