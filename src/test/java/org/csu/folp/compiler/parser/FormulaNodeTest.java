package org.csu.folp.compiler.parser;

import org.csu.folp.compiler.parser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AST 节点在构造时的校验。
 */
public class FormulaNodeTest {

    @Test
    void testIdentifierShapesAreEnforced() {
        assertEquals("x1", new VariableNode("x1").name());
        assertEquals("C12", new ConstantNode("C12").name());

        assertThrows(IllegalArgumentException.class, () -> new VariableNode("X"));
        assertThrows(IllegalArgumentException.class, () -> new VariableNode(""));
        assertThrows(IllegalArgumentException.class, () -> new VariableNode("1x"));
        assertThrows(IllegalArgumentException.class, () -> new VariableNode("x_y"));
        assertThrows(IllegalArgumentException.class, () -> new VariableNode(null));
        assertThrows(IllegalArgumentException.class, () -> new ConstantNode("a"));
        assertThrows(IllegalArgumentException.class, () -> new ConstantNode("Ab"));
        assertThrows(IllegalArgumentException.class, () -> new VariableFormulaNode("A"));
        assertThrows(IllegalArgumentException.class, () -> new ConstantFormulaNode("a"));
        assertThrows(IllegalArgumentException.class, () -> new PredicateNode("p", List.of()));
    }

    @Test
    void testTermFamiliesAreNominallyDistinct() {
        assertNotEquals(new VariableNode("x"), new VariableFormulaNode("x"));
        assertNotEquals(new ConstantNode("A"), new ConstantFormulaNode("A"));
    }

    @Test
    void testPredicateTermsAreCopiedAndUnmodifiable() {
        List<TermNode> terms = new ArrayList<>(List.of(new VariableNode("x")));
        PredicateNode predicate = new PredicateNode("P", terms);
        terms.add(new ConstantNode("A"));

        assertEquals(1, predicate.arity());
        assertThrows(UnsupportedOperationException.class, () -> predicate.terms().add(new VariableNode("y")));
    }

    @Test
    void testChildrenMustBePresent() {
        PredicateNode p = new PredicateNode("P", List.of());
        assertThrows(NullPointerException.class, () -> new NegationNode(null));
        assertThrows(NullPointerException.class, () -> new ConjunctionNode(p, null));
        assertThrows(NullPointerException.class, () -> new DisjunctionNode(null, p));
        assertThrows(NullPointerException.class, () -> new ImplicationNode(null, null));
        assertThrows(NullPointerException.class, () -> new ForallNode(null, p));
        assertThrows(NullPointerException.class, () -> new ExistsNode(new VariableNode("x"), null));
    }
}
