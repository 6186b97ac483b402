package org.wff.generator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.wff.formula.Formula;
import org.wff.formula.FormulaReader;
import org.wff.rules.Application;
import org.wff.rules.InferenceRule;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DerivationGraphTest {

    private DerivationGraph graph;
    private int conclusionId;

    private static Formula f(String text) {
        return FormulaReader.readWellFormed(text);
    }

    /** p→q, q→r, p ⊢ q ⊢ r */
    @BeforeEach
    void buildChain() {
        graph = new DerivationGraph();
        graph.addLeaf(f("p -> q"));
        graph.addLeaf(f("q -> r"));
        graph.addLeaf(f("p"));
        graph.addDerived(new Application(f("q"), InferenceRule.MODUS_PONENS, List.of(f("p -> q"), f("p"))));
        conclusionId = graph.addDerived(new Application(f("r"), InferenceRule.MODUS_PONENS, List.of(f("q -> r"), f("q"))));
    }

    @Test
    void nodesAreIndexedByFormula() {
        assertEquals(5, graph.size());
        assertEquals(2, graph.addLeaf(f("p")));
        assertEquals(5, graph.size());
        assertEquals(-1, graph.idOf(f("s")));
        assertTrue(graph.getNode(graph.idOf(f("p"))).isLeaf());
        assertEquals(InferenceRule.MODUS_PONENS, graph.getNode(conclusionId).rule());
    }

    @Test
    void depthCountsLongestChain() {
        assertEquals(0, graph.depth(graph.idOf(f("p"))));
        assertEquals(1, graph.depth(graph.idOf(f("q"))));
        assertEquals(2, graph.depth(conclusionId));
    }

    @Test
    void antecedentsAndAncestorsFollowEdges() {
        int implication = graph.idOf(f("p -> q"));
        int antecedent = graph.idOf(f("p"));
        int middle = graph.idOf(f("q"));

        assertEquals(List.of(implication, antecedent), graph.getNode(middle).antecedents());
        assertEquals(Set.of(implication, antecedent, middle, graph.idOf(f("q -> r"))), graph.getAncestors(conclusionId));
        assertTrue(graph.getAncestors(antecedent).isEmpty());
        assertEquals(5, graph.getNodes().size());
    }

    @Test
    void depthIgnoresUnrelatedBranches() {
        graph.addLeaf(f("s"));
        graph.addLeaf(f("t"));
        int unrelated = graph.addDerived(new Application(f("s & t"), InferenceRule.CONJUNCTION, List.of(f("s"), f("t"))));

        assertEquals(1, graph.depth(unrelated));
        assertEquals(2, graph.depth(conclusionId));
    }

    @Test
    void derivedFormulaMustBeNewAndGrounded() {
        assertThrows(IllegalArgumentException.class, () -> graph.addDerived(
                new Application(f("q"), InferenceRule.MODUS_PONENS, List.of(f("p -> q"), f("p")))));
        assertThrows(IllegalArgumentException.class, () -> graph.addDerived(
                new Application(f("t"), InferenceRule.MODUS_PONENS, List.of(f("s -> t"), f("s")))));
        assertThrows(IllegalArgumentException.class, () -> graph.getNode(42));
    }

    @Test
    void cutHidesOneStepPerUnitOfBudget() {
        PlannedProblemGenerator.Cut shallow = PlannedProblemGenerator.cut(graph, conclusionId, 1);
        assertEquals(1, shallow.hiddenCount());
        assertEquals(Set.of(f("q -> r"), f("q")), formulas(shallow));

        PlannedProblemGenerator.Cut deep = PlannedProblemGenerator.cut(graph, conclusionId, 5);
        assertEquals(2, deep.hiddenCount());
        assertEquals(Set.of(f("q -> r"), f("p -> q"), f("p")), formulas(deep));
    }

    private Set<Formula> formulas(PlannedProblemGenerator.Cut cut) {
        Set<Formula> result = new HashSet<>();
        for (int id : cut.premiseIds()) result.add(graph.getNode(id).formula());
        return result;
    }
}
