package org.wff.generator;

import org.junit.jupiter.api.Test;
import org.wff.formula.Formula;
import org.wff.formula.FormulaReader;
import org.wff.formula.Tiles;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RuleGeneratorsTest {

    private static Formula f(String text) {
        return FormulaReader.readWellFormed(text);
    }

    /** Allocatore con la sola variabile s */
    private static VarLists onlyS() {
        return VarLists.create(List.of(Tiles.variable('s')), new Random(0));
    }

    @Test
    void reverseConjunctionSplitsGoal() {
        GenerationStep step = RuleGenerators.REVERSE_CONJUNCTION.generate(f("p & ~q"), onlyS());

        assertTrue(step.newPremises().isEmpty());
        assertEquals(List.of(f("p"), f("~q")), step.nextGoals());
    }

    @Test
    void reverseModusPonensIntroducesFreshAntecedent() {
        VarLists vars = onlyS();
        GenerationStep step = RuleGenerators.REVERSE_MODUS_PONENS.generate(f("r"), vars);

        assertEquals(List.of(f("s -> r")), step.newPremises());
        assertEquals(List.of(f("s")), step.nextGoals());
        assertEquals(List.of(f("s")), vars.getUsed());
    }

    @Test
    void reverseHypotheticalSyllogismUsesFreshMiddle() {
        GenerationStep step = RuleGenerators.REVERSE_HYPOTHETICAL_SYLLOGISM.generate(f("p -> q"), onlyS());
        assertEquals(List.of(f("p -> s"), f("s -> q")), step.nextGoals());
    }

    @Test
    void reverseDisjunctiveSyllogismAndModusTollens() {
        GenerationStep ds = RuleGenerators.REVERSE_DISJUNCTIVE_SYLLOGISM.generate(f("r"), onlyS());
        assertEquals(List.of(f("s | r")), ds.newPremises());
        assertEquals(List.of(f("~s")), ds.nextGoals());

        GenerationStep mt = RuleGenerators.REVERSE_MODUS_TOLLENS.generate(f("~p"), onlyS());
        assertEquals(List.of(f("p -> s")), mt.newPremises());
        assertEquals(List.of(f("~s")), mt.nextGoals());
    }

    @Test
    void applicabilityDependsOnGoalShape() {
        assertFalse(RuleGenerators.REVERSE_MODUS_TOLLENS.canApply(f("p")));
        assertFalse(RuleGenerators.REVERSE_HYPOTHETICAL_SYLLOGISM.canApply(f("p & q")));
        assertNull(RuleGenerators.REVERSE_CONJUNCTION.generate(f("p | q"), onlyS()));

        List<GenerationStrategy> forConjunction = RuleGenerators.applicable(f("p & q"));
        assertTrue(forConjunction.contains(RuleGenerators.REVERSE_CONJUNCTION));
        assertFalse(forConjunction.contains(RuleGenerators.REVERSE_MODUS_TOLLENS));
    }

    @Test
    void strategiesNeedingFreshVariablesFailWhenExhausted() {
        VarLists vars = onlyS();
        vars.drawFreshVariable();
        assertNull(RuleGenerators.REVERSE_MODUS_PONENS.generate(f("r"), vars));
        assertNull(RuleGenerators.REVERSE_HYPOTHETICAL_SYLLOGISM.generate(f("p -> q"), vars));
    }
}
