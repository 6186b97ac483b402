package org.wff.rules;

import org.junit.jupiter.api.Test;
import org.wff.formula.Formula;
import org.wff.formula.FormulaReader;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DerivationSearchTest {

    private static List<Formula> fs(String... texts) {
        List<Formula> formulas = new ArrayList<>();
        for (String text : texts) formulas.add(FormulaReader.readWellFormed(text));
        return formulas;
    }

    private static Formula f(String text) {
        return FormulaReader.readWellFormed(text);
    }

    @Test
    void reachesGoalThroughChainOfRules() {
        assertTrue(DerivationSearch.canDerive(fs("p -> q", "q -> r", "p"), f("r")));
        assertTrue(DerivationSearch.canDerive(fs("p | q", "~p", "q -> s"), f("s")));
        assertTrue(DerivationSearch.canDerive(fs("p -> r", "q -> s", "p | q"), f("r | s")));
    }

    @Test
    void buildsIntroducedFormulasThatAppearInGoal() {
        assertTrue(DerivationSearch.canDerive(fs("p & q", "q -> r"), f("r & p")));
        assertTrue(DerivationSearch.canDerive(fs("p", "q -> r"), f("p | (q -> r)")));
        assertFalse(DerivationSearch.canDerive(fs("p"), f("p | (q -> r)")));
    }

    @Test
    void premiseItselfIsDerivable() {
        assertTrue(DerivationSearch.canDerive(fs("p", "q"), f("q")));
    }

    @Test
    void invalidArgumentsAreNotDerivable() {
        assertFalse(DerivationSearch.canDerive(fs("p -> q", "q"), f("p")));
        assertFalse(DerivationSearch.canDerive(fs("p | q"), f("p")));
    }
}
