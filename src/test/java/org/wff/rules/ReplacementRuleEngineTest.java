package org.wff.rules;

import org.junit.jupiter.api.Test;
import org.wff.formula.Formula;
import org.wff.formula.FormulaReader;

import static org.junit.jupiter.api.Assertions.*;

class ReplacementRuleEngineTest {

    private static Formula f(String text) {
        Formula formula = FormulaReader.readWellFormed(text);
        assertNotNull(formula, text);
        return formula;
    }

    private static boolean valid(ReplacementRule rule, String source, String result) {
        return ReplacementRuleEngine.isValidReplacement(rule, f(source), f(result));
    }

    @Test
    void deMorganBothDirections() {
        assertTrue(valid(ReplacementRule.DE_MORGAN, "~(p & q)", "~p | ~q"));
        assertTrue(valid(ReplacementRule.DE_MORGAN, "~p & ~q", "~(p | q)"));
        assertFalse(valid(ReplacementRule.DE_MORGAN, "~(p & q)", "~p & ~q"));
    }

    @Test
    void replacementAppliesInsideSubformula() {
        assertTrue(valid(ReplacementRule.DE_MORGAN, "r -> ~(p & q)", "r -> (~p | ~q)"));
        assertTrue(valid(ReplacementRule.COMMUTATION, "s & (p | q)", "s & (q | p)"));
    }

    @Test
    void onlyOneSubstitutionPerStep() {
        assertFalse(valid(ReplacementRule.COMMUTATION, "(p | q) & (r | s)", "(q | p) & (s | r)"));
        assertTrue(valid(ReplacementRule.COMMUTATION, "(p | q) & (r | s)", "(q | p) & (r | s)"));
    }

    @Test
    void doubleNegationAndTautology() {
        assertTrue(valid(ReplacementRule.DOUBLE_NEGATION, "p -> q", "p -> ~~q"));
        assertTrue(valid(ReplacementRule.DOUBLE_NEGATION, "~~p", "p"));
        assertTrue(valid(ReplacementRule.TAUTOLOGY, "p | p", "p"));
        assertTrue(valid(ReplacementRule.TAUTOLOGY, "q", "q & q"));
    }

    @Test
    void conditionalEquivalences() {
        assertTrue(valid(ReplacementRule.TRANSPOSITION, "p -> q", "~q -> ~p"));
        assertTrue(valid(ReplacementRule.TRANSPOSITION, "~q -> ~p", "p -> q"));
        assertTrue(valid(ReplacementRule.MATERIAL_IMPLICATION, "p -> q", "~p | q"));
        assertTrue(valid(ReplacementRule.MATERIAL_IMPLICATION, "~p | q", "p -> q"));
        assertTrue(valid(ReplacementRule.EXPORTATION, "(p & q) -> r", "p -> (q -> r)"));
        assertTrue(valid(ReplacementRule.EXPORTATION, "p -> (q -> r)", "(p & q) -> r"));
    }

    @Test
    void materialEquivalenceBothForms() {
        assertTrue(valid(ReplacementRule.MATERIAL_EQUIVALENCE, "p <-> q", "(p -> q) & (q -> p)"));
        assertTrue(valid(ReplacementRule.MATERIAL_EQUIVALENCE, "p <-> q", "(p & q) | (~p & ~q)"));
        assertTrue(valid(ReplacementRule.MATERIAL_EQUIVALENCE, "(p -> q) & (q -> p)", "p <-> q"));
    }

    @Test
    void associationAndDistribution() {
        assertTrue(valid(ReplacementRule.ASSOCIATION, "p & (q & r)", "(p & q) & r"));
        assertTrue(valid(ReplacementRule.ASSOCIATION, "(p | q) | r", "p | (q | r)"));
        assertTrue(valid(ReplacementRule.DISTRIBUTION, "p & (q | r)", "(p & q) | (p & r)"));
        assertTrue(valid(ReplacementRule.DISTRIBUTION, "(p | q) & (p | r)", "p | (q & r)"));
        assertFalse(valid(ReplacementRule.DISTRIBUTION, "p & (q | r)", "(p | q) & (p | r)"));
    }

    @Test
    void wrongRuleIsRejected() {
        assertFalse(valid(ReplacementRule.COMMUTATION, "p -> q", "q -> p"));
        assertFalse(valid(ReplacementRule.MATERIAL_IMPLICATION, "p -> q", "p | ~q"));
    }
}
