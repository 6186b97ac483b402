package org.wff.rules;

import org.junit.jupiter.api.Test;
import org.wff.formula.Formula;
import org.wff.formula.FormulaReader;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InferenceRuleEngineTest {

    private static Formula f(String text) {
        Formula formula = FormulaReader.readWellFormed(text);
        assertNotNull(formula, text);
        return formula;
    }

    private static List<Formula> fs(String... texts) {
        List<Formula> formulas = new ArrayList<>();
        for (String text : texts) formulas.add(f(text));
        return formulas;
    }

    @Test
    void modusPonensYieldsConsequent() {
        List<Formula> conclusions = InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.MODUS_PONENS, fs("p -> q", "p"));
        assertEquals(List.of(f("q")), conclusions);
    }

    @Test
    void modusTollensYieldsNegatedAntecedent() {
        List<Formula> conclusions = InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.MODUS_TOLLENS, fs("p -> q", "~q"));
        assertEquals(List.of(f("~p")), conclusions);
    }

    @Test
    void hypotheticalSyllogismRequiresExactMiddleTerm() {
        assertEquals(List.of(f("p -> r")), InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.HYPOTHETICAL_SYLLOGISM, fs("p -> q", "q -> r")));
        assertTrue(InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.HYPOTHETICAL_SYLLOGISM, fs("p -> q", "~q -> r")).isEmpty());
        assertTrue(InferenceRuleEngine.getPossibleApplications(
                InferenceRule.HYPOTHETICAL_SYLLOGISM, fs("p -> q", "r -> s")).isEmpty());
    }

    @Test
    void disjunctiveSyllogismWorksOnEitherDisjunct() {
        assertEquals(List.of(f("q")), InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.DISJUNCTIVE_SYLLOGISM, fs("p | q", "~p")));
        assertEquals(List.of(f("p")), InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.DISJUNCTIVE_SYLLOGISM, fs("p | q", "~q")));
    }

    @Test
    void disjunctiveSyllogismNeedsNegatedDisjunct() {
        assertTrue(InferenceRuleEngine.getPossibleApplications(
                InferenceRule.DISJUNCTIVE_SYLLOGISM, fs("p | q", "p")).isEmpty());
    }

    @Test
    void conjunctionProducesBothOrders() {
        List<Formula> conclusions = InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.CONJUNCTION, fs("p", "q"));
        assertEquals(2, conclusions.size());
        assertTrue(conclusions.containsAll(fs("p & q", "q & p")));
    }

    @Test
    void simplificationAndAbsorption() {
        assertEquals(fs("p", "q"), InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.SIMPLIFICATION, fs("p & q")));
        assertEquals(List.of(f("p -> (p & q)")), InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.ABSORPTION, fs("p -> q")));
    }

    @Test
    void additionUsesOtherKnownFormulaAsContext() {
        List<Application> applications = InferenceRuleEngine.getPossibleApplications(
                InferenceRule.ADDITION, fs("p", "q"));
        List<Formula> conclusions = applications.stream().map(Application::conclusion).toList();

        assertEquals(2, conclusions.size());
        assertTrue(conclusions.containsAll(fs("p | q", "q | p")));
        Application first = applications.get(0);
        assertEquals(1, first.premises().size());
        assertEquals(1, first.context().size());
    }

    @Test
    void constructiveDilemmaFromConjunctionOrSeparateImplications() {
        assertEquals(List.of(f("q | s")), InferenceRuleEngine.getPossibleConclusions(
                InferenceRule.CONSTRUCTIVE_DILEMMA, fs("(p -> q) & (r -> s)", "p | r")));

        List<Application> synthesized = InferenceRuleEngine.getPossibleApplications(
                InferenceRule.CONSTRUCTIVE_DILEMMA, fs("p -> q", "r -> s", "p | r"));
        assertEquals(1, synthesized.size());
        assertEquals(f("q | s"), synthesized.get(0).conclusion());
        assertEquals(3, synthesized.get(0).premises().size());
    }

    @Test
    void applicationsAreDeduplicatedByConclusion() {
        List<Application> applications = InferenceRuleEngine.getPossibleApplications(
                InferenceRule.MODUS_PONENS, fs("p -> q", "p", "r -> q", "r"));
        assertEquals(1, applications.size());
        assertEquals(f("q"), applications.get(0).conclusion());
    }

    @Test
    void validInferenceRespectsCitationOrder() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_PONENS, fs("p -> q", "p"), f("q")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.MODUS_PONENS, fs("p", "p -> q"), f("q")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.CONJUNCTION, fs("p", "q"), f("q & p")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.CONJUNCTION, fs("q", "p"), f("q & p")));
    }

    @Test
    void validAdditionTakesDisjunctFromConclusion() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.ADDITION, fs("p"), f("p | (r & s)")));
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.ADDITION, fs("p"), f("~t | p")));
        assertFalse(InferenceRuleEngine.isValidInference(InferenceRule.ADDITION, fs("p"), f("q | r")));
    }

    @Test
    void normalizedEqualityAcceptsEquivalentSpelling() {
        assertTrue(InferenceRuleEngine.isValidInference(InferenceRule.DISJUNCTIVE_SYLLOGISM,
                fs("(p & q) | r", "~r"), f("(p & q)")));
    }
}
