package org.wff.generator;

import org.wff.formula.Formula;
import org.wff.formula.FormulaNode;

import java.util.ArrayList;
import java.util.List;

/**
 * STRATEGIE ALL'INDIETRO - Dall'obiettivo alle premesse
 *
 * • reverse-Conjunction: (A∧B) ⇐ sotto-obiettivi A, B
 * • reverse-HypotheticalSyllogism: (A→C) ⇐ sotto-obiettivi (A→B), (B→C) con B fresca
 * • reverse-ModusPonens: Q ⇐ premessa (P→Q), sotto-obiettivo P con P fresca
 * • reverse-DisjunctiveSyllogism: Q ⇐ premessa (P∨Q), sotto-obiettivo ¬P con P fresca
 * • reverse-ModusTollens: ¬A ⇐ premessa (A→Q), sotto-obiettivo ¬Q con Q fresca
 */
public final class RuleGenerators {

    public static final GenerationStrategy REVERSE_CONJUNCTION = new GenerationStrategy(
            "reverse-Conjunction",
            FormulaNode::isConjunction,
            (goal, vars) -> new GenerationStep(List.of(),
                    List.of(Formula.of(goal.getLeft()), Formula.of(goal.getRight()))));

    public static final GenerationStrategy REVERSE_HYPOTHETICAL_SYLLOGISM = new GenerationStrategy(
            "reverse-HypotheticalSyllogism",
            FormulaNode::isImplication,
            (goal, vars) -> {
                FormulaNode middle = commitFresh(vars, false);
                if (middle == null) return null;
                return new GenerationStep(List.of(), List.of(
                        Formula.of(FormulaNode.implies(goal.getLeft(), middle)),
                        Formula.of(FormulaNode.implies(middle, goal.getRight()))));
            });

    public static final GenerationStrategy REVERSE_MODUS_PONENS = new GenerationStrategy(
            "reverse-ModusPonens",
            goal -> true,
            (goal, vars) -> {
                FormulaNode antecedent = commitFresh(vars, false);
                if (antecedent == null) return null;
                return new GenerationStep(
                        List.of(Formula.of(FormulaNode.implies(antecedent, goal))),
                        List.of(Formula.of(antecedent)));
            });

    public static final GenerationStrategy REVERSE_DISJUNCTIVE_SYLLOGISM = new GenerationStrategy(
            "reverse-DisjunctiveSyllogism",
            goal -> true,
            (goal, vars) -> {
                FormulaNode negated = commitFresh(vars, true);
                if (negated == null) return null;
                return new GenerationStep(
                        List.of(Formula.of(FormulaNode.or(negated.getChild(), goal))),
                        List.of(Formula.of(negated)));
            });

    public static final GenerationStrategy REVERSE_MODUS_TOLLENS = new GenerationStrategy(
            "reverse-ModusTollens",
            FormulaNode::isNegation,
            (goal, vars) -> {
                FormulaNode negated = commitFresh(vars, true);
                if (negated == null) return null;
                return new GenerationStep(
                        List.of(Formula.of(FormulaNode.implies(goal.getChild(), negated.getChild()))),
                        List.of(Formula.of(negated)));
            });

    public static final List<GenerationStrategy> ALL = List.of(
            REVERSE_CONJUNCTION,
            REVERSE_HYPOTHETICAL_SYLLOGISM,
            REVERSE_MODUS_PONENS,
            REVERSE_DISJUNCTIVE_SYLLOGISM,
            REVERSE_MODUS_TOLLENS);

    private RuleGenerators() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return strategie compatibili con la forma dell'obiettivo
     */
    public static List<GenerationStrategy> applicable(Formula goal) {
        List<GenerationStrategy> result = new ArrayList<>();
        for (GenerationStrategy strategy : ALL) {
            if (strategy.canApply(goal)) result.add(strategy);
        }
        return result;
    }

    /**
     * Estrae una variabile fresca e la impegna con la polarità richiesta.
     *
     * @return letterale impegnato o null se non ci sono variabili fresche
     */
    private static FormulaNode commitFresh(VarLists vars, boolean negated) {
        Formula fresh = vars.drawFreshVariable();
        if (fresh == null) return null;
        Formula literal = negated ? Formula.not(fresh) : fresh;
        return vars.useAtomicAssertion(literal) == null ? null : literal.getNode();
    }
}
