package org.wff.generator;

import org.wff.formula.Formula;
import org.wff.formula.FormulaNode;

import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Strategia all'indietro: dato un obiettivo, propone le premesse e i sotto-obiettivi
 * da cui l'obiettivo segue con una regola di inferenza.
 */
public final class GenerationStrategy {

    private final String name;
    private final Predicate<FormulaNode> applicability;
    private final BiFunction<FormulaNode, VarLists, GenerationStep> generator;

    GenerationStrategy(String name, Predicate<FormulaNode> applicability,
                       BiFunction<FormulaNode, VarLists, GenerationStep> generator) {
        this.name = name;
        this.applicability = applicability;
        this.generator = generator;
    }

    public String getName() {
        return name;
    }

    /**
     * @return true se la forma dell'obiettivo è compatibile con la strategia
     */
    public boolean canApply(Formula goal) {
        return goal != null && goal.isWellFormed() && applicability.test(goal.getNode());
    }

    /**
     * Applica la strategia. Le variabili fresche sono estratte e impegnate in {@code vars}.
     *
     * @return passo generato o null se la strategia non si applica o mancano variabili fresche
     */
    public GenerationStep generate(Formula goal, VarLists vars) {
        if (vars == null) {
            throw new IllegalArgumentException("Allocatore di variabili non può essere null");
        }
        if (!canApply(goal)) return null;
        return generator.apply(goal.getNode(), vars);
    }

    @Override
    public String toString() {
        return name;
    }
}
