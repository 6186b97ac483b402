package org.wff.generator;

import org.wff.formula.Formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Passo all'indietro: premesse da aggiungere al problema e sotto-obiettivi che restano
 * da giustificare.
 *
 * @param newPremises formule date come premesse
 * @param nextGoals formule che devono ancora essere ottenute
 */
public record GenerationStep(List<Formula> newPremises, List<Formula> nextGoals) {

    public GenerationStep {
        newPremises = List.copyOf(newPremises);
        nextGoals = List.copyOf(nextGoals);
    }

    /**
     * @return premesse e sotto-obiettivi insieme
     */
    public List<Formula> allFormulas() {
        List<Formula> all = new ArrayList<>(newPremises);
        all.addAll(nextGoals);
        return all;
    }
}
