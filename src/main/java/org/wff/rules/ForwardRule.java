package org.wff.rules;

import org.wff.formula.Formula;

import java.util.List;

/**
 * Regola in avanti con il suo peso di selezione.
 *
 * Il peso è usato dal generatore di problemi per la scelta casuale pesata: regole con
 * peso maggiore vengono proposte più spesso.
 */
public final class ForwardRule {

    private final InferenceRule rule;
    private final double weight;

    /**
     * @param rule regola del catalogo
     * @param weight peso di selezione (maggiore di zero)
     * @throws IllegalArgumentException se il peso non è positivo
     */
    public ForwardRule(InferenceRule rule, double weight) {
        if (rule == null) {
            throw new IllegalArgumentException("Regola non può essere null");
        }
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Peso della regola deve essere > 0, ricevuto: " + weight);
        }
        this.rule = rule;
        this.weight = weight;
    }

    public InferenceRule getRule() {
        return rule;
    }

    public String getName() {
        return rule.getRuleName();
    }

    public double getWeight() {
        return weight;
    }

    /**
     * @return true se la regola produce almeno un'applicazione sulle formule note
     */
    public boolean canApply(List<Formula> known) {
        if (known.size() < minimumKnown()) return false;
        return !generate(known).isEmpty();
    }

    /**
     * @return applicazioni con conclusioni distinte sulle formule note
     */
    public List<Application> generate(List<Formula> known) {
        return InferenceRuleEngine.getPossibleApplications(rule, known);
    }

    /**
     * Numero minimo di formule note perché la regola possa applicarsi.
     * L'Addizione cita una sola riga ma richiede una seconda formula da aggiungere.
     */
    private int minimumKnown() {
        return rule == InferenceRule.ADDITION ? 2 : rule.getPremiseCount();
    }

    @Override
    public String toString() {
        return rule.getAbbreviation() + "(" + weight + ")";
    }
}
