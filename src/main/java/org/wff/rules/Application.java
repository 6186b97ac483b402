package org.wff.rules;

import org.wff.formula.Formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Applicazione concreta di una regola di inferenza.
 *
 * @param conclusion formula prodotta
 * @param rule regola applicata
 * @param premises formule consumate, nell'ordine di citazione della regola
 * @param context formule che devono essere note ma non vengono citate (la X dell'Addizione)
 */
public record Application(Formula conclusion, InferenceRule rule, List<Formula> premises, List<Formula> context) {

    public Application {
        if (conclusion == null || rule == null) {
            throw new IllegalArgumentException("Conclusione e regola non possono essere null");
        }
        premises = List.copyOf(premises);
        context = List.copyOf(context);
    }

    public Application(Formula conclusion, InferenceRule rule, List<Formula> premises) {
        this(conclusion, rule, premises, List.of());
    }

    /**
     * @return premesse seguite dal contesto: tutte le formule da cui dipende la conclusione
     */
    public List<Formula> antecedents() {
        if (context.isEmpty()) return premises;
        List<Formula> all = new ArrayList<>(premises);
        all.addAll(context);
        return all;
    }

    @Override
    public String toString() {
        return premises + " ⊢ " + conclusion + " (" + rule.getAbbreviation() + ")";
    }
}
