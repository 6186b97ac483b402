package org.wff.rules;

import org.wff.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Catalogo pesato delle nove regole in avanti.
 *
 * Le regole di eliminazione e di combinazione (HS, DS, CD, Conj) hanno i pesi più alti,
 * quelle che producono formule "di contorno" (Abs, Simp, Add) i più bassi.
 */
public final class ForwardRuleGenerators {

    private static final Map<InferenceRule, Double> DEFAULT_WEIGHTS = new EnumMap<>(InferenceRule.class);

    static {
        DEFAULT_WEIGHTS.put(InferenceRule.MODUS_PONENS, 7.5);
        DEFAULT_WEIGHTS.put(InferenceRule.MODUS_TOLLENS, 7.75);
        DEFAULT_WEIGHTS.put(InferenceRule.HYPOTHETICAL_SYLLOGISM, 10.2);
        DEFAULT_WEIGHTS.put(InferenceRule.DISJUNCTIVE_SYLLOGISM, 10.3);
        DEFAULT_WEIGHTS.put(InferenceRule.CONSTRUCTIVE_DILEMMA, 10.4);
        DEFAULT_WEIGHTS.put(InferenceRule.ABSORPTION, 5.0);
        DEFAULT_WEIGHTS.put(InferenceRule.SIMPLIFICATION, 5.1);
        DEFAULT_WEIGHTS.put(InferenceRule.CONJUNCTION, 10.1);
        DEFAULT_WEIGHTS.put(InferenceRule.ADDITION, 5.2);
    }

    /** Le nove regole in avanti, nell'ordine del catalogo */
    public static final List<ForwardRule> ALL;

    static {
        List<ForwardRule> rules = new ArrayList<>();
        for (InferenceRule rule : InferenceRule.values()) {
            rules.add(new ForwardRule(rule, DEFAULT_WEIGHTS.get(rule)));
        }
        ALL = Collections.unmodifiableList(rules);
    }

    private ForwardRuleGenerators() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return regola in avanti associata alla regola del catalogo
     */
    public static ForwardRule forRule(InferenceRule rule) {
        for (ForwardRule forwardRule : ALL) {
            if (forwardRule.getRule() == rule) return forwardRule;
        }
        throw new IllegalArgumentException("Regola non presente nel catalogo: " + rule);
    }

    /**
     * @return regole applicabili alle formule note
     */
    public static List<ForwardRule> applicable(List<Formula> known) {
        List<ForwardRule> result = new ArrayList<>();
        for (ForwardRule rule : ALL) {
            if (rule.canApply(known)) result.add(rule);
        }
        return result;
    }
}
