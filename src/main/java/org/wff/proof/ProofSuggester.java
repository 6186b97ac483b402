package org.wff.proof;

import org.wff.formula.Formula;
import org.wff.formula.Tile;
import org.wff.formula.Tiles;
import org.wff.generator.GenerationStep;
import org.wff.generator.GenerationStrategy;
import org.wff.generator.RuleGenerators;
import org.wff.generator.VarLists;
import org.wff.rules.Application;
import org.wff.rules.InferenceRuleEngine;
import org.wff.rules.ReplacementRule;
import org.wff.rules.ReplacementRuleEngine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * SUGGERIMENTI - Punti di ingresso per "suggerisci la prossima riga"
 *
 * • in avanti: applicazioni delle regole di inferenza sulle righe selezionate
 * • sostituzione: riscritture di una formula per ciascuna regola di equivalenza
 * • all'indietro: passi proposti dalle strategie per raggiungere l'obiettivo
 */
public final class ProofSuggester {

    private ProofSuggester() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Applicazioni delle nove regole sulle righe selezionate, escluse quelle la cui
     * conclusione è già presente nella dimostrazione.
     *
     * @param proof dimostrazione corrente
     * @param lineNumbers righe selezionate
     * @return applicazioni suggerite
     * @throws IllegalArgumentException se una riga selezionata non esiste
     */
    public static List<Application> inferenceSuggestions(Proof proof, List<Integer> lineNumbers) {
        List<Formula> selected = new ArrayList<>();
        for (int lineNumber : lineNumbers) {
            ProofLine line = proof.getLine(lineNumber);
            if (line == null) {
                throw new IllegalArgumentException("Riga selezionata inesistente: " + lineNumber);
            }
            selected.add(line.getFormula());
        }

        Set<Formula> present = new HashSet<>();
        for (ProofLine line : proof.getLines()) present.add(line.getFormula());

        List<Application> suggestions = new ArrayList<>();
        for (Application application : InferenceRuleEngine.getPossibleApplications(selected)) {
            if (!present.contains(application.conclusion())) suggestions.add(application);
        }
        return suggestions;
    }

    /**
     * Riscritture della formula per ogni regola di sostituzione. Per la Doppia Negazione
     * e la Tautologia sono escluse le espansioni, applicabili a qualunque formula.
     */
    public static Map<ReplacementRule, List<Formula>> replacementSuggestions(Formula formula) {
        Map<ReplacementRule, List<Formula>> suggestions = new EnumMap<>(ReplacementRule.class);
        if (formula == null || !formula.isWellFormed()) return suggestions;

        int size = formula.getNode().size();
        for (ReplacementRule rule : ReplacementRule.values()) {
            List<Formula> rewrites = new ArrayList<>();
            for (Formula rewrite : ReplacementRuleEngine.getPossibleReplacements(rule, formula)) {
                boolean expansion = (rule == ReplacementRule.DOUBLE_NEGATION || rule == ReplacementRule.TAUTOLOGY)
                        && rewrite.getNode().size() > size;
                if (!expansion) rewrites.add(rewrite);
            }
            if (!rewrites.isEmpty()) suggestions.put(rule, rewrites);
        }
        return suggestions;
    }

    /**
     * Passi all'indietro verso l'obiettivo, con variabili fresche non presenti nella dimostrazione.
     *
     * @param goal formula da raggiungere
     * @param proof dimostrazione corrente
     * @param random sorgente per la scelta delle variabili fresche
     * @return passo proposto da ciascuna strategia applicabile, indicizzato per nome
     */
    public static Map<String, GenerationStep> backwardHints(Formula goal, Proof proof, Random random) {
        Set<Tile> inUse = new HashSet<>(goal.getTiles());
        for (ProofLine line : proof.getLines()) inUse.addAll(line.getFormula().getTiles());

        List<Tile> freshAlphabet = new ArrayList<>();
        for (Tile variable : Tiles.PROBLEM_VARIABLES) {
            if (!inUse.contains(variable)) freshAlphabet.add(variable);
        }

        Map<String, GenerationStep> hints = new LinkedHashMap<>();
        for (GenerationStrategy strategy : RuleGenerators.applicable(goal)) {
            VarLists vars = VarLists.create(freshAlphabet, random);
            GenerationStep step = strategy.generate(goal, vars);
            if (step != null) hints.put(strategy.getName(), step);
        }
        return hints;
    }
}
