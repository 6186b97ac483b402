package org.wff.problem;

import org.wff.formula.Formula;
import org.wff.formula.FormulaReader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Problemi curati, organizzati per capitolo. Le formule sono scritte con la
 * notazione ASCII accettata da {@link FormulaReader}.
 */
public final class ProblemSets {

    public static final List<Problem> CHAPTER_1_MODUS_PONENS = List.of(
            problem("1-1", "Simple Modus Ponens", 1, "q", "p -> q", "p"),
            problem("1-2", "Modus Ponens with Negation", 2, "s", "~r -> s", "~r"));

    public static final List<Problem> CHAPTER_2_MODUS_TOLLENS = List.of(
            problem("2-1", "Modus Tollens with Negation", 2, "~p", "p -> q", "~q"),
            problem("2-2", "Modus Tollens on a Negated Antecedent", 2, "~~r", "~r -> s", "~s"));

    public static final List<Problem> CHAPTER_3_MIXED_RULES = List.of(
            problem("3-1", "Multi-Step Proof", 3, "r", "p -> q", "q -> r", "p"),
            problem("3-2", "Disjunctive Syllogism Chain", 3, "s", "p | q", "~p", "q -> s"),
            problem("3-3", "Constructive Dilemma", 3, "r | s", "p -> r", "q -> s", "p | q"),
            problem("3-4", "Simplify then Conclude", 3, "r & p", "p & q", "q -> r"));

    private ProblemSets() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return capitoli nell'ordine di presentazione, indicizzati per titolo
     */
    public static Map<String, List<Problem>> chapters() {
        Map<String, List<Problem>> chapters = new LinkedHashMap<>();
        chapters.put("Modus Ponens", CHAPTER_1_MODUS_PONENS);
        chapters.put("Modus Tollens", CHAPTER_2_MODUS_TOLLENS);
        chapters.put("Mixed Rules", CHAPTER_3_MIXED_RULES);
        return Collections.unmodifiableMap(chapters);
    }

    public static List<Problem> all() {
        List<Problem> all = new ArrayList<>();
        for (List<Problem> chapter : chapters().values()) all.addAll(chapter);
        return all;
    }

    private static Problem problem(String id, String name, int difficulty, String conclusion, String... premises) {
        List<Formula> premiseFormulas = new ArrayList<>();
        for (String premise : premises) premiseFormulas.add(formula(premise));
        return new Problem(id, name, premiseFormulas, formula(conclusion), difficulty);
    }

    private static Formula formula(String text) {
        Formula formula = FormulaReader.readWellFormed(text);
        if (formula == null) {
            throw new IllegalStateException("Formula curata non ben formata: " + text);
        }
        return formula;
    }
}
