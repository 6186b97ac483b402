package org.wff.rules;

import org.wff.formula.Formula;
import org.wff.formula.FormulaNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * MOTORE DELLE REGOLE DI INFERENZA - Semantica in avanti del catalogo
 *
 * Data una lista di formule note, enumera tutte le applicazioni possibili di una regola.
 * Lo stesso meccanismo serve sia alla generazione dei problemi sia alla validazione
 * delle dimostrazioni: una riga è corretta se coincide con la conclusione di
 * un'applicazione generata a partire dalle sole righe citate.
 *
 * SCHEMI SUPPORTATI:
 * • MP   (A→B), A ⊢ B
 * • MT   (A→B), ¬B ⊢ ¬A
 * • HS   (A→B), (B→C) ⊢ (A→C)
 * • DS   (A∨B), ¬A ⊢ B   oppure   (A∨B), ¬B ⊢ A
 * • CD   ((A→B)∧(C→D)), (A∨C) ⊢ (B∨D), anche con le implicazioni note separatamente
 * • Abs  (A→B) ⊢ (A→(A∧B))
 * • Simp (A∧B) ⊢ A e B
 * • Conj A, B ⊢ (A∧B) e (B∧A)
 * • Add  A ⊢ (A∨X) e (X∨A), con X un'altra formula nota
 *
 * Le formule non ben formate vengono ignorate.
 */
public final class InferenceRuleEngine {

    private static final Logger LOGGER = Logger.getLogger(InferenceRuleEngine.class.getName());

    private InferenceRuleEngine() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Enumera le applicazioni di una regola sulle formule note, eliminando quelle con
     * conclusione identica (si conserva la prima trovata).
     *
     * @param rule regola da applicare
     * @param known formule note
     * @return applicazioni con conclusioni distinte
     */
    public static List<Application> getPossibleApplications(InferenceRule rule, List<Formula> known) {
        validateArguments(rule, known);
        return deduplicate(derive(rule, wellFormed(known), List.of()));
    }

    /**
     * Enumera le applicazioni di tutte le regole del catalogo.
     */
    public static List<Application> getPossibleApplications(List<Formula> known) {
        List<Application> all = new ArrayList<>();
        for (InferenceRule rule : InferenceRule.values()) {
            all.addAll(getPossibleApplications(rule, known));
        }
        return all;
    }

    /**
     * @return conclusioni distinte ottenibili con la regola dalle formule note
     */
    public static List<Formula> getPossibleConclusions(InferenceRule rule, List<Formula> known) {
        List<Formula> conclusions = new ArrayList<>();
        for (Application application : getPossibleApplications(rule, known)) {
            conclusions.add(application.conclusion());
        }
        return conclusions;
    }

    /**
     * Verifica che {@code conclusion} segua dalle premesse citate secondo la regola.
     *
     * Le premesse devono rispettare l'ordine di citazione della regola, tranne per la
     * Congiunzione. Per l'Addizione la formula aggiunta X è ricavata dalla conclusione.
     *
     * @param rule regola dichiarata
     * @param premises formule citate, nell'ordine di citazione
     * @param conclusion formula da verificare
     * @return true se esiste un'applicazione con quelle premesse e quella conclusione
     */
    public static boolean isValidInference(InferenceRule rule, List<Formula> premises, Formula conclusion) {
        if (conclusion == null || !conclusion.isWellFormed()) return false;
        for (Application application : matchingApplications(rule, premises, conclusion)) {
            if (application.conclusion().equals(conclusion)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Applicazioni della regola che consumano esattamente le premesse citate.
     * Una lista vuota indica che le premesse non rispettano lo schema della regola.
     *
     * @param rule regola dichiarata
     * @param premises formule citate, nell'ordine di citazione
     * @param candidate conclusione proposta, usata solo per ricavare la X dell'Addizione (può essere null)
     */
    public static List<Application> matchingApplications(InferenceRule rule, List<Formula> premises, Formula candidate) {
        validateArguments(rule, premises);
        for (Formula premise : premises) {
            if (premise == null || !premise.isWellFormed()) return List.of();
        }

        List<Formula> extras = new ArrayList<>();
        if (rule == InferenceRule.ADDITION && candidate != null && candidate.isWellFormed()
                && candidate.getNode().isDisjunction()) {
            extras.add(Formula.of(candidate.getNode().getLeft()));
            extras.add(Formula.of(candidate.getNode().getRight()));
        }

        List<Application> matching = new ArrayList<>();
        for (Application application : derive(rule, premises, extras)) {
            if (premisesMatch(rule, application.premises(), premises)) {
                matching.add(application);
            }
        }
        LOGGER.finest(() -> rule.getAbbreviation() + " su " + premises + ": " + matching.size() + " applicazioni compatibili");
        return matching;
    }

    //endregion

    //region GENERAZIONE PER REGOLA

    /**
     * Genera tutte le applicazioni, senza eliminare duplicati.
     * Le formule sono individuate per posizione, quindi una stessa formula citata due
     * volte conta come due premesse distinte.
     */
    static List<Application> derive(InferenceRule rule, List<Formula> known, List<Formula> extras) {
        List<Application> out = new ArrayList<>();
        switch (rule) {
            case MODUS_PONENS -> deriveModusPonens(known, out);
            case MODUS_TOLLENS -> deriveModusTollens(known, out);
            case HYPOTHETICAL_SYLLOGISM -> deriveHypotheticalSyllogism(known, out);
            case DISJUNCTIVE_SYLLOGISM -> deriveDisjunctiveSyllogism(known, out);
            case CONSTRUCTIVE_DILEMMA -> deriveConstructiveDilemma(known, out);
            case ABSORPTION -> deriveAbsorption(known, out);
            case SIMPLIFICATION -> deriveSimplification(known, out);
            case CONJUNCTION -> deriveConjunction(known, out);
            case ADDITION -> deriveAddition(known, extras, out);
        }
        return out;
    }

    private static void deriveModusPonens(List<Formula> known, List<Application> out) {
        for (int i = 0; i < known.size(); i++) {
            FormulaNode implication = known.get(i).getNode();
            if (!implication.isImplication()) continue;
            for (int j = 0; j < known.size(); j++) {
                if (i != j && known.get(j).getNode().equals(implication.getLeft())) {
                    out.add(new Application(Formula.of(implication.getRight()), InferenceRule.MODUS_PONENS,
                            List.of(known.get(i), known.get(j))));
                }
            }
        }
    }

    private static void deriveModusTollens(List<Formula> known, List<Application> out) {
        for (int i = 0; i < known.size(); i++) {
            FormulaNode implication = known.get(i).getNode();
            if (!implication.isImplication()) continue;
            FormulaNode negatedConsequent = FormulaNode.not(implication.getRight());
            for (int j = 0; j < known.size(); j++) {
                if (i != j && known.get(j).getNode().equals(negatedConsequent)) {
                    out.add(new Application(Formula.of(FormulaNode.not(implication.getLeft())),
                            InferenceRule.MODUS_TOLLENS, List.of(known.get(i), known.get(j))));
                }
            }
        }
    }

    private static void deriveHypotheticalSyllogism(List<Formula> known, List<Application> out) {
        for (int i = 0; i < known.size(); i++) {
            FormulaNode first = known.get(i).getNode();
            if (!first.isImplication()) continue;
            for (int j = 0; j < known.size(); j++) {
                FormulaNode second = known.get(j).getNode();
                // Il termine medio deve coincidere esattamente
                if (i != j && second.isImplication() && first.getRight().equals(second.getLeft())) {
                    out.add(new Application(Formula.of(FormulaNode.implies(first.getLeft(), second.getRight())),
                            InferenceRule.HYPOTHETICAL_SYLLOGISM, List.of(known.get(i), known.get(j))));
                }
            }
        }
    }

    private static void deriveDisjunctiveSyllogism(List<Formula> known, List<Application> out) {
        for (int i = 0; i < known.size(); i++) {
            FormulaNode disjunction = known.get(i).getNode();
            if (!disjunction.isDisjunction()) continue;
            FormulaNode notLeft = FormulaNode.not(disjunction.getLeft());
            FormulaNode notRight = FormulaNode.not(disjunction.getRight());
            for (int j = 0; j < known.size(); j++) {
                if (i == j) continue;
                FormulaNode other = known.get(j).getNode();
                if (other.equals(notLeft)) {
                    out.add(new Application(Formula.of(disjunction.getRight()), InferenceRule.DISJUNCTIVE_SYLLOGISM,
                            List.of(known.get(i), known.get(j))));
                }
                if (other.equals(notRight)) {
                    out.add(new Application(Formula.of(disjunction.getLeft()), InferenceRule.DISJUNCTIVE_SYLLOGISM,
                            List.of(known.get(i), known.get(j))));
                }
            }
        }
    }

    private static void deriveConstructiveDilemma(List<Formula> known, List<Application> out) {
        for (int k = 0; k < known.size(); k++) {
            FormulaNode disjunction = known.get(k).getNode();
            if (!disjunction.isDisjunction()) continue;

            // Congiunzioni di implicazioni già presenti tra le formule note
            for (int c = 0; c < known.size(); c++) {
                FormulaNode conjunction = known.get(c).getNode();
                if (c == k || !conjunction.isConjunction()
                        || !conjunction.getLeft().isImplication() || !conjunction.getRight().isImplication()) {
                    continue;
                }
                FormulaNode dilemma = dilemmaConclusion(conjunction.getLeft(), conjunction.getRight(), disjunction);
                if (dilemma != null) {
                    out.add(new Application(Formula.of(dilemma), InferenceRule.CONSTRUCTIVE_DILEMMA,
                            List.of(known.get(c), known.get(k))));
                }
            }

            // Implicazioni note separatamente: la congiunzione viene sintetizzata
            for (int i = 0; i < known.size(); i++) {
                FormulaNode first = known.get(i).getNode();
                if (i == k || !first.isImplication()) continue;
                for (int j = i + 1; j < known.size(); j++) {
                    FormulaNode second = known.get(j).getNode();
                    if (j == k || !second.isImplication()) continue;
                    FormulaNode dilemma = dilemmaConclusion(first, second, disjunction);
                    if (dilemma == null) dilemma = dilemmaConclusion(second, first, disjunction);
                    if (dilemma != null) {
                        out.add(new Application(Formula.of(dilemma), InferenceRule.CONSTRUCTIVE_DILEMMA,
                                List.of(known.get(i), known.get(j), known.get(k))));
                    }
                }
            }
        }
    }

    /**
     * (A→B), (C→D), disgiunzione (A∨C) oppure (C∨A) ⊢ (B∨D) oppure (D∨B).
     *
     * @return conclusione del dilemma o null se la disgiunzione non combacia
     */
    private static FormulaNode dilemmaConclusion(FormulaNode first, FormulaNode second, FormulaNode disjunction) {
        if (disjunction.getLeft().equals(first.getLeft()) && disjunction.getRight().equals(second.getLeft())) {
            return FormulaNode.or(first.getRight(), second.getRight());
        }
        if (disjunction.getLeft().equals(second.getLeft()) && disjunction.getRight().equals(first.getLeft())) {
            return FormulaNode.or(second.getRight(), first.getRight());
        }
        return null;
    }

    private static void deriveAbsorption(List<Formula> known, List<Application> out) {
        for (Formula formula : known) {
            FormulaNode implication = formula.getNode();
            if (!implication.isImplication()) continue;
            FormulaNode absorbed = FormulaNode.implies(implication.getLeft(),
                    FormulaNode.and(implication.getLeft(), implication.getRight()));
            out.add(new Application(Formula.of(absorbed), InferenceRule.ABSORPTION, List.of(formula)));
        }
    }

    private static void deriveSimplification(List<Formula> known, List<Application> out) {
        for (Formula formula : known) {
            FormulaNode conjunction = formula.getNode();
            if (!conjunction.isConjunction()) continue;
            out.add(new Application(Formula.of(conjunction.getLeft()), InferenceRule.SIMPLIFICATION, List.of(formula)));
            out.add(new Application(Formula.of(conjunction.getRight()), InferenceRule.SIMPLIFICATION, List.of(formula)));
        }
    }

    private static void deriveConjunction(List<Formula> known, List<Application> out) {
        for (int i = 0; i < known.size(); i++) {
            for (int j = i + 1; j < known.size(); j++) {
                Formula a = known.get(i);
                Formula b = known.get(j);
                out.add(new Application(Formula.and(a, b), InferenceRule.CONJUNCTION, List.of(a, b)));
                out.add(new Application(Formula.and(b, a), InferenceRule.CONJUNCTION, List.of(b, a)));
            }
        }
    }

    private static void deriveAddition(List<Formula> known, List<Formula> extras, List<Application> out) {
        for (int i = 0; i < known.size(); i++) {
            Formula added = known.get(i);
            for (int j = 0; j < known.size(); j++) {
                Formula other = known.get(j);
                if (i == j || other.equals(added)) continue;
                out.add(new Application(Formula.or(added, other), InferenceRule.ADDITION, List.of(added), List.of(other)));
                out.add(new Application(Formula.or(other, added), InferenceRule.ADDITION, List.of(added), List.of(other)));
            }
            for (Formula other : extras) {
                out.add(new Application(Formula.or(added, other), InferenceRule.ADDITION, List.of(added)));
                out.add(new Application(Formula.or(other, added), InferenceRule.ADDITION, List.of(added)));
            }
        }
    }

    //endregion

    //region SUPPORTO

    private static void validateArguments(InferenceRule rule, List<Formula> formulas) {
        if (rule == null) {
            throw new IllegalArgumentException("Regola non può essere null");
        }
        if (formulas == null) {
            throw new IllegalArgumentException("Lista formule non può essere null");
        }
    }

    private static List<Formula> wellFormed(List<Formula> known) {
        List<Formula> result = new ArrayList<>(known.size());
        for (Formula formula : known) {
            if (formula != null && formula.isWellFormed()) result.add(formula);
        }
        return result;
    }

    private static List<Application> deduplicate(List<Application> applications) {
        Map<Formula, Application> byConclusion = new LinkedHashMap<>();
        for (Application application : applications) {
            byConclusion.putIfAbsent(application.conclusion(), application);
        }
        return new ArrayList<>(byConclusion.values());
    }

    /**
     * Confronta le premesse di un'applicazione con quelle citate, rispettando l'ordine
     * solo se la regola lo richiede.
     */
    private static boolean premisesMatch(InferenceRule rule, List<Formula> generated, List<Formula> cited) {
        if (generated.size() != cited.size()) return false;
        if (rule.isOrderSensitive()) return generated.equals(cited);

        List<Formula> remaining = new ArrayList<>(cited);
        for (Formula formula : generated) {
            if (!remaining.remove(formula)) return false;
        }
        return true;
    }

    //endregion
}
