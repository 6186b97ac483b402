package org.wff.rules;

import org.wff.formula.Formula;
import org.wff.formula.FormulaNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RICERCA IN AVANTI - Verifica di derivabilità con il solo catalogo delle inferenze
 *
 * Satura l'insieme delle formule note applicando le nove regole finché compare
 * l'obiettivo o non si producono formule nuove.
 *
 * CONTROLLO DELL'ESPLOSIONE:
 * • MP, MT, HS, DS, Simp, CD: risultati sempre conservati
 * • Conj, Add: conservati solo se sottoformula dell'obiettivo o di una formula nota
 * • Abs: non riapplicato ai propri risultati
 * • limite di round e di dimensione dell'insieme
 */
public final class DerivationSearch {

    private static final Logger LOGGER = Logger.getLogger(DerivationSearch.class.getName());

    /** Numero massimo di round di saturazione */
    private static final int MAX_ROUNDS = 12;

    /** Numero massimo di formule note */
    private static final int MAX_KNOWN = 600;

    private DerivationSearch() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param premises formule di partenza
     * @param goal formula da raggiungere
     * @return true se l'obiettivo è derivabile entro i limiti della ricerca
     */
    public static boolean canDerive(List<Formula> premises, Formula goal) {
        if (premises == null || goal == null) {
            throw new IllegalArgumentException("Premesse e obiettivo non possono essere null");
        }
        if (!goal.isWellFormed()) return false;

        Set<Formula> known = new LinkedHashSet<>();
        for (Formula premise : premises) {
            if (premise != null && premise.isWellFormed()) known.add(premise);
        }
        if (known.contains(goal)) return true;

        Set<Formula> absorbed = new HashSet<>();
        for (int round = 1; round <= MAX_ROUNDS; round++) {
            List<Formula> snapshot = new ArrayList<>(known);
            Set<FormulaNode> targets = collectSubformulas(goal, snapshot);
            boolean grown = false;

            for (InferenceRule rule : InferenceRule.values()) {
                List<Formula> sources = snapshot;
                if (rule == InferenceRule.ABSORPTION) {
                    sources = new ArrayList<>(snapshot);
                    sources.removeAll(absorbed);
                }
                for (Application application : InferenceRuleEngine.getPossibleApplications(rule, sources)) {
                    Formula conclusion = application.conclusion();
                    if (known.contains(conclusion) || !keep(rule, conclusion, targets)) continue;

                    known.add(conclusion);
                    grown = true;
                    if (rule == InferenceRule.ABSORPTION) absorbed.add(conclusion);
                    if (conclusion.equals(goal)) {
                        int reached = round;
                        LOGGER.finest(() -> "Obiettivo " + goal + " raggiunto al round " + reached);
                        return true;
                    }
                }
            }

            if (!grown) break;
            if (known.size() > MAX_KNOWN) {
                LOGGER.fine("Ricerca interrotta: superato il limite di " + MAX_KNOWN + " formule");
                break;
            }
        }
        return false;
    }

    private static boolean keep(InferenceRule rule, Formula conclusion, Set<FormulaNode> targets) {
        return switch (rule) {
            case CONJUNCTION, ADDITION -> targets.contains(conclusion.getNode());
            default -> true;
        };
    }

    private static Set<FormulaNode> collectSubformulas(Formula goal, List<Formula> known) {
        Set<FormulaNode> result = new HashSet<>();
        addSubformulas(goal.getNode(), result);
        for (Formula formula : known) addSubformulas(formula.getNode(), result);
        return result;
    }

    private static void addSubformulas(FormulaNode node, Set<FormulaNode> out) {
        if (!out.add(node)) return;
        switch (node.getKind()) {
            case VARIABLE -> { }
            case UNARY -> addSubformulas(node.getChild(), out);
            case BINARY -> {
                addSubformulas(node.getLeft(), out);
                addSubformulas(node.getRight(), out);
            }
        }
    }
}
