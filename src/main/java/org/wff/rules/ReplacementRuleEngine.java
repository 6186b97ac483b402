package org.wff.rules;

import org.wff.formula.Formula;
import org.wff.formula.FormulaNode;
import org.wff.formula.Tile;
import org.wff.formula.Tiles;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * MOTORE DELLE REGOLE DI SOSTITUZIONE
 *
 * Una riga giustificata da una regola di sostituzione si ottiene dalla riga citata
 * rimpiazzando esattamente un sottoalbero con una sua forma equivalente secondo la
 * regola, in una direzione o nell'altra.
 *
 * EQUIVALENZE:
 * • DM    ¬(A∧B) ≡ (¬A∨¬B),  ¬(A∨B) ≡ (¬A∧¬B)
 * • Comm  (A∧B) ≡ (B∧A),  (A∨B) ≡ (B∨A)
 * • Assoc (A∧(B∧C)) ≡ ((A∧B)∧C),  idem per ∨
 * • Dist  (A∧(B∨C)) ≡ ((A∧B)∨(A∧C)),  (A∨(B∧C)) ≡ ((A∨B)∧(A∨C))
 * • DN    A ≡ ¬¬A
 * • Trans (A→B) ≡ (¬B→¬A)
 * • MI    (A→B) ≡ (¬A∨B)
 * • ME    (A↔B) ≡ ((A→B)∧(B→A)),  (A↔B) ≡ ((A∧B)∨(¬A∧¬B))
 * • Exp   ((A∧B)→C) ≡ (A→(B→C))
 * • Taut  A ≡ (A∨A),  A ≡ (A∧A)
 */
public final class ReplacementRuleEngine {

    private static final Logger LOGGER = Logger.getLogger(ReplacementRuleEngine.class.getName());

    private ReplacementRuleEngine() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Verifica che {@code result} si ottenga da {@code source} con una sola sostituzione.
     *
     * @param rule regola dichiarata
     * @param source formula della riga citata
     * @param result formula della riga corrente
     * @return true se la sostituzione è corretta
     */
    public static boolean isValidReplacement(ReplacementRule rule, Formula source, Formula result) {
        if (rule == null) {
            throw new IllegalArgumentException("Regola non può essere null");
        }
        if (source == null || result == null || !source.isWellFormed() || !result.isWellFormed()) {
            return false;
        }
        boolean valid = rewriteOnce(rule, source.getNode()).contains(result.getNode());
        LOGGER.finest(() -> rule.getAbbreviation() + ": " + source + " ⇒ " + result + (valid ? " valida" : " non valida"));
        return valid;
    }

    /**
     * Tutte le formule ottenibili dalla sorgente con una singola sostituzione.
     *
     * @return formule distinte, nell'ordine di visita (radice, poi sottoalberi da sinistra)
     */
    public static List<Formula> getPossibleReplacements(ReplacementRule rule, Formula source) {
        if (source == null || !source.isWellFormed()) return List.of();
        List<Formula> result = new ArrayList<>();
        for (FormulaNode node : rewriteOnce(rule, source.getNode())) {
            result.add(Formula.of(node));
        }
        return result;
    }

    /**
     * Alberi ottenuti sostituendo esattamente un sottoalbero (eventualmente la radice).
     */
    public static Set<FormulaNode> rewriteOnce(ReplacementRule rule, FormulaNode node) {
        Set<FormulaNode> results = new LinkedHashSet<>(equivalentsAtRoot(rule, node));
        switch (node.getKind()) {
            case VARIABLE -> { }
            case UNARY -> {
                for (FormulaNode child : rewriteOnce(rule, node.getChild())) {
                    results.add(FormulaNode.unary(node.getTile(), child));
                }
            }
            case BINARY -> {
                for (FormulaNode left : rewriteOnce(rule, node.getLeft())) {
                    results.add(FormulaNode.binary(node.getTile(), left, node.getRight()));
                }
                for (FormulaNode right : rewriteOnce(rule, node.getRight())) {
                    results.add(FormulaNode.binary(node.getTile(), node.getLeft(), right));
                }
            }
        }
        return results;
    }

    //endregion

    //region EQUIVALENZE ALLA RADICE

    /**
     * Forme equivalenti del nodo secondo la regola, applicata solo alla radice.
     */
    static List<FormulaNode> equivalentsAtRoot(ReplacementRule rule, FormulaNode node) {
        List<FormulaNode> out = new ArrayList<>();
        switch (rule) {
            case DE_MORGAN -> deMorgan(node, out);
            case COMMUTATION -> commutation(node, out);
            case ASSOCIATION -> association(node, out);
            case DISTRIBUTION -> distribution(node, out);
            case DOUBLE_NEGATION -> doubleNegation(node, out);
            case TRANSPOSITION -> transposition(node, out);
            case MATERIAL_IMPLICATION -> materialImplication(node, out);
            case MATERIAL_EQUIVALENCE -> materialEquivalence(node, out);
            case EXPORTATION -> exportation(node, out);
            case TAUTOLOGY -> tautology(node, out);
        }
        return out;
    }

    private static void deMorgan(FormulaNode node, List<FormulaNode> out) {
        if (node.isNegation()) {
            FormulaNode inner = node.getChild();
            if (inner.isConjunction()) {
                out.add(FormulaNode.or(FormulaNode.not(inner.getLeft()), FormulaNode.not(inner.getRight())));
            } else if (inner.isDisjunction()) {
                out.add(FormulaNode.and(FormulaNode.not(inner.getLeft()), FormulaNode.not(inner.getRight())));
            }
        }
        if ((node.isConjunction() || node.isDisjunction())
                && node.getLeft().isNegation() && node.getRight().isNegation()) {
            Tile dual = node.isConjunction() ? Tiles.OR : Tiles.AND;
            out.add(FormulaNode.not(FormulaNode.binary(dual, node.getLeft().getChild(), node.getRight().getChild())));
        }
    }

    private static void commutation(FormulaNode node, List<FormulaNode> out) {
        if (node.isConjunction() || node.isDisjunction()) {
            out.add(FormulaNode.binary(node.getTile(), node.getRight(), node.getLeft()));
        }
    }

    private static void association(FormulaNode node, List<FormulaNode> out) {
        if (!node.isConjunction() && !node.isDisjunction()) return;
        Tile op = node.getTile();
        // A·(B·C) ⇒ (A·B)·C
        if (node.getRight().isBinary(op)) {
            FormulaNode right = node.getRight();
            out.add(FormulaNode.binary(op, FormulaNode.binary(op, node.getLeft(), right.getLeft()), right.getRight()));
        }
        // (A·B)·C ⇒ A·(B·C)
        if (node.getLeft().isBinary(op)) {
            FormulaNode left = node.getLeft();
            out.add(FormulaNode.binary(op, left.getLeft(), FormulaNode.binary(op, left.getRight(), node.getRight())));
        }
    }

    private static void distribution(FormulaNode node, List<FormulaNode> out) {
        if (!node.isConjunction() && !node.isDisjunction()) return;
        Tile outer = node.getTile();
        Tile inner = node.isConjunction() ? Tiles.OR : Tiles.AND;

        // A·(B+C) ⇒ (A·B)+(A·C)
        if (node.getRight().isBinary(inner)) {
            FormulaNode a = node.getLeft();
            FormulaNode right = node.getRight();
            out.add(FormulaNode.binary(inner,
                    FormulaNode.binary(outer, a, right.getLeft()),
                    FormulaNode.binary(outer, a, right.getRight())));
        }

        // (A+B)·(A+C) ⇒ A+(B·C), dove · e + sono scambiati rispetto al caso precedente
        FormulaNode left = node.getLeft();
        FormulaNode right = node.getRight();
        if (left.isBinary(inner) && right.isBinary(inner) && left.getLeft().equals(right.getLeft())) {
            out.add(FormulaNode.binary(inner, left.getLeft(), FormulaNode.binary(outer, left.getRight(), right.getRight())));
        }
    }

    private static void doubleNegation(FormulaNode node, List<FormulaNode> out) {
        out.add(FormulaNode.not(FormulaNode.not(node)));
        if (node.isNegation() && node.getChild().isNegation()) {
            out.add(node.getChild().getChild());
        }
    }

    private static void transposition(FormulaNode node, List<FormulaNode> out) {
        if (!node.isImplication()) return;
        FormulaNode a = node.getLeft();
        FormulaNode b = node.getRight();
        out.add(FormulaNode.implies(FormulaNode.not(b), FormulaNode.not(a)));
        if (a.isNegation() && b.isNegation()) {
            out.add(FormulaNode.implies(b.getChild(), a.getChild()));
        }
    }

    private static void materialImplication(FormulaNode node, List<FormulaNode> out) {
        if (node.isImplication()) {
            out.add(FormulaNode.or(FormulaNode.not(node.getLeft()), node.getRight()));
        }
        if (node.isDisjunction() && node.getLeft().isNegation()) {
            out.add(FormulaNode.implies(node.getLeft().getChild(), node.getRight()));
        }
    }

    private static void materialEquivalence(FormulaNode node, List<FormulaNode> out) {
        if (node.isBiconditional()) {
            FormulaNode a = node.getLeft();
            FormulaNode b = node.getRight();
            out.add(FormulaNode.and(FormulaNode.implies(a, b), FormulaNode.implies(b, a)));
            out.add(FormulaNode.or(FormulaNode.and(a, b), FormulaNode.and(FormulaNode.not(a), FormulaNode.not(b))));
            return;
        }

        // ((A→B)∧(B→A)) ⇒ (A↔B)
        if (node.isConjunction() && node.getLeft().isImplication() && node.getRight().isImplication()) {
            FormulaNode first = node.getLeft();
            FormulaNode second = node.getRight();
            if (first.getLeft().equals(second.getRight()) && first.getRight().equals(second.getLeft())) {
                out.add(FormulaNode.iff(first.getLeft(), first.getRight()));
            }
        }

        // ((A∧B)∨(¬A∧¬B)) ⇒ (A↔B)
        if (node.isDisjunction() && node.getLeft().isConjunction() && node.getRight().isConjunction()) {
            FormulaNode both = node.getLeft();
            FormulaNode neither = node.getRight();
            if (neither.getLeft().equals(FormulaNode.not(both.getLeft()))
                    && neither.getRight().equals(FormulaNode.not(both.getRight()))) {
                out.add(FormulaNode.iff(both.getLeft(), both.getRight()));
            }
        }
    }

    private static void exportation(FormulaNode node, List<FormulaNode> out) {
        if (!node.isImplication()) return;
        // ((A∧B)→C) ⇒ (A→(B→C))
        if (node.getLeft().isConjunction()) {
            FormulaNode conjunction = node.getLeft();
            out.add(FormulaNode.implies(conjunction.getLeft(), FormulaNode.implies(conjunction.getRight(), node.getRight())));
        }
        // (A→(B→C)) ⇒ ((A∧B)→C)
        if (node.getRight().isImplication()) {
            FormulaNode inner = node.getRight();
            out.add(FormulaNode.implies(FormulaNode.and(node.getLeft(), inner.getLeft()), inner.getRight()));
        }
    }

    private static void tautology(FormulaNode node, List<FormulaNode> out) {
        out.add(FormulaNode.or(node, node));
        out.add(FormulaNode.and(node, node));
        if ((node.isDisjunction() || node.isConjunction()) && node.getLeft().equals(node.getRight())) {
            out.add(node.getLeft());
        }
    }

    //endregion
}
