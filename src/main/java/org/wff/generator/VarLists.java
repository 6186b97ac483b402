package org.wff.generator;

import org.wff.formula.Formula;
import org.wff.formula.FormulaNode;
import org.wff.formula.Tile;
import org.wff.formula.Tiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ALLOCATORE DI VARIABILI - Variabili disponibili e letterali già impegnati
 *
 * STATO:
 * • available: variabili mai usate, in ordine casuale
 * • reserved: variabili estratte come "fresche" ma non ancora impegnate
 * • used: letterali impegnati (p oppure ¬p)
 *
 * INVARIANTE: una variabile impegnata con una polarità non può essere impegnata con
 * quella opposta. Così le strategie di generazione non introducono contraddizioni
 * con variabili già usate altrove.
 *
 * Oggetto mutabile, posseduto da un singolo tentativo di generazione.
 */
public final class VarLists {

    private static final Logger LOGGER = Logger.getLogger(VarLists.class.getName());

    private final List<Tile> available;
    private final List<Tile> reserved;
    private final List<Formula> used;

    private VarLists(List<Tile> available, List<Tile> reserved, List<Formula> used) {
        this.available = available;
        this.reserved = reserved;
        this.used = used;
    }

    /**
     * Allocatore con le variabili p..w in ordine casuale.
     *
     * @param random sorgente di casualità (iniettata per la riproducibilità)
     */
    public static VarLists create(Random random) {
        return create(Tiles.PROBLEM_VARIABLES, random);
    }

    /**
     * @param variables alfabeto di variabili da usare
     * @param random sorgente di casualità
     */
    public static VarLists create(List<Tile> variables, Random random) {
        if (variables == null || random == null) {
            throw new IllegalArgumentException("Variabili e sorgente casuale non possono essere null");
        }
        for (Tile tile : variables) {
            if (tile == null || !tile.isVariable()) {
                throw new IllegalArgumentException("Tessera non variabile nell'alfabeto: " + tile);
            }
        }
        List<Tile> shuffled = new ArrayList<>(new LinkedHashSet<>(variables));
        Collections.shuffle(shuffled, random);
        return new VarLists(shuffled, new ArrayList<>(), new ArrayList<>());
    }

    /**
     * @return copia indipendente, per tentativi che possono essere scartati
     */
    public VarLists copy() {
        return new VarLists(new ArrayList<>(available), new ArrayList<>(reserved), new ArrayList<>(used));
    }

    //region ALLOCAZIONE

    /**
     * Estrae una variabile mai usata. Resta riservata finché non viene impegnata con
     * {@link #useAtomicAssertion}.
     *
     * @return variabile fresca o null se l'alfabeto è esaurito
     */
    public Formula drawFreshVariable() {
        if (available.isEmpty()) {
            LOGGER.fine("Variabili disponibili esaurite");
            return null;
        }
        Tile tile = available.remove(0);
        reserved.add(tile);
        return Formula.of(FormulaNode.variable(tile));
    }

    /**
     * Impegna un letterale.
     *
     * @param literal variabile o negazione di variabile
     * @return il letterale impegnato, oppure null se la variabile è già impegnata con
     *         la polarità opposta o non appartiene a questo allocatore
     * @throws IllegalArgumentException se la formula non è un letterale
     */
    public Formula useAtomicAssertion(Formula literal) {
        if (literal == null || !literal.isWellFormed() || !literal.getNode().isLiteral()) {
            throw new IllegalArgumentException("Asserzione atomica richiede un letterale: " + literal);
        }

        if (used.contains(literal)) return literal;
        if (used.contains(opposite(literal))) {
            LOGGER.finest(() -> "Letterale " + literal + " in conflitto con un letterale già impegnato");
            return null;
        }

        Tile variable = baseVariable(literal.getNode());
        if (available.remove(variable) || reserved.remove(variable)) {
            used.add(literal);
            return literal;
        }
        return null;
    }

    /**
     * Impegna tutti i letterali oppure nessuno.
     *
     * @return true se tutti i letterali sono compatibili e sono stati impegnati
     */
    public boolean useAll(Set<Formula> literals) {
        VarLists trial = copy();
        for (Formula literal : literals) {
            if (trial.useAtomicAssertion(literal) == null) return false;
        }
        for (Formula literal : literals) {
            useAtomicAssertion(literal);
        }
        return true;
    }

    public List<Tile> getAvailable() {
        return Collections.unmodifiableList(available);
    }

    public List<Formula> getUsed() {
        return Collections.unmodifiableList(used);
    }

    //endregion

    //region ASSERZIONI ATOMICHE

    /**
     * Letterali che compaiono nella formula: una variabile il cui genitore diretto è
     * una negazione viene riportata negata, altrimenti positiva.
     * Esempi: (¬p∧q)∨r → {¬p, q, r};  ¬(p∧q) → {p, q}.
     *
     * @return insieme dei letterali, nell'ordine di prima occorrenza
     */
    public static Set<Formula> getAtomicAssertions(Formula formula) {
        Set<Formula> result = new LinkedHashSet<>();
        if (formula != null && formula.isWellFormed()) {
            collectAssertions(formula.getNode(), false, result);
        }
        return result;
    }

    private static void collectAssertions(FormulaNode node, boolean parentIsNegation, Set<Formula> out) {
        switch (node.getKind()) {
            case VARIABLE -> out.add(Formula.of(parentIsNegation ? FormulaNode.not(node) : node));
            case UNARY -> collectAssertions(node.getChild(), node.isNegation(), out);
            case BINARY -> {
                collectAssertions(node.getLeft(), false, out);
                collectAssertions(node.getRight(), false, out);
            }
        }
    }

    /**
     * Verifica che nessun letterale compaia insieme al suo opposto nelle formule indicate.
     */
    public static boolean isConsistent(List<Formula> formulas) {
        Set<Formula> assertions = new HashSet<>();
        for (Formula formula : formulas) assertions.addAll(getAtomicAssertions(formula));
        for (Formula literal : assertions) {
            if (assertions.contains(opposite(literal))) return false;
        }
        return true;
    }

    /**
     * @return variabile del letterale
     */
    public static Tile getBaseVariable(Formula literal) {
        if (literal == null || !literal.isWellFormed() || !literal.getNode().isLiteral()) {
            throw new IllegalArgumentException("Letterale non valido: " + literal);
        }
        return baseVariable(literal.getNode());
    }

    private static Tile baseVariable(FormulaNode literal) {
        return literal.isVariable() ? literal.getTile() : literal.getChild().getTile();
    }

    private static Formula opposite(Formula literal) {
        FormulaNode node = literal.getNode();
        return Formula.of(node.isVariable() ? FormulaNode.not(node) : node.getChild());
    }

    //endregion

    @Override
    public String toString() {
        return "VarLists{available=" + available + ", reserved=" + reserved + ", used=" + used + "}";
    }
}
