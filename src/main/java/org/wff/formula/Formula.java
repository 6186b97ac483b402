package org.wff.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FORMULA - Sequenza ordinata di tessere
 *
 * È la rappresentazione "lineare" della formula, quella che l'utente compone e legge.
 * Al momento della costruzione la sequenza viene analizzata una sola volta da
 * {@link WffParser}; se è ben formata si conserva l'albero sintattico.
 *
 * UGUAGLIANZA NORMALIZZATA:
 * • due formule ben formate sono uguali se i loro alberi sono strutturalmente uguali,
 *   quindi "p∨q" e "(p∨q)" coincidono
 * • formule non ben formate si confrontano tessera per tessera
 */
public final class Formula {

    private final List<Tile> tiles;

    /** Albero sintattico, null se la sequenza non è una formula ben formata */
    private final FormulaNode node;

    /**
     * @param tiles sequenza di tessere (non null, senza elementi null)
     * @throws IllegalArgumentException se la lista è null o contiene null
     */
    public Formula(List<Tile> tiles) {
        if (tiles == null) {
            throw new IllegalArgumentException("Lista tessere non può essere null");
        }
        for (Tile tile : tiles) {
            if (tile == null) {
                throw new IllegalArgumentException("Lista tessere non può contenere elementi null");
            }
        }
        this.tiles = Collections.unmodifiableList(new ArrayList<>(tiles));
        this.node = WffParser.parseTiles(this.tiles);
    }

    /**
     * Forma canonica di un albero già noto: la sequenza non viene rianalizzata.
     */
    Formula(List<Tile> canonicalTiles, FormulaNode node) {
        this.tiles = Collections.unmodifiableList(new ArrayList<>(canonicalTiles));
        this.node = node;
    }

    /**
     * Costruisce la forma canonica di un albero sintattico.
     */
    public static Formula of(FormulaNode node) {
        return WffParser.treeToFormula(node);
    }

    //region COSTRUTTORI DI FORMULE COMPOSTE

    public static Formula not(Formula operand) {
        return of(FormulaNode.not(requireNode(operand)));
    }

    public static Formula and(Formula left, Formula right) {
        return of(FormulaNode.and(requireNode(left), requireNode(right)));
    }

    public static Formula or(Formula left, Formula right) {
        return of(FormulaNode.or(requireNode(left), requireNode(right)));
    }

    public static Formula implies(Formula left, Formula right) {
        return of(FormulaNode.implies(requireNode(left), requireNode(right)));
    }

    public static Formula iff(Formula left, Formula right) {
        return of(FormulaNode.iff(requireNode(left), requireNode(right)));
    }

    private static FormulaNode requireNode(Formula formula) {
        if (formula == null || formula.node == null) {
            throw new IllegalArgumentException("Formula non ben formata: " + formula);
        }
        return formula.node;
    }

    //endregion

    public List<Tile> getTiles() {
        return tiles;
    }

    /**
     * @return albero sintattico o null se la formula non è ben formata
     */
    public FormulaNode getNode() {
        return node;
    }

    public boolean isWellFormed() {
        return node != null;
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula other)) return false;
        if (node != null && other.node != null) {
            return node.equals(other.node);
        }
        return node == null && other.node == null && tiles.equals(other.tiles);
    }

    @Override
    public int hashCode() {
        return node != null ? node.hashCode() : tiles.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Tile tile : tiles) sb.append(tile.getSymbol());
        return sb.toString();
    }
}
