package org.wff.formula;

import java.util.Objects;

/**
 * NODO FORMULA - Albero sintattico di una formula ben formata
 *
 * Ogni nodo è di uno dei tre tipi:
 * • VARIABLE: foglia con la tessera della variabile
 * • UNARY: operatore unario (¬) con un figlio
 * • BINARY: operatore binario (∧ ∨ → ↔) con figlio sinistro e destro
 *
 * I nodi sono immutabili e confrontati strutturalmente. Vengono prodotti dal parser
 * oppure dai metodi factory di questa classe.
 */
public final class FormulaNode {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati nella rappresentazione ad albero.
     */
    public enum Kind {
        VARIABLE,
        UNARY,
        BINARY
    }

    private final Kind kind;

    /** Tessera della variabile (VARIABLE) o dell'operatore (UNARY, BINARY) */
    private final Tile tile;

    /** Figlio unico per UNARY, figlio sinistro per BINARY */
    private final FormulaNode left;

    /** Figlio destro (solo BINARY) */
    private final FormulaNode right;

    private final int hash;

    //endregion

    //region COSTRUZIONE

    private FormulaNode(Kind kind, Tile tile, FormulaNode left, FormulaNode right) {
        this.kind = kind;
        this.tile = tile;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(kind, tile, left, right);
    }

    /**
     * @param tile tessera di tipo VARIABLE
     * @throws IllegalArgumentException se la tessera non è una variabile
     */
    public static FormulaNode variable(Tile tile) {
        if (tile == null || tile.getType() != SymbolType.VARIABLE) {
            throw new IllegalArgumentException("Nodo variabile richiede una tessera variabile: " + tile);
        }
        return new FormulaNode(Kind.VARIABLE, tile, null, null);
    }

    public static FormulaNode variable(char name) {
        return variable(Tiles.variable(name));
    }

    /**
     * @param operator tessera di tipo UNARY_OPERATOR
     * @param child operando (non null)
     */
    public static FormulaNode unary(Tile operator, FormulaNode child) {
        if (operator == null || operator.getType() != SymbolType.UNARY_OPERATOR) {
            throw new IllegalArgumentException("Nodo unario richiede un operatore unario: " + operator);
        }
        if (child == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new FormulaNode(Kind.UNARY, operator, child, null);
    }

    /**
     * @param operator tessera di tipo BINARY_OPERATOR
     * @param left operando sinistro (non null)
     * @param right operando destro (non null)
     */
    public static FormulaNode binary(Tile operator, FormulaNode left, FormulaNode right) {
        if (operator == null || operator.getType() != SymbolType.BINARY_OPERATOR) {
            throw new IllegalArgumentException("Nodo binario richiede un operatore binario: " + operator);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi del nodo binario non possono essere null");
        }
        return new FormulaNode(Kind.BINARY, operator, left, right);
    }

    public static FormulaNode not(FormulaNode child) {
        return unary(Tiles.NOT, child);
    }

    public static FormulaNode and(FormulaNode left, FormulaNode right) {
        return binary(Tiles.AND, left, right);
    }

    public static FormulaNode or(FormulaNode left, FormulaNode right) {
        return binary(Tiles.OR, left, right);
    }

    public static FormulaNode implies(FormulaNode left, FormulaNode right) {
        return binary(Tiles.IMPLIES, left, right);
    }

    public static FormulaNode iff(FormulaNode left, FormulaNode right) {
        return binary(Tiles.IFF, left, right);
    }

    //endregion

    //region ACCESSO E INTERROGAZIONE

    public Kind getKind() {
        return kind;
    }

    public Tile getTile() {
        return tile;
    }

    /**
     * @return operando della negazione
     * @throws IllegalStateException se il nodo non è unario
     */
    public FormulaNode getChild() {
        if (kind != Kind.UNARY) {
            throw new IllegalStateException("Nodo " + kind + " non ha un operando unico");
        }
        return left;
    }

    public FormulaNode getLeft() {
        if (kind != Kind.BINARY) {
            throw new IllegalStateException("Nodo " + kind + " non ha operando sinistro");
        }
        return left;
    }

    public FormulaNode getRight() {
        if (kind != Kind.BINARY) {
            throw new IllegalStateException("Nodo " + kind + " non ha operando destro");
        }
        return right;
    }

    public boolean isVariable() {
        return kind == Kind.VARIABLE;
    }

    public boolean isNegation() {
        return kind == Kind.UNARY && tile.equals(Tiles.NOT);
    }

    /**
     * Verifica se il nodo è binario con l'operatore indicato.
     */
    public boolean isBinary(Tile operator) {
        return kind == Kind.BINARY && tile.equals(operator);
    }

    public boolean isConjunction() {
        return isBinary(Tiles.AND);
    }

    public boolean isDisjunction() {
        return isBinary(Tiles.OR);
    }

    public boolean isImplication() {
        return isBinary(Tiles.IMPLIES);
    }

    public boolean isBiconditional() {
        return isBinary(Tiles.IFF);
    }

    /**
     * Letterale: variabile oppure negazione diretta di una variabile.
     */
    public boolean isLiteral() {
        return isVariable() || (isNegation() && left.isVariable());
    }

    /**
     * @return numero totale di nodi dell'albero
     */
    public int size() {
        return switch (kind) {
            case VARIABLE -> 1;
            case UNARY -> 1 + left.size();
            case BINARY -> 1 + left.size() + right.size();
        };
    }

    /**
     * @return profondità dell'albero (una variabile ha profondità 0)
     */
    public int depth() {
        return switch (kind) {
            case VARIABLE -> 0;
            case UNARY -> 1 + left.depth();
            case BINARY -> 1 + Math.max(left.depth(), right.depth());
        };
    }

    /**
     * Verifica se {@code other} compare come sottoalbero (anche coincidente) di questo nodo.
     */
    public boolean containsSubtree(FormulaNode other) {
        if (equals(other)) return true;
        return switch (kind) {
            case VARIABLE -> false;
            case UNARY -> left.containsSubtree(other);
            case BINARY -> left.containsSubtree(other) || right.containsSubtree(other);
        };
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FormulaNode other)) return false;
        return hash == other.hash
                && kind == other.kind
                && tile.equals(other.tile)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Rappresentazione canonica completamente parentesizzata.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case VARIABLE -> tile.getSymbol();
            case UNARY -> tile.getSymbol() + left;
            case BINARY -> "(" + left + tile.getSymbol() + right + ")";
        };
    }

    //endregion
}
