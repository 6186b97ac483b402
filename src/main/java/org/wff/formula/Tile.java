package org.wff.formula;

/**
 * TESSERA - Simbolo atomico di una formula proposizionale
 *
 * Coppia immutabile (simbolo, categoria). Due tessere sono uguali quando coincidono
 * sia il simbolo sia la categoria.
 */
public final class Tile {

    private final String symbol;
    private final SymbolType type;

    /**
     * @param symbol simbolo testuale (non null, non vuoto)
     * @param type categoria sintattica del simbolo
     * @throws IllegalArgumentException se i parametri non sono validi
     */
    public Tile(String symbol, SymbolType type) {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("Simbolo della tessera non può essere null o vuoto");
        }
        if (type == null) {
            throw new IllegalArgumentException("Tipo della tessera non può essere null");
        }
        this.symbol = symbol;
        this.type = type;
    }

    public String getSymbol() {
        return symbol;
    }

    public SymbolType getType() {
        return type;
    }

    public boolean isVariable() {
        return type == SymbolType.VARIABLE;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Tile other)) return false;
        return symbol.equals(other.symbol) && type == other.type;
    }

    @Override
    public int hashCode() {
        return 31 * symbol.hashCode() + type.hashCode();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
