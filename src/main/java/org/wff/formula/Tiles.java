package org.wff.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ALFABETO DELLE TESSERE - Insieme fisso dei simboli ammessi
 *
 * CONTENUTO:
 * • Variabili: a-z e A-Z
 * • Operatori: ¬ (unario), ∧ ∨ → ↔ (binari)
 * • Parentesi: ( )
 *
 * Le variabili usate dal generatore di problemi sono il sottoinsieme p..w.
 */
public final class Tiles {

    public static final Tile NOT = new Tile("¬", SymbolType.UNARY_OPERATOR);
    public static final Tile AND = new Tile("∧", SymbolType.BINARY_OPERATOR);
    public static final Tile OR = new Tile("∨", SymbolType.BINARY_OPERATOR);
    public static final Tile IMPLIES = new Tile("→", SymbolType.BINARY_OPERATOR);
    public static final Tile IFF = new Tile("↔", SymbolType.BINARY_OPERATOR);
    public static final Tile LEFT_PAREN = new Tile("(", SymbolType.LEFT_PAREN);
    public static final Tile RIGHT_PAREN = new Tile(")", SymbolType.RIGHT_PAREN);

    /** Tutte le variabili dell'alfabeto, minuscole e poi maiuscole */
    public static final List<Tile> ALL_VARIABLES;

    /** Variabili impiegate nella generazione automatica dei problemi */
    public static final List<Tile> PROBLEM_VARIABLES;

    private static final Map<String, Tile> BY_SYMBOL = new HashMap<>();

    static {
        List<Tile> variables = new ArrayList<>();
        for (char c = 'a'; c <= 'z'; c++) variables.add(new Tile(String.valueOf(c), SymbolType.VARIABLE));
        for (char c = 'A'; c <= 'Z'; c++) variables.add(new Tile(String.valueOf(c), SymbolType.VARIABLE));
        ALL_VARIABLES = Collections.unmodifiableList(variables);

        List<Tile> problemVariables = new ArrayList<>();
        for (char c = 'p'; c <= 'w'; c++) problemVariables.add(variable(c, variables));
        PROBLEM_VARIABLES = Collections.unmodifiableList(problemVariables);

        for (Tile tile : variables) BY_SYMBOL.put(tile.getSymbol(), tile);
        for (Tile tile : List.of(NOT, AND, OR, IMPLIES, IFF, LEFT_PAREN, RIGHT_PAREN)) {
            BY_SYMBOL.put(tile.getSymbol(), tile);
        }
    }

    private Tiles() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    private static Tile variable(char c, List<Tile> variables) {
        return variables.stream().filter(t -> t.getSymbol().charAt(0) == c).findFirst().orElseThrow();
    }

    /**
     * Restituisce la tessera variabile per il carattere indicato.
     *
     * @param name lettera a-z o A-Z
     * @return tessera corrispondente
     * @throws IllegalArgumentException se il carattere non è una variabile dell'alfabeto
     */
    public static Tile variable(char name) {
        Tile tile = BY_SYMBOL.get(String.valueOf(name));
        if (tile == null || !tile.isVariable()) {
            throw new IllegalArgumentException("Variabile non appartenente all'alfabeto: " + name);
        }
        return tile;
    }

    /**
     * Cerca la tessera con il simbolo canonico indicato.
     *
     * @return tessera o null se il simbolo non appartiene all'alfabeto
     */
    public static Tile fromSymbol(String symbol) {
        return symbol == null ? null : BY_SYMBOL.get(symbol);
    }
}
