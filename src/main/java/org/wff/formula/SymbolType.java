package org.wff.formula;

/**
 * Categorie sintattiche delle tessere che compongono una formula.
 */
public enum SymbolType {
    VARIABLE,           // Variabile proposizionale: p, q, r, ...
    UNARY_OPERATOR,     // Negazione: ¬
    BINARY_OPERATOR,    // Connettivi binari: ∧ ∨ → ↔
    LEFT_PAREN,         // (
    RIGHT_PAREN         // )
}
