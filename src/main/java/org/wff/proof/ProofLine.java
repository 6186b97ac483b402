package org.wff.proof;

import org.wff.formula.Formula;

import java.util.Objects;

/**
 * Riga di una dimostrazione: numero, formula, giustificazione e profondità di annidamento.
 * La profondità è sempre 0 finché le sottodimostrazioni non sono supportate.
 */
public final class ProofLine {

    private final int lineNumber;
    private final Formula formula;
    private final Justification justification;
    private final int depth;

    public ProofLine(int lineNumber, Formula formula, Justification justification) {
        this(lineNumber, formula, justification, 0);
    }

    /**
     * @throws IllegalArgumentException se formula o giustificazione sono null o la profondità è negativa
     */
    public ProofLine(int lineNumber, Formula formula, Justification justification, int depth) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula della riga " + lineNumber + " non può essere null");
        }
        if (justification == null) {
            throw new IllegalArgumentException("Giustificazione della riga " + lineNumber + " non può essere null");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Profondità deve essere >= 0, ricevuto: " + depth);
        }
        this.lineNumber = lineNumber;
        this.formula = formula;
        this.justification = justification;
        this.depth = depth;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public Formula getFormula() {
        return formula;
    }

    public Justification getJustification() {
        return justification;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ProofLine other)) return false;
        return lineNumber == other.lineNumber && depth == other.depth
                && formula.equals(other.formula) && justification.equals(other.justification);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, formula, justification, depth);
    }

    @Override
    public String toString() {
        return lineNumber + ". " + formula + "    " + justification.displayText();
    }
}
