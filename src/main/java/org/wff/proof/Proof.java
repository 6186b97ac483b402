package org.wff.proof;

import org.wff.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * DIMOSTRAZIONE - Sequenza ordinata di righe
 *
 * Contenitore immutabile; {@link #append} restituisce una nuova dimostrazione con
 * la riga aggiunta e numerata automaticamente.
 */
public final class Proof {

    private final List<ProofLine> lines;

    public Proof(List<ProofLine> lines) {
        if (lines == null) {
            throw new IllegalArgumentException("Lista righe non può essere null");
        }
        for (ProofLine line : lines) {
            if (line == null) {
                throw new IllegalArgumentException("Lista righe non può contenere null");
            }
        }
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public static Proof empty() {
        return new Proof(List.of());
    }

    /**
     * Dimostrazione che inizia con le premesse indicate, numerate da 1.
     */
    public static Proof ofPremises(List<Formula> premises) {
        Proof proof = empty();
        for (Formula premise : premises) {
            proof = proof.append(premise, Justification.premise());
        }
        return proof;
    }

    /**
     * @return nuova dimostrazione con la riga aggiunta in coda
     */
    public Proof append(Formula formula, Justification justification) {
        List<ProofLine> extended = new ArrayList<>(lines);
        extended.add(new ProofLine(nextLineNumber(), formula, justification));
        return new Proof(extended);
    }

    public List<ProofLine> getLines() {
        return lines;
    }

    /**
     * @return riga con il numero indicato o null se assente
     */
    public ProofLine getLine(int lineNumber) {
        for (ProofLine line : lines) {
            if (line.getLineNumber() == lineNumber) return line;
        }
        return null;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    private int nextLineNumber() {
        return lines.isEmpty() ? 1 : lines.get(lines.size() - 1).getLineNumber() + 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        return obj instanceof Proof other && lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ProofLine line : lines) sb.append(line).append('\n');
        return sb.toString();
    }
}
