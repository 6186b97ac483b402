package org.wff.problem;

import org.wff.formula.Formula;
import org.wff.formula.FormulaNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * PROBLEMA - Premesse, conclusione da dimostrare e difficoltà
 *
 * Le premesse sono distinte (uguaglianza normalizzata) e nessuna è la negazione
 * diretta di un'altra. Per i problemi generati la difficoltà è il numero di passi
 * intermedi nascosti; per quelli curati è un livello indicativo.
 */
public final class Problem {

    private final String id;
    private final String name;
    private final List<Formula> premises;
    private final Formula conclusion;
    private final int difficulty;

    /**
     * @throws IllegalArgumentException se i dati sono incompleti, non ben formati o le
     *         premesse sono direttamente contraddittorie
     */
    public Problem(String id, String name, List<Formula> premises, Formula conclusion, int difficulty) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identificativo del problema non può essere vuoto");
        }
        if (premises == null) {
            throw new IllegalArgumentException("Premesse non possono essere null");
        }
        if (conclusion == null || !conclusion.isWellFormed()) {
            throw new IllegalArgumentException("Conclusione non ben formata: " + conclusion);
        }
        for (Formula premise : premises) {
            if (premise == null || !premise.isWellFormed()) {
                throw new IllegalArgumentException("Premessa non ben formata: " + premise);
            }
        }

        List<Formula> distinct = new ArrayList<>(new LinkedHashSet<>(premises));
        if (hasContradictoryPair(distinct)) {
            throw new IllegalArgumentException("Premesse contraddittorie: " + distinct);
        }

        this.id = id;
        this.name = name != null ? name : id;
        this.premises = Collections.unmodifiableList(distinct);
        this.conclusion = conclusion;
        this.difficulty = difficulty;
    }

    /**
     * @return true se una premessa è la negazione diretta di un'altra
     */
    public static boolean hasContradictoryPair(List<Formula> premises) {
        for (Formula premise : premises) {
            if (premises.contains(Formula.of(FormulaNode.not(premise.getNode())))) return true;
        }
        return false;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<Formula> getPremises() {
        return premises;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    public int getDifficulty() {
        return difficulty;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Problem other)) return false;
        return id.equals(other.id) && premises.equals(other.premises)
                && conclusion.equals(other.conclusion) && difficulty == other.difficulty;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, premises, conclusion, difficulty);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < premises.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(premises.get(i));
        }
        return sb.append(" ⊢ ").append(conclusion).toString();
    }
}
