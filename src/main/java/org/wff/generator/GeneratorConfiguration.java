package org.wff.generator;

import org.wff.formula.Tile;
import org.wff.formula.Tiles;

import java.util.List;

/**
 * CONFIGURAZIONE DEL GENERATORE - Parametri immutabili con valori predefiniti
 *
 * PARAMETRI:
 * • maxAttempts: tentativi prima di rinunciare (50)
 * • maxFormulaSize: numero massimo di nodi di una formula derivata (11)
 * • chainBias: probabilità di preferire le applicazioni che usano l'ultima formula derivata (0.7)
 * • verifySolvability: controllo finale con la ricerca in avanti (attivo)
 * • variables: alfabeto delle variabili (p..w)
 */
public final class GeneratorConfiguration {

    public static final int DEFAULT_MAX_ATTEMPTS = 50;
    public static final int DEFAULT_MAX_FORMULA_SIZE = 11;
    public static final double DEFAULT_CHAIN_BIAS = 0.7;

    private final int maxAttempts;
    private final int maxFormulaSize;
    private final double chainBias;
    private final boolean verifySolvability;
    private final List<Tile> variables;

    private GeneratorConfiguration(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.maxFormulaSize = builder.maxFormulaSize;
        this.chainBias = builder.chainBias;
        this.verifySolvability = builder.verifySolvability;
        this.variables = List.copyOf(builder.variables);
    }

    public static GeneratorConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getMaxFormulaSize() {
        return maxFormulaSize;
    }

    public double getChainBias() {
        return chainBias;
    }

    public boolean isVerifySolvability() {
        return verifySolvability;
    }

    public List<Tile> getVariables() {
        return variables;
    }

    @Override
    public String toString() {
        return "GeneratorConfiguration{maxAttempts=" + maxAttempts + ", maxFormulaSize=" + maxFormulaSize
                + ", chainBias=" + chainBias + ", verifySolvability=" + verifySolvability
                + ", variables=" + variables + "}";
    }

    /**
     * Costruttore incrementale con validazione in {@link #build()}.
     */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private int maxFormulaSize = DEFAULT_MAX_FORMULA_SIZE;
        private double chainBias = DEFAULT_CHAIN_BIAS;
        private boolean verifySolvability = true;
        private List<Tile> variables = Tiles.PROBLEM_VARIABLES;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder maxFormulaSize(int maxFormulaSize) {
            this.maxFormulaSize = maxFormulaSize;
            return this;
        }

        public Builder chainBias(double chainBias) {
            this.chainBias = chainBias;
            return this;
        }

        public Builder verifySolvability(boolean verifySolvability) {
            this.verifySolvability = verifySolvability;
            return this;
        }

        public Builder variables(List<Tile> variables) {
            this.variables = variables;
            return this;
        }

        /**
         * @throws IllegalArgumentException se un parametro è fuori intervallo
         */
        public GeneratorConfiguration build() {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("Numero tentativi deve essere >= 1, ricevuto: " + maxAttempts);
            }
            if (maxFormulaSize < 3) {
                throw new IllegalArgumentException("Dimensione massima formula deve essere >= 3, ricevuto: " + maxFormulaSize);
            }
            if (chainBias < 0.0 || chainBias > 1.0) {
                throw new IllegalArgumentException("Preferenza di concatenazione deve essere in [0, 1], ricevuto: " + chainBias);
            }
            if (variables == null || variables.size() < 2) {
                throw new IllegalArgumentException("Servono almeno due variabili per generare problemi");
            }
            return new GeneratorConfiguration(this);
        }
    }
}
