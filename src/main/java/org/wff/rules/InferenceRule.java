package org.wff.rules;

/**
 * Catalogo delle regole di inferenza.
 *
 * Per ogni regola sono noti il numero di righe da citare e se l'ordine delle citazioni
 * è vincolante. Solo la Congiunzione accetta le premesse in qualunque ordine; per le
 * altre regole a due premesse l'ordine è quello della tabella:
 * • MP: implicazione, antecedente
 * • MT: implicazione, negazione del conseguente
 * • HS: (A→B), (B→C)
 * • DS: disgiunzione, negazione di un disgiunto
 * • CD: congiunzione di implicazioni, disgiunzione
 */
public enum InferenceRule {
    MODUS_PONENS("Modus Ponens", "MP", 2, true),
    MODUS_TOLLENS("Modus Tollens", "MT", 2, true),
    HYPOTHETICAL_SYLLOGISM("Hypothetical Syllogism", "HS", 2, true),
    DISJUNCTIVE_SYLLOGISM("Disjunctive Syllogism", "DS", 2, true),
    CONSTRUCTIVE_DILEMMA("Constructive Dilemma", "CD", 2, true),
    ABSORPTION("Absorption", "Abs", 1, true),
    SIMPLIFICATION("Simplification", "Simp", 1, true),
    CONJUNCTION("Conjunction", "Conj", 2, false),
    ADDITION("Addition", "Add", 1, true);

    private final String ruleName;
    private final String abbreviation;
    private final int premiseCount;
    private final boolean orderSensitive;

    InferenceRule(String ruleName, String abbreviation, int premiseCount, boolean orderSensitive) {
        this.ruleName = ruleName;
        this.abbreviation = abbreviation;
        this.premiseCount = premiseCount;
        this.orderSensitive = orderSensitive;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    /** Numero di righe che una giustificazione con questa regola deve citare */
    public int getPremiseCount() {
        return premiseCount;
    }

    public boolean isOrderSensitive() {
        return orderSensitive;
    }

    /**
     * @return regola con l'abbreviazione indicata (senza distinzione maiuscole) o null
     */
    public static InferenceRule fromAbbreviation(String abbreviation) {
        for (InferenceRule rule : values()) {
            if (rule.abbreviation.equalsIgnoreCase(abbreviation)) return rule;
        }
        return null;
    }
}
