package org.wff.rules;

/**
 * Catalogo delle regole di sostituzione (equivalenze logiche).
 * Ciascuna si applica in entrambe le direzioni a una qualsiasi sottoformula.
 */
public enum ReplacementRule {
    DE_MORGAN("De Morgan's Theorem", "DM"),
    COMMUTATION("Commutation", "Comm"),
    ASSOCIATION("Association", "Assoc"),
    DISTRIBUTION("Distribution", "Dist"),
    DOUBLE_NEGATION("Double Negation", "DN"),
    TRANSPOSITION("Transposition", "Trans"),
    MATERIAL_IMPLICATION("Material Implication", "MI"),
    MATERIAL_EQUIVALENCE("Material Equivalence", "ME"),
    EXPORTATION("Exportation", "Exp"),
    TAUTOLOGY("Tautology", "Taut");

    private final String ruleName;
    private final String abbreviation;

    ReplacementRule(String ruleName, String abbreviation) {
        this.ruleName = ruleName;
        this.abbreviation = abbreviation;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public static ReplacementRule fromAbbreviation(String abbreviation) {
        for (ReplacementRule rule : values()) {
            if (rule.abbreviation.equalsIgnoreCase(abbreviation)) return rule;
        }
        return null;
    }
}
