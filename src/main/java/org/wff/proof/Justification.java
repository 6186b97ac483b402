package org.wff.proof;

import org.wff.rules.InferenceRule;
import org.wff.rules.ReplacementRule;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * GIUSTIFICAZIONE - Motivo per cui una riga compare in una dimostrazione
 *
 * TIPI:
 * • PREMISE: premessa del problema
 * • ASSUMPTION: ipotesi
 * • INFERENCE: regola di inferenza con le righe citate
 * • REPLACEMENT: regola di sostituzione con una riga citata
 * • IMPLICATION_INTRODUCTION, REDUCTIO_AD_ABSURDUM, REITERATION: riservati alle
 *   sottodimostrazioni, segnalati come non supportati dal validatore
 */
public final class Justification {

    public enum Kind {
        PREMISE,
        ASSUMPTION,
        INFERENCE,
        REPLACEMENT,
        IMPLICATION_INTRODUCTION,
        REDUCTIO_AD_ABSURDUM,
        REITERATION
    }

    private static final Justification PREMISE = new Justification(Kind.PREMISE, null, null, List.of());
    private static final Justification ASSUMPTION = new Justification(Kind.ASSUMPTION, null, null, List.of());

    private final Kind kind;
    private final InferenceRule inferenceRule;
    private final ReplacementRule replacementRule;

    /**
     * Righe citate. Per le sottodimostrazioni: inizio, fine e (solo per l'assurdo) la riga
     * della contraddizione.
     */
    private final List<Integer> lineReferences;

    private Justification(Kind kind, InferenceRule inferenceRule, ReplacementRule replacementRule,
                          List<Integer> lineReferences) {
        this.kind = kind;
        this.inferenceRule = inferenceRule;
        this.replacementRule = replacementRule;
        this.lineReferences = List.copyOf(lineReferences);
    }

    //region FACTORY METHODS

    public static Justification premise() {
        return PREMISE;
    }

    public static Justification assumption() {
        return ASSUMPTION;
    }

    /**
     * @param rule regola di inferenza
     * @param lineReferences righe citate, nell'ordine richiesto dalla regola
     */
    public static Justification inference(InferenceRule rule, int... lineReferences) {
        if (rule == null) {
            throw new IllegalArgumentException("Regola di inferenza non può essere null");
        }
        return new Justification(Kind.INFERENCE, rule, null, toList(lineReferences));
    }

    public static Justification replacement(ReplacementRule rule, int lineReference) {
        if (rule == null) {
            throw new IllegalArgumentException("Regola di sostituzione non può essere null");
        }
        return new Justification(Kind.REPLACEMENT, null, rule, List.of(lineReference));
    }

    public static Justification implicationIntroduction(int subproofStart, int subproofEnd) {
        return new Justification(Kind.IMPLICATION_INTRODUCTION, null, null, List.of(subproofStart, subproofEnd));
    }

    public static Justification reductioAdAbsurdum(int subproofStart, int subproofEnd, int contradictionLine) {
        return new Justification(Kind.REDUCTIO_AD_ABSURDUM, null, null,
                List.of(subproofStart, subproofEnd, contradictionLine));
    }

    public static Justification reiteration(int lineReference) {
        return new Justification(Kind.REITERATION, null, null, List.of(lineReference));
    }

    private static List<Integer> toList(int[] values) {
        if (values == null) return List.of();
        return Arrays.stream(values).boxed().collect(Collectors.toList());
    }

    //endregion

    public Kind getKind() {
        return kind;
    }

    /** @return regola di inferenza o null se la giustificazione non è un'inferenza */
    public InferenceRule getInferenceRule() {
        return inferenceRule;
    }

    /** @return regola di sostituzione o null se la giustificazione non è una sostituzione */
    public ReplacementRule getReplacementRule() {
        return replacementRule;
    }

    public List<Integer> getLineReferences() {
        return lineReferences;
    }

    /**
     * Testo mostrato accanto alla riga, ad esempio "1,2: MP" oppure "3: DM".
     */
    public String displayText() {
        String refs = lineReferences.stream().map(String::valueOf).collect(Collectors.joining(","));
        return switch (kind) {
            case PREMISE -> "Premise";
            case ASSUMPTION -> "Assumption";
            case INFERENCE -> refs + ": " + inferenceRule.getAbbreviation();
            case REPLACEMENT -> refs + ": " + replacementRule.getAbbreviation();
            case IMPLICATION_INTRODUCTION -> lineReferences.get(0) + "-" + lineReferences.get(1) + ": II";
            case REDUCTIO_AD_ABSURDUM -> lineReferences.get(0) + "-" + lineReferences.get(1)
                    + ", " + lineReferences.get(2) + ": RAA";
            case REITERATION -> refs + ": R";
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Justification other)) return false;
        return kind == other.kind
                && inferenceRule == other.inferenceRule
                && replacementRule == other.replacementRule
                && lineReferences.equals(other.lineReferences);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, inferenceRule, replacementRule, lineReferences);
    }

    @Override
    public String toString() {
        return displayText();
    }
}
