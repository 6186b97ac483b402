package org.wff.proof;

import org.junit.jupiter.api.Test;
import org.wff.formula.Formula;
import org.wff.formula.FormulaReader;
import org.wff.rules.InferenceRule;
import org.wff.rules.ReplacementRule;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofValidatorTest {

    private static Formula f(String text) {
        Formula formula = FormulaReader.read(text);
        assertNotNull(formula, text);
        return formula;
    }

    private static Proof premises(String... texts) {
        Proof proof = Proof.empty();
        for (String text : texts) proof = proof.append(f(text), Justification.premise());
        return proof;
    }

    @Test
    void emptyProofIsValid() {
        assertTrue(ProofValidator.validate(Proof.empty()).isValid());
        assertTrue(ProofValidator.validate(new Proof(List.of())).isValid());
    }

    @Test
    void proofRejectsNullLines() {
        assertThrows(IllegalArgumentException.class, () -> new Proof(null));
        assertThrows(IllegalArgumentException.class, () -> new Proof(Arrays.asList(
                new ProofLine(1, f("p"), Justification.premise()), null)));
    }

    @Test
    void modusPonensWithCitationsInRuleOrder() {
        Proof proof = premises("p -> q", "p")
                .append(f("q"), Justification.inference(InferenceRule.MODUS_PONENS, 1, 2));

        ValidationResult result = ProofValidator.validate(proof);
        assertTrue(result.isValid(), result.getErrorMessage());
        assertNull(result.getErrorMessage());
    }

    @Test
    void modusPonensWithSwappedCitationsIsRejected() {
        Proof proof = premises("p -> q", "p")
                .append(f("q"), Justification.inference(InferenceRule.MODUS_PONENS, 2, 1));

        ValidationResult result = ProofValidator.validate(proof);
        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().startsWith("Riga 3"));
        assertTrue(result.getErrorMessage().contains("schema di Modus Ponens"));
    }

    @Test
    void conjunctionAcceptsAnyCitationOrder() {
        Proof proof = premises("p", "q")
                .append(f("q & p"), Justification.inference(InferenceRule.CONJUNCTION, 1, 2))
                .append(f("p & q"), Justification.inference(InferenceRule.CONJUNCTION, 2, 1));
        assertTrue(ProofValidator.validate(proof).isValid());
    }

    @Test
    void multiStepProofWithReplacement() {
        Proof proof = premises("p -> q", "~q", "r | p")
                .append(f("~p"), Justification.inference(InferenceRule.MODUS_TOLLENS, 1, 2))
                .append(f("p | r"), Justification.replacement(ReplacementRule.COMMUTATION, 3))
                .append(f("r"), Justification.inference(InferenceRule.DISJUNCTIVE_SYLLOGISM, 5, 4))
                .append(f("~~r"), Justification.replacement(ReplacementRule.DOUBLE_NEGATION, 6));

        ValidationResult result = ProofValidator.validate(proof);
        assertTrue(result.isValid(), result.getErrorMessage());
    }

    @Test
    void replacementInsideSubformula() {
        Proof proof = premises("s -> ~(p & q)")
                .append(f("s -> (~p | ~q)"), Justification.replacement(ReplacementRule.DE_MORGAN, 1));
        assertTrue(ProofValidator.validate(proof).isValid());
    }

    @Test
    void wrongConclusionIsRejected() {
        Proof proof = premises("p -> q", "p")
                .append(f("p"), Justification.inference(InferenceRule.MODUS_PONENS, 1, 2));

        ValidationResult result = ProofValidator.validate(proof);
        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().contains("non segue per Modus Ponens"));
    }

    @Test
    void forwardAndMissingReferencesAreRejected() {
        Proof forward = premises("p -> q", "p")
                .append(f("q"), Justification.inference(InferenceRule.MODUS_PONENS, 1, 3));
        assertEquals("Riga 3 cita la riga 3 che non la precede.", ProofValidator.validate(forward).getErrorMessage());

        Proof missing = new Proof(List.of(
                new ProofLine(1, f("p -> q"), Justification.premise()),
                new ProofLine(3, f("p"), Justification.premise()),
                new ProofLine(4, f("q"), Justification.inference(InferenceRule.MODUS_PONENS, 1, 2))));
        assertEquals("Riga 4 cita la riga inesistente 2.", ProofValidator.validate(missing).getErrorMessage());
    }

    @Test
    void wrongCitationCountIsRejected() {
        Proof proof = premises("p & q")
                .append(f("p"), Justification.inference(InferenceRule.SIMPLIFICATION, 1, 1));

        ValidationResult result = ProofValidator.validate(proof);
        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().contains("richiede 1"));
    }

    @Test
    void replacementRequiresASingleReference() {
        Proof proof = premises("p & q")
                .append(f("q & p"), Justification.replacement(ReplacementRule.COMMUTATION, 1));
        assertTrue(ProofValidator.validate(proof).isValid());

        Proof invalid = premises("p & q")
                .append(f("q | p"), Justification.replacement(ReplacementRule.COMMUTATION, 1));
        assertTrue(ProofValidator.validate(invalid).getErrorMessage().contains("Commutation"));
    }

    @Test
    void malformedLineIsRejected() {
        Proof proof = premises("p").append(f("p &"), Justification.premise());

        ValidationResult result = ProofValidator.validate(proof);
        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().startsWith("Riga 2"));
        assertTrue(result.getErrorMessage().contains("non è una formula ben formata"));
    }

    @Test
    void subproofJustificationsAreNotSupported() {
        Proof proof = premises("p").append(f("p"), Justification.reiteration(1));

        ValidationResult result = ProofValidator.validate(proof);
        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().contains("non è supportata"));
    }

    @Test
    void numberingMustStartAtOneAndIncrease() {
        Proof late = new Proof(List.of(new ProofLine(2, f("p"), Justification.premise())));
        assertTrue(ProofValidator.validate(late).getErrorMessage().contains("iniziare da 1"));

        Proof repeated = new Proof(List.of(
                new ProofLine(1, f("p"), Justification.premise()),
                new ProofLine(1, f("q"), Justification.premise())));
        assertTrue(ProofValidator.validate(repeated).getErrorMessage().contains("non crescente"));
    }

    @Test
    void stopsAtFirstInvalidLine() {
        Proof proof = premises("p -> q", "p")
                .append(f("r"), Justification.inference(InferenceRule.MODUS_PONENS, 1, 2))
                .append(f("s"), Justification.inference(InferenceRule.MODUS_PONENS, 9, 9));
        assertTrue(ProofValidator.validate(proof).getErrorMessage().startsWith("Riga 3"));
    }

    @Test
    void justificationDisplayText() {
        assertEquals("Premise", Justification.premise().displayText());
        assertEquals("1,2: MP", Justification.inference(InferenceRule.MODUS_PONENS, 1, 2).displayText());
        assertEquals("3: DM", Justification.replacement(ReplacementRule.DE_MORGAN, 3).displayText());
        assertEquals("2-4: II", Justification.implicationIntroduction(2, 4).displayText());
    }
}
