package org.wff.proof;

import org.wff.formula.Formula;
import org.wff.rules.Application;
import org.wff.rules.InferenceRule;
import org.wff.rules.InferenceRuleEngine;
import org.wff.rules.ReplacementRule;
import org.wff.rules.ReplacementRuleEngine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * VALIDATORE DI DIMOSTRAZIONI - Verifica sequenziale riga per riga
 *
 * Ogni riga viene controllata usando solo le righe già accettate che la precedono.
 * La validazione si ferma al primo errore e restituisce un'unica diagnostica che
 * nomina la riga.
 *
 * CONTROLLI:
 * 1. Numeri di riga strettamente crescenti a partire da 1
 * 2. Profondità 0 (sottodimostrazioni non supportate)
 * 3. Formula ben formata
 * 4. Premessa e ipotesi: sempre valide
 * 5. Inferenza: righe citate esistenti e precedenti, numero di citazioni pari a quello
 *    della regola, premesse conformi allo schema nell'ordine della regola, formula
 *    uguale alla conclusione
 * 6. Sostituzione: una riga citata, formula ottenuta con una sola sostituzione
 *
 * Classe senza stato: può essere usata da più thread.
 */
public final class ProofValidator {

    private static final Logger LOGGER = Logger.getLogger(ProofValidator.class.getName());

    private ProofValidator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Valida l'intera dimostrazione.
     *
     * @param proof dimostrazione da validare (non null)
     * @return esito con la diagnostica del primo errore
     */
    public static ValidationResult validate(Proof proof) {
        if (proof == null) {
            throw new IllegalArgumentException("Dimostrazione non può essere null");
        }

        Map<Integer, Formula> accepted = new HashMap<>();
        int previousNumber = 0;

        for (ProofLine line : proof.getLines()) {
            String error = validateLine(line, previousNumber, accepted);
            if (error != null) {
                LOGGER.fine(() -> "Dimostrazione non valida: " + error);
                return ValidationResult.invalid(error);
            }
            accepted.put(line.getLineNumber(), line.getFormula());
            previousNumber = line.getLineNumber();
        }

        LOGGER.finest(() -> "Dimostrazione valida di " + proof.size() + " righe");
        return ValidationResult.valid();
    }

    /**
     * @return messaggio di errore o null se la riga è valida
     */
    private static String validateLine(ProofLine line, int previousNumber, Map<Integer, Formula> accepted) {
        int n = line.getLineNumber();

        if (previousNumber == 0 && n != 1) {
            return "Riga " + n + ": la numerazione deve iniziare da 1.";
        }
        if (n <= previousNumber) {
            return "Riga " + n + ": numero di riga non crescente (precedente " + previousNumber + ").";
        }
        if (line.getDepth() != 0) {
            return "Riga " + n + ": le sottodimostrazioni non sono supportate.";
        }
        if (!line.getFormula().isWellFormed()) {
            return "Riga " + n + ": '" + line.getFormula() + "' non è una formula ben formata.";
        }

        Justification justification = line.getJustification();
        return switch (justification.getKind()) {
            case PREMISE, ASSUMPTION -> null;
            case INFERENCE -> validateInference(line, justification.getInferenceRule(), accepted);
            case REPLACEMENT -> validateReplacement(line, justification.getReplacementRule(), accepted);
            case IMPLICATION_INTRODUCTION, REDUCTIO_AD_ABSURDUM, REITERATION ->
                    "Riga " + n + ": la giustificazione " + justification.displayText() + " non è supportata.";
        };
    }

    private static String validateInference(ProofLine line, InferenceRule rule, Map<Integer, Formula> accepted) {
        int n = line.getLineNumber();
        List<Integer> refs = line.getJustification().getLineReferences();

        if (refs.size() != rule.getPremiseCount()) {
            return "Riga " + n + ": " + rule.getRuleName() + " richiede " + rule.getPremiseCount()
                    + " riga/e citata/e, trovate " + refs.size() + ".";
        }

        List<Formula> cited = resolveReferences(n, refs, accepted);
        if (cited == null) {
            return referenceError(n, refs, accepted);
        }

        List<Application> matching = InferenceRuleEngine.matchingApplications(rule, cited, line.getFormula());
        if (matching.isEmpty()) {
            return "Riga " + n + ": le righe " + refs + " non corrispondono allo schema di " + rule.getRuleName() + ".";
        }
        for (Application application : matching) {
            if (application.conclusion().equals(line.getFormula())) {
                return null;
            }
        }
        return "Riga " + n + ": la formula non segue per " + rule.getRuleName() + " dalle righe " + refs + ".";
    }

    private static String validateReplacement(ProofLine line, ReplacementRule rule, Map<Integer, Formula> accepted) {
        int n = line.getLineNumber();
        List<Integer> refs = line.getJustification().getLineReferences();

        if (refs.size() != 1) {
            return "Riga " + n + ": " + rule.getRuleName() + " richiede esattamente una riga citata.";
        }

        List<Formula> cited = resolveReferences(n, refs, accepted);
        if (cited == null) {
            return referenceError(n, refs, accepted);
        }

        if (!ReplacementRuleEngine.isValidReplacement(rule, cited.get(0), line.getFormula())) {
            return "Riga " + n + ": la formula non si ottiene dalla riga " + refs.get(0)
                    + " con una sostituzione di " + rule.getRuleName() + ".";
        }
        return null;
    }

    /**
     * @return formule delle righe citate o null se una citazione non è valida
     */
    private static List<Formula> resolveReferences(int current, List<Integer> refs, Map<Integer, Formula> accepted) {
        List<Formula> cited = new ArrayList<>(refs.size());
        for (int ref : refs) {
            Formula formula = accepted.get(ref);
            if (ref >= current || formula == null) return null;
            cited.add(formula);
        }
        return cited;
    }

    private static String referenceError(int current, List<Integer> refs, Map<Integer, Formula> accepted) {
        for (int ref : refs) {
            if (ref >= current) {
                return "Riga " + current + " cita la riga " + ref + " che non la precede.";
            }
            if (!accepted.containsKey(ref)) {
                return "Riga " + current + " cita la riga inesistente " + ref + ".";
            }
        }
        return "Riga " + current + ": citazioni non valide " + refs + ".";
    }
}
