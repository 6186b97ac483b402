package org.wff.proof;

/**
 * Esito della validazione di una dimostrazione.
 * In caso di errore il messaggio indica la prima riga non valida.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(true, null);

    private final boolean valid;
    private final String errorMessage;

    private ValidationResult(boolean valid, String errorMessage) {
        this.valid = valid;
        this.errorMessage = errorMessage;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    /**
     * @param errorMessage diagnostica della prima riga non valida (non null)
     */
    public static ValidationResult invalid(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("Risultato non valido richiede un messaggio di errore");
        }
        return new ValidationResult(false, errorMessage);
    }

    public boolean isValid() {
        return valid;
    }

    /** @return messaggio di errore, null se la dimostrazione è valida */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return valid ? "VALIDA" : "NON VALIDA: " + errorMessage;
    }
}
