package org.wff.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener ANTLR che registra gli errori invece di stamparli su console.
 * Usato sia dal lexer del testo sia dal parser delle tessere.
 */
final class CollectingErrorListener extends BaseErrorListener {

    private final List<String> errors = new ArrayList<>();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        errors.add("posizione " + charPositionInLine + ": " + msg);
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }

    String getFirstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
