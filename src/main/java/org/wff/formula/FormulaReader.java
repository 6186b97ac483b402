package org.wff.formula;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.wff.antlr.WffGrammarLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * LETTORE DI FORMULE - Conversione da testo a sequenza di tessere
 *
 * Usa il lexer ANTLR generato da WffGrammar.g4 e traduce ogni token nella tessera
 * canonica corrispondente, accettando sia i simboli Unicode sia le grafie ASCII:
 * • ¬ ~ !   negazione
 * • ∧ &     congiunzione
 * • ∨ |     disgiunzione
 * • → ->    implicazione
 * • ↔ <->   doppia implicazione
 *
 * Gli spazi vengono ignorati. Un carattere non riconosciuto rende il risultato assente.
 */
public final class FormulaReader {

    private static final Logger LOGGER = Logger.getLogger(FormulaReader.class.getName());

    private FormulaReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte un testo in formula (ben formata o meno).
     *
     * @param text testo della formula
     * @return formula corrispondente o null se il testo contiene simboli non ammessi
     */
    public static Formula read(String text) {
        if (text == null) return null;

        WffGrammarLexer lexer = new WffGrammarLexer(CharStreams.fromString(text));
        CollectingErrorListener errorListener = new CollectingErrorListener();
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        List<? extends Token> tokens = lexer.getAllTokens();
        if (errorListener.hasErrors()) {
            LOGGER.fine(() -> "Testo non riconosciuto '" + text + "': " + errorListener.getFirstError());
            return null;
        }

        List<Tile> tiles = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            tiles.add(toTile(token));
        }
        return new Formula(tiles);
    }

    /**
     * Converte un testo direttamente in albero sintattico.
     *
     * @return albero o null se il testo non rappresenta una formula ben formata
     */
    public static FormulaNode parse(String text) {
        Formula formula = read(text);
        return formula == null ? null : formula.getNode();
    }

    /**
     * Come {@link #read(String)} ma restituisce la formula solo se ben formata.
     */
    public static Formula readWellFormed(String text) {
        Formula formula = read(text);
        return formula != null && formula.isWellFormed() ? formula : null;
    }

    private static Tile toTile(Token token) {
        return switch (token.getType()) {
            case WffGrammarLexer.NOT -> Tiles.NOT;
            case WffGrammarLexer.AND -> Tiles.AND;
            case WffGrammarLexer.OR -> Tiles.OR;
            case WffGrammarLexer.IMPLIES -> Tiles.IMPLIES;
            case WffGrammarLexer.IFF -> Tiles.IFF;
            case WffGrammarLexer.LPAREN -> Tiles.LEFT_PAREN;
            case WffGrammarLexer.RPAREN -> Tiles.RIGHT_PAREN;
            case WffGrammarLexer.VARIABLE -> Tiles.variable(token.getText().charAt(0));
            default -> throw new IllegalStateException("Token inatteso dal lexer: " + token);
        };
    }
}
