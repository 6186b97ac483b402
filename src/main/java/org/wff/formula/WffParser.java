package org.wff.formula;

import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.Token;
import org.wff.antlr.WffGrammarBaseVisitor;
import org.wff.antlr.WffGrammarParser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER WFF - Analisi delle sequenze di tessere con la grammatica ANTLR
 *
 * GRAMMATICA (WffGrammar.g4):
 * <pre>
 *   formula := wff EOF
 *   wff     := term (BINARY_OPERATOR term)?
 *   term    := VARIABLE | NOT term | '(' wff ')'
 * </pre>
 *
 * Le tessere vengono convertite in token e passate al parser generato tramite una
 * {@link ListTokenSource}; un visitor costruisce poi il {@link FormulaNode}.
 * Qualsiasi errore sintattico segnalato al listener rende il risultato null.
 *
 * SERIALIZZAZIONE:
 * treeToFormula produce la forma canonica completamente parentesizzata; vale
 * parse(treeToFormula(n)) = n per ogni albero n.
 */
public final class WffParser {

    private static final Logger LOGGER = Logger.getLogger(WffParser.class.getName());

    private WffParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region ANALISI

    /**
     * Analizza una formula e ne restituisce l'albero sintattico.
     *
     * @param formula formula da analizzare
     * @return albero sintattico o null se la formula non è ben formata
     */
    public static FormulaNode parse(Formula formula) {
        if (formula == null) return null;
        return formula.getNode();
    }

    /**
     * Analizza direttamente una sequenza di tessere.
     *
     * @return albero sintattico o null se la sequenza è vuota o malformata
     */
    static FormulaNode parseTiles(List<Tile> tiles) {
        if (tiles.isEmpty()) {
            LOGGER.finest("Sequenza vuota: nessuna formula");
            return null;
        }

        List<Token> tokens = new ArrayList<>(tiles.size());
        for (Tile tile : tiles) {
            tokens.add(new CommonToken(tokenType(tile), tile.getSymbol()));
        }

        WffGrammarParser parser = new WffGrammarParser(new CommonTokenStream(new ListTokenSource(tokens)));
        CollectingErrorListener errorListener = new CollectingErrorListener();
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        WffGrammarParser.FormulaContext tree = parser.formula();
        if (errorListener.hasErrors()) {
            LOGGER.finest(() -> "Sequenza non ben formata " + tiles + ": " + errorListener.getFirstError());
            return null;
        }
        return new NodeBuilder().visit(tree);
    }

    private static int tokenType(Tile tile) {
        return switch (tile.getType()) {
            case VARIABLE -> WffGrammarParser.VARIABLE;
            case UNARY_OPERATOR -> WffGrammarParser.NOT;
            case LEFT_PAREN -> WffGrammarParser.LPAREN;
            case RIGHT_PAREN -> WffGrammarParser.RPAREN;
            case BINARY_OPERATOR -> binaryTokenType(tile);
        };
    }

    private static int binaryTokenType(Tile tile) {
        if (tile.equals(Tiles.AND)) return WffGrammarParser.AND;
        if (tile.equals(Tiles.OR)) return WffGrammarParser.OR;
        if (tile.equals(Tiles.IMPLIES)) return WffGrammarParser.IMPLIES;
        if (tile.equals(Tiles.IFF)) return WffGrammarParser.IFF;
        throw new IllegalArgumentException("Connettivo binario sconosciuto: " + tile);
    }

    /**
     * Visitor che costruisce l'albero sintattico dal parse tree ANTLR.
     * Il testo di ogni token è il simbolo canonico della tessera di origine.
     */
    private static final class NodeBuilder extends WffGrammarBaseVisitor<FormulaNode> {

        @Override
        public FormulaNode visitFormula(WffGrammarParser.FormulaContext ctx) {
            return visit(ctx.wff());
        }

        @Override
        public FormulaNode visitWff(WffGrammarParser.WffContext ctx) {
            FormulaNode left = visit(ctx.left);
            if (ctx.op == null) return left;
            return FormulaNode.binary(Tiles.fromSymbol(ctx.op.getText()), left, visit(ctx.right));
        }

        @Override
        public FormulaNode visitVariable(WffGrammarParser.VariableContext ctx) {
            return FormulaNode.variable(Tiles.fromSymbol(ctx.VARIABLE().getText()));
        }

        @Override
        public FormulaNode visitNegation(WffGrammarParser.NegationContext ctx) {
            return FormulaNode.unary(Tiles.NOT, visit(ctx.term()));
        }

        @Override
        public FormulaNode visitGroup(WffGrammarParser.GroupContext ctx) {
            return visit(ctx.wff());
        }
    }

    //endregion

    //region SERIALIZZAZIONE

    /**
     * Serializza un albero nella forma canonica completamente parentesizzata.
     *
     * @param node albero da serializzare (non null)
     * @return formula canonica
     */
    public static Formula treeToFormula(FormulaNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Albero sintattico non può essere null");
        }
        List<Tile> tiles = new ArrayList<>();
        appendTiles(node, tiles);
        return new Formula(tiles, node);
    }

    private static void appendTiles(FormulaNode node, List<Tile> out) {
        switch (node.getKind()) {
            case VARIABLE -> out.add(node.getTile());
            case UNARY -> {
                out.add(node.getTile());
                appendTiles(node.getChild(), out);
            }
            case BINARY -> {
                out.add(Tiles.LEFT_PAREN);
                appendTiles(node.getLeft(), out);
                out.add(node.getTile());
                appendTiles(node.getRight(), out);
                out.add(Tiles.RIGHT_PAREN);
            }
        }
    }

    //endregion
}
