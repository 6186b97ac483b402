package org.wff.formula;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WffParserTest {

    private static Formula tiles(Tile... tiles) {
        return new Formula(List.of(tiles));
    }

    @Test
    void parsesVariableNegationAndBinary() {
        FormulaNode p = FormulaNode.variable('p');
        FormulaNode q = FormulaNode.variable('q');

        assertEquals(p, WffParser.parse(tiles(Tiles.variable('p'))));
        assertEquals(FormulaNode.not(FormulaNode.not(p)),
                WffParser.parse(tiles(Tiles.NOT, Tiles.NOT, Tiles.variable('p'))));
        assertEquals(FormulaNode.implies(p, q),
                WffParser.parse(tiles(Tiles.LEFT_PAREN, Tiles.variable('p'), Tiles.IMPLIES, Tiles.variable('q'), Tiles.RIGHT_PAREN)));
    }

    @Test
    void acceptsUnparenthesizedTopLevelBinary() {
        FormulaNode node = WffParser.parse(tiles(Tiles.variable('p'), Tiles.OR, Tiles.variable('q')));
        assertNotNull(node);
        assertTrue(node.isDisjunction());
    }

    @Test
    void rejectsMalformedSequences() {
        Tile p = Tiles.variable('p');
        Tile q = Tiles.variable('q');
        Tile r = Tiles.variable('r');

        assertNull(WffParser.parse(tiles()));
        assertNull(WffParser.parse(tiles(Tiles.LEFT_PAREN, p, Tiles.AND, q)));
        assertNull(WffParser.parse(tiles(Tiles.LEFT_PAREN, p, Tiles.AND, q, Tiles.RIGHT_PAREN, r)));
        assertNull(WffParser.parse(tiles(Tiles.LEFT_PAREN, p, Tiles.AND, Tiles.RIGHT_PAREN)));
        assertNull(WffParser.parse(tiles(p, Tiles.AND, q, Tiles.OR, r)));
        assertNull(WffParser.parse(tiles(Tiles.NOT)));
        assertNull(WffParser.parse(tiles(p, q)));
        assertNull(WffParser.parse(tiles(Tiles.RIGHT_PAREN, p)));
    }

    @Test
    void nestedGroupsAndNegatedGroups() {
        Tile p = Tiles.variable('p');
        Tile q = Tiles.variable('q');

        assertEquals(FormulaNode.variable('p'),
                WffParser.parse(tiles(Tiles.LEFT_PAREN, Tiles.LEFT_PAREN, p, Tiles.RIGHT_PAREN, Tiles.RIGHT_PAREN)));
        assertEquals(FormulaNode.not(FormulaNode.iff(FormulaNode.variable('p'), FormulaNode.variable('q'))),
                WffParser.parse(tiles(Tiles.NOT, Tiles.LEFT_PAREN, p, Tiles.IFF, q, Tiles.RIGHT_PAREN)));
        assertNull(WffParser.parse(tiles(Tiles.LEFT_PAREN, Tiles.RIGHT_PAREN)));
        assertNull(WffParser.parse(tiles(Tiles.NOT, Tiles.LEFT_PAREN, p, Tiles.RIGHT_PAREN, Tiles.RIGHT_PAREN)));
    }

    @Test
    void canonicalFormulaMatchesReparsedTiles() {
        FormulaNode node = FormulaReader.parse("(p & ~q) -> (r | s)");
        Formula canonical = Formula.of(node);
        Formula reparsed = new Formula(canonical.getTiles());

        assertEquals(node, reparsed.getNode());
        assertEquals(canonical, reparsed);
    }

    @Test
    void constructionFromImmutableListsRejectsNullTiles() {
        assertTrue(tiles(Tiles.variable('p')).isWellFormed());
        assertThrows(IllegalArgumentException.class, () -> new Formula(Arrays.asList(Tiles.variable('p'), null)));
        assertThrows(IllegalArgumentException.class, () -> new Formula(null));
    }

    @Test
    void rejectsChainedImplicationAfterParenthesizedConjunct() {
        assertNull(FormulaReader.parse("(p->s) & q->v"));
        assertNotNull(FormulaReader.parse("((p->s) & q)->v"));
    }

    @Test
    void treeToFormulaProducesFullyParenthesizedForm() {
        FormulaNode node = FormulaNode.not(FormulaNode.or(FormulaNode.variable('p'),
                FormulaNode.and(FormulaNode.variable('q'), FormulaNode.not(FormulaNode.variable('r')))));

        assertEquals("¬(p∨(q∧¬r))", WffParser.treeToFormula(node).toString());
    }

    @Test
    void roundTripPreservesTree() {
        List<String> samples = List.of("p", "~~p", "p -> q", "((p & q) -> r)", "~(p <-> ~q)",
                "((p | q) & (r -> ~s)) -> (t | u)");
        for (String sample : samples) {
            FormulaNode node = FormulaReader.parse(sample);
            assertNotNull(node, sample);
            assertEquals(node, WffParser.parse(WffParser.treeToFormula(node)), sample);
        }
    }

    @Test
    void equalityIgnoresOptionalOuterParentheses() {
        Formula bare = FormulaReader.read("p | q");
        Formula wrapped = FormulaReader.read("(p | q)");

        assertEquals(bare, wrapped);
        assertEquals(bare.hashCode(), wrapped.hashCode());
        assertNotEquals(bare, FormulaReader.read("q | p"));
    }

    @Test
    void malformedFormulasCompareByTiles() {
        Formula first = tiles(Tiles.variable('p'), Tiles.AND);
        Formula second = tiles(Tiles.variable('p'), Tiles.AND);

        assertFalse(first.isWellFormed());
        assertEquals(first, second);
        assertNotEquals(first, FormulaReader.read("p"));
    }

    @Test
    void nodeMetrics() {
        FormulaNode node = FormulaReader.parse("(p -> q) & ~r");
        assertEquals(6, node.size());
        assertEquals(2, node.depth());
        assertTrue(node.containsSubtree(FormulaReader.parse("p -> q")));
        assertFalse(node.containsSubtree(FormulaReader.parse("q -> p")));
    }
}
