package org.wff.generator;

import org.junit.jupiter.api.Test;
import org.wff.formula.Formula;
import org.wff.formula.FormulaReader;
import org.wff.formula.Tiles;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VarListsTest {

    private static Formula f(String text) {
        return FormulaReader.readWellFormed(text);
    }

    @Test
    void oppositePolarityIsRefused() {
        VarLists vars = VarLists.create(new Random(1));

        assertEquals(f("p"), vars.useAtomicAssertion(f("p")));
        assertEquals(f("p"), vars.useAtomicAssertion(f("p")));
        assertNull(vars.useAtomicAssertion(f("~p")));
        assertEquals(List.of(f("p")), vars.getUsed());
        assertFalse(vars.getAvailable().contains(Tiles.variable('p')));
    }

    @Test
    void variablesOutsideAlphabetAreRefused() {
        VarLists vars = VarLists.create(new Random(1));
        assertNull(vars.useAtomicAssertion(f("a")));
        assertThrows(IllegalArgumentException.class, () -> vars.useAtomicAssertion(f("p & q")));
    }

    @Test
    void drawsUntilExhausted() {
        VarLists vars = VarLists.create(List.of(Tiles.variable('p'), Tiles.variable('q')), new Random(3));

        Formula first = vars.drawFreshVariable();
        Formula second = vars.drawFreshVariable();
        assertNotNull(first);
        assertNotNull(second);
        assertNotEquals(first, second);
        assertNull(vars.drawFreshVariable());

        // una variabile riservata può ancora essere impegnata
        assertEquals(Formula.not(first), vars.useAtomicAssertion(Formula.not(first)));
    }

    @Test
    void copyIsIndependent() {
        VarLists vars = VarLists.create(new Random(5));
        VarLists copy = vars.copy();

        copy.useAtomicAssertion(f("q"));
        assertTrue(vars.getUsed().isEmpty());
        assertEquals(8, vars.getAvailable().size());
        assertEquals(7, copy.getAvailable().size());
    }

    @Test
    void useAllIsAllOrNothing() {
        VarLists vars = VarLists.create(new Random(5));
        vars.useAtomicAssertion(f("r"));

        Set<Formula> conflicting = new LinkedHashSet<>(List.of(f("p"), f("~r")));
        assertFalse(vars.useAll(conflicting));
        assertEquals(List.of(f("r")), vars.getUsed());

        Set<Formula> compatible = new LinkedHashSet<>(List.of(f("p"), f("~s")));
        assertTrue(vars.useAll(compatible));
        assertEquals(List.of(f("r"), f("p"), f("~s")), vars.getUsed());
    }

    @Test
    void atomicAssertionsFollowDirectNegation() {
        assertEquals(new LinkedHashSet<>(List.of(f("~p"), f("q"), f("r"))),
                VarLists.getAtomicAssertions(f("(~p & q) | r")));
        assertEquals(new LinkedHashSet<>(List.of(f("p"), f("q"))),
                VarLists.getAtomicAssertions(f("~(p & q)")));
    }

    @Test
    void consistencyOverSeveralFormulas() {
        assertTrue(VarLists.isConsistent(List.of(f("p -> q"), f("p"), f("r | s"))));
        assertFalse(VarLists.isConsistent(List.of(f("p -> q"), f("~q"))));
        assertEquals(Tiles.variable('t'), VarLists.getBaseVariable(f("~t")));
    }
}
