package org.dice.logic.minimization;

import org.dice.logic.parsing.ast.operands.Constant;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TestImplicant {

    private static final List<String> ABC = Arrays.asList("A", "B", "C");

    @Test
    public void mergesWhenExactlyOneBitDiffers() {
        Implicant m5 = Implicant.ofMinterm(5, 3);
        Implicant m7 = Implicant.ofMinterm(7, 3);
        assertTrue(m5.canMerge(m7));

        Implicant merged = m5.merge(m7);
        assertEquals("1-1", merged.getPattern());
        assertEquals(Arrays.asList(5, 7), Arrays.asList(merged.getMinterms().toArray()));
        assertEquals(2, merged.getLiteralCount());
    }

    @Test
    public void doesNotMergeAcrossTwoBitsOrDifferentMasks() {
        assertFalse(Implicant.ofMinterm(0, 3).canMerge(Implicant.ofMinterm(3, 3)));
        Implicant zeroDash = Implicant.ofMinterm(0, 3).merge(Implicant.ofMinterm(1, 3));
        Implicant twoDash = Implicant.ofMinterm(6, 3).merge(Implicant.ofMinterm(4, 3));
        assertEquals("00-", zeroDash.getPattern());
        assertEquals("1-0", twoDash.getPattern());
        assertFalse(zeroDash.canMerge(twoDash));
    }

    @Test
    public void coversMintermsMatchingFixedBits() {
        Implicant oneDashOne = Implicant.ofMinterm(5, 3).merge(Implicant.ofMinterm(7, 3));
        assertTrue(oneDashOne.covers(5));
        assertTrue(oneDashOne.covers(7));
        assertFalse(oneDashOne.covers(4));
        assertFalse(oneDashOne.covers(1));
    }

    @Test
    public void translatesToProductTerm() {
        assertEquals("((A AND NOT B) AND C)", Implicant.ofMinterm(5, 3).toExpression(ABC).render());
        Implicant dashOneDash = Implicant.ofMinterm(2, 3).merge(Implicant.ofMinterm(3, 3))
                .merge(Implicant.ofMinterm(6, 3).merge(Implicant.ofMinterm(7, 3)));
        assertEquals("-1-", dashOneDash.getPattern());
        assertEquals("B", dashOneDash.toExpression(ABC).render());
    }

    @Test
    public void longProductTermsNestAsBalancedTree() {
        List<String> abcde = Arrays.asList("A", "B", "C", "D", "E");
        assertEquals("(((NOT A AND B) AND NOT C) AND (D AND NOT E))",
                Implicant.ofMinterm(10, 5).toExpression(abcde).render());
    }

    @Test
    public void implicantWithoutLiteralsIsTrue() {
        assertSame(Constant.TRUE, Implicant.ofMinterm(0, 0).toExpression(Arrays.<String>asList()));
    }

    @Test
    public void equalityIgnoresCoveredMinterms() {
        Implicant a = Implicant.ofMinterm(4, 3).merge(Implicant.ofMinterm(5, 3));
        Implicant b = Implicant.ofMinterm(5, 3).merge(Implicant.ofMinterm(4, 3));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
