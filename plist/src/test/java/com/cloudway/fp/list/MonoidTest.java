/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Optional;

import org.junit.Test;
import static org.junit.Assert.*;

public class MonoidTest
{
    @Test
    public void numericInstances() {
        assertEquals(10, (int)PList.of(1, 2, 3, 4).fold(Monoid.intSum));
        assertEquals(24, (int)PList.of(1, 2, 3, 4).fold(Monoid.intProduct));
        assertEquals(0, (int)PList.<Integer>nil().fold(Monoid.intSum));
        assertEquals(1, (int)PList.<Integer>nil().fold(Monoid.intProduct));
        assertEquals(120L, (long)PList.of(1L, 2L, 3L, 4L, 5L).fold(Monoid.longProduct));
        assertEquals(2.5, PList.of(1.0, 1.5).fold(Monoid.doubleSum), 1e-9);
        assertEquals(3.0, PList.of(2.0, 1.5).fold(Monoid.doubleProduct), 1e-9);
        assertEquals(1.0, PList.<Double>nil().fold(Monoid.doubleProduct), 0.0);
        assertEquals(new BigDecimal("3.75"), PList.of(new BigDecimal("1.5"), new BigDecimal("2.25")).fold(Monoid.bigDecimalSum));
        assertEquals(BigDecimal.ZERO, PList.<BigDecimal>nil().fold(Monoid.bigDecimalSum));
        assertEquals(BigInteger.valueOf(6), PList.of(BigInteger.ONE, BigInteger.valueOf(2), BigInteger.valueOf(3)).fold(Monoid.bigIntProduct));
    }

    @Test
    public void booleanInstances() {
        assertTrue(PList.of(true, true).fold(Monoid.conjunction));
        assertFalse(PList.of(true, false).fold(Monoid.conjunction));
        assertTrue(PList.of(false, true).fold(Monoid.disjunction));
        assertTrue(PList.<Boolean>nil().fold(Monoid.conjunction));
        assertFalse(PList.<Boolean>nil().fold(Monoid.disjunction));
    }

    @Test
    public void stringConcat() {
        assertEquals("abc", PList.of("a", "b", "c").fold(Monoid.stringConcat));
        assertEquals("", PList.<String>nil().fold(Monoid.stringConcat));
    }

    @Test
    public void listConcat() {
        PList<PList<Integer>> lists = PList.of(PList.of(1, 2), PList.<Integer>nil(), PList.of(3));
        assertEquals(PList.of(1, 2, 3), lists.fold(Monoid.ofList()));
    }

    @Test
    public void optionalInstances() {
        PList<Optional<Integer>> xs = PList.of(Optional.empty(), Optional.of(3), Optional.of(7), Optional.of(5));
        assertEquals(Optional.of(3), xs.fold(Monoid.first()));
        assertEquals(Optional.of(7), xs.fold(Monoid.max(Comparator.<Integer>naturalOrder())));
        assertEquals(Optional.empty(), PList.<Optional<Integer>>nil().fold(Monoid.first()));
    }

    @Test
    public void customMonoid() {
        Monoid<Integer> max = Monoid.monoid(Integer.MIN_VALUE, Math::max);
        assertEquals(9, (int)PList.of(3, 9, 2).fold(max));
        assertEquals(Integer.MIN_VALUE, (int)max.concat(PList.nil()));
    }
}
