/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import static org.junit.Assert.*;

public class FilterNotTest
{
    @Test
    public void emptyList() {
        PList<Integer> xs = PList.nil();
        assertTrue(xs.filterNot(x -> x % 2 == 0).isEmpty());
        assertTrue(xs.filterNot(x -> x % 2 != 0).isEmpty());
        assertTrue(xs.isEmpty());
    }

    @Test
    public void singleElement() {
        PList<Integer> xs = PList.of(123);
        assertEquals(xs, xs.filterNot(x -> x % 2 == 0));
        assertTrue(xs.filterNot(x -> x % 2 != 0).isEmpty());
        assertEquals(PList.of(123), xs);
    }

    @Test
    public void multipleElements() {
        PList<Integer> xs = PList.of(1, 2, 4, 5, 6);
        assertEquals(PList.of(1, 5), xs.filterNot(x -> x % 2 == 0));
        assertEquals(PList.of(2, 4, 6), xs.filterNot(x -> x % 2 != 0));
        assertEquals(PList.of(1, 2, 4, 5, 6), xs);
    }

    @Test
    public void elementsAreSharedNotCopied() {
        PList<AtomicInteger> ys = PList.of(11, 12, 14, 15, 16).map(AtomicInteger::new);

        PList<AtomicInteger> odd = ys.filterNot(p -> p.get() % 2 == 0);
        assertEquals(2, odd.size());
        assertSame(ys.get(0), odd.get(0));
        assertSame(ys.get(3), odd.get(1));

        PList<AtomicInteger> even = ys.filterNot(p -> p.get() % 2 != 0);
        assertEquals(3, even.size());
        assertEquals(12, even.get(0).get());
        assertEquals(14, even.get(1).get());
        assertEquals(16, even.get(2).get());

        assertTrue(ys.filterNot(p -> true).isEmpty());
        assertEquals(ys, ys.filterNot(p -> false));
        assertEquals(5, ys.size());
        assertEquals(PList.of(11, 12, 14, 15, 16), ys.map(AtomicInteger::get));
    }

    @Test
    public void predicateInvokedOncePerElement() {
        AtomicInteger calls = new AtomicInteger();
        PList.range(0, 10).filterNot(x -> { calls.incrementAndGet(); return x > 4; });
        assertEquals(10, calls.get());
    }
}
