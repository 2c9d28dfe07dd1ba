/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Many threads read lists that share a common suffix.
 */
public class ConcurrentReadTest
{
    private static final int THREADS = 8;
    private static final int SIZE = 10_000;

    private ExecutorService executor;

    @Before
    public void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @After
    public void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
    }

    @Test(timeout = 30000)
    public void sharedChainReadConcurrently() throws Exception {
        PList<Integer> shared = PList.range(0, SIZE);
        long expectedSum = (long)SIZE * (SIZE - 1) / 2;

        List<Callable<Long>> tasks = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            int id = t;
            tasks.add(() -> {
                // each reader derives its own list from the same suffix
                PList<Integer> mine = shared.drop(id).prepend(-id);
                long sum = 0;
                for (int x : shared) {
                    sum += x;
                }
                assertEquals(SIZE - id + 1, mine.size());
                assertEquals(-id, (int)mine.head());
                assertSame(Node.skip(shared.root(), id), mine.tail().root());
                assertEquals(shared.drop(id), mine.tail());
                assertEquals(shared, shared.sorted());
                return sum;
            });
        }

        for (Future<Long> f : executor.invokeAll(tasks)) {
            assertEquals(expectedSum, (long)f.get());
        }
        assertEquals(SIZE, shared.size());
        assertEquals(PList.range(0, SIZE), shared);
    }
}
