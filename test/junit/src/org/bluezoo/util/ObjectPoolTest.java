/*
 * ObjectPoolTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of chryssie, an incremental template parser.
 *
 * chryssie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * chryssie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with chryssie.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.util;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ObjectPool}, {@link RingDequePool} and
 * {@link StringBuilderPool}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ObjectPoolTest {

    @Test
    public void testLeaseReturnsInstance() {
        RingDequePool<String> pool = new RingDequePool<String>(2);
        RingDeque<String> first;
        try (ObjectPool.Lease<RingDeque<String>> lease = pool.acquire()) {
            first = lease.get();
            first.push("x");
        }
        assertEquals(1, pool.getAvailableCount());
        try (ObjectPool.Lease<RingDeque<String>> lease = pool.acquire()) {
            assertSame(first, lease.get());
            assertTrue(lease.get().isEmpty());
            assertEquals(0, pool.getAvailableCount());
        }
    }

    @Test
    public void testRetentionBound() {
        RingDequePool<String> pool = new RingDequePool<String>(1);
        ObjectPool.Lease<RingDeque<String>> a = pool.acquire();
        ObjectPool.Lease<RingDeque<String>> b = pool.acquire();
        assertNotSame(a.get(), b.get());
        assertTrue(a.free());
        assertFalse(b.free());
        assertEquals(1, pool.getAvailableCount());
        assertEquals(1, pool.getMaxRetained());
    }

    @Test
    public void testLargeDequeDropped() {
        RingDequePool<Integer> pool = new RingDequePool<Integer>(2);
        ObjectPool.Lease<RingDeque<Integer>> lease = pool.acquire();
        RingDeque<Integer> deque = lease.get();
        for (int i = 0; i < RingDequePool.MAX_RETAINED_CAPACITY; i++) {
            deque.push(i);
        }
        assertTrue(deque.capacity() >= RingDequePool.MAX_RETAINED_CAPACITY);
        assertFalse(lease.free());
        assertEquals(0, pool.getAvailableCount());
    }

    @Test
    public void testLargeBuilderDropped() {
        StringBuilderPool pool = new StringBuilderPool(2);
        ObjectPool.Lease<StringBuilder> small = pool.acquire();
        small.get().append("hello");
        assertTrue(small.free());

        ObjectPool.Lease<StringBuilder> reused = pool.acquire();
        assertEquals(0, reused.get().length());
        StringBuilder buf = reused.get();
        buf.ensureCapacity(StringBuilderPool.MAX_RETAINED_CAPACITY);
        assertFalse(reused.free());
        assertEquals(0, pool.getAvailableCount());
    }

    @Test
    public void testFreeIdempotent() {
        StringBuilderPool pool = new StringBuilderPool(2);
        ObjectPool.Lease<StringBuilder> lease = pool.acquire();
        assertTrue(lease.free());
        assertFalse(lease.free());
        lease.close();
        assertEquals(1, pool.getAvailableCount());
    }

    @Test(expected = IllegalStateException.class)
    public void testGetAfterClose() {
        StringBuilderPool pool = new StringBuilderPool(2);
        ObjectPool.Lease<StringBuilder> lease = pool.acquire();
        lease.close();
        lease.get();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeRetention() {
        new StringBuilderPool(-1);
    }

    @Test
    public void testConcurrentUse() throws Exception {
        final RingDequePool<Integer> pool = new RingDequePool<Integer>(4);
        Thread[] threads = new Thread[8];
        final Throwable[] failure = new Throwable[1];
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread() {
                @Override
                public void run() {
                    try {
                        for (int i = 0; i < 1000; i++) {
                            try (ObjectPool.Lease<RingDeque<Integer>> lease = pool.acquire()) {
                                RingDeque<Integer> deque = lease.get();
                                assertTrue(deque.isEmpty());
                                deque.push(i);
                                deque.push(i + 1);
                                assertEquals(Integer.valueOf(i + 1), deque.pop());
                            }
                        }
                    } catch (Throwable e) {
                        synchronized (failure) {
                            failure[0] = e;
                        }
                    }
                }
            };
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        synchronized (failure) {
            if (failure[0] != null) {
                throw new AssertionError(failure[0]);
            }
        }
        assertTrue(pool.getAvailableCount() <= 4);
    }

}
