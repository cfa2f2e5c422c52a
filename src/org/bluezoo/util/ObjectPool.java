/*
 * ObjectPool.java
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

import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Bounded pool of reusable scratch objects.
 *
 * <p>Objects are leased from the pool and returned when the lease is
 * closed. If the pool is empty a new instance is created. On return the
 * subclass decides through {@link #beginFree} whether the instance is fit
 * to be retained (for example, not grown past a size threshold) and resets
 * it; if it is not, or if every slot is occupied, the instance is simply
 * discarded.
 *
 * <p>Usage pattern:
 * <pre>
 * try (ObjectPool.Lease&lt;StringBuilder&gt; lease = pool.acquire()) {
 *     StringBuilder buf = lease.get();
 *     // ... use buf ...
 * }
 * </pre>
 *
 * <p>Slots are claimed and released with compare-and-set, so a pool may be
 * shared between threads. A leased instance belongs to the leasing thread
 * until the lease is closed.
 *
 * @param <T> the pooled type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class ObjectPool<T> {

    /**
     * Default number of retained instances, overridable with the
     * {@code chryssie.pool.maxRetained} system property.
     */
    static final int DEFAULT_MAX_RETAINED = Integer.getInteger("chryssie.pool.maxRetained",
            Runtime.getRuntime().availableProcessors() * 2);

    private final AtomicReferenceArray<T> slots;

    /**
     * Creates a pool retaining the default number of instances.
     */
    protected ObjectPool() {
        this(DEFAULT_MAX_RETAINED);
    }

    /**
     * Creates a pool retaining at most the given number of instances.
     *
     * @param maxRetained the maximum number of idle instances kept
     * @throws IllegalArgumentException if maxRetained is negative
     */
    protected ObjectPool(int maxRetained) {
        if (maxRetained < 0) {
            throw new IllegalArgumentException("maxRetained must not be negative: " + maxRetained);
        }
        slots = new AtomicReferenceArray<T>(maxRetained);
    }

    /**
     * Leases an instance, creating one if none is idle.
     *
     * @return a lease that must be closed to return the instance
     */
    public Lease<T> acquire() {
        T instance = poll();
        if (instance == null) {
            instance = createInstance();
            if (instance == null) {
                throw new IllegalStateException("createInstance returned null");
            }
        }
        return new Lease<T>(this, instance);
    }

    /**
     * Returns the number of idle instances currently retained.
     *
     * @return the idle instance count
     */
    public int getAvailableCount() {
        int available = 0;
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i) != null) {
                available++;
            }
        }
        return available;
    }

    /**
     * Returns the maximum number of idle instances this pool retains.
     *
     * @return the retention limit
     */
    public int getMaxRetained() {
        return slots.length();
    }

    /**
     * Creates a new instance when no idle one is available.
     *
     * @return a new instance, never null
     */
    protected abstract T createInstance();

    /**
     * Prepares an instance for retention.
     * Implementations reset the instance and return {@code false} to
     * reject instances that should not be retained.
     *
     * @param instance the instance being returned
     * @return true if the instance may be retained
     */
    protected abstract boolean beginFree(T instance);

    private T poll() {
        for (int i = 0; i < slots.length(); i++) {
            T instance = slots.get(i);
            if (instance != null && slots.compareAndSet(i, instance, null)) {
                return instance;
            }
        }
        return null;
    }

    /**
     * Offers an instance back to the pool.
     *
     * @return true if the instance was retained
     */
    boolean free(T instance) {
        if (!beginFree(instance)) {
            return false;
        }
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i) == null && slots.compareAndSet(i, null, instance)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A scoped lease of a pooled instance.
     * Closing the lease returns the instance to the pool; further closes
     * have no effect.
     *
     * @param <T> the pooled type
     */
    public static final class Lease<T> implements AutoCloseable {

        private final T instance;
        private ObjectPool<T> pool;

        Lease(ObjectPool<T> pool, T instance) {
            this.pool = pool;
            this.instance = instance;
        }

        /**
         * Returns the leased instance.
         *
         * @return the instance
         * @throws IllegalStateException if the lease has been closed
         */
        public T get() {
            if (pool == null) {
                throw new IllegalStateException("Lease already closed");
            }
            return instance;
        }

        /**
         * Returns the instance to the pool.
         *
         * @return true if the pool retained the instance, false if it was
         *         rejected or the lease was already closed
         */
        public boolean free() {
            ObjectPool<T> p = pool;
            if (p == null) {
                return false;
            }
            pool = null;
            return p.free(instance);
        }

        @Override
        public void close() {
            free();
        }
    }

}
