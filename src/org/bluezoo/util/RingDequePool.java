/*
 * RingDequePool.java
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

/**
 * Pool of {@link RingDeque} work stacks.
 * Deques that have grown to {@link #MAX_RETAINED_CAPACITY} or beyond are
 * not retained, which bounds the memory a pool can hold on to after an
 * unusually deep traversal.
 *
 * @param <E> the element type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RingDequePool<E> extends ObjectPool<RingDeque<E>> {

    static final int MAX_RETAINED_CAPACITY = 128;
    static final int INITIAL_CAPACITY = 8;

    public RingDequePool() {
        super();
    }

    public RingDequePool(int maxRetained) {
        super(maxRetained);
    }

    @Override
    protected RingDeque<E> createInstance() {
        return new RingDeque<E>(INITIAL_CAPACITY);
    }

    @Override
    protected boolean beginFree(RingDeque<E> deque) {
        if (deque.capacity() >= MAX_RETAINED_CAPACITY) {
            return false;
        }
        if (!deque.isEmpty()) {
            deque.clear();
        }
        return true;
    }

}
