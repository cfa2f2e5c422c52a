/*
 * StringBuilderPool.java
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
 * Pool of {@link StringBuilder} instances.
 * Builders whose capacity has reached {@link #MAX_RETAINED_CAPACITY}
 * are discarded rather than retained.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class StringBuilderPool extends ObjectPool<StringBuilder> {

    static final int MAX_RETAINED_CAPACITY = 1024;

    private static final StringBuilderPool DEFAULT = new StringBuilderPool();

    /**
     * Returns the shared pool.
     *
     * @return the default pool
     */
    public static StringBuilderPool getDefault() {
        return DEFAULT;
    }

    public StringBuilderPool() {
        super();
    }

    public StringBuilderPool(int maxRetained) {
        super(maxRetained);
    }

    @Override
    protected StringBuilder createInstance() {
        return new StringBuilder();
    }

    @Override
    protected boolean beginFree(StringBuilder buf) {
        if (buf.capacity() >= MAX_RETAINED_CAPACITY) {
            return false;
        }
        buf.setLength(0);
        return true;
    }

}
