/*
 * package-info.java
 * Copyright (C) 2005, 2025 Chris Burdess
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

/**
 * Low-level container and pooling utilities.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.util.RingDeque} - growable circular buffer with
 *       constant time operations at both ends and an observable capacity</li>
 *   <li>{@link org.bluezoo.util.ObjectPool} - bounded pool of scratch
 *       objects leased with try-with-resources</li>
 *   <li>{@link org.bluezoo.util.RingDequePool} and
 *       {@link org.bluezoo.util.StringBuilderPool} - pools that refuse to
 *       retain instances grown past a size threshold</li>
 * </ul>
 *
 * <h2>Design</h2>
 *
 * <p>These utilities are designed for:
 * <ul>
 *   <li>Minimal memory allocation in hot paths</li>
 *   <li>Bounded retention of scratch memory</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.util;
