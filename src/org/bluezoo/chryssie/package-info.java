/*
 * package-info.java
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

/**
 * Incremental parsing of text templates.
 *
 * <p>A template is literal text interleaved with blocks, each enclosed in
 * a pair of delimiters. Four kinds of block are recognised: directives,
 * standard control blocks, expression blocks and class feature blocks.
 * Block content is kept as raw text; its meaning belongs to whatever
 * processes the template.
 *
 * <p>{@link org.bluezoo.chryssie.TemplateSyntaxTree} is the entry point.
 * After an edit, {@link org.bluezoo.chryssie.TemplateSyntaxTree#withChanges}
 * builds the tree of the new text while sharing every untouched node of
 * the previous one.
 *
 * <h2>Configuration</h2>
 *
 * <p>The following system properties set defaults:
 * <ul>
 *   <li>{@code chryssie.incremental} - reuse the previous tree when
 *       reparsing (default true)</li>
 *   <li>{@code chryssie.reuseNodes} - reuse whole blocks as well as tokens
 *       (default true)</li>
 *   <li>{@code chryssie.pool.maxRetained} - number of scratch containers
 *       each pool retains</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.chryssie.syntax
 * @see org.bluezoo.chryssie.parser
 */
package org.bluezoo.chryssie;
