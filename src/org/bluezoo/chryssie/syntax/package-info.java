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
 * Syntax trees of templates.
 *
 * <p>Trees have two layers. Green nodes
 * ({@link org.bluezoo.chryssie.syntax.GreenNode}) are immutable and know
 * only their kind, width and children, so they can be shared between
 * versions of a tree. Syntax nodes
 * ({@link org.bluezoo.chryssie.syntax.SyntaxNode}) add absolute positions
 * and parent links, and are created on demand while navigating.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.chryssie.syntax.TemplateSyntaxKind} - token and
 *       node kinds</li>
 *   <li>{@link org.bluezoo.chryssie.syntax.GreenToken},
 *       {@link org.bluezoo.chryssie.syntax.GreenListNode},
 *       {@link org.bluezoo.chryssie.syntax.GreenBlock} and
 *       {@link org.bluezoo.chryssie.syntax.GreenDocument} - the green node
 *       types</li>
 *   <li>{@link org.bluezoo.chryssie.syntax.DiagnosticInfo} - syntax errors
 *       attached to green nodes</li>
 *   <li>{@link org.bluezoo.chryssie.syntax.TextChange} - an edit to the
 *       text of a template</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.chryssie.syntax;
