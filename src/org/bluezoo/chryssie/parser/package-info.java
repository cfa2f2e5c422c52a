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
 * Lexing, blending and parsing of templates.
 *
 * <p>{@link org.bluezoo.chryssie.parser.TemplateLexer} splits text into
 * tokens. {@link org.bluezoo.chryssie.parser.Blender} feeds those tokens
 * to {@link org.bluezoo.chryssie.parser.TemplateParser}, substituting
 * tokens and blocks of a previous tree wherever a change has left them
 * intact.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.chryssie.parser;
