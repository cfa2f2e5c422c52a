/*
 * BlendedToken.java
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

package org.bluezoo.chryssie.parser;

import org.bluezoo.chryssie.syntax.GreenNode;
import org.bluezoo.chryssie.syntax.GreenToken;

/**
 * One unit of blender output: a token, or a whole node reused from the
 * previous tree together with its first token.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class BlendedToken {

    private final GreenNode node;
    private final GreenToken token;
    private final int position;

    BlendedToken(GreenNode node, GreenToken token, int position) {
        this.node = node;
        this.token = token;
        this.position = position;
    }

    /**
     * Returns the reused node.
     *
     * @return a node from the previous tree, or null if this unit is a
     *         single token
     */
    public GreenNode getNode() {
        return node;
    }

    /**
     * Returns the token at the start of this unit.
     */
    public GreenToken getToken() {
        return token;
    }

    /**
     * Returns the position in the new text just past this unit.
     */
    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return (node != null ? node : token) + "->" + position;
    }

}
