/*
 * GreenListNode.java
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

package org.bluezoo.chryssie.syntax;

import java.util.List;

/**
 * A flat sequence of tokens: either a {@link TemplateSyntaxKind#TEXT_RUN}
 * of literal output text or the {@link TemplateSyntaxKind#BLOCK_CONTENT}
 * between a block's delimiters.
 *
 * <p>Besides {@link TemplateSyntaxKind#LITERAL_TEXT} tokens, a list may
 * hold delimiter tokens the parser did not accept as delimiters in that
 * position; those are reported through diagnostics on the enclosing node.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class GreenListNode extends GreenNode {

    private final GreenToken[] tokens;

    /**
     * Creates a new list node.
     *
     * @param kind {@link TemplateSyntaxKind#TEXT_RUN} or
     *        {@link TemplateSyntaxKind#BLOCK_CONTENT}
     * @param tokens the tokens, at least one
     * @param diagnostics diagnostics owned by this node, may be null
     */
    public GreenListNode(TemplateSyntaxKind kind, List<GreenToken> tokens, DiagnosticInfo[] diagnostics) {
        this(kind, tokens.toArray(new GreenToken[tokens.size()]), diagnostics);
    }

    private GreenListNode(TemplateSyntaxKind kind, GreenToken[] tokens, DiagnosticInfo[] diagnostics) {
        super(kind, sumWidths(tokens), diagnostics, false);
        if (kind != TemplateSyntaxKind.TEXT_RUN && kind != TemplateSyntaxKind.BLOCK_CONTENT) {
            throw new IllegalArgumentException(kind + " is not a list kind");
        }
        if (tokens.length == 0) {
            throw new IllegalArgumentException("List nodes must not be empty");
        }
        for (GreenToken token : tokens) {
            if (token == null || token.getKind() == TemplateSyntaxKind.END_OF_FILE) {
                throw new IllegalArgumentException("Invalid list element: " + token);
            }
        }
        this.tokens = tokens;
    }

    @Override
    public int getSlotCount() {
        return tokens.length;
    }

    @Override
    public GreenToken getSlot(int index) {
        return tokens[index];
    }

    @Override
    public int getSlotOffset(int index) {
        int offset = 0;
        for (int i = 0; i < index; i++) {
            offset += tokens[i].getFullWidth();
        }
        return offset;
    }

}
