/*
 * GreenToken.java
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

import java.io.IOException;

import org.bluezoo.util.RingDeque;

/**
 * A leaf of the green tree: a run of literal text, a delimiter, or the
 * zero-width end of file sentinel.
 *
 * <p>Tokens carry their raw text. There is no separate trivia: every
 * character of the source belongs to exactly one token.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class GreenToken extends GreenNode {

    private final String text;

    /**
     * Creates a new token.
     *
     * @param kind a token kind
     * @param text the raw text of the token
     * @throws IllegalArgumentException if kind is not a token kind, or if
     *         text is empty for anything other than end of file
     */
    public GreenToken(TemplateSyntaxKind kind, String text) {
        super(kind, text == null ? 0 : text.length(), null, false);
        if (!kind.isToken()) {
            throw new IllegalArgumentException(kind + " is not a token kind");
        }
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        if (kind == TemplateSyntaxKind.END_OF_FILE ? !text.isEmpty() : text.isEmpty()) {
            throw new IllegalArgumentException("Invalid text for " + kind + ": '" + text + "'");
        }
        this.text = text;
    }

    /**
     * Creates an end of file token.
     *
     * @return a new zero-width end of file token
     */
    public static GreenToken endOfFile() {
        return new GreenToken(TemplateSyntaxKind.END_OF_FILE, "");
    }

    @Override
    public boolean isToken() {
        return true;
    }

    /**
     * Returns the raw text of this token.
     *
     * @return the text, empty only for end of file
     */
    public String getText() {
        return text;
    }

    @Override
    public int getSlotCount() {
        return 0;
    }

    @Override
    public GreenNode getSlot(int index) {
        throw new IndexOutOfBoundsException("Tokens have no slots: " + index);
    }

    @Override
    void writeTo(Appendable out, RingDeque<GreenNode> stack) throws IOException {
        out.append(text);
    }

    @Override
    public String toFullString() {
        return text;
    }

    @Override
    public boolean isEquivalentTo(GreenNode other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GreenToken)) {
            return false;
        }
        GreenToken token = (GreenToken) other;
        return getKind() == token.getKind() && text.equals(token.text);
    }

    @Override
    public String toString() {
        String preview = text.length() > 20
            ? text.substring(0, 20) + "..."
            : text;
        preview = preview.replace("\n", "\\n").replace("\t", "\\t");
        return getKind() + "'" + preview + "'";
    }

}
