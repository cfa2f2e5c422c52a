/*
 * TemplateLexer.java
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

import org.bluezoo.chryssie.syntax.GreenToken;
import org.bluezoo.chryssie.syntax.TemplateSyntaxKind;

/**
 * Splits template text into tokens.
 *
 * <p>Each call to {@link #nextToken} returns one token starting at the
 * current position: either a single delimiter, chosen by longest match,
 * or the longest run of literal text in which no delimiter starts.
 * Recognition does not depend on what came before, so lexing can be
 * restarted at any token boundary with {@link #reset}. At the end of the
 * text the lexer returns a zero-width end of file token, and keeps
 * returning one on every subsequent call.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TemplateLexer {

    private final CharSequence text;
    private final TemplateDelimiters delimiters;
    private final int length;
    private int pos;
    private int tokenCount;

    /**
     * Creates a lexer using the default delimiters.
     *
     * @param text the text to lex
     */
    public TemplateLexer(CharSequence text) {
        this(text, TemplateDelimiters.DEFAULT);
    }

    /**
     * Creates a lexer.
     *
     * @param text the text to lex
     * @param delimiters the delimiter texts
     */
    public TemplateLexer(CharSequence text, TemplateDelimiters delimiters) {
        if (text == null || delimiters == null) {
            throw new IllegalArgumentException("text and delimiters must not be null");
        }
        this.text = text;
        this.delimiters = delimiters;
        this.length = text.length();
    }

    public CharSequence getText() {
        return text;
    }

    public TemplateDelimiters getDelimiters() {
        return delimiters;
    }

    /**
     * Returns the position of the next token.
     */
    public int getPosition() {
        return pos;
    }

    /**
     * Moves the lexer to a new position. The position must be a token
     * boundary for the resulting tokens to agree with a lexing from the
     * start of the text.
     *
     * @param position the new position
     * @throws IndexOutOfBoundsException if position is outside the text
     */
    public void reset(int position) {
        if (position < 0 || position > length) {
            throw new IndexOutOfBoundsException("Position " + position + " outside [0," + length + "]");
        }
        pos = position;
    }

    /**
     * Returns the number of tokens produced so far, end of file included.
     */
    public int getTokenCount() {
        return tokenCount;
    }

    /**
     * Produces the token at the current position and advances past it.
     *
     * @return the next token
     */
    public GreenToken nextToken() {
        tokenCount++;
        if (pos >= length) {
            return GreenToken.endOfFile();
        }
        TemplateSyntaxKind kind = delimiters.match(text, pos);
        if (kind != null) {
            String delimiter = delimiters.getText(kind);
            pos += delimiter.length();
            return new GreenToken(kind, delimiter);
        }
        int start = pos;
        pos = scanLiteral(pos + 1);
        return new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, text.subSequence(start, pos).toString());
    }

    /**
     * Returns the end of the literal run containing the given position:
     * the first position at or after it where a delimiter starts, or the
     * end of the text.
     */
    private int scanLiteral(int from) {
        int i = from;
        while (i < length) {
            if (delimiters.isLeadChar(text.charAt(i)) && delimiters.match(text, i) != null) {
                break;
            }
            i++;
        }
        return i;
    }

    /**
     * Returns the length of the longest delimiter.
     */
    public int getMaxDelimiterLength() {
        return delimiters.getMaxLength();
    }

    /**
     * Determines whether lexing this text at the given position would
     * produce a token of the same kind and text as the one given. Only
     * the characters the lexer would examine are checked: the token's own
     * text, and for a literal the few characters past its end that could
     * complete a delimiter.
     *
     * <p>End of file tokens are never reusable.
     *
     * @param token a token, typically from a previous version of the text
     * @param position a token boundary in this text
     * @return true if the token can stand in for a fresh one at position
     */
    public boolean isReusable(GreenToken token, int position) {
        TemplateSyntaxKind kind = token.getKind();
        if (kind == TemplateSyntaxKind.END_OF_FILE) {
            return false;
        }
        String tokenText = token.getText();
        int width = tokenText.length();
        int end = position + width;
        if (position < 0 || end > length) {
            return false;
        }
        for (int i = 0; i < width; i++) {
            if (text.charAt(position + i) != tokenText.charAt(i)) {
                return false;
            }
        }
        if (kind.isDelimiter()) {
            return delimiters.match(text, position) == kind;
        }
        // A delimiter may now start inside the literal, overlapping its end
        int from = Math.max(position, end - delimiters.getMaxLength() + 1);
        for (int i = from; i < end; i++) {
            if (delimiters.match(text, i) != null) {
                return false;
            }
        }
        // The literal must still stop where it did
        return end == length || delimiters.match(text, end) != null;
    }

}
