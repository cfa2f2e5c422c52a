/*
 * GreenBlock.java
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

/**
 * A delimited block: a directive, or a standard, expression or class
 * feature control block.
 *
 * <p>A block has exactly three slots:
 * <ol start="0">
 * <li>the start delimiter, always present</li>
 * <li>the content, absent for an empty block</li>
 * <li>the end delimiter, absent if the block is unterminated</li>
 * </ol>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class GreenBlock extends GreenNode {

    public static final int START_SLOT = 0;
    public static final int CONTENT_SLOT = 1;
    public static final int END_SLOT = 2;

    private final GreenToken start;
    private final GreenListNode content;
    private final GreenToken end;

    /**
     * Creates a new block.
     *
     * @param kind the block kind
     * @param start the start delimiter
     * @param content the content, or null
     * @param end the end delimiter, or null if unterminated
     * @param diagnostics diagnostics owned by this node, may be null
     */
    public GreenBlock(TemplateSyntaxKind kind, GreenToken start, GreenListNode content, GreenToken end,
            DiagnosticInfo[] diagnostics) {
        super(kind, sumWidths(start, content, end), diagnostics, anyContainDiagnostics(content));
        if (!kind.isBlock()) {
            throw new IllegalArgumentException(kind + " is not a block kind");
        }
        if (start == null || start.getKind() != kind.getStartDelimiter()) {
            throw new IllegalArgumentException("Invalid start delimiter for " + kind + ": " + start);
        }
        if (end != null && end.getKind() != start.getKind().getMatchingEnd()) {
            throw new IllegalArgumentException("Invalid end delimiter for " + kind + ": " + end);
        }
        if (content != null && content.getKind() != TemplateSyntaxKind.BLOCK_CONTENT) {
            throw new IllegalArgumentException("Invalid content for " + kind + ": " + content);
        }
        this.start = start;
        this.content = content;
        this.end = end;
    }

    public GreenToken getStart() {
        return start;
    }

    /**
     * Returns the content between the delimiters.
     *
     * @return the content, or null if the block is empty
     */
    public GreenListNode getContent() {
        return content;
    }

    /**
     * Returns the end delimiter.
     *
     * @return the end delimiter, or null if the block is unterminated
     */
    public GreenToken getEnd() {
        return end;
    }

    /**
     * Indicates whether this block was closed by its end delimiter.
     *
     * @return true if the end delimiter is present
     */
    public boolean isTerminated() {
        return end != null;
    }

    @Override
    public int getSlotCount() {
        return 3;
    }

    @Override
    public GreenNode getSlot(int index) {
        switch (index) {
            case START_SLOT:
                return start;
            case CONTENT_SLOT:
                return content;
            case END_SLOT:
                return end;
            default:
                throw new IndexOutOfBoundsException("Invalid block slot: " + index);
        }
    }

}
