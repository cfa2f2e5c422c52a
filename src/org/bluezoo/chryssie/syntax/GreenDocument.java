/*
 * GreenDocument.java
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
 * The root of a template: a sequence of text runs and blocks, followed by
 * the end of file token in the last slot.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class GreenDocument extends GreenNode {

    private final GreenNode[] items;
    private final GreenToken endOfFile;

    /**
     * Creates a new document.
     *
     * @param items text runs and blocks in document order
     * @param endOfFile the end of file token
     */
    public GreenDocument(List<GreenNode> items, GreenToken endOfFile) {
        this(items.toArray(new GreenNode[items.size()]), endOfFile);
    }

    private GreenDocument(GreenNode[] items, GreenToken endOfFile) {
        super(TemplateSyntaxKind.DOCUMENT, sumWidths(items), null, anyContainDiagnostics(items));
        for (GreenNode item : items) {
            if (item == null || (item.getKind() != TemplateSyntaxKind.TEXT_RUN && !item.getKind().isBlock())) {
                throw new IllegalArgumentException("Invalid document item: " + item);
            }
        }
        if (endOfFile == null || endOfFile.getKind() != TemplateSyntaxKind.END_OF_FILE) {
            throw new IllegalArgumentException("Invalid end of file token: " + endOfFile);
        }
        this.items = items;
        this.endOfFile = endOfFile;
    }

    /**
     * Returns the number of items, not counting the end of file token.
     *
     * @return the item count
     */
    public int getItemCount() {
        return items.length;
    }

    /**
     * Returns an item.
     *
     * @param index the item index
     * @return a text run or block
     */
    public GreenNode getItem(int index) {
        return items[index];
    }

    public GreenToken getEndOfFile() {
        return endOfFile;
    }

    @Override
    public int getSlotCount() {
        return items.length + 1;
    }

    @Override
    public GreenNode getSlot(int index) {
        if (index == items.length) {
            return endOfFile;
        }
        return items[index];
    }

}
