/*
 * SyntaxNode.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A positioned view of a {@link GreenNode}.
 *
 * <p>A syntax node pairs a green node with its absolute start position
 * and its parent. It owns no data of its own: children are materialized
 * on demand, each time they are asked for, and nothing is ever cached in
 * the green node. Syntax nodes are cheap to create and are not meant to
 * be shared between threads; each reader navigates with its own.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SyntaxNode {

    private final GreenNode green;
    private final SyntaxNode parent;
    private final int position;
    private final int slot;

    private SyntaxNode(GreenNode green, SyntaxNode parent, int position, int slot) {
        this.green = green;
        this.parent = parent;
        this.position = position;
        this.slot = slot;
    }

    /**
     * Wraps a green root node, placing it at position 0.
     *
     * @param root the green root
     * @return the red root
     */
    public static SyntaxNode attachRoot(GreenNode root) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        return new SyntaxNode(root, null, 0, -1);
    }

    public GreenNode getGreen() {
        return green;
    }

    public TemplateSyntaxKind getKind() {
        return green.getKind();
    }

    public boolean isToken() {
        return green.isToken();
    }

    /**
     * Returns the parent node.
     *
     * @return the parent, or null for the root
     */
    public SyntaxNode getParent() {
        return parent;
    }

    /**
     * Returns the slot this node occupies in its parent.
     *
     * @return the slot index, or -1 for the root
     */
    public int getSlotIndex() {
        return slot;
    }

    /**
     * Returns the absolute position of the first character of this node.
     *
     * @return the start position
     */
    public int getPosition() {
        return position;
    }

    /**
     * Returns the absolute position just past the last character of this
     * node.
     *
     * @return the end position
     */
    public int getEndPosition() {
        return position + green.getFullWidth();
    }

    public int getFullWidth() {
        return green.getFullWidth();
    }

    public int getSlotCount() {
        return green.getSlotCount();
    }

    /**
     * Returns the child in the given slot.
     *
     * @param index the slot index
     * @return the child, or null if the slot is absent
     */
    public SyntaxNode getChild(int index) {
        GreenNode child = green.getSlot(index);
        if (child == null) {
            return null;
        }
        return new SyntaxNode(child, this, position + green.getSlotOffset(index), index);
    }

    /**
     * Returns the present children in order.
     *
     * @return the children, empty for tokens
     */
    public List<SyntaxNode> getChildren() {
        int slotCount = green.getSlotCount();
        if (slotCount == 0) {
            return Collections.emptyList();
        }
        List<SyntaxNode> children = new ArrayList<SyntaxNode>(slotCount);
        int offset = position;
        for (int i = 0; i < slotCount; i++) {
            GreenNode child = green.getSlot(i);
            if (child != null) {
                children.add(new SyntaxNode(child, this, offset, i));
                offset += child.getFullWidth();
            }
        }
        return children;
    }

    /**
     * Returns the leftmost token of this subtree.
     *
     * @return the first token, or null if this subtree holds no token
     */
    public SyntaxNode getFirstToken() {
        SyntaxNode node = this;
        while (!node.isToken()) {
            SyntaxNode next = null;
            for (int i = 0; i < node.getSlotCount() && next == null; i++) {
                next = node.getChild(i);
            }
            if (next == null) {
                return null;
            }
            node = next;
        }
        return node;
    }

    /**
     * Finds the token containing the given absolute position. A position
     * equal to the end of this node resolves to its last token, which for
     * a document is the end of file token.
     *
     * @param pos the absolute position
     * @return the token
     * @throws IndexOutOfBoundsException if pos lies outside this node
     */
    public SyntaxNode findToken(int pos) {
        if (pos < position || pos > getEndPosition()) {
            throw new IndexOutOfBoundsException("Position " + pos + " outside ["
                    + position + "," + getEndPosition() + "]");
        }
        SyntaxNode node = this;
        while (!node.isToken()) {
            SyntaxNode match = null;
            SyntaxNode last = null;
            int offset = node.position;
            GreenNode g = node.green;
            for (int i = 0; i < g.getSlotCount(); i++) {
                GreenNode child = g.getSlot(i);
                if (child == null) {
                    continue;
                }
                int end = offset + child.getFullWidth();
                last = new SyntaxNode(child, node, offset, i);
                if (pos < end) {
                    match = last;
                    break;
                }
                offset = end;
            }
            if (match == null) {
                match = last;
            }
            if (match == null) {
                return null;
            }
            node = match;
        }
        return node;
    }

    /**
     * Returns the full text of this subtree.
     *
     * @return the text
     */
    public String toFullString() {
        return green.toFullString();
    }

    /**
     * Dispatches to the visitor method for this node's kind.
     *
     * @param visitor the visitor
     */
    public void accept(SyntaxVisitor visitor) {
        TemplateSyntaxKind kind = green.getKind();
        if (kind.isToken()) {
            visitor.visitToken(this);
        } else if (kind.isBlock()) {
            visitor.visitBlock(this);
        } else {
            switch (kind) {
                case DOCUMENT:
                    visitor.visitDocument(this);
                    break;
                case TEXT_RUN:
                    visitor.visitTextRun(this);
                    break;
                case BLOCK_CONTENT:
                    visitor.visitBlockContent(this);
                    break;
                default:
                    throw new IllegalStateException("Unhandled kind: " + kind);
            }
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SyntaxNode other = (SyntaxNode) obj;
        return green == other.green &&
               position == other.position &&
               slot == other.slot &&
               (parent == null ? other.parent == null : parent.equals(other.parent));
    }

    @Override
    public int hashCode() {
        int result = System.identityHashCode(green);
        result = 31 * result + position;
        result = 31 * result + slot;
        return result;
    }

    @Override
    public String toString() {
        return green + "@" + position;
    }

}
